package com.companya.scd.storage;

import com.companya.scd.exception.InvariantViolationException;
import com.companya.scd.model.BusinessKey;
import com.companya.scd.model.Fingerprint;
import com.companya.scd.model.ScalarValue;
import com.companya.scd.model.SourceRecord;
import com.companya.scd.model.VersionRow;
import com.companya.scd.model.Versioning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link StorageConnector} over a plain JDBC {@code DataSource}.
 *
 * Column sets are discovered from result set metadata, so the same connector serves
 * every configured table pair. History tables must hold every source column plus
 * {@code row_hash}, {@code valid_from}, {@code valid_to} and {@code is_current}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcStorageConnector implements StorageConnector {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<SourceRecord> fetchAll(String sourceTable) {
        String sql = "SELECT * FROM " + Identifiers.require(sourceTable);
        List<SourceRecord> records = read("read source table " + sourceTable,
                () -> jdbcTemplate.query(sql, (rs, rowNum) -> mapRecord(rs)));
        log.debug("Fetched {} records from {}", records.size(), sourceTable);
        return records;
    }

    @Override
    public List<VersionRow> fetchCurrent(String historyTable, String businessKey) {
        String sql = "SELECT * FROM " + Identifiers.require(historyTable) + " WHERE " + Versioning.IS_CURRENT + " = ?";
        return read("read current slice of " + historyTable,
                () -> jdbcTemplate.query(sql, (rs, rowNum) -> mapVersion(rs, businessKey), Boolean.TRUE));
    }

    @Override
    public int closeOut(String historyTable, String businessKey, BusinessKey key, LocalDateTime asOf) {
        String sql = "UPDATE " + Identifiers.require(historyTable)
                + " SET " + Versioning.VALID_TO + " = ?, " + Versioning.IS_CURRENT + " = ?"
                + " WHERE " + Identifiers.require(businessKey) + " = ? AND " + Versioning.IS_CURRENT + " = ?";
        return write("close out key " + key + " in " + historyTable,
                () -> jdbcTemplate.update(sql, asOf, Boolean.FALSE, key.value().toJdbcValue(), Boolean.TRUE));
    }

    @Override
    public void insertVersion(String historyTable, SourceRecord record, Fingerprint fingerprint,
                              LocalDateTime validFrom, LocalDateTime validTo) {
        List<String> columns = new ArrayList<>(record.names());
        columns.forEach(Identifiers::require);
        List<Object> values = record.asMap().values().stream()
                .map(ScalarValue::toJdbcValue)
                .collect(Collectors.toCollection(ArrayList::new));

        columns.addAll(List.of(Versioning.ROW_HASH, Versioning.VALID_FROM, Versioning.VALID_TO, Versioning.IS_CURRENT));
        values.addAll(List.of(fingerprint.hex(), validFrom, validTo, Boolean.TRUE));

        String sql = "INSERT INTO " + Identifiers.require(historyTable)
                + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
        write("insert version into " + historyTable, () -> jdbcTemplate.update(sql, values.toArray()));
    }

    @Override
    public Optional<LocalDateTime> latestBoundary(String historyTable) {
        String table = Identifiers.require(historyTable);
        String latestStart = "SELECT MAX(" + Versioning.VALID_FROM + ") FROM " + table;
        String latestClose = "SELECT MAX(" + Versioning.VALID_TO + ") FROM " + table + " WHERE " + Versioning.IS_CURRENT + " = ?";
        return read("read latest boundary of " + historyTable, () -> {
            LocalDateTime start = jdbcTemplate.queryForObject(latestStart,
                    (rs, rowNum) -> rs.getObject(1, LocalDateTime.class));
            LocalDateTime close = jdbcTemplate.queryForObject(latestClose,
                    (rs, rowNum) -> rs.getObject(1, LocalDateTime.class), Boolean.FALSE);
            return Stream.of(start, close)
                    .filter(Objects::nonNull)
                    .max(LocalDateTime::compareTo);
        });
    }

    @Override
    public List<VersionRow> fetchVersions(String historyTable, String businessKey, BusinessKey key) {
        String sql = "SELECT * FROM " + Identifiers.require(historyTable)
                + " WHERE " + Identifiers.require(businessKey) + " = ?"
                + " ORDER BY " + Versioning.VALID_FROM;
        return read("read versions of key " + key + " from " + historyTable,
                () -> jdbcTemplate.query(sql, (rs, rowNum) -> mapVersion(rs, businessKey), key.value().toJdbcValue()));
    }

    @Override
    public List<VersionRow> fetchAllVersions(String historyTable, String businessKey) {
        String sql = "SELECT * FROM " + Identifiers.require(historyTable)
                + " ORDER BY " + Identifiers.require(businessKey) + ", " + Versioning.VALID_FROM;
        return read("read all versions from " + historyTable,
                () -> jdbcTemplate.query(sql, (rs, rowNum) -> mapVersion(rs, businessKey)));
    }

    @Override
    public Optional<VersionRow> fetchAsOf(String historyTable, String businessKey, BusinessKey key, LocalDateTime pointInTime) {
        String sql = "SELECT * FROM " + Identifiers.require(historyTable)
                + " WHERE " + Identifiers.require(businessKey) + " = ?"
                + " AND " + Versioning.VALID_FROM + " <= ? AND " + Versioning.VALID_TO + " > ?";
        List<VersionRow> rows = read("read key " + key + " as of " + pointInTime + " from " + historyTable,
                () -> jdbcTemplate.query(sql, (rs, rowNum) -> mapVersion(rs, businessKey),
                        key.value().toJdbcValue(), pointInTime, pointInTime));
        if (rows.size() > 1) {
            throw new InvariantViolationException(
                    "Key " + key + " has " + rows.size() + " versions valid at " + pointInTime + " in " + historyTable);
        }
        return rows.stream().findFirst();
    }

    private SourceRecord mapRecord(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        SourceRecord.Builder builder = SourceRecord.builder();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            builder.put(metaData.getColumnLabel(i), readValue(rs, i, metaData.getColumnType(i)));
        }
        return builder.build();
    }

    private VersionRow mapVersion(ResultSet rs, String businessKey) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        SourceRecord.Builder attributes = SourceRecord.builder();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String column = SourceRecord.normalize(metaData.getColumnLabel(i));
            if (!Versioning.isMetadataColumn(column)) {
                attributes.put(column, readValue(rs, i, metaData.getColumnType(i)));
            }
        }
        SourceRecord record = attributes.build();
        return new VersionRow(
                new BusinessKey(record.get(businessKey)),
                record,
                new Fingerprint(rs.getString(Versioning.ROW_HASH)),
                rs.getObject(Versioning.VALID_FROM, LocalDateTime.class),
                rs.getObject(Versioning.VALID_TO, LocalDateTime.class),
                rs.getBoolean(Versioning.IS_CURRENT));
    }

    private static ScalarValue readValue(ResultSet rs, int index, int sqlType) throws SQLException {
        switch (sqlType) {
            case Types.BIGINT, Types.INTEGER, Types.SMALLINT, Types.TINYINT -> {
                long value = rs.getLong(index);
                return rs.wasNull() ? ScalarValue.NULL : ScalarValue.integer(value);
            }
            case Types.DECIMAL, Types.NUMERIC -> {
                return ScalarValue.real(rs.getBigDecimal(index));
            }
            case Types.DOUBLE, Types.FLOAT, Types.REAL -> {
                double value = rs.getDouble(index);
                return rs.wasNull() ? ScalarValue.NULL : ScalarValue.real(value);
            }
            case Types.BOOLEAN, Types.BIT -> {
                boolean value = rs.getBoolean(index);
                return rs.wasNull() ? ScalarValue.NULL : ScalarValue.integer(value ? 1 : 0);
            }
            case Types.TIMESTAMP -> {
                LocalDateTime value = rs.getObject(index, LocalDateTime.class);
                return value == null ? ScalarValue.NULL : ScalarValue.text(value.toString());
            }
            default -> {
                return ScalarValue.text(rs.getString(index));
            }
        }
    }

    private static <T> T read(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException ex) {
            throw StorageExceptions.translateRead(operation, ex);
        }
    }

    private static <T> T write(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException ex) {
            throw StorageExceptions.translateMerge(operation, ex);
        }
    }
}
