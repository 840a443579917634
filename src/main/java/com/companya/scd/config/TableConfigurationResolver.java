package com.companya.scd.config;

import com.companya.scd.exception.InvalidConfigurationException;
import com.companya.scd.model.SourceRecord;
import com.companya.scd.model.TableConfiguration;
import com.companya.scd.storage.Identifiers;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns {@code scd.tables[*]} entries (and their optional metadata files) into
 * validated {@link TableConfiguration}s. Validation happens before any storage access.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableConfigurationResolver {

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final String HISTORY_SUFFIX = "_cdc";

    private final ScdProperties properties;
    private final ObjectMapper objectMapper;

    public List<String> tableNames() {
        return properties.getTables().stream().map(ScdProperties.TableProperties::resolvedName).toList();
    }

    public TableConfiguration resolve(String name) {
        return properties.getTables().stream()
                .filter(t -> name.equals(t.resolvedName()))
                .findFirst()
                .map(this::resolve)
                .orElseThrow(() -> new InvalidConfigurationException("No table configured under name '" + name + "'"));
    }

    public TableConfiguration resolve(ScdProperties.TableProperties table) {
        if (table.getSourceTable() == null || table.getSourceTable().isBlank()) {
            throw new InvalidConfigurationException("source-table is required for every scd.tables entry");
        }
        String businessKey = table.getBusinessKey();
        List<String> monitored = table.getMonitoredAttributes();
        boolean detectRemoved = Boolean.TRUE.equals(table.getDetectRemoved());

        if (table.getMetadataFile() != null && !table.getMetadataFile().isBlank()) {
            TableMetadata metadata = loadMetadata(table.getMetadataFile());
            businessKey = metadata.primaryKey();
            monitored = metadata.changingAttributes() == null ? List.of() : metadata.changingAttributes();
            if (table.getDetectRemoved() == null && metadata.detectRemoved() != null) {
                detectRemoved = metadata.detectRemoved();
            }
            log.info("Loaded metadata for {} from {}: key={}, monitoring {}",
                    table.resolvedName(), table.getMetadataFile(), businessKey, monitored);
        }

        String historyTable = table.getHistoryTable() == null || table.getHistoryTable().isBlank()
                ? table.getSourceTable() + HISTORY_SUFFIX
                : table.getHistoryTable();

        TableConfiguration config = new TableConfiguration(table.resolvedName(), table.getSourceTable(), historyTable,
                businessKey, monitored == null ? List.of() : monitored, detectRemoved);
        validate(config);
        return config;
    }

    /**
     * @throws InvalidConfigurationException when the key or monitored attributes are
     *                                       missing, overlap, repeat, or are not plain identifiers
     */
    public static void validate(TableConfiguration config) {
        Identifiers.require(config.sourceTable());
        Identifiers.require(config.historyTable());
        if (SourceRecord.normalize(config.sourceTable()).equals(SourceRecord.normalize(config.historyTable()))) {
            throw new InvalidConfigurationException("Source and history table must differ: " + config.sourceTable());
        }
        if (config.businessKey() == null || config.businessKey().isBlank()) {
            throw new InvalidConfigurationException("Business key is required for table " + config.name());
        }
        Identifiers.require(config.businessKey());
        if (config.monitoredAttributes().isEmpty()) {
            throw new InvalidConfigurationException("At least one monitored attribute is required for table " + config.name());
        }
        String key = SourceRecord.normalize(config.businessKey());
        Set<String> seen = new HashSet<>();
        for (String attribute : config.monitoredAttributes()) {
            Identifiers.require(attribute);
            String normalized = SourceRecord.normalize(attribute);
            if (normalized.equals(key)) {
                throw new InvalidConfigurationException(
                        "Business key '" + config.businessKey() + "' must not be a monitored attribute");
            }
            if (!seen.add(normalized)) {
                throw new InvalidConfigurationException("Monitored attribute '" + attribute + "' is listed twice");
            }
        }
    }

    private TableMetadata loadMetadata(String location) {
        Resource resource = location.startsWith(CLASSPATH_PREFIX)
                ? new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()))
                : new FileSystemResource(location);
        if (!resource.exists()) {
            throw new InvalidConfigurationException("Metadata file '" + location + "' not found");
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, TableMetadata.class);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Invalid metadata file '" + location + "': " + e.getMessage(), e);
        }
    }
}
