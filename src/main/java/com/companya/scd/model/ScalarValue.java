package com.companya.scd.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single attribute value as it appears in a source or history row.
 *
 * Values are tagged so canonicalization for fingerprinting happens in exactly one
 * place ({@link #canonicalText()}) instead of at every call site that reads a column.
 * INTEGER and REAL are both numeric: they canonicalize to the same text whenever
 * they denote the same number, so {@code 2}, {@code 2.0} and {@code 2.00} never
 * count as a change. TEXT never equals a number, even when it looks like one.
 */
public final class ScalarValue {

    public enum Kind { TEXT, INTEGER, REAL, NULL }

    /** Canonical token for null. Real values always start with "s:" or "n:". */
    public static final String NULL_TOKEN = "\\N";

    public static final ScalarValue NULL = new ScalarValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private ScalarValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ScalarValue text(String value) {
        return value == null ? NULL : new ScalarValue(Kind.TEXT, value);
    }

    public static ScalarValue integer(long value) {
        return new ScalarValue(Kind.INTEGER, value);
    }

    public static ScalarValue real(BigDecimal value) {
        return value == null ? NULL : new ScalarValue(Kind.REAL, value);
    }

    public static ScalarValue real(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Non-finite real values are not supported: " + value);
        }
        return new ScalarValue(Kind.REAL, BigDecimal.valueOf(value));
    }

    /**
     * Maps a plain Java value (as returned by JDBC or parsed from JSON) onto a scalar.
     * Booleans become INTEGER 0/1; anything that is not a number or string is stored
     * as TEXT using its {@code toString()} form.
     */
    public static ScalarValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof ScalarValue scalar) {
            return scalar;
        }
        if (raw instanceof String s) {
            return text(s);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return integer(((Number) raw).longValue());
        }
        if (raw instanceof java.math.BigInteger big) {
            return real(new BigDecimal(big));
        }
        if (raw instanceof BigDecimal decimal) {
            return real(decimal);
        }
        if (raw instanceof Double || raw instanceof Float) {
            return real(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean b) {
            return integer(b ? 1 : 0);
        }
        return text(raw.toString());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * The value in the form handed to JDBC: String, Long, BigDecimal or null.
     */
    @JsonValue
    public Object toJdbcValue() {
        return value;
    }

    /**
     * Locale-independent text form used for fingerprinting.
     */
    public String canonicalText() {
        return switch (kind) {
            case NULL -> NULL_TOKEN;
            case TEXT -> "s:" + escape((String) value);
            case INTEGER -> "n:" + value;
            case REAL -> "n:" + canonicalNumber((BigDecimal) value);
        };
    }

    private static String canonicalNumber(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }

    private static String escape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' || c == '|') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarValue other)) return false;
        return canonicalText().equals(other.canonicalText());
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonicalText());
    }

    @Override
    public String toString() {
        return kind == Kind.NULL ? "null" : String.valueOf(value);
    }
}
