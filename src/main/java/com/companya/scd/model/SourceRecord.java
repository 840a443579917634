package com.companya.scd.model;

import com.companya.scd.exception.MissingAttributeException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, immutable view of one row. Attribute names are normalized to upper case
 * so lookups behave the same regardless of how the JDBC driver reports column labels.
 */
public final class SourceRecord {

    private final Map<String, ScalarValue> attributes;

    private SourceRecord(Map<String, ScalarValue> attributes) {
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convenience factory for tests and JSON payloads; preserves the map's iteration order.
     */
    public static SourceRecord of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public static String normalize(String attributeName) {
        return attributeName.toUpperCase(Locale.ROOT);
    }

    public ScalarValue get(String attributeName) {
        ScalarValue value = attributes.get(normalize(attributeName));
        if (value == null) {
            throw new MissingAttributeException(attributeName);
        }
        return value;
    }

    public boolean has(String attributeName) {
        return attributes.containsKey(normalize(attributeName));
    }

    public Set<String> names() {
        return attributes.keySet();
    }

    @JsonValue
    public Map<String, ScalarValue> asMap() {
        return attributes;
    }

    public int size() {
        return attributes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return attributes.equals(((SourceRecord) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "SourceRecord" + attributes;
    }

    public static final class Builder {

        private final Map<String, ScalarValue> attributes = new LinkedHashMap<>();

        public Builder put(String name, Object value) {
            attributes.put(normalize(name), ScalarValue.of(value));
            return this;
        }

        public SourceRecord build() {
            return new SourceRecord(new LinkedHashMap<>(attributes));
        }
    }
}
