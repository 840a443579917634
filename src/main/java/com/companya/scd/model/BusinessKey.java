package com.companya.scd.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity of an entity across all of its versions.
 */
public record BusinessKey(ScalarValue value) {

    @Override
    @JsonValue
    public ScalarValue value() {
        return value;
    }

    public static BusinessKey of(Object raw) {
        return new BusinessKey(ScalarValue.of(raw));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
