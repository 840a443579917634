package com.companya.scd.exception;

import lombok.Getter;

/**
 * A record lacks an attribute the configuration requires, which usually means the
 * source schema drifted away from the configured monitored attributes.
 */
@Getter
public class MissingAttributeException extends ScdException {

    private final String attribute;

    public MissingAttributeException(String attribute) {
        this(attribute, "Record has no attribute '" + attribute + "'");
    }

    public MissingAttributeException(String attribute, String message) {
        super(ErrorKind.MISSING_ATTRIBUTE, message);
        this.attribute = attribute;
    }
}
