package com.companya.scd.storage;

import com.companya.scd.exception.InvalidConfigurationException;

import java.util.regex.Pattern;

/**
 * Table and column names come from configuration and end up inside SQL text,
 * so only plain identifiers are accepted.
 */
public final class Identifiers {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Identifiers() {
    }

    public static boolean isValid(String identifier) {
        return identifier != null && PLAIN_IDENTIFIER.matcher(identifier).matches();
    }

    public static String require(String identifier) {
        if (!isValid(identifier)) {
            throw new InvalidConfigurationException("Not a plain SQL identifier: '" + identifier + "'");
        }
        return identifier;
    }
}
