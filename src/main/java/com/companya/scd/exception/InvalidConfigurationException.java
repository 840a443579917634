package com.companya.scd.exception;

public class InvalidConfigurationException extends ScdException {

    public InvalidConfigurationException(String message) {
        super(ErrorKind.INVALID_CONFIGURATION, message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(ErrorKind.INVALID_CONFIGURATION, message, cause);
    }
}
