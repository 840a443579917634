package com.companya.scd.exception;

public class InvariantViolationException extends ScdException {

    public InvariantViolationException(String message) {
        super(ErrorKind.INVARIANT_VIOLATION, message);
    }
}
