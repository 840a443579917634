package com.companya.scd.exception;

import lombok.Getter;

/**
 * The source snapshot contains more than one record for the same business key.
 */
@Getter
public class DuplicateKeyException extends ScdException {

    private final String businessKey;

    public DuplicateKeyException(String businessKey) {
        super(ErrorKind.DUPLICATE_KEY, "Source snapshot contains business key " + businessKey + " more than once");
        this.businessKey = businessKey;
    }
}
