package com.companya.scd.exception;

/**
 * Base type for every structural failure raised by the versioning engine.
 * Subclasses fix the {@link ErrorKind} so callers can report a failure without
 * inspecting its concrete type.
 */
public abstract class ScdException extends RuntimeException {

    private final ErrorKind kind;

    protected ScdException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ScdException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Whether the orchestrator may retry the failed step.
     */
    public boolean isRetryable() {
        return false;
    }
}
