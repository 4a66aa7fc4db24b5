package com.newsvault.backend.persistence;

/**
 * A sink write failed, after retries where the sink has them.
 */
public class PersistenceException extends RuntimeException {

    private final PersistenceErrorKind kind;

    public PersistenceException(PersistenceErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public PersistenceErrorKind getKind() {
        return kind;
    }
}
