package com.newsvault.backend.retention;

/**
 * A sweep could not start. Never affects ingestion.
 */
public class RetentionException extends RuntimeException {

    public RetentionException(String message) {
        super(message);
    }
}
