package com.newsvault.backend.storage.index;

/**
 * A vector index call failed or timed out.
 */
public class VectorIndexException extends RuntimeException {

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
