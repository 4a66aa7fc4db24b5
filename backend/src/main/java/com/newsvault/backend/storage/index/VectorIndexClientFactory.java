package com.newsvault.backend.storage.index;

/**
 * Opens new vector index sessions.
 */
public interface VectorIndexClientFactory {

    /**
     * @throws VectorIndexException when no session can be established
     */
    VectorIndexClient open();
}
