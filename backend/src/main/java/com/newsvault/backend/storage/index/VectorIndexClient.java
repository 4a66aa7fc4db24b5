package com.newsvault.backend.storage.index;

/**
 * One session against the vector index. Callers open a fresh session per logical attempt and close it afterwards.
 */
public interface VectorIndexClient extends AutoCloseable {

    void upsert(IndexRecord record);

    /**
     * Deletes the points matching {@code filter}.
     *
     * @return the number of points that matched right before deletion
     */
    long deleteWhere(IndexFilter filter);

    long count();

    long count(IndexFilter filter);

    IndexStats stats();

    boolean healthCheck();

    /**
     * Removes every point but keeps the collection.
     */
    void clearAll();

    /**
     * Drops the collection and creates it again with its payload indexes.
     */
    void recreate();

    @Override
    void close();
}
