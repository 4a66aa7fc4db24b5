package com.newsvault.backend.storage.archive;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Date-partitioned document store for ingested articles.
 * Keys look like {@code YYYY/MM/DD/<name>.json}.
 */
public interface ContentArchive {

    ArchivePutResult put(String key, ArchiveRecord document);

    /**
     * Keys starting with {@code keyPrefix}; empty when nothing matches.
     */
    List<String> exists(String keyPrefix);

    Optional<ArchiveRecord> get(String key);

    boolean delete(String key);

    /**
     * Removes every document stored under a date partition before {@code cutoffDate}.
     *
     * @return number of documents removed
     */
    int deleteDaysBefore(LocalDate cutoffDate);

    boolean healthCheck();
}
