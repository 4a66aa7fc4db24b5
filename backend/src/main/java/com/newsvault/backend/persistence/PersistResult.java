package com.newsvault.backend.persistence;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of writing one article to both sinks.
 */
@Value
@Builder
public class PersistResult {
    String articleId;
    boolean archived;
    // Archive write skipped because the key already existed
    boolean archiveSkipped;
    boolean indexed;
    int indexAttempts;
    PersistenceErrorKind error;
    String errorMessage;

    /**
     * The index write is the primary record; the item counts as ingested only when it succeeded.
     */
    public boolean isAdmitted() {
        return indexed;
    }
}
