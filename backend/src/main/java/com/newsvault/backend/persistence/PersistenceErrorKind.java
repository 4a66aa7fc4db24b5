package com.newsvault.backend.persistence;

public enum PersistenceErrorKind {
    ARCHIVE_WRITE,
    INDEX_WRITE,
    EMBEDDING,
    CONFIGURATION
}
