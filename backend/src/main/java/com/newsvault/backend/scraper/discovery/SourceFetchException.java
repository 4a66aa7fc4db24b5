package com.newsvault.backend.scraper.discovery;

/**
 * The top-level feed or listing document of a source could not be fetched or parsed.
 * Fails that source for the current cycle only.
 */
public class SourceFetchException extends RuntimeException {

    private final String sourceName;

    public SourceFetchException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
