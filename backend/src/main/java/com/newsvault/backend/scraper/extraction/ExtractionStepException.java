package com.newsvault.backend.scraper.extraction;

/**
 * One extraction stage could not produce text. The chain moves on to the next stage.
 */
public class ExtractionStepException extends RuntimeException {

    public ExtractionStepException(String message) {
        super(message);
    }

    public ExtractionStepException(String message, Throwable cause) {
        super(message, cause);
    }
}
