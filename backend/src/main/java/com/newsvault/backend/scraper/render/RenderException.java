package com.newsvault.backend.scraper.render;

/**
 * A page could not be rendered. Fails the rendered strategy, never the item.
 */
public class RenderException extends RuntimeException {

    private final boolean timedOut;

    public RenderException(String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
