package com.newsvault.backend.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Content extraction strategies, declared in default fallback order.
 */
@Getter
@AllArgsConstructor
public enum ExtractionMethod {
    RENDERED("rendered"),
    STATIC("static"),
    PARAGRAPH("paragraph"),
    FEED_SUMMARY("feed-summary");

    private final String code;

    public static ExtractionMethod fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("code cannot be null");
        for (ExtractionMethod method : values()) {
            if (method.code.equalsIgnoreCase(code) || method.name().equalsIgnoreCase(code)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Code " + code + " is not a valid ExtractionMethod");
    }
}
