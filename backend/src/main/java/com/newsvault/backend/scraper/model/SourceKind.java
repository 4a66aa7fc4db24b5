package com.newsvault.backend.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum SourceKind {
    FEED("feed"),
    LISTING("listing");

    private final String code;

    public static SourceKind fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("code cannot be null");
        for (SourceKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code) || kind.name().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        // "rss" is what older source files call a feed
        if ("rss".equalsIgnoreCase(code) || "atom".equalsIgnoreCase(code)) {
            return FEED;
        }
        throw new IllegalArgumentException("Code " + code + " is not a valid SourceKind");
    }
}
