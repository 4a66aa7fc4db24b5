package com.newsvault.backend.storage.archive;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The write-once JSON document stored in the content archive.
 * Timestamps are ISO-8601 strings with offset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveRecord {
    private String articleId;
    private String url;
    private String title;
    private String source;
    private String author;
    private String category;
    private String content;
    private int contentLength;
    private String extractionMethod;
    private boolean belowThreshold;
    private String publishedAt;
    private String crawledAt;
    private String translatedTitle;
    private String translatedContent;
}
