package com.newsvault.backend.scraper.model;

import java.time.ZonedDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ExtractedArticle {
    String url;
    String title;
    ZonedDateTime publishedAt;
    String sourceName;
    String author;
    String category;

    String content;
    int contentLength;
    ExtractionMethod extractionMethod;

    // Set only when the last-resort feed summary was accepted under the minimum length
    boolean belowThreshold;

    String translatedTitle;
    String translatedContent;

    public static ExtractedArticle of(CandidateItem item, String content, ExtractionMethod method, boolean belowThreshold) {
        return ExtractedArticle.builder()
                .url(item.getUrl())
                .title(item.getTitle())
                .publishedAt(item.getPublishedAt())
                .sourceName(item.getSourceName())
                .author(item.getAuthor())
                .category(item.getCategory())
                .content(content)
                .contentLength(content.length())
                .extractionMethod(method)
                .belowThreshold(belowThreshold)
                .build();
    }
}
