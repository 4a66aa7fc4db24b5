package com.newsvault.backend.scraper.model;

import java.time.ZonedDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * An article reference produced by discovery. Lives for one cycle.
 */
@Value
@Builder(toBuilder = true)
public class CandidateItem {
    String url;
    String title;
    // Normalized to the pipeline's canonical zone
    ZonedDateTime publishedAt;
    String sourceName;
    String author;
    String category;
    // Feed summary/description, the last extraction fallback
    String summary;
}
