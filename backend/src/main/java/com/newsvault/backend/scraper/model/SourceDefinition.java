package com.newsvault.backend.scraper.model;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One configured source. Immutable for the duration of a run.
 */
@Value
@Builder(toBuilder = true)
public class SourceDefinition {

    String name;
    String displayName;
    SourceKind kind;
    String endpoint;
    Duration recencyWindow;

    // Zone used for timestamps the source publishes without an offset
    ZoneId zone;
    int maxItems;

    // Extraction hints
    @Singular
    List<String> contentSelectors;
    @Singular("extractionStep")
    List<ExtractionMethod> extractionOrder;
    Integer minContentLength;
    int minWordCount;
    boolean renderEnabled;

    // Listing pages
    String itemSelector;
    String linkSelector;
    String titleSelector;
    String categorySelector;
    String dateSelector;
    String datePattern;
    boolean renderListing;

    @Singular("skipUrlContaining")
    List<String> skipUrlsContaining;

    boolean checkArchiveBeforeWrite;
    boolean llmCleaning;
    boolean translate;

    public boolean isFeed() {
        return kind == SourceKind.FEED;
    }

    public String getDisplayName() {
        return displayName != null ? displayName : name;
    }

    public int effectiveMinContentLength(int defaultLength) {
        return minContentLength != null ? minContentLength : defaultLength;
    }

    /**
     * Returns the configured extraction order, or every strategy in default order.
     */
    public List<ExtractionMethod> effectiveExtractionOrder() {
        if (extractionOrder == null || extractionOrder.isEmpty()) {
            return List.of(ExtractionMethod.values());
        }
        return extractionOrder;
    }
}
