package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.scraper.model.ExtractionMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Uses the feed's summary, prefixed with the page title when the page was already fetched.
 */
@Component
@RequiredArgsConstructor
public class FeedSummaryExtractionStrategy implements ExtractionStrategy {

    private final TextCleaner textCleaner;

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.FEED_SUMMARY;
    }

    @Override
    public String extract(ExtractionContext context) {
        String summary = context.getItem().getSummary();
        if (summary == null || summary.isBlank()) {
            throw new ExtractionStepException("no feed summary");
        }

        String pageTitle = context.fetchedStaticPage()
                .map(page -> page.title().trim())
                .filter(title -> !title.isEmpty())
                .orElse(context.getItem().getTitle());
        String text = pageTitle != null ? pageTitle + "\n" + summary : summary;
        return textCleaner.clean(text);
    }
}
