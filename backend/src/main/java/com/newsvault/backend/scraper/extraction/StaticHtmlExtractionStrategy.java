package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.config.ScrapingConfig;
import com.newsvault.backend.scraper.model.ExtractionMethod;
import java.io.IOException;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Plain HTTP fetch, then the content selectors, then the whole page when no match is long enough.
 */
@Component
public class StaticHtmlExtractionStrategy extends SelectorExtractionStrategy {

    public StaticHtmlExtractionStrategy(TextCleaner textCleaner, ScrapingConfig scrapingConfig,
                                        PipelineProperties properties) {
        super(textCleaner, scrapingConfig, properties);
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.STATIC;
    }

    @Override
    public String extract(ExtractionContext context) {
        Document page;
        try {
            page = context.staticPage();
        } catch (IOException e) {
            throw new ExtractionStepException("fetch failed: " + e.getMessage(), e);
        }

        return bestMatchOrWholePage(page.body(), context.getSource(), context.getItem().getUrl());
    }
}
