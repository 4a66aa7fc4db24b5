package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.config.ScrapingConfig;
import com.newsvault.backend.scraper.model.SourceDefinition;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

/**
 * Base for stages that pick article text by CSS selector.
 */
@Slf4j
public abstract class SelectorExtractionStrategy implements ExtractionStrategy {

    protected final TextCleaner textCleaner;
    protected final ScrapingConfig scrapingConfig;
    protected final PipelineProperties properties;

    protected SelectorExtractionStrategy(TextCleaner textCleaner, ScrapingConfig scrapingConfig,
                                         PipelineProperties properties) {
        this.textCleaner = textCleaner;
        this.scrapingConfig = scrapingConfig;
        this.properties = properties;
    }

    /**
     * The largest selector match when it reaches the source's minimum length, otherwise
     * whichever of that match and the cleaned text of {@code root} is longer.
     */
    protected String bestMatchOrWholePage(Element root, SourceDefinition source, String url) {
        String best = largestMatch(root, selectorsFor(source));
        if (best.length() >= source.effectiveMinContentLength(properties.getMinContentLength())) {
            return best;
        }

        String pageText = textCleaner.cleanElement(root);
        if (pageText.length() > best.length()) {
            log.debug("No qualifying selector match for {} ({} chars), using full page text", url, best.length());
            return pageText;
        }
        return best;
    }

    /**
     * Source selectors when configured, otherwise the generic ones.
     */
    protected List<String> selectorsFor(SourceDefinition source) {
        return source.getContentSelectors().isEmpty() ? scrapingConfig.getContentSelectors() : source.getContentSelectors();
    }

    /**
     * Cleaned text of the selector match with the most text, or an empty string when nothing matches.
     */
    protected String largestMatch(Element root, List<String> selectors) {
        String best = "";
        for (String selector : selectors) {
            for (Element element : root.select(selector)) {
                String text = textCleaner.cleanElement(element);
                if (text.length() > best.length()) {
                    log.debug("Selector '{}' matched {} chars", selector, text.length());
                    best = text;
                }
            }
        }
        return best;
    }
}
