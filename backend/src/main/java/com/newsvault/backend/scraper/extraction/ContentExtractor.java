package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.scraper.discovery.PageFetcher;
import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.ExtractedArticle;
import com.newsvault.backend.scraper.model.ExtractionMethod;
import com.newsvault.backend.scraper.model.SourceDefinition;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the full text of a candidate item through the ordered strategy chain.
 * <p>
 * The first stage whose cleaned text reaches the minimum length wins and no later stage runs.
 * A feed summary shorter than that is kept only as a last resort and flagged.
 */
@Service
@Slf4j
public class ContentExtractor {

    private final Map<ExtractionMethod, ExtractionStrategy> strategies = new EnumMap<>(ExtractionMethod.class);
    private final PageFetcher pageFetcher;
    private final PipelineProperties properties;

    public ContentExtractor(List<ExtractionStrategy> strategies, PageFetcher pageFetcher, PipelineProperties properties) {
        for (ExtractionStrategy strategy : strategies) {
            this.strategies.put(strategy.method(), strategy);
        }
        this.pageFetcher = pageFetcher;
        this.properties = properties;
    }

    /**
     * @throws ExtractionExhaustedException when no stage produced acceptable text
     */
    public ExtractedArticle extract(CandidateItem item, SourceDefinition source) {
        ExtractionContext context = new ExtractionContext(item, source, pageFetcher);
        int minLength = source.effectiveMinContentLength(properties.getMinContentLength());
        Map<ExtractionMethod, String> reasons = new LinkedHashMap<>();
        String lastResort = null;

        for (ExtractionMethod method : source.effectiveExtractionOrder()) {
            ExtractionStrategy strategy = strategies.get(method);
            if (strategy == null) {
                reasons.put(method, "strategy not available");
                continue;
            }

            String text;
            try {
                text = strategy.extract(context);
            } catch (ExtractionStepException e) {
                log.debug("Strategy {} failed for {}: {}", method.getCode(), item.getUrl(), e.getMessage());
                reasons.put(method, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.warn("⚠️ Strategy {} errored for {}: {}", method.getCode(), item.getUrl(), e.getMessage());
                reasons.put(method, "error: " + e.getMessage());
                continue;
            }

            if (acceptable(text, minLength, source)) {
                log.debug("✅ Extracted {} chars from {} via {}", text.length(), item.getUrl(), method.getCode());
                return ExtractedArticle.of(item, text, method, false);
            }

            reasons.put(method, "too short (" + (text == null ? 0 : text.length()) + " chars)");
            if (method == ExtractionMethod.FEED_SUMMARY && text != null && text.length() >= properties.getLastResortMinLength()) {
                lastResort = text;
            }
        }

        if (lastResort != null) {
            log.warn("⚠️ Using {}-char feed summary for {} as last resort", lastResort.length(), item.getUrl());
            return ExtractedArticle.of(item, lastResort, ExtractionMethod.FEED_SUMMARY, true);
        }
        throw new ExtractionExhaustedException(item.getUrl(), reasons);
    }

    private boolean acceptable(String text, int minLength, SourceDefinition source) {
        if (text == null || text.length() < minLength) return false;
        return source.getMinWordCount() <= 0 || TextCleaner.wordCount(text) >= source.getMinWordCount();
    }
}
