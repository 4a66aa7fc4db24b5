package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.config.ScrapingConfig;
import com.newsvault.backend.scraper.model.ExtractionMethod;
import com.newsvault.backend.scraper.render.RenderEnginePool;
import com.newsvault.backend.scraper.render.RenderException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Renders the page in a headless browser, applies the source selector and prunes low-density blocks.
 */
@Component
@Slf4j
public class RenderedExtractionStrategy extends SelectorExtractionStrategy {

    private final RenderEnginePool renderEnginePool;
    private final ContentDensityPruner pruner;

    public RenderedExtractionStrategy(TextCleaner textCleaner, ScrapingConfig scrapingConfig, PipelineProperties properties,
                                      RenderEnginePool renderEnginePool, ContentDensityPruner pruner) {
        super(textCleaner, scrapingConfig, properties);
        this.renderEnginePool = renderEnginePool;
        this.pruner = pruner;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.RENDERED;
    }

    @Override
    public String extract(ExtractionContext context) {
        if (!context.getSource().isRenderEnabled()) {
            throw new ExtractionStepException("rendering disabled for source");
        }

        String url = context.getItem().getUrl();
        String html;
        try {
            html = renderEnginePool.renderHtml(url);
        } catch (RenderException e) {
            throw new ExtractionStepException(e.isTimedOut() ? "render timed out" : e.getMessage(), e);
        }

        Document page = Jsoup.parse(html, url);
        Element body = page.body();
        for (String selector : scrapingConfig.getStrippedElements()) {
            body.select(selector).remove();
        }
        pruner.prune(body);

        String text = bestMatchOrWholePage(body, context.getSource(), url);
        log.debug("🌐 Rendered extraction produced {} chars for {}", text.length(), url);
        return text;
    }
}
