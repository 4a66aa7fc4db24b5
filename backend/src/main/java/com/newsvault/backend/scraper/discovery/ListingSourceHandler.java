package com.newsvault.backend.scraper.discovery;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.config.ScrapingConfig;
import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.SourceDefinition;
import com.newsvault.backend.scraper.render.RenderEnginePool;
import com.newsvault.backend.scraper.render.RenderException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

/**
 * Discovers items from an HTML listing page using the source's row and link selectors.
 * <p>
 * When a row carries no usable timestamp the article page is fetched to read one.
 * A failing per-item fetch skips that item only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListingSourceHandler implements SourceHandler {

    private final PageFetcher pageFetcher;
    private final RenderEnginePool renderEnginePool;
    private final PublishDateParser dateParser;
    private final ScrapingConfig scrapingConfig;
    private final PipelineProperties properties;
    private final Clock clock;

    @Override
    public Stream<CandidateItem> discover(SourceDefinition source) {
        Document listing = fetchListing(source);
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(properties.getZone()));
        Duration window = source.getRecencyWindow() != null ? source.getRecencyWindow() : properties.getDefaultRecencyWindow();
        ZonedDateTime cutoff = now.minus(window);

        Elements rows = source.getItemSelector() != null
                ? listing.select(source.getItemSelector())
                : listing.select(source.getLinkSelector());
        log.info("🔍 {} listing has {} rows, keeping those published after {}", source.getDisplayName(), rows.size(), cutoff);

        Set<String> seenUrls = new LinkedHashSet<>();
        List<CandidateItem> items = new ArrayList<>();
        for (Element row : rows) {
            if (source.getMaxItems() > 0 && items.size() >= source.getMaxItems()) {
                break;
            }

            Element link = source.getItemSelector() != null ? row.selectFirst(source.getLinkSelector()) : row;
            if (link == null) continue;

            String url = UrlCanonicalizer.canonicalize(source.getEndpoint(), link.attr("href"));
            if (url == null || shouldSkip(url, source) || !seenUrls.add(url)) {
                continue;
            }

            String title = text(source.getTitleSelector() != null ? row.selectFirst(source.getTitleSelector()) : link);
            if (title == null) {
                log.debug("Skipping row without title: {}", url);
                continue;
            }

            Optional<ZonedDateTime> publishedAt = rowDate(row, source, now);
            if (publishedAt.isEmpty()) {
                publishedAt = articlePageDate(url, source);
            }
            if (publishedAt.isEmpty()) {
                log.warn("⚠️ No publish date for {}, skipping", url);
                continue;
            }

            ZonedDateTime canonical = PublishDateParser.toCanonical(publishedAt.get(), properties.getZone());
            if (canonical.isBefore(cutoff)) {
                log.debug("Skipping old item {} published {}", url, canonical);
                continue;
            }

            items.add(CandidateItem.builder()
                    .url(url)
                    .title(title)
                    .publishedAt(canonical)
                    .sourceName(source.getName())
                    .category(source.getCategorySelector() != null ? text(row.selectFirst(source.getCategorySelector())) : null)
                    .build());
        }

        log.info("✅ Discovered {} recent items from {}", items.size(), source.getDisplayName());
        return items.stream();
    }

    private Document fetchListing(SourceDefinition source) {
        try {
            if (source.isRenderListing()) {
                String html = renderEnginePool.renderHtml(source.getEndpoint());
                return Jsoup.parse(html, source.getEndpoint());
            }
            return pageFetcher.fetchHtml(source.getEndpoint());
        } catch (IOException | RenderException e) {
            throw new SourceFetchException(source.getName(), "Failed to fetch listing " + source.getEndpoint(), e);
        }
    }

    private boolean shouldSkip(String url, SourceDefinition source) {
        for (String pattern : source.getSkipUrlsContaining()) {
            if (url.contains(pattern)) return true;
        }
        for (String pattern : scrapingConfig.getExcludedUrlPatterns()) {
            if (url.contains(pattern)) return true;
        }
        return false;
    }

    private Optional<ZonedDateTime> rowDate(Element row, SourceDefinition source, ZonedDateTime now) {
        if (source.getDateSelector() == null) return Optional.empty();
        Element dateElement = row.selectFirst(source.getDateSelector());
        if (dateElement == null) return Optional.empty();

        String value = dateElement.hasAttr("datetime") ? dateElement.attr("datetime") : dateElement.text();
        if (source.getDatePattern() != null) {
            return dateParser.parseWithPattern(value, source.getDatePattern(), source.getZone(), now);
        }
        return dateParser.parse(value, source.getZone());
    }

    private Optional<ZonedDateTime> articlePageDate(String url, SourceDefinition source) {
        try {
            Document page = pageFetcher.fetchHtml(url);
            return dateParser.fromArticlePage(page, source.getZone());
        } catch (IOException | RuntimeException e) {
            log.warn("⚠️ Failed to fetch {} for its publish date: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private String text(Element element) {
        if (element == null) return null;
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }
}
