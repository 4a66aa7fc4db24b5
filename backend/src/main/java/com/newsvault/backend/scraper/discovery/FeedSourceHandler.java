package com.newsvault.backend.scraper.discovery;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.SourceDefinition;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

/**
 * Discovers items from RSS 2.0 and Atom feeds.
 * <p>
 * The feed document is fetched eagerly so an unreachable feed fails the source up front;
 * entries are then converted lazily in feed order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedSourceHandler implements SourceHandler {

    private final PageFetcher pageFetcher;
    private final PublishDateParser dateParser;
    private final PipelineProperties properties;
    private final Clock clock;

    @Override
    public Stream<CandidateItem> discover(SourceDefinition source) {
        Document feed;
        try {
            feed = pageFetcher.fetchXml(source.getEndpoint());
        } catch (IOException e) {
            throw new SourceFetchException(source.getName(), "Failed to fetch feed " + source.getEndpoint(), e);
        }

        if (feed.selectFirst("rss, feed, rdf|RDF, channel") == null) {
            throw new SourceFetchException(source.getName(), "Document at " + source.getEndpoint() + " is not an RSS or Atom feed", null);
        }

        Elements entries = feed.select("item, entry");
        ZonedDateTime cutoff = recencyCutoff(source);
        log.info("📰 {} feed has {} entries, keeping those published after {}", source.getDisplayName(), entries.size(), cutoff);

        Stream<CandidateItem> items = entries.stream()
                .map(entry -> toCandidate(entry, source))
                .flatMap(Optional::stream)
                .filter(item -> {
                    boolean recent = !item.getPublishedAt().isBefore(cutoff);
                    if (!recent) {
                        log.debug("Skipping old entry {} published {}", item.getUrl(), item.getPublishedAt());
                    }
                    return recent;
                });
        return source.getMaxItems() > 0 ? items.limit(source.getMaxItems()) : items;
    }

    ZonedDateTime recencyCutoff(SourceDefinition source) {
        Duration window = source.getRecencyWindow() != null ? source.getRecencyWindow() : properties.getDefaultRecencyWindow();
        return ZonedDateTime.now(clock.withZone(properties.getZone())).minus(window);
    }

    private Optional<CandidateItem> toCandidate(Element entry, SourceDefinition source) {
        String title = childText(entry, "title");
        String url = UrlCanonicalizer.canonicalize(source.getEndpoint(), entryLink(entry));
        String rawDate = firstChildText(entry, "pubDate", "published", "updated", "dc|date");
        Optional<ZonedDateTime> publishedAt = dateParser.parse(rawDate, source.getZone());

        if (title == null || url == null || publishedAt.isEmpty()) {
            log.warn("⚠️ Skipping malformed entry in {} (title={}, link={}, date={})", source.getName(), title, url, rawDate);
            return Optional.empty();
        }

        return Optional.of(CandidateItem.builder()
                .url(url)
                .title(title)
                .publishedAt(PublishDateParser.toCanonical(publishedAt.get(), properties.getZone()))
                .sourceName(source.getName())
                .author(entryAuthor(entry))
                .category(entryCategory(entry))
                .summary(entrySummary(entry))
                .build());
    }

    private String entryLink(Element entry) {
        // Atom: <link rel="alternate" href="..."/>, RSS: <link>...</link>
        for (Element link : entry.children()) {
            if (!link.normalName().equals("link")) continue;
            if (link.hasAttr("href")) {
                String rel = link.attr("rel");
                if (rel.isEmpty() || rel.equals("alternate")) return link.attr("href");
            } else if (!link.text().isBlank()) {
                return link.text().trim();
            }
        }
        String guid = childText(entry, "guid");
        return guid != null && guid.startsWith("http") ? guid : null;
    }

    private String entryAuthor(Element entry) {
        Element atomName = entry.selectFirst("author > name");
        if (atomName != null && !atomName.text().isBlank()) return atomName.text().trim();
        return firstChildText(entry, "dc|creator", "author");
    }

    private String entryCategory(Element entry) {
        for (Element category : entry.children()) {
            if (!category.normalName().equals("category")) continue;
            if (category.hasAttr("term")) return category.attr("term");
            if (!category.text().isBlank()) return category.text().trim();
        }
        return null;
    }

    private String entrySummary(Element entry) {
        String raw = firstChildText(entry, "description", "summary", "content|encoded", "content");
        if (raw == null) return null;
        // Descriptions are usually escaped HTML
        String text = Jsoup.parse(raw).text().trim();
        return text.isEmpty() ? null : text;
    }

    private String firstChildText(Element entry, String... selectors) {
        for (String selector : selectors) {
            String value = childText(entry, selector);
            if (value != null) return value;
        }
        return null;
    }

    private String childText(Element entry, String selector) {
        Element child = entry.selectFirst("> " + selector);
        if (child == null) return null;
        String text = child.text().trim();
        return text.isEmpty() ? null : text;
    }
}
