package com.newsvault.backend.scraper.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.newsvault.backend.config.ConfigurationException;
import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.scraper.model.ExtractionMethod;
import com.newsvault.backend.scraper.model.SourceDefinition;
import com.newsvault.backend.scraper.model.SourceKind;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class SourceRegistryTest {

    private PipelineProperties properties;
    private SourceRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        registry = new SourceRegistry(properties, new DefaultResourceLoader());
    }

    @Test
    void loadsFeedAndListingDefinitionsInFileOrder() {
        registry.loadFrom(yaml(
                "sources:\n"
                        + "  - name: fxfeed\n"
                        + "    kind: rss\n"
                        + "    endpoint: https://fx.example.com/rss\n"
                        + "    recencyWindow: 6h\n"
                        + "    maxItems: 20\n"
                        + "  - name: tokyo\n"
                        + "    kind: listing\n"
                        + "    endpoint: https://tokyo.example.com/news/\n"
                        + "    timezone: Asia/Tokyo\n"
                        + "    itemSelector: tr.row\n"
                        + "    linkSelector: a.title\n"
                        + "    minContentLength: 120\n"
                        + "    extractionOrder: [static, paragraph, static]\n"
                        + "    skipUrlsContaining: [/video/]\n"));

        List<SourceDefinition> sources = registry.getSources();
        assertEquals(2, sources.size());

        SourceDefinition feed = sources.get(0);
        assertEquals("fxfeed", feed.getName());
        assertEquals(SourceKind.FEED, feed.getKind());
        assertEquals(Duration.ofHours(6), feed.getRecencyWindow());
        assertEquals(20, feed.getMaxItems());
        assertEquals(properties.getZone(), feed.getZone());
        assertNull(feed.getMinContentLength());
        assertEquals(List.of(ExtractionMethod.values()), feed.effectiveExtractionOrder());

        SourceDefinition listing = sources.get(1);
        assertEquals(SourceKind.LISTING, listing.getKind());
        assertEquals(ZoneId.of("Asia/Tokyo"), listing.getZone());
        assertEquals(properties.getDefaultRecencyWindow(), listing.getRecencyWindow());
        assertEquals(120, listing.getMinContentLength());
        assertEquals(List.of(ExtractionMethod.STATIC, ExtractionMethod.PARAGRAPH), listing.effectiveExtractionOrder());
        assertEquals(List.of("/video/"), listing.getSkipUrlsContaining());
    }

    @Test
    void skipsInvalidAndDuplicateEntries() {
        registry.loadFrom(yaml(
                "sources:\n"
                        + "  - name: no-endpoint\n"
                        + "    kind: feed\n"
                        + "  - name: listing-without-links\n"
                        + "    kind: listing\n"
                        + "    endpoint: https://a.example.com/\n"
                        + "  - name: unknown-kind\n"
                        + "    kind: podcast\n"
                        + "    endpoint: https://b.example.com/\n"
                        + "  - name: good\n"
                        + "    kind: feed\n"
                        + "    endpoint: https://c.example.com/feed\n"
                        + "  - name: good\n"
                        + "    kind: feed\n"
                        + "    endpoint: https://d.example.com/feed\n"));

        assertEquals(1, registry.getSources().size());
        assertEquals("https://c.example.com/feed", registry.getSource("good").orElseThrow().getEndpoint());
        assertFalse(registry.getSource("unknown-kind").isPresent());
    }

    @Test
    void rejectsFileWithoutSourcesList() {
        assertThrows(ConfigurationException.class, () -> registry.loadFrom(yaml("feeds: []\n")));
    }

    @Test
    void loadsBundledSourceFile() {
        registry.loadConfigurations();

        assertFalse(registry.getSources().isEmpty());
        assertTrue(registry.getSources().stream().anyMatch(source -> source.getKind() == SourceKind.LISTING));
    }

    @Test
    void parsesShortAndIsoDurations() {
        assertEquals(Duration.ofDays(2), SourceRegistry.parseDuration("2d"));
        assertEquals(Duration.ofMinutes(90), SourceRegistry.parseDuration("90m"));
        assertEquals(Duration.ofHours(24), SourceRegistry.parseDuration("PT24H"));
        assertThrows(IllegalArgumentException.class, () -> SourceRegistry.parseDuration("soon"));
    }

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
