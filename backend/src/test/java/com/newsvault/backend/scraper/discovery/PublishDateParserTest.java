package com.newsvault.backend.scraper.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class PublishDateParserTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");

    private final PublishDateParser parser = new PublishDateParser();

    @Test
    void parsesRssAndIsoTimestamps() {
        assertEquals(Instant.parse("2025-06-10T14:05:00Z"),
                parser.parse("Tue, 10 Jun 2025 14:05:00 GMT", TOKYO).orElseThrow().toInstant());
        assertEquals(Instant.parse("2025-06-10T14:05:00Z"),
                parser.parse("Tue, 10 Jun 2025 14:05:00 +0000", TOKYO).orElseThrow().toInstant());
        assertEquals(Instant.parse("2025-06-10T10:34:07Z"),
                parser.parse("2025-06-10T16:34:07+06:00", TOKYO).orElseThrow().toInstant());
    }

    @Test
    void readsOffsetlessValuesInSourceZone() {
        assertEquals(Instant.parse("2025-06-10T00:00:00Z"),
                parser.parse("2025-06-10T09:00:00", TOKYO).orElseThrow().toInstant());
        assertEquals(Instant.parse("2025-06-09T15:00:00Z"),
                parser.parse("2025-06-10", TOKYO).orElseThrow().toInstant());
    }

    @Test
    void returnsEmptyForUnparseableValues() {
        assertTrue(parser.parse("yesterday afternoon", TOKYO).isEmpty());
        assertTrue(parser.parse("", TOKYO).isEmpty());
        assertTrue(parser.parse(null, TOKYO).isEmpty());
    }

    @Test
    void patternWithoutYearTakesCurrentYear() {
        ZonedDateTime now = ZonedDateTime.of(2025, 6, 10, 3, 0, 0, 0, ZoneOffset.UTC);

        ZonedDateTime parsed = parser.parseWithPattern("06/10 11:30", "MM/dd HH:mm", TOKYO, now).orElseThrow();

        assertEquals(Instant.parse("2025-06-10T02:30:00Z"), parsed.toInstant());
    }

    @Test
    void patternWithoutYearRollsBackAcrossNewYear() {
        ZonedDateTime now = ZonedDateTime.of(2025, 1, 1, 1, 0, 0, 0, ZoneOffset.UTC);

        ZonedDateTime parsed = parser.parseWithPattern("12/31 23:00", "MM/dd HH:mm", TOKYO, now).orElseThrow();

        assertEquals(2024, parsed.getYear());
    }

    @Test
    void articlePagePrefersJsonLdThenMeta() {
        Document jsonLd = Jsoup.parse("<html><head>"
                + "<script type=\"application/ld+json\">{\"@graph\":[{\"@type\":\"WebPage\"},"
                + "{\"@type\":\"NewsArticle\",\"datePublished\":\"2025-06-10T08:00:00Z\"}]}</script>"
                + "<meta property=\"article:published_time\" content=\"2025-06-01T00:00:00Z\">"
                + "</head><body></body></html>");
        Document metaOnly = Jsoup.parse("<html><head>"
                + "<meta property=\"article:published_time\" content=\"2025-06-01T00:00:00Z\">"
                + "</head><body></body></html>");
        Document timeOnly = Jsoup.parse("<html><body><time datetime=\"2025-05-01T12:00:00+09:00\">May 1</time></body></html>");

        assertEquals(Instant.parse("2025-06-10T08:00:00Z"), parser.fromArticlePage(jsonLd, TOKYO).orElseThrow().toInstant());
        assertEquals(Instant.parse("2025-06-01T00:00:00Z"), parser.fromArticlePage(metaOnly, TOKYO).orElseThrow().toInstant());
        assertEquals(Instant.parse("2025-05-01T03:00:00Z"), parser.fromArticlePage(timeOnly, TOKYO).orElseThrow().toInstant());
        assertTrue(parser.fromArticlePage(Jsoup.parse("<p>nothing</p>"), TOKYO).isEmpty());
    }

    @Test
    void canonicalizationKeepsInstant() {
        ZonedDateTime tokyo = ZonedDateTime.of(2025, 6, 10, 9, 0, 0, 0, TOKYO);

        ZonedDateTime canonical = PublishDateParser.toCanonical(tokyo, LOS_ANGELES);

        assertEquals(LOS_ANGELES, canonical.getZone());
        assertEquals(tokyo.toInstant(), canonical.toInstant());
    }
}
