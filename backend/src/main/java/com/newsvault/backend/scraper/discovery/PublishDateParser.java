package com.newsvault.backend.scraper.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Parses the publish timestamps found in feeds and article pages.
 * <p>
 * An unparseable value yields an empty result, never "now".
 */
@Component
@Slf4j
public class PublishDateParser {

    private static final DateTimeFormatter[] ZONED_FORMATS = {
            DateTimeFormatter.RFC_1123_DATE_TIME,      // Tue, 10 Jun 2025 14:05:00 GMT
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,    // 2025-06-10T16:34:07+06:00
            DateTimeFormatter.ISO_ZONED_DATE_TIME,     // 2025-06-10T16:33:30.000Z
            new DateTimeFormatterBuilder()             // Tue, 10 Jun 2025 14:05:00 +0000 with a textual zone tail
                    .parseCaseInsensitive()
                    .appendPattern("EEE, d MMM yyyy HH:mm[:ss] Z")
                    .toFormatter(Locale.ENGLISH)
    };

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a feed or meta timestamp. Values without an offset are read in {@code sourceZone}.
     */
    public Optional<ZonedDateTime> parse(String value, ZoneId sourceZone) {
        if (value == null || value.isBlank()) return Optional.empty();
        String dateStr = value.trim();

        for (DateTimeFormatter formatter : ZONED_FORMATS) {
            try {
                return Optional.of(ZonedDateTime.parse(dateStr, formatter));
            } catch (DateTimeParseException ignored) {
                // Try next formatter
            }
        }
        try {
            return Optional.of(LocalDateTime.parse(dateStr, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atZone(sourceZone));
        } catch (DateTimeParseException ignored) {
            // Fall through to date-only
        }
        try {
            return Optional.of(LocalDate.parse(dateStr, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(sourceZone));
        } catch (DateTimeParseException ignored) {
            log.debug("Could not parse date string: {}", dateStr);
        }
        return Optional.empty();
    }

    /**
     * Parses a listing-row timestamp with a source-specific pattern such as {@code MM/dd HH:mm}.
     * Missing year is taken from {@code now}; a result in the future rolls back one year.
     */
    public Optional<ZonedDateTime> parseWithPattern(String value, String pattern, ZoneId sourceZone, ZonedDateTime now) {
        if (value == null || value.isBlank() || pattern == null) return Optional.empty();
        ZonedDateTime localNow = now.withZoneSameInstant(sourceZone);
        DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .parseDefaulting(ChronoField.YEAR_OF_ERA, localNow.getYear())
                .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
                .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
                .toFormatter(Locale.ENGLISH);
        try {
            ZonedDateTime parsed = LocalDateTime.parse(value.trim(), formatter).atZone(sourceZone);
            if (!pattern.contains("y") && parsed.isAfter(localNow.plusDays(1))) {
                parsed = parsed.minusYears(1);
            }
            return Optional.of(parsed);
        } catch (DateTimeParseException e) {
            log.debug("Could not parse '{}' with pattern '{}': {}", value, pattern, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads the publish timestamp of an article page: JSON-LD {@code datePublished},
     * then {@code article:published_time}, then the first {@code time[datetime]}.
     */
    public Optional<ZonedDateTime> fromArticlePage(Document doc, ZoneId sourceZone) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            Optional<String> jsonLdDate = datePublishedFromJsonLd(script.data());
            if (jsonLdDate.isPresent()) {
                Optional<ZonedDateTime> parsed = parse(jsonLdDate.get(), sourceZone);
                if (parsed.isPresent()) return parsed;
            }
        }

        String[] metaSelectors = {
                "meta[property=article:published_time]",
                "meta[name=article:published_time]",
                "meta[itemprop=datePublished]",
                "meta[name=pubdate]"
        };
        for (String selector : metaSelectors) {
            Element meta = doc.selectFirst(selector);
            if (meta != null) {
                Optional<ZonedDateTime> parsed = parse(meta.attr("content"), sourceZone);
                if (parsed.isPresent()) return parsed;
            }
        }

        Element time = doc.selectFirst("time[datetime]");
        return time != null ? parse(time.attr("datetime"), sourceZone) : Optional.empty();
    }

    private Optional<String> datePublishedFromJsonLd(String json) {
        if (json == null || json.isBlank()) return Optional.empty();
        try {
            JsonNode root = objectMapper.readTree(json);
            return findDatePublished(root);
        } catch (Exception e) {
            log.debug("Failed to parse JSON-LD: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> findDatePublished(JsonNode node) {
        if (node == null) return Optional.empty();
        if (node.isArray()) {
            for (JsonNode child : node) {
                Optional<String> found = findDatePublished(child);
                if (found.isPresent()) return found;
            }
            return Optional.empty();
        }
        if (node.has("datePublished") && !node.get("datePublished").isNull()) {
            return Optional.of(node.get("datePublished").asText());
        }
        // Some sites nest the article inside @graph
        return node.has("@graph") ? findDatePublished(node.get("@graph")) : Optional.empty();
    }

    /**
     * Normalizes any zoned timestamp to the canonical zone.
     */
    public static ZonedDateTime toCanonical(ZonedDateTime value, ZoneId canonicalZone) {
        return value.withZoneSameInstant(canonicalZone);
    }
}
