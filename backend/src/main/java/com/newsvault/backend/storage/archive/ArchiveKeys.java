package com.newsvault.backend.storage.archive;

import java.text.Normalizer;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds archive keys of the form {@code YYYY/MM/DD/<source>-<slug>-<hash8>.json}.
 */
public final class ArchiveKeys {

    private static final DateTimeFormatter DATE_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final int MAX_SLUG_LENGTH = 60;

    private ArchiveKeys() {
    }

    public static String keyFor(String source, String title, String urlHash, ZonedDateTime publishedAt, ZoneId zone) {
        return namePrefix(source, title, urlHash, publishedAt, zone) + ".json";
    }

    /**
     * Key without the extension; the prefix checked before writing.
     */
    public static String namePrefix(String source, String title, String urlHash, ZonedDateTime publishedAt, ZoneId zone) {
        return datePrefix(publishedAt.withZoneSameInstant(zone).toLocalDate())
                + slug(source) + "-" + slug(title) + "-" + urlHash;
    }

    public static String datePrefix(LocalDate date) {
        return date.format(DATE_PATH) + "/";
    }

    static String slug(String value) {
        if (value == null || value.isBlank()) return "untitled";
        String ascii = Normalizer.normalize(value, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (ascii.length() > MAX_SLUG_LENGTH) {
            ascii = ascii.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return ascii.isEmpty() ? "untitled" : ascii;
    }
}
