package com.newsvault.backend.storage;

import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.hash.Hashing;
import com.newsvault.backend.scraper.model.ExtractedArticle;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Stable identifiers derived from article content and metadata.
 */
@Component
public class ContentHasher {

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of {@code text}.
     */
    public String sha256(String text) {
        return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
    }

    /**
     * The article id shared by the archive record and the index point.
     * Identical content and key metadata always produce the same id, so a retried upsert overwrites.
     */
    public String articleId(ExtractedArticle article) {
        String hashInput = String.join("\u0000",
                nullToEmpty(article.getContent()),
                nullToEmpty(article.getUrl()),
                nullToEmpty(article.getTitle()),
                nullToEmpty(article.getSourceName()),
                article.getPublishedAt() == null ? "" : article.getPublishedAt().toInstant().toString());
        return UUID.nameUUIDFromBytes(sha256(hashInput).getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * First eight hex characters of the URL hash, used in archive keys.
     */
    public String shortUrlHash(String url) {
        return sha256(nullToEmpty(url)).substring(0, 8);
    }
}
