package com.newsvault.backend.persistence;

import com.newsvault.backend.ai.service.EmbeddingService;
import com.newsvault.backend.config.ConfigurationException;
import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.dedup.DuplicateFilter;
import com.newsvault.backend.health.DependencyHealthRegistry;
import com.newsvault.backend.scraper.model.ExtractedArticle;
import com.newsvault.backend.scraper.model.SourceDefinition;
import com.newsvault.backend.storage.ContentHasher;
import com.newsvault.backend.storage.archive.ArchiveKeys;
import com.newsvault.backend.storage.archive.ArchivePutResult;
import com.newsvault.backend.storage.archive.ArchiveRecord;
import com.newsvault.backend.storage.archive.ContentArchive;
import com.newsvault.backend.storage.index.IndexFilter;
import com.newsvault.backend.storage.index.IndexRecord;
import com.newsvault.backend.storage.index.IndexStats;
import com.newsvault.backend.storage.index.VectorIndexClient;
import com.newsvault.backend.storage.index.VectorIndexClientFactory;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Writes each article to the content archive and the vector index.
 * <p>
 * The two sinks are independent. An archive failure is logged and reported but the index write
 * still happens, and index success alone admits the URL to the duplicate filter. Index writes
 * are retried with backoff, each attempt on a fresh session, under an id derived from the
 * article so a retry overwrites rather than duplicates.
 */
@Service
@Slf4j
public class PersistenceCoordinator {

    private final ContentArchive contentArchive;
    private final VectorIndexClientFactory indexClientFactory;
    private final EmbeddingService embeddingService;
    private final DuplicateFilter duplicateFilter;
    private final ContentHasher contentHasher;
    private final DependencyHealthRegistry healthRegistry;
    private final PipelineProperties properties;
    private final Clock clock;
    private final RetryPolicy indexRetryPolicy;

    @Autowired
    public PersistenceCoordinator(ContentArchive contentArchive,
                                  VectorIndexClientFactory indexClientFactory,
                                  EmbeddingService embeddingService,
                                  DuplicateFilter duplicateFilter,
                                  ContentHasher contentHasher,
                                  DependencyHealthRegistry healthRegistry,
                                  PipelineProperties properties,
                                  Clock clock) {
        this(contentArchive, indexClientFactory, embeddingService, duplicateFilter, contentHasher, healthRegistry,
                properties, clock,
                RetryPolicy.exponential(properties.getIndex().getMaxAttempts(), properties.getIndex().getBaseBackoff(),
                        PersistenceCoordinator::isRetryable));
    }

    PersistenceCoordinator(ContentArchive contentArchive,
                           VectorIndexClientFactory indexClientFactory,
                           EmbeddingService embeddingService,
                           DuplicateFilter duplicateFilter,
                           ContentHasher contentHasher,
                           DependencyHealthRegistry healthRegistry,
                           PipelineProperties properties,
                           Clock clock,
                           RetryPolicy indexRetryPolicy) {
        this.contentArchive = contentArchive;
        this.indexClientFactory = indexClientFactory;
        this.embeddingService = embeddingService;
        this.duplicateFilter = duplicateFilter;
        this.contentHasher = contentHasher;
        this.healthRegistry = healthRegistry;
        this.properties = properties;
        this.clock = clock;
        this.indexRetryPolicy = indexRetryPolicy;
    }

    public PersistResult persist(ExtractedArticle article, SourceDefinition source) {
        String articleId = contentHasher.articleId(article);
        ZonedDateTime crawledAt = ZonedDateTime.now(clock.withZone(properties.getZone()));
        PersistResult.PersistResultBuilder result = PersistResult.builder().articleId(articleId);

        // Archive first; its outcome never decides admission
        ArchiveOutcome archiveOutcome = archive(article, source, articleId, crawledAt);
        result.archived(archiveOutcome.archived).archiveSkipped(archiveOutcome.skipped);
        if (archiveOutcome.error != null) {
            result.error(PersistenceErrorKind.ARCHIVE_WRITE).errorMessage(archiveOutcome.error);
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            index(article, articleId, crawledAt, attempts);
            result.indexed(true);
            duplicateFilter.admit(article.getUrl(), article.getTitle());
        } catch (PersistenceException e) {
            log.error("❌ Index write failed for '{}' ({}) after {} attempt(s): {}",
                    article.getTitle(), article.getUrl(), attempts.get(), e.getMessage());
            result.indexed(false).error(e.getKind()).errorMessage(e.getMessage());
        }
        return result.indexAttempts(attempts.get()).build();
    }

    private ArchiveOutcome archive(ExtractedArticle article, SourceDefinition source, String articleId, ZonedDateTime crawledAt) {
        if (!properties.getArchive().isEnabled()) {
            return new ArchiveOutcome(false, false, null);
        }

        String urlHash = contentHasher.shortUrlHash(article.getUrl());
        String prefix = ArchiveKeys.namePrefix(source.getName(), article.getTitle(), urlHash, article.getPublishedAt(), properties.getZone());
        try {
            if (source.isCheckArchiveBeforeWrite()) {
                List<String> existing = contentArchive.exists(prefix);
                if (!existing.isEmpty()) {
                    log.debug("📁 Already archived, skipping upload: {}", existing.get(0));
                    return new ArchiveOutcome(true, true, null);
                }
            }

            ArchivePutResult put = contentArchive.put(prefix + ".json", toArchiveRecord(article, articleId, crawledAt));
            if (put.isOk()) {
                healthRegistry.markHealthy(DependencyHealthRegistry.ARCHIVE);
                return new ArchiveOutcome(true, false, null);
            }
            healthRegistry.markUnhealthy(DependencyHealthRegistry.ARCHIVE, put.getLocationOrError());
            log.warn("⚠️ Archive write failed for '{}' ({}): {}", article.getTitle(), article.getUrl(), put.getLocationOrError());
            return new ArchiveOutcome(false, false, put.getLocationOrError());
        } catch (RuntimeException e) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.ARCHIVE, e.getMessage());
            log.warn("⚠️ Archive write failed for '{}' ({}): {}", article.getTitle(), article.getUrl(), e.getMessage());
            return new ArchiveOutcome(false, false, e.getMessage());
        }
    }

    private void index(ExtractedArticle article, String articleId, ZonedDateTime crawledAt, AtomicInteger attempts) {
        float[] vector;
        try {
            vector = embeddingService.embed(embeddingInput(article));
        } catch (ConfigurationException e) {
            throw new PersistenceException(PersistenceErrorKind.CONFIGURATION, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new PersistenceException(PersistenceErrorKind.EMBEDDING, "Embedding failed: " + e.getMessage(), e);
        }

        IndexRecord record = IndexRecord.builder()
                .id(articleId)
                .vector(vector)
                .payload(payload(article, articleId, crawledAt))
                .build();

        try {
            indexRetryPolicy.run("Index upsert of '" + article.getTitle() + "'", () -> {
                attempts.incrementAndGet();
                // New session per attempt, a failed one may hold a broken channel
                try (VectorIndexClient client = indexClientFactory.open()) {
                    client.upsert(record);
                }
            });
            healthRegistry.markHealthy(DependencyHealthRegistry.VECTOR_INDEX);
        } catch (RuntimeException e) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.VECTOR_INDEX, e.getMessage());
            throw new PersistenceException(PersistenceErrorKind.INDEX_WRITE, e.getMessage(), e);
        }
    }

    /**
     * Removes every point from the vector index and forgets every admitted URL.
     */
    public long clearIndex() {
        try (VectorIndexClient client = indexClientFactory.open()) {
            long before = client.count();
            client.clearAll();
            duplicateFilter.clear();
            log.warn("🗑️ Cleared vector index ({} points)", before);
            return before;
        }
    }

    public void recreateIndex() {
        try (VectorIndexClient client = indexClientFactory.open()) {
            client.recreate();
            duplicateFilter.clear();
        }
    }

    public IndexStats indexStats() {
        try (VectorIndexClient client = indexClientFactory.open()) {
            return client.stats();
        }
    }

    String embeddingInput(ExtractedArticle article) {
        String text = article.getTitle() + "\n\n" + article.getContent();
        int limit = properties.getIndex().getEmbeddingInputLimit();
        return text.length() > limit ? text.substring(0, limit) : text;
    }

    Map<String, Object> payload(ExtractedArticle article, String articleId, ZonedDateTime crawledAt) {
        String content = article.getContent();
        int textLimit = properties.getIndex().getPayloadTextLimit();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("articleId", articleId);
        payload.put("title", article.getTitle());
        payload.put("url", article.getUrl());
        payload.put("source", article.getSourceName());
        payload.put("author", article.getAuthor());
        payload.put("category", article.getCategory());
        payload.put("publishedAt", article.getPublishedAt().toOffsetDateTime().toString());
        payload.put("publishedAtEpoch", IndexFilter.epochSeconds(article.getPublishedAt().toInstant()));
        payload.put("crawledAt", crawledAt.toOffsetDateTime().toString());
        payload.put("extractionMethod", article.getExtractionMethod().getCode());
        payload.put("text", content.length() > textLimit ? content.substring(0, textLimit) : content);
        payload.put("textLength", content.length());
        payload.put("translatedTitle", article.getTranslatedTitle());
        return payload;
    }

    private ArchiveRecord toArchiveRecord(ExtractedArticle article, String articleId, ZonedDateTime crawledAt) {
        return ArchiveRecord.builder()
                .articleId(articleId)
                .url(article.getUrl())
                .title(article.getTitle())
                .source(article.getSourceName())
                .author(article.getAuthor())
                .category(article.getCategory())
                .content(article.getContent())
                .contentLength(article.getContentLength())
                .extractionMethod(article.getExtractionMethod().getCode())
                .belowThreshold(article.isBelowThreshold())
                .publishedAt(article.getPublishedAt().toOffsetDateTime().toString())
                .crawledAt(crawledAt.toOffsetDateTime().toString())
                .translatedTitle(article.getTranslatedTitle())
                .translatedContent(article.getTranslatedContent())
                .build();
    }

    static boolean isRetryable(Throwable error) {
        return !(error instanceof ConfigurationException) && !(error instanceof IllegalArgumentException);
    }

    private static final class ArchiveOutcome {
        private final boolean archived;
        private final boolean skipped;
        private final String error;

        private ArchiveOutcome(boolean archived, boolean skipped, String error) {
            this.archived = archived;
            this.skipped = skipped;
            this.error = error;
        }
    }
}
