package com.newsvault.backend.startup;

import com.newsvault.backend.ai.service.LlmContentCleaner;
import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.dedup.DuplicateFilter;
import com.newsvault.backend.persistence.PersistResult;
import com.newsvault.backend.persistence.PersistenceCoordinator;
import com.newsvault.backend.retention.RetentionException;
import com.newsvault.backend.retention.RetentionResult;
import com.newsvault.backend.retention.RetentionSweeper;
import com.newsvault.backend.scraper.discovery.SourceFetchException;
import com.newsvault.backend.scraper.discovery.SourceHandlerFactory;
import com.newsvault.backend.scraper.extraction.ContentExtractor;
import com.newsvault.backend.scraper.extraction.ExtractionExhaustedException;
import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.ExtractedArticle;
import com.newsvault.backend.scraper.model.SourceDefinition;
import com.newsvault.backend.scraper.source.SourceRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drives the ingestion pipeline: one pass over every source per cycle, then retention when due.
 * <p>
 * Sources run concurrently on the source executor; items of one source run sequentially in
 * discovery order. Failures are recovered per item, then per source, so a cycle always finishes.
 */
@Slf4j
@Service
public class CycleOrchestrator {

    private final SourceRegistry sourceRegistry;
    private final SourceHandlerFactory handlerFactory;
    private final ContentExtractor contentExtractor;
    private final LlmContentCleaner llmContentCleaner;
    private final DuplicateFilter duplicateFilter;
    private final PersistenceCoordinator persistenceCoordinator;
    private final RetentionSweeper retentionSweeper;
    private final MemoryGuard memoryGuard;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Executor sourceTaskExecutor;

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong();
    private final AtomicReference<CycleStats> lastCycle = new AtomicReference<>();
    private final AtomicReference<ZonedDateTime> lastRetentionRun = new AtomicReference<>();
    private volatile boolean isStartupComplete = false;

    public CycleOrchestrator(SourceRegistry sourceRegistry,
                             SourceHandlerFactory handlerFactory,
                             ContentExtractor contentExtractor,
                             LlmContentCleaner llmContentCleaner,
                             DuplicateFilter duplicateFilter,
                             PersistenceCoordinator persistenceCoordinator,
                             RetentionSweeper retentionSweeper,
                             MemoryGuard memoryGuard,
                             PipelineProperties properties,
                             Clock clock,
                             @Qualifier("sourceTaskExecutor") Executor sourceTaskExecutor) {
        this.sourceRegistry = sourceRegistry;
        this.handlerFactory = handlerFactory;
        this.contentExtractor = contentExtractor;
        this.llmContentCleaner = llmContentCleaner;
        this.duplicateFilter = duplicateFilter;
        this.persistenceCoordinator = persistenceCoordinator;
        this.retentionSweeper = retentionSweeper;
        this.memoryGuard = memoryGuard;
        this.properties = properties;
        this.clock = clock;
        this.sourceTaskExecutor = sourceTaskExecutor;
    }

    /**
     * Automatically start the first cycle when the application is ready
     */
    @EventListener(ApplicationReadyEvent.class)
    @Async
    public void onApplicationReady() {
        if (!properties.isAutoStart()) {
            log.info("🔕 Auto-start disabled via configuration");
            return;
        }

        log.info("🚀 APPLICATION READY - Starting ingestion pipeline in {} seconds...", properties.getStartupDelay().toSeconds());
        try {
            Thread.sleep(properties.getStartupDelay().toMillis());
            runCycle();
        } catch (InterruptedException e) {
            log.error("❌ Startup cycle interrupted: {}", e.getMessage());
            Thread.currentThread().interrupt();
        } finally {
            isStartupComplete = true;
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.cycle-interval:1h}", initialDelayString = "${pipeline.cycle-interval:1h}")
    public void scheduledCycle() {
        if (!properties.isAutoStart()) {
            return;
        }
        if (!isStartupComplete) {
            log.info("⏳ Skipping scheduled cycle - startup still in progress");
            return;
        }
        log.info("⏰ SCHEDULED CYCLE STARTED");
        runCycle();
    }

    /**
     * Runs one full pass. Returns empty when a cycle is already in progress.
     */
    public Optional<CycleStats> runCycle() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.warn("⚠️ Cycle already running, skipping");
            return Optional.empty();
        }

        try {
            long cycleNumber = cycleCounter.incrementAndGet();
            ZonedDateTime startedAt = now();
            List<SourceDefinition> sources = sourceRegistry.getSources();
            log.info("🌟 ===== INGESTION CYCLE #{} STARTED ({} sources) =====", cycleNumber, sources.size());

            List<CompletableFuture<SourceCycleStats>> futures = sources.stream()
                    .map(source -> CompletableFuture.supplyAsync(() -> processSource(source), sourceTaskExecutor))
                    .collect(Collectors.toList());
            List<SourceCycleStats> sourceStats = futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());

            RetentionResult retention = runRetentionIfDue();
            ZonedDateTime finishedAt = now();

            CycleStats stats = CycleStats.builder()
                    .cycleNumber(cycleNumber)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .durationSeconds(Duration.between(startedAt, finishedAt).toMillis() / 1000.0)
                    .discovered(sourceStats.stream().mapToInt(SourceCycleStats::getDiscovered).sum())
                    .processed(sourceStats.stream().mapToInt(SourceCycleStats::getProcessed).sum())
                    .failed(sourceStats.stream().mapToInt(SourceCycleStats::getFailed).sum())
                    .skipped(sourceStats.stream().mapToInt(SourceCycleStats::getSkipped).sum())
                    .failedSources((int) sourceStats.stream().filter(SourceCycleStats::isSourceFailed).count())
                    .sources(sourceStats)
                    .retention(retention)
                    .build();
            lastCycle.set(stats);

            log.info("🎯 CYCLE #{} COMPLETE: discovered={}, processed={}, failed={}, skipped={}, failed sources={}/{} in {}s",
                    cycleNumber, stats.getDiscovered(), stats.getProcessed(), stats.getFailed(), stats.getSkipped(),
                    stats.getFailedSources(), sources.size(), stats.getDurationSeconds());
            return Optional.of(stats);
        } finally {
            cycleRunning.set(false);
        }
    }

    SourceCycleStats processSource(SourceDefinition source) {
        memoryGuard.checkpoint();
        ZonedDateTime startedAt = now();
        int discovered = 0;
        int processed = 0;
        int failed = 0;
        int skipped = 0;
        int belowThreshold = 0;
        int archiveFailures = 0;

        log.info("📰 Processing source: {}", source.getDisplayName());
        try (Stream<CandidateItem> items = handlerFactory.getHandler(source).discover(source)) {
            Iterator<CandidateItem> iterator = items.iterator();
            while (iterator.hasNext()) {
                CandidateItem item = iterator.next();
                discovered++;
                ItemOutcome outcome = processItem(item, source);
                switch (outcome) {
                    case PROCESSED -> processed++;
                    case PROCESSED_BELOW_THRESHOLD -> {
                        processed++;
                        belowThreshold++;
                    }
                    case PROCESSED_ARCHIVE_FAILED -> {
                        processed++;
                        archiveFailures++;
                    }
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                }
                memoryGuard.checkpoint();
            }
        } catch (SourceFetchException e) {
            log.error("❌ Source {} unavailable this cycle: {}", source.getDisplayName(), e.getMessage());
            return sourceFailure(source, startedAt, discovered, processed, failed, skipped, e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Source {} failed: {}", source.getDisplayName(), e.getMessage(), e);
            return sourceFailure(source, startedAt, discovered, processed, failed, skipped, e.getMessage());
        }

        log.info("✅ {}: discovered={}, processed={}, failed={}, skipped={}",
                source.getDisplayName(), discovered, processed, failed, skipped);
        return SourceCycleStats.builder()
                .source(source.getName())
                .discovered(discovered)
                .processed(processed)
                .failed(failed)
                .skipped(skipped)
                .belowThreshold(belowThreshold)
                .archiveFailures(archiveFailures)
                .durationSeconds(secondsSince(startedAt))
                .build();
    }

    private ItemOutcome processItem(CandidateItem item, SourceDefinition source) {
        if (!duplicateFilter.tryReserve(item.getUrl(), item.getTitle())) {
            log.debug("Duplicate or in progress elsewhere, skipping: {}", item.getUrl());
            return ItemOutcome.SKIPPED;
        }

        try {
            ExtractedArticle article = contentExtractor.extract(item, source);
            article = llmContentCleaner.enhance(article, source);

            PersistResult result = persistenceCoordinator.persist(article, source);
            if (!result.isAdmitted()) {
                return ItemOutcome.FAILED;
            }
            log.info("✅ Ingested '{}' via {} ({} chars)", article.getTitle(), article.getExtractionMethod().getCode(), article.getContentLength());
            if (!result.isArchived() && properties.getArchive().isEnabled()) {
                return ItemOutcome.PROCESSED_ARCHIVE_FAILED;
            }
            return article.isBelowThreshold() ? ItemOutcome.PROCESSED_BELOW_THRESHOLD : ItemOutcome.PROCESSED;
        } catch (ExtractionExhaustedException e) {
            log.warn("❌ Rejected {}: {}", item.getUrl(), e.getMessage());
            return ItemOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("❌ Error processing {}: {}", item.getUrl(), e.getMessage(), e);
            return ItemOutcome.FAILED;
        } finally {
            duplicateFilter.release(item.getUrl());
        }
    }

    RetentionResult runRetentionIfDue() {
        PipelineProperties.Retention retention = properties.getRetention();
        if (!retention.isEnabled()) {
            return null;
        }

        ZonedDateTime now = now();
        ZonedDateTime lastRun = lastRetentionRun.get();
        if (lastRun != null && now.isBefore(lastRun.plus(retention.getInterval()))) {
            return null;
        }

        lastRetentionRun.set(now);
        try {
            return retentionSweeper.sweep(retention.getRetentionHours());
        } catch (RetentionException e) {
            log.warn("⚠️ Retention skipped: {}", e.getMessage());
            return null;
        }
    }

    private SourceCycleStats sourceFailure(SourceDefinition source, ZonedDateTime startedAt, int discovered,
                                           int processed, int failed, int skipped, String error) {
        return SourceCycleStats.builder()
                .source(source.getName())
                .discovered(discovered)
                .processed(processed)
                .failed(failed)
                .skipped(skipped)
                .sourceFailed(true)
                .error(error)
                .durationSeconds(secondsSince(startedAt))
                .build();
    }

    public Optional<CycleStats> getLastCycle() {
        return Optional.ofNullable(lastCycle.get());
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    public boolean isStartupComplete() {
        return isStartupComplete;
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock.withZone(properties.getZone()));
    }

    private double secondsSince(ZonedDateTime start) {
        return Duration.between(start, now()).toMillis() / 1000.0;
    }

    private enum ItemOutcome {
        PROCESSED,
        PROCESSED_BELOW_THRESHOLD,
        PROCESSED_ARCHIVE_FAILED,
        SKIPPED,
        FAILED
    }
}
