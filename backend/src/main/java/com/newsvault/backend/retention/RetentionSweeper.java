package com.newsvault.backend.retention;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.health.DependencyHealthRegistry;
import com.newsvault.backend.storage.archive.ContentArchive;
import com.newsvault.backend.storage.index.IndexFilter;
import com.newsvault.backend.storage.index.VectorIndexClient;
import com.newsvault.backend.storage.index.VectorIndexClientFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Deletes index entries published before {@code now - retentionHours}.
 * <p>
 * State moves IDLE → RUNNING → COMPLETED or FAILED. A call while a sweep is RUNNING is rejected.
 * A failed sweep is reported in its result and the next one starts normally.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionSweeper {

    private final VectorIndexClientFactory indexClientFactory;
    private final ContentArchive contentArchive;
    private final DependencyHealthRegistry healthRegistry;
    private final PipelineProperties properties;
    private final Clock clock;

    private final AtomicReference<RetentionState> state = new AtomicReference<>(RetentionState.IDLE);
    private final AtomicReference<RetentionResult> lastResult = new AtomicReference<>();

    /**
     * @throws RetentionException when another sweep is running or {@code retentionHours} is not positive
     */
    public RetentionResult sweep(int retentionHours) {
        if (retentionHours <= 0) {
            throw new RetentionException("retentionHours must be positive, got " + retentionHours);
        }
        RetentionState current = state.get();
        if (current == RetentionState.RUNNING || !state.compareAndSet(current, RetentionState.RUNNING)) {
            throw new RetentionException("A retention sweep is already running");
        }

        ZonedDateTime startedAt = ZonedDateTime.now(clock.withZone(properties.getZone()));
        ZonedDateTime cutoff = startedAt.minusHours(retentionHours);
        log.info("🧹 Starting retention sweep: deleting entries published before {} ({}h)", cutoff, retentionHours);

        RetentionResult.RetentionResultBuilder result = RetentionResult.builder()
                .retentionHours(retentionHours)
                .cutoff(cutoff)
                .startedAt(startedAt);

        try (VectorIndexClient client = indexClientFactory.open()) {
            long before = client.count();
            long deleted = client.deleteWhere(IndexFilter.publishedBefore(cutoff.toInstant()));
            long after = client.count();
            // Fall back to the count delta when the delete reported nothing useful
            long deletedCount = deleted >= 0 ? deleted : Math.max(0, before - after);

            int archiveDeleted = 0;
            if (properties.getRetention().isArchiveSweepEnabled()) {
                archiveDeleted = contentArchive.deleteDaysBefore(cutoff.toLocalDate());
            }

            healthRegistry.markHealthy(DependencyHealthRegistry.VECTOR_INDEX);
            result.status(RetentionState.COMPLETED)
                    .beforeCount(before)
                    .afterCount(after)
                    .deletedCount(deletedCount)
                    .archiveDeletedCount(archiveDeleted);
            log.info("✅ Retention sweep completed: {} deleted ({} → {}), {} archived documents removed",
                    deletedCount, before, after, archiveDeleted);
        } catch (RuntimeException e) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.VECTOR_INDEX, e.getMessage());
            log.error("❌ Retention sweep failed: {}", e.getMessage(), e);
            result.status(RetentionState.FAILED).error(e.getMessage());
        }

        RetentionResult finished = result
                .durationSeconds(Duration.between(startedAt.toInstant(), clock.instant()).toMillis() / 1000.0)
                .build();
        lastResult.set(finished);
        state.set(finished.getStatus());
        return finished;
    }

    public RetentionState getState() {
        return state.get();
    }

    public RetentionResult getLastResult() {
        return lastResult.get();
    }
}
