package com.newsvault.backend.startup;

import com.newsvault.backend.retention.RetentionResult;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate counters of one pass over every source. Observability only.
 */
@Value
@Builder
public class CycleStats {
    long cycleNumber;
    ZonedDateTime startedAt;
    ZonedDateTime finishedAt;
    double durationSeconds;
    int discovered;
    int processed;
    int failed;
    int skipped;
    int failedSources;
    List<SourceCycleStats> sources;
    // Present only when the retention interval elapsed during this cycle
    RetentionResult retention;
}
