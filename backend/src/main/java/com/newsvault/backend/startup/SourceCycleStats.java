package com.newsvault.backend.startup;

import lombok.Builder;
import lombok.Value;

/**
 * Counters for one source in one cycle.
 */
@Value
@Builder
public class SourceCycleStats {
    String source;
    int discovered;
    int processed;
    int failed;
    int skipped;
    int belowThreshold;
    int archiveFailures;
    boolean sourceFailed;
    String error;
    double durationSeconds;
}
