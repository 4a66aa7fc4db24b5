package com.newsvault.backend.retention;

import java.time.ZonedDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RetentionResult {
    RetentionState status;
    int retentionHours;
    ZonedDateTime cutoff;
    ZonedDateTime startedAt;
    long beforeCount;
    long afterCount;
    long deletedCount;
    int archiveDeletedCount;
    double durationSeconds;
    String error;
}
