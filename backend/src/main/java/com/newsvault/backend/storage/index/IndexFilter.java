package com.newsvault.backend.storage.index;

import java.time.Instant;
import lombok.Value;

/**
 * Selects index points by publish instant.
 */
@Value
public class IndexFilter {
    Instant publishedBefore;

    public static IndexFilter publishedBefore(Instant cutoff) {
        return new IndexFilter(cutoff);
    }

    /**
     * Fractional epoch seconds, the form {@code publishedAtEpoch} is stored and compared in.
     */
    public static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
