package com.newsvault.backend.startup;

import com.newsvault.backend.config.PipelineProperties;
import java.time.Duration;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Soft backpressure between work items: above the high-water mark, request a GC and pause.
 */
@Component
@Slf4j
public class MemoryGuard {

    private static final long MB = 1024 * 1024;

    private final PipelineProperties properties;
    private final LongSupplier usedMemoryMb;

    @Autowired
    public MemoryGuard(PipelineProperties properties) {
        this(properties, () -> {
            Runtime runtime = Runtime.getRuntime();
            return (runtime.totalMemory() - runtime.freeMemory()) / MB;
        });
    }

    MemoryGuard(PipelineProperties properties, LongSupplier usedMemoryMb) {
        this.properties = properties;
        this.usedMemoryMb = usedMemoryMb;
    }

    /**
     * @return true when memory was above the high-water mark and a cooldown was taken
     */
    public boolean checkpoint() {
        long used = usedMemoryMb.getAsLong();
        if (used <= properties.getMemoryHighWaterMarkMb()) {
            return false;
        }

        log.warn("⚠️ Memory usage {}MB above {}MB, forcing garbage collection", used, properties.getMemoryHighWaterMarkMb());
        System.gc();
        Duration cooldown = properties.getMemoryCooldown();
        if (!cooldown.isZero() && !cooldown.isNegative()) {
            try {
                Thread.sleep(cooldown.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("🔄 Memory after cooldown: {}MB", usedMemoryMb.getAsLong());
        return true;
    }
}
