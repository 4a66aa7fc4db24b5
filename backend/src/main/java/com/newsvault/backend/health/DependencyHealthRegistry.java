package com.newsvault.backend.health;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tracks whether each external collaborator is usable.
 * <p>
 * A dependency that was never reported is treated as healthy.
 */
@Component
@Slf4j
public class DependencyHealthRegistry {

    public static final String ARCHIVE = "archive";
    public static final String VECTOR_INDEX = "vector-index";
    public static final String EMBEDDING = "embedding";
    public static final String LLM = "llm";
    public static final String RENDER = "render";

    private final Map<String, DependencyStatus> statuses = new ConcurrentHashMap<>();
    private final Clock clock;

    public DependencyHealthRegistry(Clock clock) {
        this.clock = clock;
    }

    public void markHealthy(String dependency) {
        DependencyStatus previous = statuses.put(dependency, DependencyStatus.builder()
                .healthy(true)
                .checkedAt(Instant.now(clock))
                .build());
        if (previous != null && !previous.isHealthy()) {
            log.info("✅ Dependency '{}' recovered", dependency);
        }
    }

    public void markUnhealthy(String dependency, String error) {
        DependencyStatus previous = statuses.put(dependency, DependencyStatus.builder()
                .healthy(false)
                .lastError(error)
                .checkedAt(Instant.now(clock))
                .build());
        if (previous == null || previous.isHealthy()) {
            log.warn("⚠️ Dependency '{}' marked unhealthy: {}", dependency, error);
        }
    }

    public boolean isHealthy(String dependency) {
        DependencyStatus status = statuses.get(dependency);
        return status == null || status.isHealthy();
    }

    public Map<String, DependencyStatus> snapshot() {
        return new LinkedHashMap<>(statuses);
    }

    @Value
    @Builder
    public static class DependencyStatus {
        boolean healthy;
        String lastError;
        Instant checkedAt;
    }
}
