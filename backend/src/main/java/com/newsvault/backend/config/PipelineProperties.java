package com.newsvault.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline-wide settings bound from {@code pipeline.*}.
 * <p>
 * All instants compared by the pipeline (recency windows, retention cutoffs, archive
 * date paths) are normalized to {@link #timezone} first.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    @NotBlank
    private String timezone = "America/Los_Angeles";
    @NotBlank
    private String sourcesFile = "classpath:sources.yml";

    private boolean autoStart = true;
    private Duration startupDelay = Duration.ofSeconds(30);
    private Duration cycleInterval = Duration.ofHours(1);

    @Min(1)
    private int maxConcurrentSources = 2;
    @Min(1)
    private int maxConcurrentRenders = 1;
    private Duration renderTimeout = Duration.ofSeconds(30);
    private Duration fetchTimeout = Duration.ofSeconds(30);
    private Duration defaultRecencyWindow = Duration.ofDays(1);

    @Min(1)
    private int minContentLength = 200;
    @Min(1)
    private int lastResortMinLength = 50;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double pruningThreshold = 0.45;

    private long memoryHighWaterMarkMb = 800;
    private Duration memoryCooldown = Duration.ofSeconds(10);

    @Valid
    private Retention retention = new Retention();
    @Valid
    private Dedup dedup = new Dedup();
    @Valid
    private Index index = new Index();
    @Valid
    private Archive archive = new Archive();
    @Valid
    private Llm llm = new Llm();

    public ZoneId getZone() {
        return ZoneId.of(timezone);
    }

    @Data
    public static class Retention {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(24);
        @Min(1)
        private int retentionHours = 24;
        private boolean archiveSweepEnabled = false;
    }

    @Data
    public static class Dedup {
        @Min(1)
        private int capacity = 10_000;
        private boolean matchTitles = true;
    }

    @Data
    public static class Index {
        @Min(1)
        private int maxAttempts = 3;
        private Duration baseBackoff = Duration.ofSeconds(2);
        private int payloadTextLimit = 1000;
        private int embeddingInputLimit = 8000;
    }

    @Data
    public static class Archive {
        private boolean enabled = true;
        private String rootDirectory = "data/archive";
    }

    @Data
    public static class Llm {
        private boolean cleaningEnabled = false;
        private boolean translationEnabled = false;
        private int maxInputChars = 12_000;
    }
}
