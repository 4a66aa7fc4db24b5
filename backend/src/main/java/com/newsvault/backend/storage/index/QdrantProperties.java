package com.newsvault.backend.storage.index;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@ConfigurationProperties(prefix = "qdrant")
@Validated
public class QdrantProperties {
    @NotBlank
    private String host = "localhost";
    // gRPC port, REST is 6333
    private int port = 6334;
    private boolean useTls = false;
    private String apiKey = "";
    @NotBlank
    private String collectionName = "news_articles";
    @Min(1)
    private int vectorSize = 3072;
    private Duration timeout = Duration.ofSeconds(30);
}
