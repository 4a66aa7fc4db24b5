package com.newsvault.backend.ai.service;

import com.newsvault.backend.config.ConfigurationException;
import com.newsvault.backend.health.DependencyHealthRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Turns article text into the dense vector stored in the index.
 */
@Service
@Slf4j
public class EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final DependencyHealthRegistry healthRegistry;

    public EmbeddingService(ObjectProvider<EmbeddingModel> embeddingModel, DependencyHealthRegistry healthRegistry) {
        this.embeddingModel = embeddingModel.getIfAvailable();
        this.healthRegistry = healthRegistry;
        if (this.embeddingModel == null) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.EMBEDDING, "spring.ai.openai.api-key is not set");
        }
    }

    public boolean isAvailable() {
        return embeddingModel != null;
    }

    /**
     * @throws ConfigurationException when no embedding model is configured
     */
    public float[] embed(String text) {
        if (embeddingModel == null) {
            throw new ConfigurationException(DependencyHealthRegistry.EMBEDDING, "No embedding model configured");
        }
        try {
            float[] vector = embeddingModel.embed(text);
            healthRegistry.markHealthy(DependencyHealthRegistry.EMBEDDING);
            return vector;
        } catch (RuntimeException e) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.EMBEDDING, e.getMessage());
            throw e;
        }
    }
}
