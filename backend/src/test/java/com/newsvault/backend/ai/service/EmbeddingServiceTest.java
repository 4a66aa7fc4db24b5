package com.newsvault.backend.ai.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.newsvault.backend.config.ConfigurationException;
import com.newsvault.backend.health.DependencyHealthRegistry;
import java.time.Clock;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;

class EmbeddingServiceTest {

    private final DependencyHealthRegistry healthRegistry = new DependencyHealthRegistry(Clock.systemUTC());

    @Test
    void missingModelIsConfigurationError() {
        EmbeddingService service = new EmbeddingService(provider(null), healthRegistry);

        assertFalse(service.isAvailable());
        assertFalse(healthRegistry.isHealthy(DependencyHealthRegistry.EMBEDDING));
        assertThrows(ConfigurationException.class, () -> service.embed("text"));
    }

    @Test
    void embedsWithConfiguredModel() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed("BoJ holds rates")).thenReturn(new float[]{0.5f, -0.5f});
        EmbeddingService service = new EmbeddingService(provider(model), healthRegistry);

        assertArrayEquals(new float[]{0.5f, -0.5f}, service.embed("BoJ holds rates"));
        assertTrue(healthRegistry.isHealthy(DependencyHealthRegistry.EMBEDDING));
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<EmbeddingModel> provider(EmbeddingModel model) {
        ObjectProvider<EmbeddingModel> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(model);
        return provider;
    }
}
