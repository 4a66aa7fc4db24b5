package com.newsvault.backend.storage.index;

import com.newsvault.backend.health.DependencyHealthRegistry;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a new Qdrant gRPC channel for every session so a broken connection is never reused.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QdrantVectorIndexClientFactory implements VectorIndexClientFactory {

    private final QdrantProperties properties;
    private final DependencyHealthRegistry healthRegistry;
    private final AtomicBoolean collectionReady = new AtomicBoolean(false);

    @Override
    public VectorIndexClient open() {
        QdrantClient qdrantClient;
        try {
            QdrantGrpcClient.Builder grpcClientBuilder = QdrantGrpcClient
                    .newBuilder(properties.getHost(), properties.getPort(), properties.isUseTls())
                    .withTimeout(properties.getTimeout());
            if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
                grpcClientBuilder.withApiKey(properties.getApiKey());
            }
            qdrantClient = new QdrantClient(grpcClientBuilder.build());
        } catch (RuntimeException e) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.VECTOR_INDEX, e.getMessage());
            throw new VectorIndexException("Failed to connect to Qdrant at " + properties.getHost() + ":" + properties.getPort(), e);
        }

        QdrantVectorIndexClient client = new QdrantVectorIndexClient(qdrantClient, properties);
        if (!collectionReady.get()) {
            try {
                client.ensureCollection();
                collectionReady.set(true);
            } catch (RuntimeException e) {
                client.close();
                healthRegistry.markUnhealthy(DependencyHealthRegistry.VECTOR_INDEX, e.getMessage());
                throw e;
            }
        }
        return client;
    }
}
