package com.newsvault.backend.storage.index;

import static io.qdrant.client.ConditionFactory.range;
import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.VectorsFactory.vectors;

import com.google.common.util.concurrent.ListenableFuture;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.ValueFactory;
import io.qdrant.client.grpc.Collections.CollectionInfo;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.PayloadSchemaType;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Common.Filter;
import io.qdrant.client.grpc.Common.Range;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.PointStruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Vector index session backed by one Qdrant gRPC client.
 */
@Slf4j
public class QdrantVectorIndexClient implements VectorIndexClient {

    static final String PUBLISHED_AT_EPOCH = "publishedAtEpoch";
    static final String SOURCE = "source";

    private final QdrantClient qdrantClient;
    private final QdrantProperties properties;

    public QdrantVectorIndexClient(QdrantClient qdrantClient, QdrantProperties properties) {
        this.qdrantClient = qdrantClient;
        this.properties = properties;
    }

    @Override
    public void upsert(IndexRecord record) {
        List<Float> vector = new ArrayList<>(record.getVector().length);
        for (float value : record.getVector()) {
            vector.add(value);
        }

        PointStruct point = PointStruct.newBuilder()
                .setId(id(UUID.fromString(record.getId())))
                .setVectors(vectors(vector))
                .putAllPayload(toPayload(record.getPayload()))
                .build();

        awaitFuture(qdrantClient.upsertAsync(collection(), List.of(point)), "upsert");
        log.debug("[QDRANT] Upserted point {}", record.getId());
    }

    @Override
    public long deleteWhere(IndexFilter filter) {
        Filter qdrantFilter = toFilter(filter);
        long matching = awaitFuture(qdrantClient.countAsync(collection(), qdrantFilter, true), "count");
        if (matching == 0) {
            return 0;
        }
        awaitFuture(qdrantClient.deleteAsync(collection(), qdrantFilter), "delete");
        log.info("[QDRANT] Deleted {} points published before {}", matching, filter.getPublishedBefore());
        return matching;
    }

    @Override
    public long count() {
        return awaitFuture(qdrantClient.countAsync(collection(), Filter.newBuilder().build(), true), "count");
    }

    @Override
    public long count(IndexFilter filter) {
        return awaitFuture(qdrantClient.countAsync(collection(), toFilter(filter), true), "count");
    }

    @Override
    public IndexStats stats() {
        CollectionInfo info = awaitFuture(qdrantClient.getCollectionInfoAsync(collection()), "collection info");
        return IndexStats.builder()
                .collection(collection())
                .pointCount(info.getPointsCount())
                .status(info.getStatus().name())
                .build();
    }

    @Override
    public boolean healthCheck() {
        try {
            awaitFuture(qdrantClient.healthCheckAsync(), "health check");
            return true;
        } catch (VectorIndexException e) {
            log.warn("[QDRANT] Health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void clearAll() {
        long total = count();
        awaitFuture(qdrantClient.deleteAsync(collection(), Filter.newBuilder().build()), "clear");
        log.warn("🗑️ [QDRANT] Cleared {} points from {}", total, collection());
    }

    @Override
    public void recreate() {
        if (awaitFuture(qdrantClient.collectionExistsAsync(collection()), "collection exists")) {
            awaitFuture(qdrantClient.deleteCollectionAsync(collection()), "delete collection");
            log.warn("🗑️ [QDRANT] Dropped collection {}", collection());
        }
        createCollection();
    }

    /**
     * Creates the collection and its payload indexes when missing.
     */
    public void ensureCollection() {
        if (!awaitFuture(qdrantClient.collectionExistsAsync(collection()), "collection exists")) {
            createCollection();
        }
    }

    private void createCollection() {
        VectorParams params = VectorParams.newBuilder()
                .setSize(properties.getVectorSize())
                .setDistance(Distance.Cosine)
                .build();
        awaitFuture(qdrantClient.createCollectionAsync(collection(), params), "create collection");
        awaitFuture(qdrantClient.createPayloadIndexAsync(collection(), PUBLISHED_AT_EPOCH, PayloadSchemaType.Float,
                null, true, null, null), "create payload index");
        awaitFuture(qdrantClient.createPayloadIndexAsync(collection(), SOURCE, PayloadSchemaType.Keyword,
                null, true, null, null), "create payload index");
        log.info("✅ [QDRANT] Created collection {} (size={}, cosine)", collection(), properties.getVectorSize());
    }

    @Override
    public void close() {
        qdrantClient.close();
    }

    static Filter toFilter(IndexFilter filter) {
        Filter.Builder builder = Filter.newBuilder();
        if (filter.getPublishedBefore() != null) {
            double cutoff = IndexFilter.epochSeconds(filter.getPublishedBefore());
            builder.addMust(range(PUBLISHED_AT_EPOCH, Range.newBuilder().setLt(cutoff).build()));
        }
        return builder.build();
    }

    static Map<String, Value> toPayload(Map<String, Object> payload) {
        Map<String, Value> values = new LinkedHashMap<>();
        payload.forEach((key, raw) -> {
            if (raw == null) return;
            if (raw instanceof Integer || raw instanceof Long) {
                values.put(key, ValueFactory.value(((Number) raw).longValue()));
            } else if (raw instanceof Number) {
                values.put(key, ValueFactory.value(((Number) raw).doubleValue()));
            } else if (raw instanceof Boolean) {
                values.put(key, ValueFactory.value((Boolean) raw));
            } else {
                values.put(key, ValueFactory.value(raw.toString()));
            }
        });
        return values;
    }

    private String collection() {
        return properties.getCollectionName();
    }

    private <T> T awaitFuture(ListenableFuture<T> future, String operation) {
        long timeoutSeconds = properties.getTimeout().toSeconds();
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new VectorIndexException("Qdrant " + operation + " interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() != null ? executionException.getCause() : executionException;
            throw new VectorIndexException("Qdrant " + operation + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new VectorIndexException("Qdrant " + operation + " timed out after " + timeoutSeconds + "s", timeoutException);
        }
    }
}
