package com.newsvault.backend.storage.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.qdrant.client.grpc.Common.FieldCondition;
import io.qdrant.client.grpc.Common.Filter;
import io.qdrant.client.grpc.JsonWithInt.Value;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QdrantVectorIndexClientTest {

    @Test
    void publishedBeforeBecomesStrictRangeOnEpochField() {
        Filter filter = QdrantVectorIndexClient.toFilter(IndexFilter.publishedBefore(Instant.ofEpochSecond(1_750_000_000L)));

        assertEquals(1, filter.getMustCount());
        FieldCondition condition = filter.getMust(0).getField();
        assertEquals(QdrantVectorIndexClient.PUBLISHED_AT_EPOCH, condition.getKey());
        assertTrue(condition.getRange().hasLt());
        assertEquals(1_750_000_000d, condition.getRange().getLt());
    }

    @Test
    void cutoffKeepsFractionalSeconds() {
        Filter filter = QdrantVectorIndexClient.toFilter(
                IndexFilter.publishedBefore(Instant.parse("2025-06-09T12:00:00.700Z")));

        assertEquals(1_749_470_400.7, filter.getMust(0).getField().getRange().getLt(), 1e-6);
    }

    @Test
    void payloadKeepsTypesAndDropsNulls() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", "BoJ holds rates");
        payload.put("textLength", 1200);
        payload.put("publishedAtEpoch", 1.75e9);
        payload.put("belowThreshold", false);
        payload.put("author", null);

        Map<String, Value> values = QdrantVectorIndexClient.toPayload(payload);

        assertEquals(4, values.size());
        assertEquals("BoJ holds rates", values.get("title").getStringValue());
        assertEquals(1200L, values.get("textLength").getIntegerValue());
        assertEquals(1.75e9, values.get("publishedAtEpoch").getDoubleValue());
        assertFalse(values.get("belowThreshold").getBoolValue());
    }
}
