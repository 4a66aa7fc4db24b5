package com.newsvault.backend.storage.index;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One point of the vector index. The id is derived from the article so a retried upsert overwrites.
 */
@Value
@Builder
public class IndexRecord {
    String id;
    float[] vector;
    Map<String, Object> payload;
}
