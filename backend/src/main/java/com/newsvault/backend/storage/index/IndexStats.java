package com.newsvault.backend.storage.index;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexStats {
    String collection;
    long pointCount;
    String status;
}
