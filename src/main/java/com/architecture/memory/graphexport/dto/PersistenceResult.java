package com.architecture.memory.graphexport.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PersistenceResult {
    int rootCount;
    int nodeCount;
    long flattenMillis;
    long saveMillis;
}
