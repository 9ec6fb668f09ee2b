package com.architecture.memory.graphexport.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExportSummary {
    int sourceLocations;
    int rootCount;
    int nodeCount;
    long analysisMillis;
    long pushMillis;
}
