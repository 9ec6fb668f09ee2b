package com.architecture.memory.graphexport.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class AnalysisRequest {
    List<Path> sourceLocations;
    Path topLevel;
    @Builder.Default
    List<Path> includePaths = List.of();
    boolean loadIncludes;
}
