package com.architecture.memory.graphexport.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * One export run as requested on the command line. Null credentials and depth fall back to
 * the configured defaults.
 */
@Value
@Builder
public class ExportRequest {
    List<String> paths;
    String username;
    String password;
    Integer saveDepth;
    boolean loadIncludes;
    Path includesFile;
}
