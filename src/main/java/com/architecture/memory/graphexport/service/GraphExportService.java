package com.architecture.memory.graphexport.service;

import com.architecture.memory.graphexport.config.GraphExportProperties;
import com.architecture.memory.graphexport.config.PersistenceConfig;
import com.architecture.memory.graphexport.dto.AnalysisRequest;
import com.architecture.memory.graphexport.dto.ExportRequest;
import com.architecture.memory.graphexport.dto.ExportSummary;
import com.architecture.memory.graphexport.dto.PersistenceResult;
import com.architecture.memory.graphexport.dto.ValidatedSources;
import com.architecture.memory.graphexport.exception.InputValidationException;
import com.architecture.memory.graphexport.model.graph.CodeNode;
import com.architecture.memory.graphexport.service.analyzer.SpoonGraphAnalyzer;
import com.architecture.memory.graphexport.service.graph.PersistencePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one export:
 *   1. Validate input paths and load include paths
 *   2. Analyze the sources into a code graph with SpoonGraphAnalyzer
 *   3. Push the graph to Neo4j with PersistencePipeline
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphExportService {

    private final InputPathValidator inputPathValidator;
    private final IncludePathsLoader includePathsLoader;
    private final SpoonGraphAnalyzer spoonGraphAnalyzer;
    private final PersistencePipeline persistencePipeline;
    private final GraphExportProperties properties;

    public ExportSummary export(ExportRequest request) {
        ValidatedSources sources = inputPathValidator.validate(request.getPaths());
        List<Path> includePaths = request.getIncludesFile() != null
                ? includePathsLoader.load(request.getIncludesFile())
                : List.of();
        PersistenceConfig config = buildConfig(request);

        log.info("[graph-export] Exporting {} path(s) under {} (includes={}, loadIncludes={})",
                sources.getLocations().size(), sources.getTopLevel(), includePaths.size(), request.isLoadIncludes());

        long startTime = System.currentTimeMillis();

        List<CodeNode> roots = spoonGraphAnalyzer.analyze(AnalysisRequest.builder()
                .sourceLocations(sources.getLocations())
                .topLevel(sources.getTopLevel())
                .includePaths(includePaths)
                .loadIncludes(request.isLoadIncludes())
                .build());

        long analyzingTime = System.currentTimeMillis();
        log.info("[graph-export] Benchmark: analyzing code in {} s.", (analyzingTime - startTime) / 1000.0);

        PersistenceResult result = persistencePipeline.persist(roots, config);

        long pushTime = System.currentTimeMillis();
        log.info("[graph-export] Benchmark: push code in {} s.", (pushTime - analyzingTime) / 1000.0);

        return ExportSummary.builder()
                .sourceLocations(sources.getLocations().size())
                .rootCount(result.getRootCount())
                .nodeCount(result.getNodeCount())
                .analysisMillis(analyzingTime - startTime)
                .pushMillis(pushTime - analyzingTime)
                .build();
    }

    PersistenceConfig buildConfig(ExportRequest request) {
        PersistenceConfig.PersistenceConfigBuilder builder = PersistenceConfig.from(properties).toBuilder();
        if (request.getUsername() != null) {
            builder.username(request.getUsername());
        }
        if (request.getPassword() != null) {
            builder.password(request.getPassword());
        }
        if (request.getSaveDepth() != null) {
            if (request.getSaveDepth() < PersistenceConfig.UNBOUNDED_DEPTH) {
                throw new InputValidationException("--save-depth must be -1 or greater, was " + request.getSaveDepth());
            }
            builder.saveDepth(request.getSaveDepth());
        }
        return builder.build();
    }
}
