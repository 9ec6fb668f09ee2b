package com.architecture.memory.graphexport.runner;

import com.architecture.memory.graphexport.dto.ExportRequest;
import com.architecture.memory.graphexport.dto.ExportSummary;
import com.architecture.memory.graphexport.service.GraphExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs the export once on startup. Failures propagate so Spring Boot can turn them into
 * the process exit status.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GraphExportRunner implements ApplicationRunner {

    private final ExportArgumentsParser argumentsParser;
    private final GraphExportService graphExportService;

    @Override
    public void run(ApplicationArguments args) {
        ExportRequest request = argumentsParser.parse(args);
        log.info("[graph-export] Starting export of {}", request.getPaths());
        ExportSummary summary = graphExportService.export(request);
        log.info("[graph-export] Export finished: roots={} nodes={} analysis={}ms push={}ms",
                summary.getRootCount(), summary.getNodeCount(), summary.getAnalysisMillis(), summary.getPushMillis());
    }
}
