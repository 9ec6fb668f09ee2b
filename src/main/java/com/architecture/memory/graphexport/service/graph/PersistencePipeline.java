package com.architecture.memory.graphexport.service.graph;

import com.architecture.memory.graphexport.config.PersistenceConfig;
import com.architecture.memory.graphexport.dto.PersistenceResult;
import com.architecture.memory.graphexport.exception.GraphPersistenceException;
import com.architecture.memory.graphexport.model.graph.CodeNode;
import com.architecture.memory.graphexport.service.connection.ConnectionManager;
import com.architecture.memory.graphexport.service.connection.GraphConnection;
import com.architecture.memory.graphexport.service.connection.GraphSession;
import com.architecture.memory.graphexport.service.connection.GraphTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pushes an analyzed code graph to the database: connect, purge, flatten, save in one
 * transaction, commit. The connection is released on every path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersistencePipeline {

    private final ConnectionManager connectionManager;
    private final GraphFlattener graphFlattener;

    /**
     * Persist the graph below {@code roots}.
     *
     * @return counts and timings of the run
     * @throws com.architecture.memory.graphexport.exception.GraphConnectionException if no session could be opened
     * @throws GraphPersistenceException if purge, flatten, save or commit failed; nothing was committed
     */
    public PersistenceResult persist(List<CodeNode> roots, PersistenceConfig config) {
        Objects.requireNonNull(roots, "roots");
        Objects.requireNonNull(config, "config");
        if (config.getSaveDepth() < PersistenceConfig.UNBOUNDED_DEPTH) {
            throw new IllegalArgumentException("save depth must be -1 or greater, was " + config.getSaveDepth());
        }

        log.info("[graph-persist] begin roots={} depth={} purge={} uri={}",
                roots.size(), config.getSaveDepth(), config.isPurgeBeforeWrite(), config.getUri());

        try (GraphConnection connection = connectionManager.connect(config)) {
            PersistenceResult result = write(connection.getSession(), roots, config);
            log.info("[graph-persist] end nodes={} flatten={}ms save={}ms",
                    result.getNodeCount(), result.getFlattenMillis(), result.getSaveMillis());
            return result;
        }
    }

    private PersistenceResult write(GraphSession session, List<CodeNode> roots, PersistenceConfig config) {
        try {
            if (config.isPurgeBeforeWrite()) {
                log.warn("[graph-persist] Purging the target database before writing");
                session.purgeDatabase();
            }

            long flattenStart = System.currentTimeMillis();
            Set<CodeNode> uniqueRoots = graphFlattener.deduplicate(roots);
            Set<CodeNode> nodesToPush = graphFlattener.flatten(uniqueRoots);
            long flattenMillis = System.currentTimeMillis() - flattenStart;

            log.info("[graph-persist] Using save depth: {}", config.isDepthUnbounded() ? "unbounded" : config.getSaveDepth());
            log.info("[graph-persist] Count root units: {}", uniqueRoots.size());
            log.info("[graph-persist] Count nodes to save: {}", nodesToPush.size());

            long saveMillis;
            try (GraphTransaction transaction = session.beginTransaction()) {
                long saveStart = System.currentTimeMillis();
                session.save(nodesToPush, config.getSaveDepth());
                saveMillis = System.currentTimeMillis() - saveStart;
                log.info("[graph-persist] Benchmark: pure push time: {} ms", saveMillis);
                transaction.commit();
            }

            return PersistenceResult.builder()
                    .rootCount(uniqueRoots.size())
                    .nodeCount(nodesToPush.size())
                    .flattenMillis(flattenMillis)
                    .saveMillis(saveMillis)
                    .build();
        } catch (GraphPersistenceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("[graph-persist] Persisting graph failed, transaction not committed", ex);
            throw new GraphPersistenceException("Failed to persist code graph: " + ex.getMessage(), ex);
        }
    }
}
