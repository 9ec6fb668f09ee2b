package com.architecture.memory.graphexport.service.connection;

import com.architecture.memory.graphexport.model.graph.CodeNode;
import com.architecture.memory.graphexport.service.graph.GraphWritePlan;
import com.architecture.memory.graphexport.service.graph.GraphWritePlan.RelationshipRecord;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Session;
import org.neo4j.driver.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link GraphSession} over a Neo4j driver session.
 *
 * Every node gets the {@code Node} label plus a label derived from its kind, and is merged on
 * {@code id}. Rows are sent in {@code UNWIND} batches grouped by label or relationship type,
 * since neither can be passed as a query parameter.
 */
@Slf4j
public class Neo4jGraphSession implements GraphSession {

    static final String NODE_LABEL = "Node";
    static final String PURGE_QUERY = "MATCH (n) DETACH DELETE n";

    private static final String MERGE_NODES = """
            UNWIND $rows AS row
            MERGE (n:%s {id: row.id})
            SET n += row.properties, n:%s
            """;

    private static final String MERGE_RELATIONSHIPS = """
            UNWIND $rows AS row
            MATCH (a:%s {id: row.from})
            MATCH (b:%s {id: row.to})
            MERGE (a)-[r:%s]->(b)
            SET r += row.properties
            """;

    private final Session session;
    private final int batchSize;

    // ids written by committed transactions of this session
    private final Set<String> writtenIds = new HashSet<>();
    private final Set<String> pendingIds = new HashSet<>();
    private Neo4jGraphTransaction currentTransaction;

    public Neo4jGraphSession(Session session, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, was " + batchSize);
        }
        this.session = session;
        this.batchSize = batchSize;
    }

    @Override
    public void purgeDatabase() {
        if (currentTransaction != null) {
            throw new IllegalStateException("Cannot purge while a transaction is open");
        }
        log.info("[graph-persist] Purging all nodes and relationships");
        session.run(PURGE_QUERY).consume();
        writtenIds.clear();
    }

    @Override
    public GraphTransaction beginTransaction() {
        if (currentTransaction != null) {
            throw new IllegalStateException("A transaction is already open on this session");
        }
        pendingIds.clear();
        currentTransaction = new Neo4jGraphTransaction(session.beginTransaction(), this::finish);
        return currentTransaction;
    }

    @Override
    public void save(Collection<CodeNode> nodes, int depth) {
        if (currentTransaction == null || !currentTransaction.isOpen()) {
            throw new IllegalStateException("save requires an open transaction");
        }
        Transaction tx = currentTransaction.delegate();
        GraphWritePlan plan = GraphWritePlan.expand(nodes, depth);

        int nodeStatements = writeNodes(tx, plan.getNodes().values());
        int relationshipStatements = writeRelationships(tx, plan.getRelationships());
        log.info("[graph-persist] Saved nodes={} relationships={} in {} statement(s), depth={}",
                plan.getNodes().size(), plan.getRelationships().size(),
                nodeStatements + relationshipStatements, depth);
    }

    @Override
    public void clear() {
        writtenIds.clear();
        pendingIds.clear();
    }

    @Override
    public void close() {
        try {
            if (currentTransaction != null) {
                currentTransaction.close();
            }
        } finally {
            session.close();
        }
    }

    Set<String> getWrittenIds() {
        return writtenIds;
    }

    private void finish(Neo4jGraphTransaction transaction) {
        if (transaction.isCommitted()) {
            writtenIds.addAll(pendingIds);
        }
        pendingIds.clear();
        currentTransaction = null;
    }

    private int writeNodes(Transaction tx, Collection<CodeNode> nodes) {
        Map<String, List<Map<String, Object>>> rowsByLabel = new LinkedHashMap<>();
        for (CodeNode node : nodes) {
            if (writtenIds.contains(node.getId()) || pendingIds.contains(node.getId())) {
                continue;
            }
            rowsByLabel.computeIfAbsent(label(node.getKind()), k -> new ArrayList<>()).add(nodeRow(node));
            pendingIds.add(node.getId());
        }

        int statements = 0;
        for (Map.Entry<String, List<Map<String, Object>>> entry : rowsByLabel.entrySet()) {
            String query = MERGE_NODES.formatted(quote(NODE_LABEL), quote(entry.getKey()));
            statements += runBatched(tx, query, entry.getValue());
        }
        return statements;
    }

    private int writeRelationships(Transaction tx, List<RelationshipRecord> relationships) {
        Map<String, List<Map<String, Object>>> rowsByType = new LinkedHashMap<>();
        for (RelationshipRecord relationship : relationships) {
            Map<String, Object> row = new HashMap<>();
            row.put("from", relationship.getFromId());
            row.put("to", relationship.getToId());
            row.put("properties", PropertyValues.coerceAll(relationship.getProperties()));
            rowsByType.computeIfAbsent(label(relationship.getType()), k -> new ArrayList<>()).add(row);
        }

        int statements = 0;
        for (Map.Entry<String, List<Map<String, Object>>> entry : rowsByType.entrySet()) {
            String query = MERGE_RELATIONSHIPS.formatted(quote(NODE_LABEL), quote(NODE_LABEL), quote(entry.getKey()));
            statements += runBatched(tx, query, entry.getValue());
        }
        return statements;
    }

    private int runBatched(Transaction tx, String query, List<Map<String, Object>> rows) {
        int statements = 0;
        for (int start = 0; start < rows.size(); start += batchSize) {
            List<Map<String, Object>> batch = rows.subList(start, Math.min(start + batchSize, rows.size()));
            tx.run(query, Map.of("rows", batch)).consume();
            statements++;
        }
        return statements;
    }

    private Map<String, Object> nodeRow(CodeNode node) {
        Map<String, Object> properties = PropertyValues.coerceAll(node.getProperties());
        if (node.getName() != null) {
            properties.put("name", node.getName());
        }
        if (node.getKind() != null) {
            properties.put("kind", node.getKind());
        }
        Map<String, Object> row = new HashMap<>();
        row.put("id", node.getId());
        row.put("properties", properties);
        return row;
    }

    static String label(String raw) {
        if (raw == null || raw.isBlank()) {
            return "Unknown";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    private static String quote(String identifier) {
        return "`" + identifier + "`";
    }
}
