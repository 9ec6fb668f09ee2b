package com.architecture.memory.graphexport.service.graph;

import com.architecture.memory.graphexport.model.graph.CodeNode;
import lombok.Getter;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The node and relationship records a depth-bounded save has to write.
 *
 * Expansion starts from every saved node with the full hop budget and walks outgoing
 * relationships breadth-first, structural and semantic alike. Because all start nodes share
 * one budget, the first time a node is reached is also the visit with the most hops left,
 * so each node is expanded exactly once. Nodes reached along the way are written as well.
 */
@Getter
public final class GraphWritePlan {

    public static final int UNBOUNDED = -1;

    private final Map<String, CodeNode> nodes;
    private final List<RelationshipRecord> relationships;

    private GraphWritePlan(Map<String, CodeNode> nodes, List<RelationshipRecord> relationships) {
        this.nodes = nodes;
        this.relationships = relationships;
    }

    public static GraphWritePlan expand(Collection<CodeNode> seeds, int depth) {
        if (depth < UNBOUNDED) {
            throw new IllegalArgumentException("depth must be -1 or greater, was " + depth);
        }
        int budget = depth == UNBOUNDED ? Integer.MAX_VALUE : depth;

        Map<String, CodeNode> nodes = new LinkedHashMap<>();
        List<RelationshipRecord> relationships = new ArrayList<>();
        Set<String> relationshipKeys = new HashSet<>();
        Deque<Frontier> queue = new ArrayDeque<>();

        for (CodeNode seed : seeds) {
            if (seed != null && nodes.putIfAbsent(seed.getId(), seed) == null) {
                queue.add(new Frontier(seed, budget));
            }
        }

        while (!queue.isEmpty()) {
            Frontier frontier = queue.poll();
            if (frontier.remaining == 0) {
                continue;
            }
            CodeNode source = frontier.node;

            List<CodeNode> children = source.getChildren();
            for (int index = 0; index < children.size(); index++) {
                CodeNode child = children.get(index);
                if (child != null) {
                    link(source, CodeNode.AST, child, Map.of("index", index),
                            frontier.remaining, nodes, relationships, relationshipKeys, queue);
                }
            }
            for (Map.Entry<String, Set<CodeNode>> edge : source.getEdges().entrySet()) {
                for (CodeNode target : edge.getValue()) {
                    if (target != null) {
                        link(source, edge.getKey(), target, Map.of(),
                                frontier.remaining, nodes, relationships, relationshipKeys, queue);
                    }
                }
            }
        }
        return new GraphWritePlan(nodes, relationships);
    }

    private static void link(CodeNode source, String type, CodeNode target, Map<String, Object> properties,
                             int remaining, Map<String, CodeNode> nodes, List<RelationshipRecord> relationships,
                             Set<String> relationshipKeys, Deque<Frontier> queue) {
        String key = source.getId() + '\u0000' + type + '\u0000' + target.getId();
        if (relationshipKeys.add(key)) {
            relationships.add(new RelationshipRecord(type, source.getId(), target.getId(), properties));
        }
        if (nodes.putIfAbsent(target.getId(), target) == null) {
            queue.add(new Frontier(target, remaining == Integer.MAX_VALUE ? remaining : remaining - 1));
        }
    }

    private record Frontier(CodeNode node, int remaining) {
    }

    @Value
    public static class RelationshipRecord {
        String type;
        String fromId;
        String toId;
        Map<String, Object> properties;
    }
}
