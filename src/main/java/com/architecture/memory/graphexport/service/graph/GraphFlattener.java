package com.architecture.memory.graphexport.service.graph;

import com.architecture.memory.graphexport.model.graph.CodeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Collects every node reachable from a set of roots over the structural relationship.
 *
 * Roots handed over by the analyzer can repeat when the same unit was reached through
 * overlapping inputs, so they are deduplicated first. Semantic edges are not followed.
 */
@Component
@Slf4j
public class GraphFlattener {

    public Set<CodeNode> flatten(Collection<CodeNode> roots) {
        Objects.requireNonNull(roots, "roots");
        Set<CodeNode> uniqueRoots = deduplicate(roots);

        Set<CodeNode> visited = new LinkedHashSet<>();
        for (CodeNode root : uniqueRoots) {
            collectSubtree(root, visited);
        }

        log.debug("[graph-flatten] roots={} uniqueRoots={} nodes={}", roots.size(), uniqueRoots.size(), visited.size());
        return visited;
    }

    public Set<CodeNode> deduplicate(Collection<CodeNode> roots) {
        Set<CodeNode> unique = new LinkedHashSet<>();
        for (CodeNode root : roots) {
            if (root != null) {
                unique.add(root);
            }
        }
        return unique;
    }

    // Iterative pre-order walk; a node seen under an earlier root is not entered again.
    private void collectSubtree(CodeNode root, Set<CodeNode> visited) {
        if (!visited.add(root)) {
            return;
        }
        Deque<CodeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CodeNode current = stack.pop();
            for (CodeNode child : current.getChildren()) {
                if (child != null && visited.add(child)) {
                    stack.push(child);
                }
            }
        }
    }
}
