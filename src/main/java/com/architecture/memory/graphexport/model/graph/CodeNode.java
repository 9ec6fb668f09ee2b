package com.architecture.memory.graphexport.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node of the analyzed code graph.
 *
 * Identity is the {@link #id} alone: two instances with the same id are the same node.
 * {@link #children} is the structural (containment) relationship, persisted as {@value #AST}.
 * {@link #edges} holds semantic relationships (calls, types, inheritance) keyed by type;
 * these may form cycles and are never used to enumerate descendants.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public class CodeNode {

    public static final String AST = "AST";

    @EqualsAndHashCode.Include
    @ToString.Include
    private String id;

    @ToString.Include
    private String kind;

    @ToString.Include
    private String name;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @Builder.Default
    private List<CodeNode> children = new ArrayList<>();

    @Builder.Default
    private Map<String, Set<CodeNode>> edges = new LinkedHashMap<>();

    public CodeNode addChild(CodeNode child) {
        children.add(child);
        return this;
    }

    public CodeNode addEdge(String type, CodeNode target) {
        edges.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(target);
        return this;
    }

    public CodeNode property(String key, Object value) {
        if (value != null) {
            properties.put(key, value);
        }
        return this;
    }

    public Set<CodeNode> getEdges(String type) {
        return edges.getOrDefault(type, Collections.emptySet());
    }
}
