package com.architecture.memory.graphexport.service.graph;

import com.architecture.memory.graphexport.model.graph.CodeNode;
import com.architecture.memory.graphexport.service.graph.GraphWritePlan.RelationshipRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphWritePlanTest {

    @Test
    void unboundedDepthWritesEveryReachableRelationship() {
        CodeNode a = node("a");
        CodeNode b = node("b");
        CodeNode c = node("c");
        a.addChild(b);
        b.addChild(c);
        c.addEdge("INVOKES", a);

        GraphWritePlan plan = GraphWritePlan.expand(List.of(a), -1);

        assertThat(plan.getNodes()).containsOnlyKeys("a", "b", "c");
        assertThat(plan.getRelationships())
                .extracting(r -> r.getFromId() + "-" + r.getType() + "->" + r.getToId())
                .containsExactlyInAnyOrder("a-AST->b", "b-AST->c", "c-INVOKES->a");
    }

    @Test
    void depthZeroWritesNodesOnly() {
        CodeNode a = node("a");
        CodeNode b = node("b");
        a.addChild(b);

        GraphWritePlan plan = GraphWritePlan.expand(List.of(a, b), 0);

        assertThat(plan.getNodes()).containsOnlyKeys("a", "b");
        assertThat(plan.getRelationships()).isEmpty();
    }

    @Test
    void depthCapStopsExpansionFromSeed() {
        CodeNode a = node("a");
        CodeNode b = node("b");
        CodeNode c = node("c");
        CodeNode d = node("d");
        a.addChild(b);
        b.addChild(c);
        c.addChild(d);

        GraphWritePlan plan = GraphWritePlan.expand(List.of(a), 2);

        assertThat(plan.getNodes()).containsOnlyKeys("a", "b", "c");
        assertThat(plan.getRelationships()).extracting(RelationshipRecord::getToId).containsExactly("b", "c");
    }

    @Test
    void everySeedGetsTheFullBudget() {
        CodeNode a = node("a");
        CodeNode b = node("b");
        CodeNode c = node("c");
        a.addChild(b);
        b.addChild(c);

        // b is reachable from a, but as a seed it is expanded with the full budget
        GraphWritePlan plan = GraphWritePlan.expand(List.of(a, b), 1);

        assertThat(plan.getRelationships())
                .extracting(r -> r.getFromId() + "->" + r.getToId())
                .containsExactlyInAnyOrder("a->b", "b->c");
    }

    @Test
    void childIndexIsKeptOnStructuralRelationships() {
        CodeNode parent = node("parent");
        parent.addChild(node("first"));
        parent.addChild(node("second"));

        GraphWritePlan plan = GraphWritePlan.expand(List.of(parent), 1);

        assertThat(plan.getRelationships())
                .extracting(r -> r.getToId() + "@" + r.getProperties().get("index"))
                .containsExactly("first@0", "second@1");
    }

    @Test
    void duplicateRelationshipsAreWrittenOnce() {
        CodeNode parent = node("parent");
        CodeNode child = node("child");
        parent.addChild(child);
        parent.addChild(child);
        parent.addEdge("USES", child);

        GraphWritePlan plan = GraphWritePlan.expand(List.of(parent, parent), -1);

        assertThat(plan.getNodes()).hasSize(2);
        assertThat(plan.getRelationships()).extracting(RelationshipRecord::getType).containsExactly("AST", "USES");
    }

    @Test
    void rejectsDepthBelowMinusOne() {
        assertThatThrownBy(() -> GraphWritePlan.expand(List.of(node("a")), -2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static CodeNode node(String id) {
        return CodeNode.builder().id(id).kind("Test").name(id).build();
    }
}
