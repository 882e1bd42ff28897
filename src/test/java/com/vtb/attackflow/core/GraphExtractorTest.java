package com.vtb.attackflow.core;

import com.vtb.attackflow.models.AttackGraph;
import com.vtb.attackflow.models.FlowEdge;
import com.vtb.attackflow.models.FlowObject;
import com.vtb.attackflow.models.GraphNode;
import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphExtractorTest {

    private static FlowObject action(String id, String tactic) {
        return FlowObject.builder().type("attack-action").id(id).name(id).tacticId(tactic).build();
    }

    private static FlowObject relationship(String source, String target) {
        return FlowObject.builder()
            .type("relationship")
            .id("relationship--" + source + "-" + target)
            .sourceRef(source)
            .targetRef(target)
            .build();
    }

    @Test
    void edgesFromAllReferenceKinds() {
        FlowObject a = action("a", "TA0001");
        a.setOtherRefs(Map.of("effect_refs", List.of("b")));
        FlowObject b = action("b", "TA0002");
        b.setObjectRefs(List.of("c"));
        FlowObject c = action("c", null);
        c.setCommandRef("d");
        FlowObject d = FlowObject.builder().type("attack-asset").id("d").name("Сервер").build();

        AttackGraph graph = GraphExtractor.extract(List.of(a, b, c, d, relationship("a", "d")));

        assertEquals(4, graph.getNodes().size());
        assertEquals(4, graph.getEdges().size());
        assertEquals(List.of("c", "a"), graph.parentsOf("d"), "Родители в порядке появления ребер");
        assertEquals(List.of("b", "d"), graph.childrenOf("a"));
        assertEquals(NodeKind.ASSET, graph.getNodes().get("d").getKind());
    }

    @Test
    void danglingEdgesAndSelfLoopsAreDropped() {
        FlowObject a = action("a", null);
        a.setOtherRefs(Map.of("effect_refs", List.of("a", "missing")));
        FlowObject b = action("b", null);

        AttackGraph graph = GraphExtractor.extract(List.of(a, b, relationship("a", "b"), relationship("ghost", "b")));

        assertEquals(List.of(FlowEdge.of("a", "b")), graph.getEdges());
    }

    @Test
    void startRefsDoNotCreateEdges() {
        FlowObject flow = FlowObject.builder().type("attack-flow").id("flow").build();
        flow.setOtherRefs(Map.of("start_refs", List.of("a")));

        AttackGraph graph = GraphExtractor.extract(List.of(flow, action("a", null), action("b", null), relationship("a", "b")));

        assertEquals(1, graph.getEdges().size());
        assertFalse(graph.usedNodeIds().contains("flow"));
    }

    @Test
    void logicNodesAreClassified() {
        FlowObject operator = FlowObject.builder().type("attack-operator").id("op").operator("and").build();
        FlowObject condition = FlowObject.builder().type("attack-condition").id("cond").build();
        FlowObject orCondition = FlowObject.builder().type("attack-condition").id("cond2").conditionType("OR").build();

        AttackGraph graph = GraphExtractor.extract(List.of(operator, condition, orCondition,
            relationship("op", "cond"), relationship("cond", "cond2")));

        assertEquals(LogicKind.AND, graph.getLogicNodes().get("op"));
        assertEquals(LogicKind.UNKNOWN, graph.getLogicNodes().get("cond"));
        assertEquals(LogicKind.OR, graph.getLogicNodes().get("cond2"));
        assertEquals("UNKNOWN", graph.getNodes().get("cond").getLogicType());
    }

    @Test
    void duplicateIdsKeepFirstObject() {
        AttackGraph graph = GraphExtractor.extract(List.of(action("a", "TA0001"), action("a", "TA0002"), action("b", null),
            relationship("a", "b")));

        assertEquals("TA0001", graph.getNodes().get("a").getTacticId());
    }

    @Test
    void sampleBundleGraph() throws Exception {
        AttackGraph graph = GraphExtractor.extract(new FlowBundleReader().read(FlowBundleReaderTest.SAMPLE_FLOW));

        assertEquals(6, graph.getEdges().size(), "Ребро на отсутствующий актив должно быть отброшено");
        assertEquals(7, graph.usedNodeIds().size());
        assertEquals(2, graph.getLogicNodes().size());
        assertEquals(2, graph.parentsOf("attack-operator--00000000-0000-4000-8000-000000000005").size());
    }

    @Test
    void fromNodesBuildsSameGraph() {
        GraphNode op = GraphNode.builder().id("op").kind(NodeKind.OPERATOR).logicType("OR").build();
        GraphNode a = GraphNode.builder().id("a").kind(NodeKind.ACTION).tacticId("TA0007").name("Discovery").build();

        AttackGraph graph = GraphExtractor.fromNodes(List.of(a, op), List.of(FlowEdge.of("a", "op")));

        assertEquals(LogicKind.OR, graph.getLogicNodes().get("op"));
        assertEquals("TA0007", graph.getNodes().get("a").getTacticId());
        assertTrue(graph.getNodes().get("a").hasTactic());
    }

    @Test
    void emptyInputIsFatal() {
        assertThrows(GraphCompilationException.class, () -> GraphExtractor.extract(List.of()));
        assertThrows(GraphCompilationException.class,
            () -> GraphExtractor.extract(List.of(relationship("a", "b"))),
            "Документ только из связей не содержит узлов");
    }
}
