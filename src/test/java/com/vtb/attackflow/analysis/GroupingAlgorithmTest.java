package com.vtb.attackflow.analysis;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.models.GraphNode;
import com.vtb.attackflow.models.GroupType;
import com.vtb.attackflow.models.GroupingResult;
import com.vtb.attackflow.models.LogicGroup;
import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.NodeGroup;
import com.vtb.attackflow.models.NodeKind;
import com.vtb.attackflow.models.PartitionGroup;
import com.vtb.attackflow.models.Recommendation;
import com.vtb.attackflow.models.RecommendationAction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GroupingAlgorithmTest {

    private static GraphNode node(String id, String tactic) {
        return GraphNode.builder().id(id).kind(NodeKind.ACTION).tacticId(tactic).build();
    }

    private static Map<String, GraphNode> registry(GraphNode... nodes) {
        Map<String, GraphNode> registry = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            registry.put(node.getId(), node);
        }
        return registry;
    }

    private static Recommendation recommendation(String nodeId, RecommendationAction... actions) {
        EnumSet<RecommendationAction> set = EnumSet.noneOf(RecommendationAction.class);
        set.addAll(List.of(actions));
        return Recommendation.builder().nodeId(nodeId).actions(set).build();
    }

    private static void assertCoversExactlyOnce(List<String> expected, List<List<String>> groups) {
        List<String> all = new ArrayList<>();
        groups.forEach(all::addAll);
        assertEquals(expected.size(), all.size(), "Каждый родитель должен попасть ровно в одну группу");
        assertTrue(all.containsAll(expected));
    }

    @Test
    void partitionBucketsByTacticAndMergesSmallest() {
        Map<String, GraphNode> nodes = registry(node("p1", "TA0001"), node("p2", "TA0001"),
            node("p3", "TA0002"), node("p4", "TA0007"), node("p5", "TA0008"));
        List<String> parents = List.of("p1", "p2", "p3", "p4", "p5");

        List<List<String>> groups = GroupingAlgorithm.partition(parents, nodes, 3, CompilerConfig.BucketKey.TACTIC_ID);

        assertEquals(List.of(List.of("p5"), List.of("p1", "p2"), List.of("p3", "p4")), groups);
        assertCoversExactlyOnce(parents, groups);
    }

    @Test
    void largeBucketIsChunked() {
        List<String> parents = List.of("a", "b", "c", "d", "e", "f", "g");
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        parents.forEach(id -> nodes.put(id, node(id, "TA0002")));

        List<List<String>> groups = GroupingAlgorithm.partition(parents, nodes, 3, CompilerConfig.BucketKey.TACTIC_ID);

        assertEquals(List.of(List.of("a", "b", "c"), List.of("d", "e", "f"), List.of("g")), groups);
    }

    @Test
    void chunkCountNeverExceedsMaxSize() {
        List<String> parents = List.of("a", "b", "c", "d", "e", "f");
        Map<String, GraphNode> nodes = registry(node("a", "TA0001"), node("b", "TA0002"), node("c", "TA0003"),
            node("d", "TA0004"), node("e", "TA0005"), node("f", "TA0006"));

        for (int maxSize = 1; maxSize <= 6; maxSize++) {
            List<List<String>> groups = GroupingAlgorithm.partition(parents, nodes, maxSize, CompilerConfig.BucketKey.TACTIC_ID);
            assertTrue(groups.size() <= maxSize, "Подгрупп не больше " + maxSize + ", получено " + groups.size());
            assertCoversExactlyOnce(parents, groups);
        }
    }

    @Test
    void nodesWithoutTacticShareUnknownBucket() {
        Map<String, GraphNode> nodes = registry(node("a", null), node("b", ""), node("c", "TA0001"));

        List<List<String>> groups = GroupingAlgorithm.partition(List.of("a", "c", "b", "x"), nodes, 3,
            CompilerConfig.BucketKey.TACTIC_ID);

        assertEquals(List.of(List.of("a", "b", "x"), List.of("c")), groups);
        assertEquals(GroupingAlgorithm.UNKNOWN_BUCKET, GroupingAlgorithm.bucketOf(null, CompilerConfig.BucketKey.KIND));
        assertEquals("ACTION", GroupingAlgorithm.bucketOf(nodes.get("a"), CompilerConfig.BucketKey.KIND));
        assertEquals("ALL", GroupingAlgorithm.bucketOf(nodes.get("a"), CompilerConfig.BucketKey.NONE));
    }

    @Test
    void invalidMaxSize() {
        assertThrows(IllegalArgumentException.class,
            () -> GroupingAlgorithm.partition(List.of("a"), Map.of(), 0, CompilerConfig.BucketKey.NONE));
        assertThrows(IllegalArgumentException.class,
            () -> GroupingAlgorithm.computeGroups(List.of(), Map.of(), Map.of(), Map.of(), 0, null, null));
    }

    @Test
    void logicNodeIsNeverPartitioned() {
        Map<String, List<String>> parents = Map.of("op", List.of("a", "b", "c", "d"));
        List<Recommendation> recs = List.of(
            recommendation("op", RecommendationAction.PARTITION, RecommendationAction.LOGIC_AND));

        GroupingResult result = GroupingAlgorithm.computeGroups(recs, parents, Map.of(), Map.of(), CompilerConfig.defaults());

        assertTrue(result.getPartitionGroups().isEmpty());
        assertEquals(1, result.getLogicGroups().size());
        LogicGroup group = result.getLogicGroups().get(0);
        assertEquals(LogicKind.AND, group.getLogic());
        assertEquals(List.of("a", "b", "c", "d"), group.getMembers());
    }

    @Test
    void unknownLogicFollowsPolicy() {
        List<Recommendation> recs = List.of(recommendation("cond", RecommendationAction.LOGIC_UNKNOWN));
        Map<String, List<String>> parents = Map.of("cond", List.of("a"));

        GroupingResult byDefault = GroupingAlgorithm.computeGroups(recs, parents, Map.of(), Map.of(), CompilerConfig.defaults());
        assertEquals(LogicKind.OR, byDefault.getLogicGroups().get(0).getLogic());

        GroupingResult asAnd = GroupingAlgorithm.computeGroups(recs, parents, Map.of(), Map.of(), 3,
            CompilerConfig.BucketKey.TACTIC_ID, LogicKind.AND);
        assertEquals(LogicKind.AND, asAnd.getLogicGroups().get(0).getLogic());
    }

    @Test
    void partitionAndDivorceOnSameNode() {
        Map<String, List<String>> parents = Map.of("n", List.of("a", "b", "c", "d"));
        Map<String, List<String>> children = Map.of("n", List.of("x", "y", "z"));
        List<Recommendation> recs = List.of(recommendation("n", RecommendationAction.PARTITION, RecommendationAction.DIVORCE));

        GroupingResult result = GroupingAlgorithm.computeGroups(recs, parents, children, Map.of(), CompilerConfig.defaults());

        PartitionGroup partition = result.getPartitionGroups().get(0);
        assertEquals(List.of(List.of("a", "b", "c"), List.of("d")), partition.getGroups());
        assertEquals(List.of("x", "y", "z"), result.getDivorceGroups().get(0).getChildren());
        assertEquals(List.of(GroupType.PARTITION, GroupType.DIVORCE),
            result.allGroups().stream().map(NodeGroup::getType).toList());
    }
}
