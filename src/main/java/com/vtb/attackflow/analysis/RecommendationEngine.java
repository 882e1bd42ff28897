package com.vtb.attackflow.analysis;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.models.AttackGraph;
import com.vtb.attackflow.models.GraphNode;
import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.Recommendation;
import com.vtb.attackflow.models.RecommendationAction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Движок структурных рекомендаций.
 *
 * Для каждого узла из списка ребер считает число родителей и потомков:
 * 3+ родителя - разбиение (partition), 3+ потомка - развод (divorce).
 * Логическим узлам независимо от этого назначается ровно одна из
 * LOGIC_AND / LOGIC_OR / LOGIC_UNKNOWN. Граф не изменяется
 */
@Slf4j
public final class RecommendationEngine {

    public static final int DEFAULT_THRESHOLD = 3;

    private RecommendationEngine() {}

    public static List<Recommendation> recommend(AttackGraph graph, CompilerConfig.Grouping settings) {
        if (graph == null) {
            throw new IllegalArgumentException("AttackGraph не может быть null");
        }
        int partitionThreshold = settings != null ? settings.getPartitionThreshold() : DEFAULT_THRESHOLD;
        int divorceThreshold = settings != null ? settings.getDivorceThreshold() : DEFAULT_THRESHOLD;

        Map<String, String> logicTypes = new LinkedHashMap<>();
        graph.getLogicNodes().keySet().forEach(id ->
            graph.node(id).map(GraphNode::getLogicType).ifPresent(type -> logicTypes.put(id, type)));

        return recommend(new LinkedHashSet<>(graph.usedNodeIds()),
            graph.getParentMap(),
            graph.getChildMap(),
            graph.getLogicNodes(),
            logicTypes,
            partitionThreshold,
            divorceThreshold);
    }

    /**
     * Рекомендации по картам родителей/потомков и классификации логических узлов
     */
    public static List<Recommendation> recommend(Collection<String> nodeIds,
                                                 Map<String, List<String>> parentMap,
                                                 Map<String, List<String>> childMap,
                                                 Map<String, LogicKind> logicNodes,
                                                 Map<String, String> logicTypes,
                                                 int partitionThreshold,
                                                 int divorceThreshold) {
        List<Recommendation> result = new ArrayList<>();
        Map<String, List<String>> parents = parentMap != null ? parentMap : Collections.emptyMap();
        Map<String, List<String>> children = childMap != null ? childMap : Collections.emptyMap();
        Map<String, LogicKind> logic = logicNodes != null ? logicNodes : Collections.emptyMap();

        for (String nodeId : nodeIds) {
            int parentCount = parents.getOrDefault(nodeId, Collections.emptyList()).size();
            int childCount = children.getOrDefault(nodeId, Collections.emptyList()).size();
            if (parentCount == 0 && childCount == 0) {
                continue;
            }

            EnumSet<RecommendationAction> actions = EnumSet.noneOf(RecommendationAction.class);
            if (parentCount >= partitionThreshold) {
                actions.add(RecommendationAction.PARTITION);
                log.debug("Partition recommended (parents: {}) for node {}", parentCount, nodeId);
            }
            if (childCount >= divorceThreshold) {
                actions.add(RecommendationAction.DIVORCE);
                log.debug("Divorce recommended (children: {}) for node {}", childCount, nodeId);
            }
            LogicKind kind = logic.get(nodeId);
            if (kind != null) {
                actions.add(RecommendationAction.forLogic(kind));
                log.debug("Логический узел {} классифицирован как {}", nodeId, kind);
            }

            if (!actions.isEmpty()) {
                result.add(Recommendation.builder()
                    .nodeId(nodeId)
                    .parentCount(parentCount)
                    .childCount(childCount)
                    .actions(actions)
                    .logicType(logicTypes != null ? logicTypes.get(nodeId) : null)
                    .build());
            }
        }

        log.info("Рекомендаций сформировано: {}", result.size());
        return result;
    }
}
