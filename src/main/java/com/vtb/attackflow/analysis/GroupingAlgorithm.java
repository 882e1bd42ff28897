package com.vtb.attackflow.analysis;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.models.DivorceGroup;
import com.vtb.attackflow.models.GraphNode;
import com.vtb.attackflow.models.GroupingResult;
import com.vtb.attackflow.models.LogicGroup;
import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.NodeKind;
import com.vtb.attackflow.models.PartitionGroup;
import com.vtb.attackflow.models.Recommendation;
import com.vtb.attackflow.models.RecommendationAction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Построение групп по рекомендациям: partition, divorce и logic.
 *
 * Родители узла с рекомендацией partition раскладываются в корзины по
 * семантическому ключу (по умолчанию код тактики), корзины режутся на куски
 * не больше maxSize, затем два самых маленьких куска сливаются, пока кусков
 * больше maxSize
 */
@Slf4j
public final class GroupingAlgorithm {

    public static final String UNKNOWN_BUCKET = "UNKNOWN";

    private GroupingAlgorithm() {}

    public static GroupingResult computeGroups(List<Recommendation> recommendations,
                                               Map<String, List<String>> parentMap,
                                               Map<String, List<String>> childMap,
                                               Map<String, GraphNode> nodes,
                                               CompilerConfig config) {
        CompilerConfig effective = config != null ? config : CompilerConfig.defaults();
        return computeGroups(recommendations, parentMap, childMap, nodes,
            effective.getGrouping().getMaxGroupSize(),
            effective.getGrouping().getBucketKey(),
            effective.getLogic().getUnknownPolicy());
    }

    public static GroupingResult computeGroups(List<Recommendation> recommendations,
                                               Map<String, List<String>> parentMap,
                                               Map<String, List<String>> childMap,
                                               Map<String, GraphNode> nodes,
                                               int maxSize,
                                               CompilerConfig.BucketKey bucketKey,
                                               LogicKind unknownPolicy) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxGroupSize должен быть >= 1, получено: " + maxSize);
        }
        CompilerConfig.BucketKey key = bucketKey != null ? bucketKey : CompilerConfig.BucketKey.TACTIC_ID;
        CompilerConfig.Logic logicPolicy = new CompilerConfig.Logic();
        logicPolicy.setUnknownPolicy(unknownPolicy);
        logicPolicy.ensureDefaults();
        Map<String, List<String>> parents = parentMap != null ? parentMap : Collections.emptyMap();
        Map<String, List<String>> children = childMap != null ? childMap : Collections.emptyMap();
        Map<String, GraphNode> registry = nodes != null ? nodes : Collections.emptyMap();

        List<PartitionGroup> partitionGroups = new ArrayList<>();
        List<DivorceGroup> divorceGroups = new ArrayList<>();
        List<LogicGroup> logicGroups = new ArrayList<>();

        for (Recommendation rec : Optional.ofNullable(recommendations).orElse(Collections.emptyList())) {
            String nodeId = rec.getNodeId();
            Optional<RecommendationAction> logicAction = rec.logicAction();

            if (logicAction.isPresent()) {
                LogicKind logic = switch (logicAction.get()) {
                    case LOGIC_AND -> LogicKind.AND;
                    case LOGIC_OR -> LogicKind.OR;
                    default -> logicPolicy.resolve(LogicKind.UNKNOWN);
                };
                logicGroups.add(LogicGroup.builder()
                    .nodeId(nodeId)
                    .logic(logic)
                    .members(new ArrayList<>(parents.getOrDefault(nodeId, Collections.emptyList())))
                    .build());
                if (rec.has(RecommendationAction.PARTITION)) {
                    log.debug("Узел {} логический ({}), разбиение не выполняется", nodeId, logic);
                }
            } else if (rec.has(RecommendationAction.PARTITION)) {
                List<String> nodeParents = parents.getOrDefault(nodeId, Collections.emptyList());
                List<List<String>> groups = partition(nodeParents, registry, maxSize, key);
                partitionGroups.add(PartitionGroup.builder().nodeId(nodeId).groups(groups).build());
                log.debug("Узел {}: {} родителей разбиты на {} подгрупп", nodeId, nodeParents.size(), groups.size());
            }

            if (rec.has(RecommendationAction.DIVORCE)) {
                divorceGroups.add(DivorceGroup.builder()
                    .nodeId(nodeId)
                    .children(new ArrayList<>(children.getOrDefault(nodeId, Collections.emptyList())))
                    .build());
            }
        }

        log.info("Группы построены: partition={}, divorce={}, logic={}",
            partitionGroups.size(), divorceGroups.size(), logicGroups.size());

        return GroupingResult.builder()
            .partitionGroups(partitionGroups)
            .divorceGroups(divorceGroups)
            .logicGroups(logicGroups)
            .build();
    }

    /**
     * Разбить список родителей на подгруппы.
     * Каждый родитель попадает ровно в одну подгруппу, подгрупп не больше maxSize
     */
    public static List<List<String>> partition(List<String> parentIds,
                                               Map<String, GraphNode> nodes,
                                               int maxSize,
                                               CompilerConfig.BucketKey bucketKey) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxGroupSize должен быть >= 1, получено: " + maxSize);
        }
        Map<String, List<String>> buckets = new LinkedHashMap<>();
        for (String parentId : parentIds) {
            buckets.computeIfAbsent(bucketOf(nodes.get(parentId), bucketKey), k -> new ArrayList<>()).add(parentId);
        }

        List<List<String>> chunks = new ArrayList<>();
        for (List<String> bucket : buckets.values()) {
            for (int start = 0; start < bucket.size(); start += maxSize) {
                chunks.add(new ArrayList<>(bucket.subList(start, Math.min(start + maxSize, bucket.size()))));
            }
        }

        // Сортировка стабильна: при равных размерах сливаются куски, встреченные раньше
        while (chunks.size() > maxSize) {
            chunks.sort(Comparator.comparingInt(List::size));
            List<String> first = chunks.remove(0);
            List<String> second = chunks.remove(0);
            List<String> merged = new ArrayList<>(first);
            merged.addAll(second);
            chunks.add(merged);
        }
        return chunks;
    }

    static String bucketOf(GraphNode node, CompilerConfig.BucketKey bucketKey) {
        if (node == null) {
            return UNKNOWN_BUCKET;
        }
        String value = switch (bucketKey) {
            case TACTIC_ID -> node.getTacticId();
            case TECHNIQUE_ID -> node.getTechniqueId();
            case KIND -> Optional.ofNullable(node.getKind()).orElse(NodeKind.OTHER).name();
            case NONE -> "ALL";
        };
        return value == null || value.isBlank() ? UNKNOWN_BUCKET : value;
    }
}
