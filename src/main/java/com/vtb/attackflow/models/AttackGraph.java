package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Реестр узлов, список ребер и производные карты родителей/потомков.
 * Карты строятся один раз экстрактором и дальше только читаются
 */
@Data
@Builder
public class AttackGraph {
    @Builder.Default
    private Map<String, GraphNode> nodes = new LinkedHashMap<>();
    @Builder.Default
    private List<FlowEdge> edges = new ArrayList<>();
    @Builder.Default
    private Map<String, List<String>> parentMap = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, List<String>> childMap = new LinkedHashMap<>();
    /** Логические узлы (условия и операторы) -> их семантика */
    @Builder.Default
    private Map<String, LogicKind> logicNodes = new LinkedHashMap<>();

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<String> parentsOf(String id) {
        return parentMap.getOrDefault(id, Collections.emptyList());
    }

    public List<String> childrenOf(String id) {
        return childMap.getOrDefault(id, Collections.emptyList());
    }

    /**
     * Идентификаторы, на которые ссылается хотя бы одно ребро, в порядке появления
     */
    public Set<String> usedNodeIds() {
        Set<String> used = new LinkedHashSet<>();
        for (FlowEdge edge : edges) {
            used.add(edge.getSource());
            used.add(edge.getTarget());
        }
        return used;
    }
}
