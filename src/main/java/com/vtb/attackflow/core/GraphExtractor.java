package com.vtb.attackflow.core;

import com.vtb.attackflow.models.AttackGraph;
import com.vtb.attackflow.models.FlowEdge;
import com.vtb.attackflow.models.FlowObject;
import com.vtb.attackflow.models.GraphNode;
import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.MitreTactic;
import com.vtb.attackflow.models.NodeKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Извлечение графа сценария атаки из объектов документа.
 *
 * Ребра берутся из relationship (source_ref -> target_ref), object_refs,
 * прочих атрибутов *_refs (кроме start_refs) и command_ref.
 * Ребра на незарегистрированные узлы и петли отбрасываются с предупреждением
 */
@Slf4j
public final class GraphExtractor {

    private static final Set<String> SKIPPED_REF_ATTRIBUTES = Set.of("object_refs", "start_refs");

    private GraphExtractor() {}

    public static AttackGraph extract(List<FlowObject> objects) {
        if (objects == null || objects.isEmpty()) {
            throw new GraphCompilationException("Документ пуст: нет объектов для построения графа");
        }

        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Map<String, LogicKind> logicNodes = new LinkedHashMap<>();
        for (FlowObject object : objects) {
            if (object == null || object.getId() == null || object.isRelationship()) {
                continue;
            }
            GraphNode node = toNode(object);
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                log.warn("Повторный идентификатор объекта {}, используется первое вхождение", node.getId());
                continue;
            }
            if (node.getKind().isLogical()) {
                LogicKind logic = LogicKind.parse(node.getLogicType());
                logicNodes.put(node.getId(), logic);
                log.debug("Логический узел {}: {} ({})", node.getId(), node.getLogicType(), logic);
            }
        }

        if (nodes.isEmpty()) {
            throw new GraphCompilationException("В документе нет извлекаемых узлов");
        }

        List<FlowEdge> edges = new ArrayList<>();
        int dropped = 0;
        for (FlowObject object : objects) {
            if (object == null || (object.getId() == null && !object.isRelationship())) {
                continue;
            }
            for (FlowEdge edge : edgesOf(object)) {
                if (accept(edge, nodes)) {
                    edges.add(edge);
                } else {
                    dropped++;
                }
            }
        }

        Map<String, Set<String>> parents = new LinkedHashMap<>();
        Map<String, Set<String>> children = new LinkedHashMap<>();
        for (FlowEdge edge : edges) {
            parents.computeIfAbsent(edge.getTarget(), k -> new LinkedHashSet<>()).add(edge.getSource());
            children.computeIfAbsent(edge.getSource(), k -> new LinkedHashSet<>()).add(edge.getTarget());
        }

        log.info("Граф извлечен: {} узлов, {} ребер, {} логических узлов, отброшено ребер: {}",
            nodes.size(), edges.size(), logicNodes.size(), dropped);

        return AttackGraph.builder()
            .nodes(nodes)
            .edges(edges)
            .parentMap(freeze(parents))
            .childMap(freeze(children))
            .logicNodes(logicNodes)
            .build();
    }

    /**
     * Построить граф напрямую из реестра узлов и списка ребер (без документа)
     */
    public static AttackGraph fromNodes(List<GraphNode> nodeList, List<FlowEdge> edgeList) {
        if (nodeList == null || nodeList.isEmpty()) {
            throw new GraphCompilationException("В графе нет узлов");
        }
        List<FlowObject> objects = new ArrayList<>();
        for (GraphNode node : nodeList) {
            NodeKind kind = Optional.ofNullable(node.getKind()).orElse(NodeKind.OTHER);
            objects.add(FlowObject.builder()
                .type(kind.getDocumentType() != null ? kind.getDocumentType() : "x-other")
                .id(node.getId())
                .name(node.getName())
                .tacticId(node.getTacticId())
                .techniqueId(node.getTechniqueId())
                .description(node.getDescription())
                .conditionType(kind == NodeKind.CONDITION ? node.getLogicType() : null)
                .operator(kind == NodeKind.OPERATOR ? node.getLogicType() : null)
                .build());
        }
        for (FlowEdge edge : Optional.ofNullable(edgeList).orElse(Collections.emptyList())) {
            objects.add(FlowObject.builder()
                .type("relationship")
                .id("relationship--" + edge.getSource() + "--" + edge.getTarget())
                .sourceRef(edge.getSource())
                .targetRef(edge.getTarget())
                .build());
        }
        return extract(objects);
    }

    private static GraphNode toNode(FlowObject object) {
        NodeKind kind = NodeKind.fromDocumentType(object.getType());
        String logicType = switch (kind) {
            case CONDITION -> Optional.ofNullable(object.getConditionType()).orElse("UNKNOWN");
            case OPERATOR -> Optional.ofNullable(object.getOperator()).orElse("UNKNOWN");
            default -> null;
        };

        String tacticId = object.getTacticId();
        if (tacticId != null && MitreTactic.fromId(tacticId).isEmpty()) {
            log.debug("Неизвестная тактика {} у узла {}, узел считается нетактическим", tacticId, object.getId());
        }

        return GraphNode.builder()
            .id(object.getId())
            .kind(kind)
            .tacticId(tacticId)
            .techniqueId(object.getTechniqueId())
            .name(object.displayName())
            .description(object.getDescription())
            .logicType(logicType)
            .build();
    }

    private static List<FlowEdge> edgesOf(FlowObject object) {
        List<FlowEdge> edges = new ArrayList<>();
        if (object.isRelationship()) {
            if (object.getSourceRef() != null && object.getTargetRef() != null) {
                edges.add(edge(object.getSourceRef(), object.getTargetRef(), "relationship"));
            }
            return edges;
        }

        for (String ref : Optional.ofNullable(object.getObjectRefs()).orElse(Collections.emptyList())) {
            edges.add(edge(object.getId(), ref, "object_refs"));
        }
        Optional.ofNullable(object.getOtherRefs()).orElse(Collections.emptyMap()).forEach((attribute, refs) -> {
            if (SKIPPED_REF_ATTRIBUTES.contains(attribute) || refs == null) {
                return;
            }
            for (String ref : refs) {
                edges.add(edge(object.getId(), ref, attribute));
            }
        });
        if (object.getCommandRef() != null) {
            edges.add(edge(object.getId(), object.getCommandRef(), "command_ref"));
        }
        return edges;
    }

    private static FlowEdge edge(String source, String target, String origin) {
        return FlowEdge.builder().source(source).target(target).origin(origin).build();
    }

    private static boolean accept(FlowEdge edge, Map<String, GraphNode> nodes) {
        if (edge.getSource().equals(edge.getTarget())) {
            log.warn("Петля {} -> {} отброшена", edge.getSource(), edge.getTarget());
            return false;
        }
        if (!nodes.containsKey(edge.getSource()) || !nodes.containsKey(edge.getTarget())) {
            log.warn("Ребро {} -> {} ({}) ссылается на отсутствующий узел, пропущено",
                edge.getSource(), edge.getTarget(), edge.getOrigin());
            return false;
        }
        return true;
    }

    private static Map<String, List<String>> freeze(Map<String, Set<String>> source) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        source.forEach((key, values) -> result.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(result);
    }
}
