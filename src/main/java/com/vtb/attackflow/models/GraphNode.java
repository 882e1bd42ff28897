package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Узел графа сценария атаки. Не изменяется после извлечения
 */
@Value
@Builder
public class GraphNode {
    String id;
    @Builder.Default
    NodeKind kind = NodeKind.OTHER;
    String tacticId;
    String techniqueId;
    String name;
    String description;
    /** Исходная строка condition_type / operator для логических узлов */
    String logicType;

    public Optional<MitreTactic> tactic() {
        return MitreTactic.fromId(tacticId);
    }

    /**
     * Узел считается тактическим, только если код тактики известен
     */
    public boolean hasTactic() {
        return tactic().isPresent();
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
