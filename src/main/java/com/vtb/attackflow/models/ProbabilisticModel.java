package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Готовая модель для внешнего движка вывода: порядок создания переменных,
 * список дуг и таблицы
 */
@Data
@Builder
public class ProbabilisticModel {
    @Builder.Default
    private List<ProbabilisticVariable> variables = new ArrayList<>();
    @Builder.Default
    private List<ModelArc> arcs = new ArrayList<>();

    public Optional<ProbabilisticVariable> variable(String id) {
        return variables.stream().filter(v -> v.getId().equals(id)).findFirst();
    }

    public Optional<ProbabilisticVariable> variableForNode(String nodeId) {
        return variables.stream().filter(v -> nodeId.equals(v.getSourceNodeId())).findFirst();
    }

    public long countByRole(VariableRole role) {
        return variables.stream().filter(v -> v.getRole() == role).count();
    }
}
