package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Переменная байесовской сети.
 *
 * Таблица хранится плоско: строка r соответствует комбинации состояний родителей
 * в порядке добавления дуг, первый родитель - младший разряд смешанной системы счисления.
 * Длина строки равна числу состояний самой переменной
 */
@Data
@Builder
public class ProbabilisticVariable {
    private String id;
    /** Идентификатор исходного узла графа; null для вентилей и хабов */
    private String sourceNodeId;
    private String name;
    private String description;
    @Builder.Default
    private VariableType type = VariableType.CPT;
    @Builder.Default
    private VariableRole role = VariableRole.GRAPH_NODE;
    private String tacticId;
    @Builder.Default
    private List<String> states = new ArrayList<>();
    @Builder.Default
    private List<String> parents = new ArrayList<>();
    /** Порядок силы состояний каждого родителя для noisy-MAX вентилей */
    @Builder.Default
    private Map<String, List<Integer>> parentStrengths = new LinkedHashMap<>();
    private double[] cpt;
    private LayoutPosition position;

    public int cardinality() {
        return states.size();
    }

    public boolean hasTable() {
        return cpt != null && cpt.length > 0;
    }

    public double[] row(int index) {
        int width = cardinality();
        return Arrays.copyOfRange(cpt, index * width, (index + 1) * width);
    }

    public int rowCount() {
        return hasTable() ? cpt.length / cardinality() : 0;
    }
}
