package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Результат одного прогона компиляции: граф, рекомендации, группы и модель
 */
@Data
@Builder
public class CompiledModel {
    private AttackGraph graph;
    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();
    private GroupingResult groups;
    private ProbabilisticModel model;
    @Builder.Default
    private Map<String, NodeFuzzyInfo> fuzzyInfo = new LinkedHashMap<>();
}
