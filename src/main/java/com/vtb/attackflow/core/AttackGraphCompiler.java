package com.vtb.attackflow.core;

import com.vtb.attackflow.analysis.GroupingAlgorithm;
import com.vtb.attackflow.analysis.RecommendationEngine;
import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.models.AttackGraph;
import com.vtb.attackflow.models.CompiledModel;
import com.vtb.attackflow.models.FlowObject;
import com.vtb.attackflow.models.GroupingResult;
import com.vtb.attackflow.models.ProbabilisticModel;
import com.vtb.attackflow.models.Recommendation;
import com.vtb.attackflow.synthesis.ModelSynthesizer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Главный движок компиляции графа атаки в байесовскую сеть.
 * Координирует этапы: извлечение графа, рекомендации, группировка, синтез.
 * Данные идут строго вниз по цепочке, каждый вызов compile независим
 */
@Slf4j
public class AttackGraphCompiler {

    private final CompilerConfig config;

    public AttackGraphCompiler() {
        this(CompilerConfig.load());
    }

    public AttackGraphCompiler(CompilerConfig config) {
        this.config = config != null ? config : CompilerConfig.defaults();
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /**
     * Прочитать бандл с диска и скомпилировать
     */
    public CompiledModel compile(Path bundle) throws IOException {
        List<FlowObject> objects = new FlowBundleReader().read(bundle);
        return compile(objects);
    }

    public CompiledModel compile(List<FlowObject> objects) {
        log.info("=== Начало компиляции графа атаки ===");
        AttackGraph graph = GraphExtractor.extract(objects);
        return compile(graph);
    }

    public CompiledModel compile(AttackGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("AttackGraph не может быть null");
        }
        long startTime = System.currentTimeMillis();

        List<Recommendation> recommendations = RecommendationEngine.recommend(graph, config.getGrouping());
        GroupingResult groups = GroupingAlgorithm.computeGroups(
            recommendations,
            graph.getParentMap(),
            graph.getChildMap(),
            graph.getNodes(),
            config);

        ModelSynthesizer synthesizer = new ModelSynthesizer(config);
        ProbabilisticModel model = synthesizer.synthesize(graph, recommendations, groups);

        long duration = System.currentTimeMillis() - startTime;
        log.info("=== Компиляция завершена за {} мс: {} переменных, {} дуг ===",
            duration, model.getVariables().size(), model.getArcs().size());

        return CompiledModel.builder()
            .graph(graph)
            .recommendations(recommendations)
            .groups(groups)
            .model(model)
            .fuzzyInfo(new LinkedHashMap<>(synthesizer.getFuzzyInfo()))
            .build();
    }
}
