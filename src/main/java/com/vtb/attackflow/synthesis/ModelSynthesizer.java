package com.vtb.attackflow.synthesis;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.core.GraphCompilationException;
import com.vtb.attackflow.fuzzy.FuzzyTacticEvaluator;
import com.vtb.attackflow.heuristics.FuzzyParameterHeuristics;
import com.vtb.attackflow.models.AttackGraph;
import com.vtb.attackflow.models.DivorceGroup;
import com.vtb.attackflow.models.FlowEdge;
import com.vtb.attackflow.models.FuzzyState;
import com.vtb.attackflow.models.GraphNode;
import com.vtb.attackflow.models.GroupingResult;
import com.vtb.attackflow.models.LogicGroup;
import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.MitreTactic;
import com.vtb.attackflow.models.NodeFuzzyInfo;
import com.vtb.attackflow.models.PartitionGroup;
import com.vtb.attackflow.models.ProbabilisticModel;
import com.vtb.attackflow.models.ProbabilisticVariable;
import com.vtb.attackflow.models.Recommendation;
import com.vtb.attackflow.models.VariableRole;
import com.vtb.attackflow.models.VariableType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Синтез байесовской сети из графа, рекомендаций и групп.
 *
 * Фазы выполняются строго по порядку: создание переменных, подключение групп
 * (partition, logic, divorce), оставшиеся ребра, расчет всех таблиц, раскладка.
 * Таблицы считаются только в конце, когда набор родителей каждой переменной
 * окончательный. Каждый прогон работает со своим реестром
 */
@Slf4j
public class ModelSynthesizer {

    static final List<String> BINARY_STATES = List.of("False", "True");

    private static final String FUZZY_HEADER = "Fuzzy Tactic: ";

    /** Как считать таблицу переменной в фазе расчета */
    enum TablePolicy {
        AND_GATE,
        NOISY_MAX,
        DIVORCE_BIAS,
        FUZZY,
        DEFAULT
    }

    private final CompilerConfig config;

    private ModelRegistry registry;
    private Map<String, TablePolicy> policies;
    private Map<String, NodeFuzzyInfo> fuzzyInfo;

    public ModelSynthesizer(CompilerConfig config) {
        this.config = config != null ? config : CompilerConfig.defaults();
    }

    public ProbabilisticModel synthesize(AttackGraph graph, List<Recommendation> recommendations, GroupingResult groups) {
        if (graph == null) {
            throw new IllegalArgumentException("AttackGraph не может быть null");
        }
        GroupingResult effectiveGroups = groups != null ? groups : GroupingResult.builder().build();
        registry = new ModelRegistry();
        policies = new LinkedHashMap<>();
        fuzzyInfo = new LinkedHashMap<>();

        Set<String> usedIds = graph.usedNodeIds();
        if (usedIds.isEmpty()) {
            throw new GraphCompilationException("Ни один узел не связан ребрами, модель построить нельзя");
        }

        log.info("Синтез модели: {} узлов в ребрах", usedIds.size());
        createVariables(graph, usedIds, recommendations);
        Set<String> partitioned = wirePartitions(effectiveGroups);
        wireLogic(effectiveGroups);
        Set<String> divorcedChildren = wireDivorce(effectiveGroups, partitioned);
        wireRemainingEdges(graph, effectiveGroups, divorcedChildren);
        computeAllTables();
        ModelLayout.apply(registry, config.getLayout());

        ProbabilisticModel model = ProbabilisticModel.builder()
            .variables(new ArrayList<>(registry.variables()))
            .arcs(new ArrayList<>(registry.arcs()))
            .build();
        log.info("Модель построена: {} переменных, {} дуг (вентили: {}, хабы: {})",
            model.getVariables().size(), model.getArcs().size(),
            model.countByRole(VariableRole.PARTITION_GATE), model.countByRole(VariableRole.DIVORCE_HUB));
        return model;
    }

    /**
     * Нечеткие сведения по тактическим узлам последнего прогона
     */
    public Map<String, NodeFuzzyInfo> getFuzzyInfo() {
        return fuzzyInfo != null ? Collections.unmodifiableMap(fuzzyInfo) : Collections.emptyMap();
    }

    // ---------- CreateVariables ----------

    private void createVariables(AttackGraph graph, Set<String> usedIds, List<Recommendation> recommendations) {
        Map<String, List<String>> messages = new LinkedHashMap<>();
        Optional.ofNullable(recommendations).orElse(Collections.emptyList())
            .forEach(rec -> messages.put(rec.getNodeId(), rec.messages()));

        for (String nodeId : usedIds) {
            GraphNode node = graph.node(nodeId).orElseGet(() -> GraphNode.builder().id(nodeId).name(nodeId).build());
            boolean tactic = node.hasTactic();
            String id = registry.allocateId(nodeId);

            StringBuilder description = new StringBuilder(describe(node, graph, messages.get(nodeId)));
            if (tactic) {
                NodeFuzzyInfo info = evaluateFuzzy(node);
                fuzzyInfo.put(nodeId, info);
                appendFuzzy(description, info);
            }

            registry.add(ProbabilisticVariable.builder()
                .id(id)
                .sourceNodeId(nodeId)
                .name(node.displayName())
                .description(description.toString())
                .tacticId(tactic ? node.tactic().map(MitreTactic::getId).orElse(null) : null)
                .states(new ArrayList<>(tactic ? FuzzyState.labels() : BINARY_STATES))
                .build());
            policies.put(id, tactic ? TablePolicy.FUZZY : TablePolicy.DEFAULT);
        }
        log.debug("Создано переменных: {}, тактических: {}", usedIds.size(), fuzzyInfo.size());
    }

    private NodeFuzzyInfo evaluateFuzzy(GraphNode node) {
        String tacticId = node.tactic().map(MitreTactic::getId).orElse(node.getTacticId());
        Map<String, Double> params = FuzzyParameterHeuristics.configure(node, config.getFuzzy());
        double[] membership = FuzzyTacticEvaluator.membership(tacticId, params);
        return NodeFuzzyInfo.builder()
            .nodeId(node.getId())
            .nodeName(node.displayName())
            .techniqueId(node.getTechniqueId())
            .tacticId(tacticId)
            .tacticName(MitreTactic.nameOf(tacticId))
            .parameters(params)
            .states(FuzzyTacticEvaluator.states())
            .membership(membership)
            .baseSuccessProbability(FuzzyTacticEvaluator.successProbability(tacticId, params))
            .build();
    }

    // ---------- WireGroups ----------

    private Set<String> wirePartitions(GroupingResult groups) {
        Set<String> logicIds = groups.logicNodeIds();
        Set<String> partitioned = new LinkedHashSet<>();
        for (PartitionGroup group : groups.getPartitionGroups()) {
            if (logicIds.contains(group.getNodeId())) {
                continue;
            }
            Optional<ProbabilisticVariable> target = registry.forNode(group.getNodeId());
            if (target.isEmpty()) {
                log.warn("Partition для {} пропущен: переменная не найдена", group.getNodeId());
                continue;
            }
            partitioned.add(group.getNodeId());
            int index = 1;
            for (List<String> members : group.getGroups()) {
                String gateName = group.getNodeId() + "_grp" + index++;
                ProbabilisticVariable gate = registry.add(ProbabilisticVariable.builder()
                    .id(registry.allocateId(gateName))
                    .name(gateName)
                    .description("Partition of " + group.getNodeId() + ": " + members)
                    .type(VariableType.NOISY_MAX)
                    .role(VariableRole.PARTITION_GATE)
                    .states(new ArrayList<>(BINARY_STATES))
                    .build());
                policies.put(gate.getId(), TablePolicy.NOISY_MAX);
                for (String member : members) {
                    registry.forNode(member).ifPresent(parent -> registry.addArc(parent.getId(), gate.getId()));
                }
                registry.addArc(gate.getId(), target.get().getId());
            }
        }
        return partitioned;
    }

    /**
     * Логический узел становится бинарным: AND - полная таблица минимума,
     * OR - noisy-MAX вентиль по всем входам
     */
    private void wireLogic(GroupingResult groups) {
        for (LogicGroup group : groups.getLogicGroups()) {
            Optional<ProbabilisticVariable> found = registry.forNode(group.getNodeId());
            if (found.isEmpty()) {
                log.warn("Логический узел {} пропущен: переменная не найдена", group.getNodeId());
                continue;
            }
            ProbabilisticVariable operator = found.get();
            boolean and = group.getLogic() == LogicKind.AND;
            operator.setStates(new ArrayList<>(BINARY_STATES));
            operator.setTacticId(null);
            operator.setType(and ? VariableType.CPT : VariableType.NOISY_MAX);
            operator.setRole(and ? VariableRole.LOGIC_AND : VariableRole.LOGIC_OR);
            policies.put(operator.getId(), and ? TablePolicy.AND_GATE : TablePolicy.NOISY_MAX);
            if (fuzzyInfo.remove(group.getNodeId()) != null) {
                operator.setDescription(withoutFuzzy(operator.getDescription()));
                log.debug("Узел {} с тактикой стал логическим вентилем {}", group.getNodeId(), group.getLogic());
            }

            for (String member : group.getMembers()) {
                registry.forNode(member).ifPresent(parent -> registry.addArc(parent.getId(), operator.getId()));
            }
        }
    }

    private Set<String> wireDivorce(GroupingResult groups, Set<String> partitioned) {
        Set<String> logicIds = groups.logicNodeIds();
        Set<String> divorcedChildren = new LinkedHashSet<>();
        for (DivorceGroup group : groups.getDivorceGroups()) {
            List<ProbabilisticVariable> children = new ArrayList<>();
            for (String childId : group.getChildren()) {
                if (partitioned.contains(childId) || logicIds.contains(childId)) {
                    continue;
                }
                registry.forNode(childId).ifPresent(children::add);
            }
            Optional<ProbabilisticVariable> parent = registry.forNode(group.getNodeId());
            if (children.isEmpty() || parent.isEmpty()) {
                continue;
            }

            String hubName = group.getNodeId() + "_div";
            ProbabilisticVariable hub = registry.add(ProbabilisticVariable.builder()
                .id(registry.allocateId(hubName))
                .name(hubName)
                .description("Divorce of " + group.getNodeId() + ": splits to "
                    + children.stream().map(ProbabilisticVariable::getSourceNodeId).toList())
                .role(VariableRole.DIVORCE_HUB)
                .states(new ArrayList<>(BINARY_STATES))
                .build());
            policies.put(hub.getId(), TablePolicy.DEFAULT);
            registry.addArc(parent.get().getId(), hub.getId());

            for (ProbabilisticVariable child : children) {
                if (registry.addArc(hub.getId(), child.getId())) {
                    policies.put(child.getId(), TablePolicy.DIVORCE_BIAS);
                    divorcedChildren.add(child.getSourceNodeId());
                }
            }
        }
        return divorcedChildren;
    }

    // ---------- WireRemainingEdges ----------

    private void wireRemainingEdges(AttackGraph graph, GroupingResult groups, Set<String> divorcedChildren) {
        Set<FlowEdge> covered = new LinkedHashSet<>();
        for (PartitionGroup group : groups.getPartitionGroups()) {
            group.members().forEach(member -> covered.add(FlowEdge.of(member, group.getNodeId())));
        }
        for (LogicGroup group : groups.getLogicGroups()) {
            group.getMembers().forEach(member -> covered.add(FlowEdge.of(member, group.getNodeId())));
        }
        for (DivorceGroup group : groups.getDivorceGroups()) {
            group.getChildren().forEach(child -> covered.add(FlowEdge.of(group.getNodeId(), child)));
        }

        int added = 0;
        for (FlowEdge edge : graph.getEdges()) {
            if (divorcedChildren.contains(edge.getTarget())) {
                continue;
            }
            if (covered.contains(FlowEdge.of(edge.getSource(), edge.getTarget()))) {
                continue;
            }
            Optional<ProbabilisticVariable> source = registry.forNode(edge.getSource());
            Optional<ProbabilisticVariable> target = registry.forNode(edge.getTarget());
            if (source.isEmpty() || target.isEmpty()) {
                log.warn("Ребро {} -> {} пропущено: нет переменной", edge.getSource(), edge.getTarget());
                continue;
            }
            if (registry.addArc(source.get().getId(), target.get().getId())) {
                added++;
            }
        }
        log.debug("Добавлено прямых дуг: {}", added);
    }

    // ---------- ComputeAllCPTs ----------

    private void computeAllTables() {
        CompilerConfig.NoisyMax noisy = config.getNoisyMax();
        for (ProbabilisticVariable variable : registry.variables()) {
            int[] cardinalities = registry.parentCardinalities(variable);
            TablePolicy policy = policies.getOrDefault(variable.getId(), TablePolicy.DEFAULT);
            if (variable.getType() == VariableType.NOISY_MAX) {
                variable.setParentStrengths(strengths(variable));
            }

            double[] table = computeOrDefault(variable, cardinalities, () -> switch (policy) {
                case AND_GATE -> CptCalculator.andGate(cardinalities);
                case NOISY_MAX -> CptCalculator.noisyMax(cardinalities,
                    noisy.getLinkProbability(), noisy.getLeakProbability());
                case DIVORCE_BIAS -> CptCalculator.divorceBias(cardinalities, hubIndexes(variable),
                    variable.cardinality());
                case FUZZY -> CptCalculator.fuzzyWithParents(fuzzyBase(variable), cardinalities);
                case DEFAULT -> CptCalculator.defaultTable(cardinalities, variable.cardinality());
            });
            variable.setCpt(table);
        }
    }

    /**
     * Единая политика отката для таблиц: ошибка расчета или некорректная
     * таблица заменяются таблицей по умолчанию. Если и она не помещается,
     * переменная отключается от родителей и получает априорное распределение
     */
    double[] computeOrDefault(ProbabilisticVariable variable, int[] cardinalities, Supplier<double[]> computation) {
        try {
            if (!CptCalculator.fits(cardinalities, variable.cardinality())) {
                throw new IllegalStateException(cardinalities.length + " родителей дают таблицу больше "
                    + CptCalculator.MAX_TABLE_ENTRIES + " значений");
            }
            double[] table = computation.get();
            CptCalculator.validate(table, cardinalities, variable.cardinality());
            return table;
        } catch (RuntimeException e) {
            log.warn("Таблица для {} не рассчитана ({}), используется таблица по умолчанию",
                variable.getId(), e.getMessage());
        }
        if (CptCalculator.fits(cardinalities, variable.cardinality())) {
            try {
                return CptCalculator.defaultTable(cardinalities, variable.cardinality());
            } catch (RuntimeException e) {
                log.warn("Таблица по умолчанию для {} не рассчитана ({})", variable.getId(), e.getMessage());
            }
        }
        int detached = registry != null ? registry.detachParents(variable.getId()) : 0;
        variable.getParents().clear();
        variable.getParentStrengths().clear();
        log.warn("Переменная {} отключена от {} родителей, используется априорное распределение",
            variable.getId(), detached);
        return CptCalculator.defaultTable(new int[0], variable.cardinality());
    }

    private double[] fuzzyBase(ProbabilisticVariable variable) {
        NodeFuzzyInfo info = fuzzyInfo.get(variable.getSourceNodeId());
        if (info == null || info.getMembership() == null) {
            throw new IllegalStateException("Нет нечеткого распределения для " + variable.getId());
        }
        return info.getMembership();
    }

    private int[] hubIndexes(ProbabilisticVariable variable) {
        List<String> parents = variable.getParents();
        return IntStream.range(0, parents.size())
            .filter(i -> registry.get(parents.get(i))
                .map(parent -> parent.getRole() == VariableRole.DIVORCE_HUB)
                .orElse(false))
            .toArray();
    }

    private Map<String, List<Integer>> strengths(ProbabilisticVariable variable) {
        Map<String, List<Integer>> strengths = new LinkedHashMap<>();
        for (String parentId : variable.getParents()) {
            int cardinality = registry.get(parentId).map(ProbabilisticVariable::cardinality).orElse(2);
            strengths.put(parentId, IntStream.range(0, cardinality).boxed().toList());
        }
        return strengths;
    }

    // ---------- Аннотации ----------

    private static String describe(GraphNode node, AttackGraph graph, List<String> recommendations) {
        List<String> lines = new ArrayList<>();
        if (node.getName() != null) {
            lines.add("Name: " + node.getName());
        }
        if (node.getDescription() != null) {
            lines.add("Description: " + node.getDescription());
        }
        if (node.getTacticId() != null) {
            lines.add("Tactic: " + node.getTacticId());
        }
        if (node.getTechniqueId() != null) {
            lines.add("Technique: " + node.getTechniqueId());
        }
        List<String> parents = graph.parentsOf(node.getId());
        if (!parents.isEmpty()) {
            lines.add("Parents: " + parents);
        }
        List<String> children = graph.childrenOf(node.getId());
        if (!children.isEmpty()) {
            lines.add("Children: " + children);
        }
        if (recommendations != null && !recommendations.isEmpty()) {
            lines.add("Recommendations: " + String.join(", ", recommendations));
        }
        return String.join("\n", lines);
    }

    private static String withoutFuzzy(String description) {
        int start = description != null ? description.indexOf(FUZZY_HEADER) : -1;
        return start < 0 ? description : description.substring(0, start).stripTrailing();
    }

    private static void appendFuzzy(StringBuilder description, NodeFuzzyInfo info) {
        if (description.length() > 0) {
            description.append('\n');
        }
        description.append(FUZZY_HEADER).append(info.getTacticName());
        description.append("\nFuzzy Parameters: ").append(info.getParameters());
        description.append("\nFuzzy Membership Distribution:");
        double[] membership = info.getMembership();
        for (int i = 0; i < membership.length; i++) {
            description.append("\n  ").append(info.getStates().get(i)).append(": ")
                .append(String.format(Locale.ROOT, "%.3f", membership[i]));
        }
    }
}
