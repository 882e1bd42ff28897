package com.vtb.attackflow.synthesis;

import com.vtb.attackflow.models.ModelArc;
import com.vtb.attackflow.models.ProbabilisticVariable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Реестр переменных и дуг одного прогона синтеза.
 *
 * Дуги, которые ссылаются на отсутствующие переменные, повторяются,
 * замыкаются на себя или создают цикл, отклоняются с предупреждением.
 * Экземпляр не разделяется между прогонами
 */
@Slf4j
public class ModelRegistry {

    private final Map<String, ProbabilisticVariable> variables = new LinkedHashMap<>();
    private final Map<String, String> idsByNode = new LinkedHashMap<>();
    private final List<ModelArc> arcs = new ArrayList<>();
    private final Map<String, Set<String>> children = new LinkedHashMap<>();

    /**
     * Безопасный идентификатор: все, кроме букв, цифр и '_', заменяется на '_'.
     * При совпадении с уже занятым идентификатором добавляется числовой суффикс
     */
    public String allocateId(String rawId) {
        String base = sanitize(rawId);
        String candidate = base;
        int suffix = 2;
        while (variables.containsKey(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    public static String sanitize(String rawId) {
        if (rawId == null || rawId.isBlank()) {
            return "_";
        }
        String safe = rawId.replaceAll("[^A-Za-z0-9_]", "_");
        return Character.isDigit(safe.charAt(0)) ? "_" + safe : safe;
    }

    public ProbabilisticVariable add(ProbabilisticVariable variable) {
        if (variables.containsKey(variable.getId())) {
            throw new IllegalStateException("Переменная " + variable.getId() + " уже существует");
        }
        variables.put(variable.getId(), variable);
        if (variable.getSourceNodeId() != null) {
            idsByNode.put(variable.getSourceNodeId(), variable.getId());
        }
        return variable;
    }

    public Optional<ProbabilisticVariable> get(String id) {
        return Optional.ofNullable(variables.get(id));
    }

    public Optional<ProbabilisticVariable> forNode(String nodeId) {
        return Optional.ofNullable(idsByNode.get(nodeId)).map(variables::get);
    }

    public Collection<ProbabilisticVariable> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public List<ModelArc> arcs() {
        return Collections.unmodifiableList(arcs);
    }

    public Set<String> childrenOf(String id) {
        return children.getOrDefault(id, Collections.emptySet());
    }

    /**
     * Добавить дугу from -> to. Родитель дописывается в конец списка родителей
     * потомка, что фиксирует порядок разрядов в его таблице
     *
     * @return true, если дуга добавлена
     */
    public boolean addArc(String from, String to) {
        ProbabilisticVariable source = variables.get(from);
        ProbabilisticVariable target = variables.get(to);
        if (source == null || target == null) {
            log.warn("Дуга {} -> {} пропущена: переменная не найдена", from, to);
            return false;
        }
        if (from.equals(to)) {
            log.warn("Дуга {} -> {} пропущена: петля", from, to);
            return false;
        }
        if (hasArc(from, to)) {
            log.debug("Дуга {} -> {} уже существует", from, to);
            return false;
        }
        if (reachable(to, from)) {
            log.warn("Дуга {} -> {} пропущена: образует цикл", from, to);
            return false;
        }
        target.getParents().add(from);
        children.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        arcs.add(new ModelArc(from, to));
        return true;
    }

    public boolean hasArc(String from, String to) {
        return childrenOf(from).contains(to);
    }

    /**
     * Удалить все входящие дуги переменной
     *
     * @return число удаленных дуг
     */
    public int detachParents(String id) {
        ProbabilisticVariable target = variables.get(id);
        if (target == null) {
            return 0;
        }
        List<String> parents = new ArrayList<>(target.getParents());
        for (String parent : parents) {
            Set<String> siblings = children.get(parent);
            if (siblings != null) {
                siblings.remove(id);
            }
        }
        arcs.removeIf(arc -> arc.getTo().equals(id));
        target.getParents().clear();
        return parents.size();
    }

    /**
     * Мощности родителей переменной в порядке дуг
     */
    public int[] parentCardinalities(ProbabilisticVariable variable) {
        List<String> parents = variable.getParents();
        int[] cardinalities = new int[parents.size()];
        for (int i = 0; i < parents.size(); i++) {
            cardinalities[i] = variables.get(parents.get(i)).cardinality();
        }
        return cardinalities;
    }

    private boolean reachable(String start, String goal) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(goal)) {
                return true;
            }
            if (seen.add(current)) {
                childrenOf(current).forEach(stack::push);
            }
        }
        return false;
    }
}
