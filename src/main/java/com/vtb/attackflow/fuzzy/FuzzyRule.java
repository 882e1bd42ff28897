package com.vtb.attackflow.fuzzy;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Правило Мамдани: конъюнкция условий (min) -> терм выхода
 */
@Value
public class FuzzyRule {
    List<Condition> conditions;
    String outputTerm;

    @Value
    public static class Condition {
        String variable;
        String term;
    }

    public static Builder when(String variable, String term) {
        return new Builder().and(variable, term);
    }

    /**
     * Степень срабатывания правила на заданных входах
     */
    public double strength(Map<String, FuzzyVariable> inputs, Map<String, Double> values) {
        double result = 1.0;
        for (Condition condition : conditions) {
            FuzzyVariable variable = inputs.get(condition.getVariable());
            Double value = values.get(condition.getVariable());
            if (variable == null || value == null) {
                throw new IllegalStateException("Нет входа " + condition.getVariable() + " для правила -> " + outputTerm);
            }
            result = Math.min(result, variable.degree(condition.getTerm(), value));
        }
        return result;
    }

    public static class Builder {
        private final List<Condition> conditions = new ArrayList<>();

        public Builder and(String variable, String term) {
            conditions.add(new Condition(variable, term));
            return this;
        }

        public FuzzyRule then(String outputTerm) {
            return new FuzzyRule(Collections.unmodifiableList(new ArrayList<>(conditions)), outputTerm);
        }
    }
}
