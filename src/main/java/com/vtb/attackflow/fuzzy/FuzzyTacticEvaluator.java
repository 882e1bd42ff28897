package com.vtb.attackflow.fuzzy;

import com.vtb.attackflow.models.FuzzyState;
import com.vtb.attackflow.util.MixedRadix;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Нечеткая оценка вероятности успеха противника по тактике MITRE ATT&CK.
 *
 * Вывод Мамдани на целочисленной шкале 0..100: AND = min, импликация -
 * срезка, агрегация - max, дефаззификация - центр тяжести. Полученное
 * значение раскладывается по пяти термам выхода и нормируется.
 * Ошибки вычисления не выходят наружу: все пути идут через computeOrDefault
 */
@Slf4j
public final class FuzzyTacticEvaluator {

    /** Значение шкалы, если ни одно правило не сработало или вычисление упало */
    public static final double NEUTRAL_VALUE = 50.0;

    private static final FuzzyVariable OUTPUT = FuzzyVariable.successProbability();
    private static final int UNIVERSE_STEPS = 100;

    private FuzzyTacticEvaluator() {}

    public static List<String> states() {
        return FuzzyState.labels();
    }

    public static Map<String, Double> getDefaultParams(String tacticId) {
        return TacticRuleBook.defaultParams(tacticId);
    }

    /**
     * Распределение [VeryLow, Low, Medium, High, VeryHigh] для тактики.
     * Неизвестная тактика дает равномерное распределение
     */
    public static double[] membership(String tacticId, Map<String, Double> params) {
        Optional<TacticRuleSet> ruleSet = TacticRuleBook.forTactic(tacticId);
        if (ruleSet.isEmpty()) {
            log.debug("Тактика {} не поддерживается, равномерное распределение", tacticId);
            return uniform();
        }
        return computeOrDefault(tacticId,
            () -> evaluateMembership(ruleSet.get(), params),
            () -> bucketFallback(NEUTRAL_VALUE));
    }

    /**
     * Четкая вероятность успеха 0..1; 0.5 для неизвестной тактики или при ошибке
     */
    public static double successProbability(String tacticId, Map<String, Double> params) {
        Optional<TacticRuleSet> ruleSet = TacticRuleBook.forTactic(tacticId);
        if (ruleSet.isEmpty()) {
            return NEUTRAL_VALUE / 100.0;
        }
        try {
            return crispValue(ruleSet.get(), params).orElse(NEUTRAL_VALUE) / 100.0;
        } catch (RuntimeException e) {
            log.warn("Ошибка нечеткого вывода для {}: {}", tacticId, e.getMessage());
            return NEUTRAL_VALUE / 100.0;
        }
    }

    /**
     * Значение выхода 0..100; пусто, если ни одно правило не сработало
     */
    public static OptionalDouble crispValue(String tacticId, Map<String, Double> params) {
        TacticRuleSet ruleSet = TacticRuleBook.forTactic(tacticId)
            .orElseThrow(() -> new IllegalArgumentException("Неизвестная тактика: " + tacticId));
        return crispValue(ruleSet, params);
    }

    static OptionalDouble crispValue(TacticRuleSet ruleSet, Map<String, Double> params) {
        Map<String, Double> inputs = resolveParams(ruleSet, params);

        double[] strengths = new double[ruleSet.getRules().size()];
        boolean fired = false;
        for (int i = 0; i < strengths.length; i++) {
            strengths[i] = ruleSet.getRules().get(i).strength(ruleSet.getInputs(), inputs);
            fired |= strengths[i] > 0.0;
        }
        if (!fired) {
            return OptionalDouble.empty();
        }

        double area = 0.0;
        double moment = 0.0;
        for (int step = 0; step <= UNIVERSE_STEPS; step++) {
            double x = step;
            double aggregated = 0.0;
            for (int i = 0; i < strengths.length; i++) {
                if (strengths[i] <= 0.0) {
                    continue;
                }
                String term = ruleSet.getRules().get(i).getOutputTerm();
                aggregated = Math.max(aggregated, Math.min(strengths[i], OUTPUT.degree(term, x)));
            }
            area += aggregated;
            moment += aggregated * x;
        }
        if (area <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(moment / area);
    }

    /**
     * Таблица для тактического узла, все родители которого 5-уровневые.
     * Строки нумеруются по смешанной системе счисления с основанием 5
     */
    public static double[] cptWithFuzzyParents(String tacticId, int parentCount, Map<String, Double> params) {
        if (parentCount < 0) {
            throw new IllegalArgumentException("Число родителей не может быть отрицательным: " + parentCount);
        }
        double[] base = membership(tacticId, params);
        if (parentCount == 0) {
            return base;
        }
        int[] cardinalities = new int[parentCount];
        Arrays.fill(cardinalities, FuzzyState.COUNT);
        int rows = MixedRadix.rowCount(cardinalities);
        double[] table = new double[rows * FuzzyState.COUNT];
        for (int row = 0; row < rows; row++) {
            int[] states = MixedRadix.decode(row, cardinalities);
            double influence = MixedRadix.averageActivation(states, cardinalities);
            double[] adjusted = InfluenceShift.FUZZY_PARENTS.apply(base, influence);
            System.arraycopy(adjusted, 0, table, row * FuzzyState.COUNT, FuzzyState.COUNT);
        }
        return table;
    }

    /**
     * Детерминированная раскладка значения шкалы по пяти диапазонам
     */
    public static double[] bucketFallback(double value) {
        if (value <= 20) {
            return new double[]{0.8, 0.15, 0.05, 0.0, 0.0};
        } else if (value <= 40) {
            return new double[]{0.2, 0.6, 0.2, 0.0, 0.0};
        } else if (value <= 60) {
            return new double[]{0.05, 0.25, 0.4, 0.25, 0.05};
        } else if (value <= 80) {
            return new double[]{0.0, 0.0, 0.2, 0.6, 0.2};
        }
        return new double[]{0.0, 0.0, 0.05, 0.15, 0.8};
    }

    public static double[] uniform() {
        double[] result = new double[FuzzyState.COUNT];
        Arrays.fill(result, 1.0 / FuzzyState.COUNT);
        return result;
    }

    /**
     * Единая политика отката: результат, который бросил исключение или не
     * является распределением из пяти значений, заменяется на fallback
     */
    public static double[] computeOrDefault(String context, Supplier<double[]> computation, Supplier<double[]> fallback) {
        try {
            double[] result = computation.get();
            if (isDistribution(result)) {
                return result;
            }
            log.warn("Нечеткий вывод для {} вернул некорректное распределение, используется запасное", context);
        } catch (RuntimeException e) {
            log.warn("Ошибка нечеткого вывода для {}: {}, используется запасное распределение", context, e.getMessage());
        }
        return fallback.get();
    }

    /**
     * Входы правил: значения по умолчанию, поверх них переданные параметры,
     * обрезанные до [0, 100]. Параметры, которых тактика не использует, игнорируются
     */
    static Map<String, Double> resolveParams(TacticRuleSet ruleSet, Map<String, Double> params) {
        Map<String, Double> resolved = new LinkedHashMap<>(ruleSet.getDefaults());
        Optional.ofNullable(params).orElse(Collections.emptyMap()).forEach((name, value) -> {
            if (value == null) {
                return;
            }
            if (!ruleSet.getInputs().containsKey(name)) {
                log.trace("Параметр {} не используется тактикой {}", name, ruleSet.getTactic().getId());
                return;
            }
            resolved.put(name, clamp(value));
        });
        return resolved;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return NEUTRAL_VALUE;
        }
        return Math.max(FuzzyVariable.UNIVERSE_MIN, Math.min(FuzzyVariable.UNIVERSE_MAX, value));
    }

    private static double[] evaluateMembership(TacticRuleSet ruleSet, Map<String, Double> params) {
        OptionalDouble crisp = crispValue(ruleSet, params);
        if (crisp.isEmpty()) {
            log.warn("Ни одно правило тактики {} не сработало, используется раскладка по диапазонам",
                ruleSet.getTactic().getId());
            return bucketFallback(NEUTRAL_VALUE);
        }
        return membershipOfValue(crisp.getAsDouble());
    }

    /**
     * Степени принадлежности значения пяти термам выхода, нормированные к 1
     */
    static double[] membershipOfValue(double value) {
        double[] memberships = new double[FuzzyState.COUNT];
        double total = 0.0;
        FuzzyState[] states = FuzzyState.values();
        for (int i = 0; i < states.length; i++) {
            memberships[i] = OUTPUT.degree(states[i].getTerm(), value);
            total += memberships[i];
        }
        if (total <= 0.0) {
            return uniform();
        }
        for (int i = 0; i < memberships.length; i++) {
            memberships[i] /= total;
        }
        return memberships;
    }

    private static boolean isDistribution(double[] values) {
        if (values == null || values.length != FuzzyState.COUNT) {
            return false;
        }
        double total = 0.0;
        for (double value : values) {
            if (Double.isNaN(value) || value < 0.0) {
                return false;
            }
            total += value;
        }
        return Math.abs(total - 1.0) < 1e-6;
    }
}
