package com.vtb.attackflow.fuzzy;

import com.vtb.attackflow.models.MitreTactic;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class FuzzyTacticEvaluatorTest {

    private static final double EPS = 1e-9;

    private static double sum(double[] values) {
        double total = 0.0;
        for (double value : values) {
            total += value;
        }
        return total;
    }

    @Test
    void everyTacticYieldsDistributionForDefaults() {
        for (MitreTactic tactic : MitreTactic.values()) {
            double[] membership = FuzzyTacticEvaluator.membership(tactic.getId(),
                FuzzyTacticEvaluator.getDefaultParams(tactic.getId()));
            assertEquals(5, membership.length);
            assertEquals(1.0, sum(membership), 1e-6, "Распределение " + tactic.getId() + " должно суммироваться в 1");
            for (double value : membership) {
                assertTrue(value >= 0.0);
            }
        }
    }

    @Test
    void initialAccessDefaultsAreMedium() {
        double[] membership = FuzzyTacticEvaluator.membership("TA0001", FuzzyTacticEvaluator.getDefaultParams("TA0001"));

        assertArrayEquals(new double[]{0.0, 0.0, 1.0, 0.0, 0.0}, membership, 1e-6);
        assertTrue(membership[2] >= membership[0]);
        assertEquals(0.5, FuzzyTacticEvaluator.successProbability("TA0001",
            FuzzyTacticEvaluator.getDefaultParams("TA0001")), 1e-6);
    }

    @Test
    void unknownTacticIsUniform() {
        assertArrayEquals(FuzzyTacticEvaluator.uniform(), FuzzyTacticEvaluator.membership("TA9999", Map.of()), EPS);
        assertArrayEquals(FuzzyTacticEvaluator.uniform(), FuzzyTacticEvaluator.membership(null, null), EPS);
        assertEquals(0.5, FuzzyTacticEvaluator.successProbability("TA9999", Map.of()), EPS);
        assertThrows(IllegalArgumentException.class, () -> FuzzyTacticEvaluator.crispValue("TA9999", Map.of()));
    }

    @Test
    void defaultParamsPerTactic() {
        assertEquals(Map.of(TacticRuleBook.DETECTION, 40.0, TacticRuleBook.SKILL, 40.0),
            FuzzyTacticEvaluator.getDefaultParams("TA0002"));
        assertEquals(Map.of(TacticRuleBook.DETECTION, 50.0, TacticRuleBook.SKILL, 50.0),
            FuzzyTacticEvaluator.getDefaultParams("unknown"), "Для неизвестной тактики минимальный набор");
        assertEquals(3, FuzzyTacticEvaluator.getDefaultParams("TA0040").size());

        FuzzyTacticEvaluator.getDefaultParams("TA0002").put("extra", 1.0);
        assertEquals(2, FuzzyTacticEvaluator.getDefaultParams("TA0002").size(), "Каждый вызов возвращает новую копию");
    }

    @Test
    void noFiringRuleFallsBackToNeutralBuckets() {
        Map<String, Double> params = Map.of(TacticRuleBook.DETECTION, 100.0, TacticRuleBook.SKILL, 0.0);

        assertTrue(FuzzyTacticEvaluator.crispValue("TA0002", params).isEmpty(), "Ни одно правило не должно сработать");
        assertArrayEquals(FuzzyTacticEvaluator.bucketFallback(50), FuzzyTacticEvaluator.membership("TA0002", params), EPS);
        assertEquals(0.5, FuzzyTacticEvaluator.successProbability("TA0002", params), EPS);
    }

    @Test
    void bucketFallbackRanges() {
        assertArrayEquals(new double[]{0.8, 0.15, 0.05, 0.0, 0.0}, FuzzyTacticEvaluator.bucketFallback(20), EPS);
        assertArrayEquals(new double[]{0.2, 0.6, 0.2, 0.0, 0.0}, FuzzyTacticEvaluator.bucketFallback(21), EPS);
        assertArrayEquals(new double[]{0.05, 0.25, 0.4, 0.25, 0.05}, FuzzyTacticEvaluator.bucketFallback(50), EPS);
        assertArrayEquals(new double[]{0.0, 0.0, 0.2, 0.6, 0.2}, FuzzyTacticEvaluator.bucketFallback(80), EPS);
        assertArrayEquals(new double[]{0.0, 0.0, 0.05, 0.15, 0.8}, FuzzyTacticEvaluator.bucketFallback(95), EPS);
    }

    @Test
    void unusedAndOutOfRangeParameters() {
        Map<String, Double> defaults = FuzzyTacticEvaluator.getDefaultParams("TA0001");
        double[] base = FuzzyTacticEvaluator.membership("TA0001", defaults);

        Map<String, Double> extended = FuzzyTacticEvaluator.getDefaultParams("TA0001");
        extended.put(TacticRuleBook.BACKUP_RECOVERY, 99.0);
        extended.put("unknown_parameter", 7.0);
        assertArrayEquals(base, FuzzyTacticEvaluator.membership("TA0001", extended), EPS,
            "Параметры, которые тактика не использует, игнорируются");

        Map<String, Double> high = Map.of(TacticRuleBook.SKILL, 100.0);
        Map<String, Double> tooHigh = Map.of(TacticRuleBook.SKILL, 250.0);
        assertArrayEquals(FuzzyTacticEvaluator.membership("TA0007", high),
            FuzzyTacticEvaluator.membership("TA0007", tooHigh), EPS, "Значения вне шкалы обрезаются до [0, 100]");
    }

    @Test
    void expertDiscoveryIsLikelierThanNovice() {
        OptionalDouble expert = FuzzyTacticEvaluator.crispValue("TA0007",
            Map.of(TacticRuleBook.SKILL, 100.0, TacticRuleBook.DETECTION, 50.0));
        OptionalDouble novice = FuzzyTacticEvaluator.crispValue("TA0007",
            Map.of(TacticRuleBook.SKILL, 0.0, TacticRuleBook.DETECTION, 50.0));

        assertTrue(expert.isPresent() && novice.isPresent());
        assertTrue(expert.getAsDouble() > novice.getAsDouble());
    }

    @Test
    void tableWithFuzzyParents() {
        Map<String, Double> params = FuzzyTacticEvaluator.getDefaultParams("TA0001");
        double[] table = FuzzyTacticEvaluator.cptWithFuzzyParents("TA0001", 2, params);

        assertEquals(25 * 5, table.length, "Для двух 5-уровневых родителей 25 строк");
        for (int row = 0; row < 25; row++) {
            double total = 0.0;
            for (int s = 0; s < 5; s++) {
                total += table[row * 5 + s];
            }
            assertEquals(1.0, total, 1e-6);
        }
        // строка 0: оба родителя Very_Low, последняя: оба Very_High
        assertTrue(table[0] > table[24 * 5], "Слабые родители сдвигают массу к низким состояниям");
        assertTrue(table[24 * 5 + 4] > table[4], "Сильные родители сдвигают массу к высоким состояниям");
        // среднее 0.5 оставляет базовое распределение, только с нижней границей 0.01
        int middle = 2 + 2 * 5;
        assertTrue(table[middle * 5 + 2] > 0.9);

        assertArrayEquals(FuzzyTacticEvaluator.membership("TA0001", params),
            FuzzyTacticEvaluator.cptWithFuzzyParents("TA0001", 0, params), EPS);
        assertThrows(IllegalArgumentException.class, () -> FuzzyTacticEvaluator.cptWithFuzzyParents("TA0001", -1, params));
    }

    @Test
    void computeOrDefaultRejectsInvalidResult() {
        double[] fallback = FuzzyTacticEvaluator.uniform();

        assertArrayEquals(fallback, FuzzyTacticEvaluator.computeOrDefault("test",
            () -> new double[]{0.5, 0.5}, () -> fallback), EPS);
        assertArrayEquals(fallback, FuzzyTacticEvaluator.computeOrDefault("test",
            () -> { throw new IllegalStateException("сбой"); }, () -> fallback), EPS);
        assertArrayEquals(new double[]{0, 0, 1, 0, 0}, FuzzyTacticEvaluator.computeOrDefault("test",
            () -> new double[]{0, 0, 1, 0, 0}, () -> fallback), EPS);
    }

    @Test
    void clampHandlesNaN() {
        assertEquals(50.0, FuzzyTacticEvaluator.clamp(Double.NaN), EPS);
        assertEquals(0.0, FuzzyTacticEvaluator.clamp(-5), EPS);
        assertEquals(100.0, FuzzyTacticEvaluator.clamp(101), EPS);
    }
}
