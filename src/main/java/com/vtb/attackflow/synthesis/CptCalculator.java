package com.vtb.attackflow.synthesis;

import com.vtb.attackflow.fuzzy.InfluenceShift;
import com.vtb.attackflow.models.FuzzyState;
import com.vtb.attackflow.util.MixedRadix;

import java.util.Arrays;

/**
 * Построители таблиц условных вероятностей.
 *
 * Все методы получают мощности родителей в порядке дуг и раскладывают строки
 * через {@link MixedRadix}. Результат - плоский массив rows * childCardinality
 */
public final class CptCalculator {

    public static final double[] BINARY_PRIOR = {0.7, 0.3};
    public static final double[] FIVE_STATE_PRIOR = {0.15, 0.2, 0.3, 0.2, 0.15};

    static final double[] HUB_FALSE_FIVE_STATE = {0.4, 0.3, 0.2, 0.08, 0.02};
    static final double[] HUB_TRUE_FIVE_STATE = {0.02, 0.08, 0.2, 0.3, 0.4};
    static final double[] HUB_FALSE_BINARY = {1.0, 0.0};
    static final double[] HUB_TRUE_BINARY = {0.0, 1.0};

    /** Наибольшее допустимое число значений в одной таблице */
    public static final long MAX_TABLE_ENTRIES = 1L << 20;

    private static final double TOLERANCE = 1e-6;

    private CptCalculator() {}

    /**
     * AND: P(true) = минимум нормированных активаций родителей.
     * Без родителей вентиль всегда истинен
     */
    public static double[] andGate(int[] parentCardinalities) {
        int rows = MixedRadix.rowCount(parentCardinalities);
        double[] table = new double[rows * 2];
        for (int row = 0; row < rows; row++) {
            int[] states = MixedRadix.decode(row, parentCardinalities);
            double minActivation = 1.0;
            for (int i = 0; i < states.length; i++) {
                minActivation = Math.min(minActivation, MixedRadix.normalizedActivation(states[i], parentCardinalities[i]));
            }
            table[row * 2] = 1.0 - minActivation;
            table[row * 2 + 1] = minActivation;
        }
        return table;
    }

    /**
     * Развертка бинарного noisy-MAX вентиля в полную таблицу:
     * P(false) = (1 - leak) * prod(1 - link * a_i), a_i - нормированная активация родителя
     */
    public static double[] noisyMax(int[] parentCardinalities, double linkProbability, double leakProbability) {
        if (linkProbability < 0 || linkProbability > 1 || leakProbability < 0 || leakProbability > 1) {
            throw new IllegalArgumentException("Вероятности link/leak должны быть в [0, 1]");
        }
        int rows = MixedRadix.rowCount(parentCardinalities);
        double[] table = new double[rows * 2];
        for (int row = 0; row < rows; row++) {
            int[] states = MixedRadix.decode(row, parentCardinalities);
            double inactive = 1.0 - leakProbability;
            for (int i = 0; i < states.length; i++) {
                inactive *= 1.0 - linkProbability * MixedRadix.normalizedActivation(states[i], parentCardinalities[i]);
            }
            table[row * 2] = inactive;
            table[row * 2 + 1] = 1.0 - inactive;
        }
        return table;
    }

    /**
     * Таблица потомка, подключенного к хабам развода. Строка определяется
     * долей истинных хабов среди hubIndexes; остальные родители на строку не влияют
     */
    public static double[] divorceBias(int[] parentCardinalities, int[] hubIndexes, int childCardinality) {
        if (hubIndexes == null || hubIndexes.length == 0) {
            throw new IllegalArgumentException("Не указан ни один хаб среди родителей");
        }
        double[] low = childCardinality == FuzzyState.COUNT ? HUB_FALSE_FIVE_STATE : HUB_FALSE_BINARY;
        double[] high = childCardinality == FuzzyState.COUNT ? HUB_TRUE_FIVE_STATE : HUB_TRUE_BINARY;
        if (childCardinality != FuzzyState.COUNT && childCardinality != 2) {
            throw new IllegalArgumentException("Неподдерживаемая мощность потомка: " + childCardinality);
        }

        int rows = MixedRadix.rowCount(parentCardinalities);
        double[] table = new double[rows * childCardinality];
        for (int row = 0; row < rows; row++) {
            int[] states = MixedRadix.decode(row, parentCardinalities);
            int active = 0;
            for (int hub : hubIndexes) {
                if (states[hub] > 0) {
                    active++;
                }
            }
            double fraction = (double) active / hubIndexes.length;
            for (int s = 0; s < childCardinality; s++) {
                table[row * childCardinality + s] = (1.0 - fraction) * low[s] + fraction * high[s];
            }
        }
        return table;
    }

    /**
     * Базовое нечеткое распределение тактики, сдвинутое по средней активации
     * родителей произвольной мощности
     */
    public static double[] fuzzyWithParents(double[] base, int[] parentCardinalities) {
        if (parentCardinalities.length == 0) {
            return base.clone();
        }
        int rows = MixedRadix.rowCount(parentCardinalities);
        double[] table = new double[rows * FuzzyState.COUNT];
        for (int row = 0; row < rows; row++) {
            int[] states = MixedRadix.decode(row, parentCardinalities);
            double influence = MixedRadix.averageActivation(states, parentCardinalities);
            double[] adjusted = InfluenceShift.MIXED.apply(base, influence);
            System.arraycopy(adjusted, 0, table, row * FuzzyState.COUNT, FuzzyState.COUNT);
        }
        return table;
    }

    /**
     * Таблица по умолчанию.
     * Бинарная переменная: [0.7, 0.3] без родителей, иначе P(true) = clamp(0.2 + 0.7 * avg, 0.1, 0.9).
     * 5-уровневая: [0.15, 0.2, 0.3, 0.2, 0.15] в каждой строке
     */
    public static double[] defaultTable(int[] parentCardinalities, int childCardinality) {
        int rows = MixedRadix.rowCount(parentCardinalities);
        double[] table = new double[rows * childCardinality];
        for (int row = 0; row < rows; row++) {
            double[] values;
            if (childCardinality == FuzzyState.COUNT) {
                values = FIVE_STATE_PRIOR;
            } else if (childCardinality == 2) {
                if (parentCardinalities.length == 0) {
                    values = BINARY_PRIOR;
                } else {
                    int[] states = MixedRadix.decode(row, parentCardinalities);
                    double influence = MixedRadix.averageActivation(states, parentCardinalities);
                    double probability = Math.max(0.1, Math.min(0.9, 0.2 + 0.7 * influence));
                    values = new double[]{1.0 - probability, probability};
                }
            } else {
                values = new double[childCardinality];
                Arrays.fill(values, 1.0 / childCardinality);
            }
            System.arraycopy(values, 0, table, row * childCardinality, childCardinality);
        }
        return table;
    }

    /**
     * Помещается ли таблица rows * childCardinality в {@link #MAX_TABLE_ENTRIES}
     */
    public static boolean fits(int[] parentCardinalities, int childCardinality) {
        long entries = childCardinality;
        for (int cardinality : parentCardinalities) {
            entries *= Math.max(cardinality, 1);
            if (entries > MAX_TABLE_ENTRIES) {
                return false;
            }
        }
        return true;
    }

    /**
     * Проверка: длина таблицы согласована с родителями, каждая строка - распределение
     */
    public static void validate(double[] table, int[] parentCardinalities, int childCardinality) {
        int rows = MixedRadix.rowCount(parentCardinalities);
        if (table == null || table.length != rows * childCardinality) {
            throw new IllegalStateException("Длина таблицы " + (table == null ? 0 : table.length)
                + " не равна " + rows + " x " + childCardinality);
        }
        for (int row = 0; row < rows; row++) {
            double total = 0.0;
            for (int s = 0; s < childCardinality; s++) {
                double value = table[row * childCardinality + s];
                if (Double.isNaN(value) || value < -TOLERANCE) {
                    throw new IllegalStateException("Некорректная вероятность в строке " + row + ": " + value);
                }
                total += value;
            }
            if (Math.abs(total - 1.0) > TOLERANCE) {
                throw new IllegalStateException("Строка " + row + " суммируется в " + total);
            }
        }
    }
}
