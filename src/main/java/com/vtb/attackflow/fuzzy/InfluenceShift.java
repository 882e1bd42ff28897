package com.vtb.attackflow.fuzzy;

import com.vtb.attackflow.models.FuzzyState;

/**
 * Сдвиг базового нечеткого распределения в зависимости от средней
 * нормированной активации родителей.
 *
 * Ниже 0.3 масса смещается к низким состояниям, выше 0.7 - к высоким.
 * После сдвига каждое значение не меньше 0.01, строка нормируется
 */
public enum InfluenceShift {
    /** Родители разной мощности (бинарные и 5-уровневые), мягкий сдвиг */
    MIXED(0.3,
        new double[]{0.2, 0.15, -0.1, -0.15, -0.1},
        new double[]{-0.1, -0.15, -0.1, 0.15, 0.2}),
    /** Все родители 5-уровневые, сдвиг сильнее */
    FUZZY_PARENTS(2.0,
        new double[]{0.3, 0.2, -0.1, -0.2, -0.2},
        new double[]{-0.2, -0.2, -0.1, 0.2, 0.3});

    public static final double LOW_THRESHOLD = 0.3;
    public static final double HIGH_THRESHOLD = 0.7;
    public static final double MIN_PROBABILITY = 0.01;

    private final double factor;
    private final double[] towardLow;
    private final double[] towardHigh;

    InfluenceShift(double factor, double[] towardLow, double[] towardHigh) {
        this.factor = factor;
        this.towardLow = towardLow;
        this.towardHigh = towardHigh;
    }

    public double[] apply(double[] base, double averageInfluence) {
        if (base == null || base.length != FuzzyState.COUNT) {
            throw new IllegalArgumentException("Ожидается распределение из " + FuzzyState.COUNT + " значений");
        }
        double[] adjusted = base.clone();
        if (averageInfluence < LOW_THRESHOLD) {
            double shift = (LOW_THRESHOLD - averageInfluence) * factor;
            for (int i = 0; i < adjusted.length; i++) {
                adjusted[i] += shift * towardLow[i];
            }
        } else if (averageInfluence > HIGH_THRESHOLD) {
            double shift = (averageInfluence - HIGH_THRESHOLD) * factor;
            for (int i = 0; i < adjusted.length; i++) {
                adjusted[i] += shift * towardHigh[i];
            }
        }

        double total = 0.0;
        for (int i = 0; i < adjusted.length; i++) {
            adjusted[i] = Math.max(MIN_PROBABILITY, adjusted[i]);
            total += adjusted[i];
        }
        for (int i = 0; i < adjusted.length; i++) {
            adjusted[i] /= total;
        }
        return adjusted;
    }
}
