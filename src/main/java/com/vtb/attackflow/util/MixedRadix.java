package com.vtb.attackflow.util;

/**
 * Нумерация строк таблицы условных вероятностей.
 *
 * Строка r для родителей с мощностями c1..ck соответствует набору состояний
 * (r mod c1, (r / c1) mod c2, (r / (c1*c2)) mod c3, ...): первый родитель -
 * младший разряд. Все построители таблиц пользуются только этим классом
 */
public final class MixedRadix {

    private MixedRadix() {}

    /**
     * Число строк таблицы: произведение мощностей родителей (1 без родителей)
     */
    public static int rowCount(int[] cardinalities) {
        validate(cardinalities);
        long rows = 1;
        for (int cardinality : cardinalities) {
            rows *= cardinality;
            if (rows > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Слишком большая таблица: " + rows + " строк");
            }
        }
        return (int) rows;
    }

    public static int[] decode(int row, int[] cardinalities) {
        int rows = rowCount(cardinalities);
        if (row < 0 || row >= rows) {
            throw new IllegalArgumentException("Номер строки " + row + " вне диапазона 0.." + (rows - 1));
        }
        int[] states = new int[cardinalities.length];
        int rest = row;
        for (int i = 0; i < cardinalities.length; i++) {
            states[i] = rest % cardinalities[i];
            rest /= cardinalities[i];
        }
        return states;
    }

    /**
     * Нормированная активация состояния: бинарный родитель дает 0 или 1,
     * 5-уровневый - state / 4
     */
    public static double normalizedActivation(int state, int cardinality) {
        if (cardinality < 2) {
            throw new IllegalArgumentException("Мощность должна быть >= 2: " + cardinality);
        }
        return (double) state / (cardinality - 1);
    }

    public static double averageActivation(int[] states, int[] cardinalities) {
        if (states.length == 0) {
            return 0.5;
        }
        double total = 0.0;
        for (int i = 0; i < states.length; i++) {
            total += normalizedActivation(states[i], cardinalities[i]);
        }
        return total / states.length;
    }

    private static void validate(int[] cardinalities) {
        if (cardinalities == null) {
            throw new IllegalArgumentException("Список мощностей не может быть null");
        }
        for (int cardinality : cardinalities) {
            if (cardinality < 1) {
                throw new IllegalArgumentException("Мощность родителя должна быть >= 1: " + cardinality);
            }
        }
    }
}
