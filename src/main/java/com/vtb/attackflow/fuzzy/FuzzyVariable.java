package com.vtb.attackflow.fuzzy;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Лингвистическая переменная на шкале 0..100 с тремя или пятью термами
 */
@Getter
public class FuzzyVariable {

    public static final double UNIVERSE_MIN = 0.0;
    public static final double UNIVERSE_MAX = 100.0;

    private final String name;
    private final Map<String, TriangularMembership> terms;

    private FuzzyVariable(String name, Map<String, TriangularMembership> terms) {
        this.name = name;
        this.terms = Collections.unmodifiableMap(terms);
    }

    /**
     * Входная переменная с термами low / medium / high в заданных границах
     */
    public static FuzzyVariable input(String name, String[] termNames, double[][] shapes) {
        if (termNames.length != shapes.length) {
            throw new IllegalArgumentException("Число термов не совпадает с числом функций для " + name);
        }
        Map<String, TriangularMembership> terms = new LinkedHashMap<>();
        for (int i = 0; i < termNames.length; i++) {
            terms.put(termNames[i], TriangularMembership.of(shapes[i][0], shapes[i][1], shapes[i][2]));
        }
        return new FuzzyVariable(name, terms);
    }

    /**
     * Выходная переменная "вероятность успеха" (very_low ... very_high)
     */
    public static FuzzyVariable successProbability() {
        Map<String, TriangularMembership> terms = new LinkedHashMap<>();
        terms.put("very_low", TriangularMembership.of(0, 0, 20));
        terms.put("low", TriangularMembership.of(10, 25, 40));
        terms.put("medium", TriangularMembership.of(30, 50, 70));
        terms.put("high", TriangularMembership.of(60, 75, 90));
        terms.put("very_high", TriangularMembership.of(80, 100, 100));
        return new FuzzyVariable("success_probability", terms);
    }

    public TriangularMembership term(String termName) {
        TriangularMembership membership = terms.get(termName);
        if (membership == null) {
            throw new IllegalArgumentException("Переменная " + name + " не содержит терм " + termName);
        }
        return membership;
    }

    public double degree(String termName, double value) {
        return term(termName).degree(value);
    }
}
