package com.vtb.attackflow.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Порядковые состояния вероятности успеха противника (5 уровней)
 */
public enum FuzzyState {
    VERY_LOW("Very_Low", "very_low"),
    LOW("Low", "low"),
    MEDIUM("Medium", "medium"),
    HIGH("High", "high"),
    VERY_HIGH("Very_High", "very_high");

    public static final int COUNT = 5;

    private final String label;
    private final String term;

    FuzzyState(String label, String term) {
        this.label = label;
        this.term = term;
    }

    public String getLabel() {
        return label;
    }

    public String getTerm() {
        return term;
    }

    public static List<String> labels() {
        List<String> labels = new ArrayList<>(COUNT);
        for (FuzzyState state : values()) {
            labels.add(state.label);
        }
        return labels;
    }
}
