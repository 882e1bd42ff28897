package com.vtb.attackflow.models;

/**
 * Структурные рекомендации для узла графа
 */
public enum RecommendationAction {
    PARTITION("Partition recommended"),
    DIVORCE("Divorce recommended"),
    LOGIC_AND("Noisy adder logic node (AND) detected"),
    LOGIC_OR("Noisy-OR logic node detected"),
    LOGIC_UNKNOWN("Unknown condition type");

    private final String summary;

    RecommendationAction(String summary) {
        this.summary = summary;
    }

    public String getSummary() {
        return summary;
    }

    public boolean isLogic() {
        return this == LOGIC_AND || this == LOGIC_OR || this == LOGIC_UNKNOWN;
    }

    public static RecommendationAction forLogic(LogicKind kind) {
        return switch (kind) {
            case AND -> LOGIC_AND;
            case OR -> LOGIC_OR;
            default -> LOGIC_UNKNOWN;
        };
    }
}
