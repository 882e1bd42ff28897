package com.vtb.attackflow.models;

import java.util.Locale;

/**
 * Логическая семантика узлов-условий и операторов
 */
public enum LogicKind {
    AND,
    OR,
    UNKNOWN;

    public static LogicKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "AND" -> AND;
            case "OR" -> OR;
            default -> UNKNOWN;
        };
    }
}
