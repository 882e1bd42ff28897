package com.vtb.attackflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Уровень зрелости защиты организации
 */
public enum SecurityPosture {
    LOW("Минимальные меры защиты, ограниченный мониторинг"),
    MEDIUM("Стандартные меры защиты, умеренный мониторинг"),
    HIGH("Расширенные меры защиты, полный мониторинг");

    private final String description;

    SecurityPosture(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Разбор значения из конфигурации без учета регистра, неизвестное значение - MEDIUM
     */
    @JsonCreator
    public static SecurityPosture parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return SecurityPosture.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return MEDIUM;
        }
    }
}
