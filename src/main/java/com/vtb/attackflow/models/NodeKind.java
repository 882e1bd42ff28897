package com.vtb.attackflow.models;

import java.util.Locale;

/**
 * Виды узлов графа сценария атаки
 */
public enum NodeKind {
    ACTION("attack-action"),
    CONDITION("attack-condition"),
    OPERATOR("attack-operator"),
    ASSET("attack-asset"),
    OTHER(null);

    private final String documentType;

    NodeKind(String documentType) {
        this.documentType = documentType;
    }

    public String getDocumentType() {
        return documentType;
    }

    /**
     * Определить вид узла по типу объекта документа (attack-action, attack-operator, ...)
     */
    public static NodeKind fromDocumentType(String type) {
        if (type == null) {
            return OTHER;
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        for (NodeKind kind : values()) {
            if (kind.documentType != null && kind.documentType.equals(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }

    public boolean isLogical() {
        return this == CONDITION || this == OPERATOR;
    }
}
