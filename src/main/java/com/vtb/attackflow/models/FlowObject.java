package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Объект документа attack flow в том виде, в каком его отдает внешний парсер.
 * Содержит только поля, нужные для построения графа
 */
@Data
@Builder
public class FlowObject {
    private String type;
    private String id;
    private String name;
    private String userId;
    private String value;
    private String path;
    private String tacticId;
    private String techniqueId;
    private String description;
    private String conditionType;
    private String operator;
    private String sourceRef;
    private String targetRef;
    private String commandRef;
    @Builder.Default
    private List<String> objectRefs = new ArrayList<>();
    /** Прочие ссылочные атрибуты *_refs (имя атрибута -> идентификаторы) */
    @Builder.Default
    private Map<String, List<String>> otherRefs = new LinkedHashMap<>();

    public boolean isRelationship() {
        return "relationship".equals(type);
    }

    /**
     * Отображаемое имя: первое непустое из name, user_id, value, path, id
     */
    public String displayName() {
        for (String candidate : Arrays.asList(name, userId, value, path, id)) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return "Unknown";
    }
}
