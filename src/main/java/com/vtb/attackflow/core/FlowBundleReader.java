package com.vtb.attackflow.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.attackflow.models.FlowObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Читатель JSON бандлов attack flow (STIX 2.1) в объекты {@link FlowObject}.
 * Разбирает только поля, которые нужны экстрактору графа
 */
@Slf4j
public class FlowBundleReader {

    private static final Set<String> KNOWN_REF_FIELDS = Set.of("object_refs", "source_ref", "target_ref", "command_ref");

    private final ObjectMapper mapper;

    public FlowBundleReader() {
        this.mapper = new ObjectMapper();
    }

    public List<FlowObject> read(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            throw new IllegalArgumentException("Файл не найден: " + file);
        }
        log.info("Чтение attack flow документа: {}", file);
        try (InputStream is = Files.newInputStream(file)) {
            return read(is);
        }
    }

    public List<FlowObject> read(InputStream is) throws IOException {
        return parse(mapper.readTree(is));
    }

    public List<FlowObject> readString(String json) throws IOException {
        return parse(mapper.readTree(json));
    }

    private List<FlowObject> parse(JsonNode root) {
        List<FlowObject> objects = new ArrayList<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return objects;
        }

        JsonNode items = root.isArray() ? root : root.path("objects");
        if (!items.isArray()) {
            log.warn("В документе нет массива objects");
            return objects;
        }

        for (JsonNode item : items) {
            if (!item.isObject()) {
                continue;
            }
            objects.add(toFlowObject(item));
        }
        log.info("Прочитано объектов: {}", objects.size());
        return objects;
    }

    private FlowObject toFlowObject(JsonNode item) {
        FlowObject object = FlowObject.builder()
            .type(text(item, "type"))
            .id(text(item, "id"))
            .name(text(item, "name"))
            .userId(text(item, "user_id"))
            .value(text(item, "value"))
            .path(text(item, "path"))
            .tacticId(text(item, "tactic_id"))
            .techniqueId(text(item, "technique_id"))
            .description(text(item, "description"))
            .conditionType(text(item, "condition_type"))
            .operator(text(item, "operator"))
            .sourceRef(text(item, "source_ref"))
            .targetRef(text(item, "target_ref"))
            .commandRef(text(item, "command_ref"))
            .objectRefs(textList(item.path("object_refs")))
            .build();

        Map<String, List<String>> otherRefs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (name.endsWith("_refs") && !KNOWN_REF_FIELDS.contains(name) && field.getValue().isArray()) {
                otherRefs.put(name, textList(field.getValue()));
            }
        }
        object.setOtherRefs(otherRefs);
        return object;
    }

    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                if (element.isTextual()) {
                    values.add(element.asText());
                }
            }
        }
        return values;
    }
}
