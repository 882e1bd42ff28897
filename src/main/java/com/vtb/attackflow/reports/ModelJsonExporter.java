package com.vtb.attackflow.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vtb.attackflow.models.CompiledModel;
import com.vtb.attackflow.models.LayoutPosition;
import com.vtb.attackflow.models.ModelArc;
import com.vtb.attackflow.models.NodeFuzzyInfo;
import com.vtb.attackflow.models.NodeGroup;
import com.vtb.attackflow.models.ProbabilisticModel;
import com.vtb.attackflow.models.ProbabilisticVariable;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Выгрузка модели в JSON для внешнего движка вывода: переменные в порядке
 * создания, дуги, плоские таблицы и позиции раскладки
 */
@Slf4j
public class ModelJsonExporter implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public ModelJsonExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void generate(CompiledModel result, Path outputPath) throws IOException {
        log.info("Выгрузка модели в JSON: {}", outputPath);
        if (result == null || result.getModel() == null) {
            throw new IllegalArgumentException("CompiledModel не может быть null");
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJson(result));
        log.info("Модель сохранена: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    public String toJson(CompiledModel result) throws IOException {
        return objectMapper.writeValueAsString(toTree(result));
    }

    ObjectNode toTree(CompiledModel result) {
        ProbabilisticModel model = result.getModel();
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode variables = root.putArray("variables");
        for (ProbabilisticVariable variable : model.getVariables()) {
            ObjectNode node = variables.addObject();
            node.put("id", variable.getId());
            node.put("sourceNodeId", variable.getSourceNodeId());
            node.put("name", variable.getName());
            node.put("description", variable.getDescription());
            node.put("type", variable.getType().name());
            node.put("role", variable.getRole().name());
            node.put("tacticId", variable.getTacticId());
            node.put("cardinality", variable.cardinality());
            variable.getStates().forEach(node.putArray("states")::add);
            variable.getParents().forEach(node.putArray("parents")::add);
            if (!variable.getParentStrengths().isEmpty()) {
                ObjectNode strengths = node.putObject("parentStrengths");
                variable.getParentStrengths().forEach((parent, order) -> {
                    ArrayNode states = strengths.putArray(parent);
                    order.forEach(states::add);
                });
            }
            ArrayNode cpt = node.putArray("cpt");
            if (variable.hasTable()) {
                for (double value : variable.getCpt()) {
                    cpt.add(value);
                }
            }
            LayoutPosition position = variable.getPosition();
            if (position != null) {
                ObjectNode rect = node.putObject("position");
                rect.put("left", position.getLeft());
                rect.put("top", position.getTop());
                rect.put("right", position.getRight());
                rect.put("bottom", position.getBottom());
                rect.put("level", position.getLevel());
            }
        }

        ArrayNode arcs = root.putArray("arcs");
        for (ModelArc arc : model.getArcs()) {
            arcs.addObject().put("from", arc.getFrom()).put("to", arc.getTo());
        }

        ArrayNode groups = root.putArray("groups");
        if (result.getGroups() != null) {
            for (NodeGroup group : result.getGroups().allGroups()) {
                groups.addObject().put("type", group.getType().name()).put("nodeId", group.getNodeId());
            }
        }

        ObjectNode fuzzy = root.putObject("fuzzyInfo");
        for (NodeFuzzyInfo info : result.getFuzzyInfo().values()) {
            ObjectNode node = fuzzy.putObject(info.getNodeId());
            node.put("tacticId", info.getTacticId());
            node.put("tacticName", info.getTacticName());
            node.put("techniqueId", info.getTechniqueId());
            ObjectNode params = node.putObject("parameters");
            info.getParameters().forEach(params::put);
            ArrayNode membership = node.putArray("membership");
            for (double value : info.getMembership()) {
                membership.add(value);
            }
            node.put("baseSuccessProbability", info.getBaseSuccessProbability());
        }
        return root;
    }
}
