package com.vtb.attackflow.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.core.AttackGraphCompiler;
import com.vtb.attackflow.models.CompiledModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ModelJsonExporterTest {

    private static CompiledModel result;

    @BeforeAll
    static void compile() throws Exception {
        result = new AttackGraphCompiler(CompilerConfig.defaults()).compile(Path.of("src/test/resources/sample-flow.json"));
    }

    @Test
    void exportStructure() throws Exception {
        JsonNode root = new ObjectMapper().readTree(new ModelJsonExporter().toJson(result));

        assertEquals(7, root.path("variables").size());
        assertEquals(6, root.path("arcs").size());
        assertEquals(4, root.path("fuzzyInfo").size());
        assertEquals(2, root.path("groups").size());
        assertEquals("LOGIC", root.path("groups").get(0).path("type").asText());

        for (JsonNode variable : root.path("variables")) {
            int rows = 1;
            for (JsonNode parent : variable.path("parents")) {
                rows *= findVariable(root, parent.asText()).path("cardinality").asInt();
            }
            assertEquals(rows * variable.path("cardinality").asInt(), variable.path("cpt").size(),
                "Длина таблицы " + variable.path("id").asText());
            assertTrue(variable.has("position"));
        }

        JsonNode orGate = findRole(root, "LOGIC_OR");
        assertEquals("NOISY_MAX", orGate.path("type").asText());
        assertTrue(orGate.path("parentStrengths").isObject());
        assertEquals("False", orGate.path("states").get(0).asText());
    }

    @Test
    void generateCreatesDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested").resolve("model.json");
        ModelJsonExporter exporter = new ModelJsonExporter();

        exporter.generate(result, target);

        assertTrue(Files.exists(target));
        assertEquals("json", exporter.getFileExtension());
        assertTrue(Files.readString(target).contains("\"variables\""));
        assertThrows(IllegalArgumentException.class, () -> exporter.generate(null, target));
    }

    private static JsonNode findVariable(JsonNode root, String id) {
        for (JsonNode variable : root.path("variables")) {
            if (variable.path("id").asText().equals(id)) {
                return variable;
            }
        }
        throw new AssertionError("Нет переменной " + id);
    }

    private static JsonNode findRole(JsonNode root, String role) {
        for (JsonNode variable : root.path("variables")) {
            if (variable.path("role").asText().equals(role)) {
                return variable;
            }
        }
        throw new AssertionError("Нет переменной с ролью " + role);
    }
}
