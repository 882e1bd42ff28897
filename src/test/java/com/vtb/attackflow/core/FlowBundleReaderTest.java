package com.vtb.attackflow.core;

import com.vtb.attackflow.models.FlowObject;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для FlowBundleReader
 */
class FlowBundleReaderTest {

    static final Path SAMPLE_FLOW = Path.of("src/test/resources/sample-flow.json");

    @Test
    void testReadBundleFromFile() throws Exception {
        List<FlowObject> objects = new FlowBundleReader().read(SAMPLE_FLOW);

        assertEquals(10, objects.size(), "Должны быть прочитаны все объекты бандла");

        FlowObject phishing = objects.stream()
            .filter(o -> "attack-action--00000000-0000-4000-8000-000000000001".equals(o.getId()))
            .findFirst()
            .orElseThrow();
        assertEquals("TA0001", phishing.getTacticId());
        assertEquals("T1566.001", phishing.getTechniqueId());
        assertEquals(List.of("attack-action--00000000-0000-4000-8000-000000000002"),
            phishing.getOtherRefs().get("effect_refs"), "effect_refs должен попасть в прочие ссылки");
    }

    @Test
    void testOperatorAndRelationshipFields() throws Exception {
        List<FlowObject> objects = new FlowBundleReader().read(SAMPLE_FLOW);

        FlowObject operator = objects.stream().filter(o -> "attack-operator".equals(o.getType())).findFirst().orElseThrow();
        assertEquals("AND", operator.getOperator());

        FlowObject relationship = objects.stream().filter(FlowObject::isRelationship).findFirst().orElseThrow();
        assertEquals("attack-action--00000000-0000-4000-8000-000000000004", relationship.getSourceRef());
        assertEquals("attack-asset--00000000-0000-4000-8000-000000000007", relationship.getTargetRef());
    }

    @Test
    void testReadPlainArray() throws Exception {
        String json = """
            [
              {"type": "attack-action", "id": "a", "name": "A", "command_ref": "b"},
              {"type": "attack-asset", "id": "b", "user_id": "admin", "object_refs": ["a", 42]}
            ]
            """;
        List<FlowObject> objects = new FlowBundleReader().readString(json);

        assertEquals(2, objects.size());
        assertEquals("b", objects.get(0).getCommandRef());
        assertEquals("admin", objects.get(1).displayName(), "Имя берется из user_id, если name пуст");
        assertEquals(List.of("a"), objects.get(1).getObjectRefs(), "Нестроковые ссылки пропускаются");
        assertTrue(objects.get(0).getOtherRefs().isEmpty());
    }

    @Test
    void testDocumentWithoutObjects() throws Exception {
        assertTrue(new FlowBundleReader().readString("{\"type\": \"bundle\"}").isEmpty());
    }

    @Test
    void testReadMissingFile() {
        assertThrows(IllegalArgumentException.class,
            () -> new FlowBundleReader().read(Path.of("nonexistent-flow.json")),
            "Должна быть ошибка при несуществующем файле");
    }
}
