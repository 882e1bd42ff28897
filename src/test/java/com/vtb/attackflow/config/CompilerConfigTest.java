package com.vtb.attackflow.config;

import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.SecurityPosture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigTest {

    @Test
    void loadFromClasspath() {
        CompilerConfig config = CompilerConfig.load();

        assertEquals(3, config.getGrouping().getMaxGroupSize());
        assertEquals(3, config.getGrouping().getPartitionThreshold());
        assertEquals(CompilerConfig.BucketKey.TACTIC_ID, config.getGrouping().getBucketKey());
        assertEquals(LogicKind.OR, config.getLogic().getUnknownPolicy());
        assertEquals(0.9, config.getNoisyMax().getLinkProbability());
        assertEquals(0.01, config.getNoisyMax().getLeakProbability());
        assertEquals(SecurityPosture.MEDIUM, config.getFuzzy().getPosture());
        assertTrue(config.getFuzzy().keywordAdjustmentsEnabled());
        assertEquals(120, config.getLayout().getNodeWidth());
    }

    @Test
    void partialFileIsCompletedWithDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.yaml");
        Files.writeString(file, """
            grouping:
              maxGroupSize: 2
              bucketKey: KIND
            logic:
              unknownPolicy: AND
            fuzzy:
              posture: HIGH
              keywordAdjustments: false
              nodeOverrides:
                attack-action--1:
                  skill_requirement: 90
            noisyMax:
              linkProbability: 7.0
            unknownSection:
              value: 1
            """);

        CompilerConfig config = CompilerConfig.load(file);

        assertEquals(2, config.getGrouping().getMaxGroupSize());
        assertEquals(3, config.getGrouping().getDivorceThreshold(), "Пропущенные значения берутся по умолчанию");
        assertEquals(CompilerConfig.BucketKey.KIND, config.getGrouping().getBucketKey());
        assertEquals(LogicKind.AND, config.getLogic().getUnknownPolicy());
        assertEquals(SecurityPosture.HIGH, config.getFuzzy().getPosture());
        assertFalse(config.getFuzzy().keywordAdjustmentsEnabled());
        assertEquals(90.0, config.getFuzzy().getNodeOverrides().get("attack-action--1").get("skill_requirement"));
        assertEquals(0.9, config.getNoisyMax().getLinkProbability(), "Недопустимое значение заменяется на значение по умолчанию");
        assertEquals(100, config.getLayout().getVerticalGap());
    }

    @Test
    void missingFile() {
        assertThrows(IllegalArgumentException.class, () -> CompilerConfig.load(Path.of("no-such-config.yaml")));
    }

    @Test
    void defaultsWithoutFiles() {
        CompilerConfig config = CompilerConfig.defaults();

        assertNotNull(config.getGrouping());
        assertEquals(50, config.getLayout().getLeftMargin());
        assertEquals(LogicKind.OR, config.getLogic().resolve(LogicKind.UNKNOWN));
        assertEquals(LogicKind.AND, config.getLogic().resolve(LogicKind.AND));
    }

    @Test
    void enumValuesAreReadWithoutCase(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("lower.yaml");
        Files.writeString(file, """
            grouping:
              bucketKey: technique_id
            fuzzy:
              posture: low
            """);
        Path unknown = dir.resolve("unknown.yaml");
        Files.writeString(unknown, """
            grouping:
              bucketKey: by_color
            fuzzy:
              posture: paranoid
            """);

        CompilerConfig config = CompilerConfig.load(file);
        assertEquals(CompilerConfig.BucketKey.TECHNIQUE_ID, config.getGrouping().getBucketKey());
        assertEquals(SecurityPosture.LOW, config.getFuzzy().getPosture());

        CompilerConfig fallback = CompilerConfig.load(unknown);
        assertEquals(CompilerConfig.BucketKey.TACTIC_ID, fallback.getGrouping().getBucketKey(), "Неизвестный ключ - по тактике");
        assertEquals(SecurityPosture.MEDIUM, fallback.getFuzzy().getPosture());
    }

    @Test
    void bucketKeyParsing() {
        assertEquals(CompilerConfig.BucketKey.KIND, CompilerConfig.BucketKey.parse(" kind "));
        assertEquals(CompilerConfig.BucketKey.TACTIC_ID, CompilerConfig.BucketKey.parse("whatever"));
        assertEquals(CompilerConfig.BucketKey.TACTIC_ID, CompilerConfig.BucketKey.parse(null));
    }
}
