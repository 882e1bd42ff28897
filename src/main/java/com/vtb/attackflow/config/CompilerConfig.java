package com.vtb.attackflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.attackflow.models.LogicKind;
import com.vtb.attackflow.models.SecurityPosture;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация компилятора из YAML файла.
 * Каждый прогон компиляции получает свой экземпляр, общий синглтон не используется
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompilerConfig {

    public static final String DEFAULT_RESOURCE = "compiler-config.yaml";

    private Grouping grouping;
    private Logic logic;
    private NoisyMax noisyMax;
    private Fuzzy fuzzy;
    private Layout layout;

    /**
     * Загрузить конфигурацию по умолчанию из classpath
     */
    public static CompilerConfig load() {
        try (InputStream is = CompilerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
            }
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить конфигурацию из файла
     */
    public static CompilerConfig load(Path file) {
        if (file == null || !Files.exists(file)) {
            throw new IllegalArgumentException("Файл конфигурации не найден: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация без внешних файлов, только значения по умолчанию
     */
    public static CompilerConfig defaults() {
        CompilerConfig config = new CompilerConfig();
        config.ensureDefaults();
        return config;
    }

    private static CompilerConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        CompilerConfig config = mapper.readValue(is, CompilerConfig.class);
        if (config == null) {
            config = new CompilerConfig();
        }
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (grouping == null) {
            grouping = new Grouping();
        }
        grouping.ensureDefaults();
        if (logic == null) {
            logic = new Logic();
        }
        logic.ensureDefaults();
        if (noisyMax == null) {
            noisyMax = new NoisyMax();
        }
        noisyMax.ensureDefaults();
        if (fuzzy == null) {
            fuzzy = new Fuzzy();
        }
        fuzzy.ensureDefaults();
        if (layout == null) {
            layout = new Layout();
        }
        layout.ensureDefaults();
    }

    /**
     * Признак, по которому родители раскладываются в корзины перед разбиением
     */
    public enum BucketKey {
        TACTIC_ID,
        TECHNIQUE_ID,
        KIND,
        NONE;

        @JsonCreator
        public static BucketKey parse(String value) {
            if (value == null || value.isBlank()) {
                return TACTIC_ID;
            }
            try {
                return BucketKey.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return TACTIC_ID;
            }
        }
    }

    @Data
    public static class Grouping {
        private static final int DEFAULT_MAX_GROUP_SIZE = 3;
        private static final int DEFAULT_THRESHOLD = 3;

        private Integer maxGroupSize;
        private Integer partitionThreshold;
        private Integer divorceThreshold;
        private BucketKey bucketKey;

        public void ensureDefaults() {
            if (maxGroupSize == null || maxGroupSize < 1) {
                maxGroupSize = DEFAULT_MAX_GROUP_SIZE;
            }
            if (partitionThreshold == null || partitionThreshold < 1) {
                partitionThreshold = DEFAULT_THRESHOLD;
            }
            if (divorceThreshold == null || divorceThreshold < 1) {
                divorceThreshold = DEFAULT_THRESHOLD;
            }
            if (bucketKey == null) {
                bucketKey = BucketKey.TACTIC_ID;
            }
        }
    }

    @Data
    public static class Logic {
        /** Как трактовать условия и операторы с неизвестным типом */
        private LogicKind unknownPolicy;

        public void ensureDefaults() {
            if (unknownPolicy == null || unknownPolicy == LogicKind.UNKNOWN) {
                unknownPolicy = LogicKind.OR;
            }
        }

        public LogicKind resolve(LogicKind kind) {
            return kind == LogicKind.UNKNOWN ? unknownPolicy : kind;
        }
    }

    @Data
    public static class NoisyMax {
        private static final double DEFAULT_LINK = 0.9;
        private static final double DEFAULT_LEAK = 0.01;

        private Double linkProbability;
        private Double leakProbability;

        public void ensureDefaults() {
            if (linkProbability == null || linkProbability <= 0 || linkProbability > 1) {
                linkProbability = DEFAULT_LINK;
            }
            if (leakProbability == null || leakProbability < 0 || leakProbability >= 1) {
                leakProbability = DEFAULT_LEAK;
            }
        }
    }

    @Data
    public static class Fuzzy {
        private SecurityPosture posture;
        private Boolean keywordAdjustments;
        /** Явные параметры для отдельных узлов: id узла -> параметр -> значение */
        private Map<String, Map<String, Double>> nodeOverrides;

        public void ensureDefaults() {
            if (posture == null) {
                posture = SecurityPosture.MEDIUM;
            }
            if (keywordAdjustments == null) {
                keywordAdjustments = Boolean.TRUE;
            }
            if (nodeOverrides == null) {
                nodeOverrides = new LinkedHashMap<>();
            }
        }

        public boolean keywordAdjustmentsEnabled() {
            return keywordAdjustments == null || keywordAdjustments;
        }
    }

    @Data
    public static class Layout {
        private Integer nodeWidth;
        private Integer nodeHeight;
        private Integer horizontalGap;
        private Integer verticalGap;
        private Integer leftMargin;
        private Integer topMargin;

        public void ensureDefaults() {
            if (nodeWidth == null || nodeWidth <= 0) {
                nodeWidth = 120;
            }
            if (nodeHeight == null || nodeHeight <= 0) {
                nodeHeight = 60;
            }
            if (horizontalGap == null || horizontalGap < 0) {
                horizontalGap = 40;
            }
            if (verticalGap == null || verticalGap < 0) {
                verticalGap = 100;
            }
            if (leftMargin == null || leftMargin < 0) {
                leftMargin = 50;
            }
            if (topMargin == null || topMargin < 0) {
                topMargin = 50;
            }
        }
    }
}
