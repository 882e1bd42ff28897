package com.vtb.attackflow.heuristics;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.fuzzy.FuzzyTacticEvaluator;
import com.vtb.attackflow.fuzzy.TacticRuleBook;
import com.vtb.attackflow.models.GraphNode;
import com.vtb.attackflow.models.SecurityPosture;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Подбор нечетких параметров узла по уровню защиты организации и
 * характеристикам техники (название, код, описание).
 * Меняются только параметры, которые использует тактика узла
 */
@Slf4j
public final class FuzzyParameterHeuristics {

    private static final List<String> ADVANCED_NAME_MARKERS = List.of("rootkit", "kernel", "driver", "firmware");
    private static final List<String> COMMON_NAME_MARKERS = List.of("phishing", "script", "macro", "registry");
    private static final List<String> STEALTH_MARKERS = List.of("stealth", "hidden", "covert", "living off");
    private static final List<String> STEALTH_DESCRIPTION_MARKERS = List.of("stealth", "hidden", "covert");
    private static final List<String> VISIBLE_DESCRIPTION_MARKERS = List.of("obvious", "visible", "logged");

    // Хорошо известные и обычно детектируемые техники
    private static final List<String> COMMON_TECHNIQUES = List.of("T1566", "T1059", "T1003", "T1055", "T1083");
    private static final List<String> ADVANCED_TECHNIQUES = List.of("T1014", "T1542", "T1601");

    private FuzzyParameterHeuristics() {}

    /**
     * Параметры узла с учетом конфигурации. Явные параметры узла из
     * fuzzy.nodeOverrides заменяют эвристики целиком: возвращаются только они
     * (с обрезкой до [0, 100]), недостающие входы тактика берет по умолчанию
     */
    public static Map<String, Double> configure(GraphNode node, CompilerConfig.Fuzzy settings) {
        if (node == null) {
            throw new IllegalArgumentException("GraphNode не может быть null");
        }
        if (settings != null && settings.getNodeOverrides() != null) {
            Map<String, Double> overrides = settings.getNodeOverrides().get(node.getId());
            if (overrides != null) {
                Map<String, Double> params = new LinkedHashMap<>();
                overrides.forEach((name, value) -> {
                    if (value != null) {
                        params.put(name, clamp(value));
                    }
                });
                log.debug("Узел {}: используются явные параметры {}", node.getId(), params.keySet());
                return params;
            }
        }
        SecurityPosture posture = settings != null ? settings.getPosture() : SecurityPosture.MEDIUM;
        boolean keywords = settings == null || settings.keywordAdjustmentsEnabled();
        return configure(node, posture, keywords);
    }

    public static Map<String, Double> configure(GraphNode node, SecurityPosture posture) {
        return configure(node, posture, true);
    }

    public static Map<String, Double> configure(GraphNode node, SecurityPosture posture, boolean keywordAdjustments) {
        if (node == null) {
            throw new IllegalArgumentException("GraphNode не может быть null");
        }
        Map<String, Double> params = FuzzyTacticEvaluator.getDefaultParams(node.getTacticId());
        applyPosture(params, posture != null ? posture : SecurityPosture.MEDIUM);
        if (keywordAdjustments) {
            applyNameMarkers(params, node.getName());
            applyTechnique(params, node.getTechniqueId());
            applyDescription(params, node.getDescription());
        }
        return params;
    }

    static void applyPosture(Map<String, Double> params, SecurityPosture posture) {
        switch (posture) {
            case LOW -> {
                shift(params, TacticRuleBook.DETECTION, -20);
                shift(params, TacticRuleBook.SKILL, -15);
                shift(params, TacticRuleBook.RESOURCES, 15);
                assign(params, TacticRuleBook.MONITORING_COVERAGE, 25);
                assign(params, TacticRuleBook.SECURITY_HARDENING, 30);
                assign(params, TacticRuleBook.NETWORK_SEGMENTATION, 25);
            }
            case HIGH -> {
                shift(params, TacticRuleBook.DETECTION, 25);
                shift(params, TacticRuleBook.SKILL, 10);
                shift(params, TacticRuleBook.RESOURCES, -10);
                assign(params, TacticRuleBook.MONITORING_COVERAGE, 80);
                assign(params, TacticRuleBook.SECURITY_HARDENING, 75);
                assign(params, TacticRuleBook.NETWORK_SEGMENTATION, 80);
            }
            default -> {
                assign(params, TacticRuleBook.MONITORING_COVERAGE, 50);
                assign(params, TacticRuleBook.SECURITY_HARDENING, 50);
                assign(params, TacticRuleBook.NETWORK_SEGMENTATION, 50);
            }
        }
    }

    static void applyNameMarkers(Map<String, Double> params, String name) {
        if (name == null || name.isBlank()) {
            return;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (containsAny(lower, ADVANCED_NAME_MARKERS)) {
            shift(params, TacticRuleBook.SKILL, 25);
        } else if (containsAny(lower, COMMON_NAME_MARKERS)) {
            shift(params, TacticRuleBook.SKILL, -15);
        }
        if (containsAny(lower, STEALTH_MARKERS)) {
            shift(params, TacticRuleBook.DETECTION, 20);
        }
    }

    static void applyTechnique(Map<String, Double> params, String techniqueId) {
        if (techniqueId == null || techniqueId.isBlank()) {
            return;
        }
        String upper = techniqueId.trim().toUpperCase(Locale.ROOT);
        if (COMMON_TECHNIQUES.stream().anyMatch(upper::startsWith)) {
            shift(params, TacticRuleBook.DETECTION, -10);
        }
        if (ADVANCED_TECHNIQUES.stream().anyMatch(upper::startsWith)) {
            shift(params, TacticRuleBook.SKILL, 20);
            shift(params, TacticRuleBook.DETECTION, 15);
        }
    }

    static void applyDescription(Map<String, Double> params, String description) {
        if (description == null || description.isBlank()) {
            return;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        if (containsAny(lower, STEALTH_DESCRIPTION_MARKERS)) {
            shift(params, TacticRuleBook.DETECTION, 20);
        } else if (containsAny(lower, VISIBLE_DESCRIPTION_MARKERS)) {
            shift(params, TacticRuleBook.DETECTION, -20);
        }
    }

    private static void shift(Map<String, Double> params, String name, double delta) {
        params.computeIfPresent(name, (key, value) -> clamp(value + delta));
    }

    private static void assign(Map<String, Double> params, String name, double value) {
        params.computeIfPresent(name, (key, old) -> clamp(value));
    }

    private static boolean containsAny(String text, List<String> markers) {
        return markers.stream().anyMatch(text::contains);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
