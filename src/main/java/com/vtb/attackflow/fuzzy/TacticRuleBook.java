package com.vtb.attackflow.fuzzy;

import com.vtb.attackflow.models.MitreTactic;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Статическая схема нечетких систем по тактикам MITRE ATT&CK.
 *
 * Для каждой тактики объявлены ровно те входы, которые используют ее правила,
 * и их значения по умолчанию. Схема задается один раз и дальше только читается
 */
public final class TacticRuleBook {

    public static final String DETECTION = "detection_difficulty";
    public static final String SKILL = "skill_requirement";
    public static final String RESOURCES = "resource_availability";
    public static final String TIME = "time_constraint";
    public static final String SYSTEM_COMPLEXITY = "system_complexity";
    public static final String TARGET_EXPOSURE = "target_exposure";
    public static final String ATTACK_SURFACE = "attack_surface";
    public static final String SECURITY_HARDENING = "security_hardening";
    public static final String MONITORING_COVERAGE = "monitoring_coverage";
    public static final String PASSWORD_POLICY = "password_policy";
    public static final String NETWORK_SEGMENTATION = "network_segmentation";
    public static final String DATA_ACCESSIBILITY = "data_accessibility";
    public static final String NETWORK_MONITORING = "network_monitoring";
    public static final String DATA_LOSS_PREVENTION = "data_loss_prevention";
    public static final String BACKUP_RECOVERY = "backup_recovery";

    private static final double[][] WIDE_SHAPES = {{0, 0, 40}, {30, 50, 70}, {60, 100, 100}};
    private static final double[][] NARROW_SHAPES = {{0, 0, 30}, {20, 50, 80}, {70, 100, 100}};

    private static final Map<MitreTactic, TacticRuleSet> RULE_SETS = buildRuleSets();

    private TacticRuleBook() {}

    public static Optional<TacticRuleSet> forTactic(String tacticId) {
        return MitreTactic.fromId(tacticId).map(RULE_SETS::get);
    }

    public static TacticRuleSet forTactic(MitreTactic tactic) {
        return RULE_SETS.get(tactic);
    }

    /**
     * Параметры по умолчанию; для неизвестной тактики - минимальный набор (detection, skill = 50)
     */
    public static Map<String, Double> defaultParams(String tacticId) {
        Map<String, Double> params = new LinkedHashMap<>();
        Optional<TacticRuleSet> ruleSet = forTactic(tacticId);
        if (ruleSet.isPresent()) {
            params.putAll(ruleSet.get().getDefaults());
        } else {
            params.put(DETECTION, 50.0);
            params.put(SKILL, 50.0);
        }
        return params;
    }

    public static Map<MitreTactic, TacticRuleSet> all() {
        return Collections.unmodifiableMap(RULE_SETS);
    }

    // ---------- входные переменные ----------

    static FuzzyVariable detection() {
        return FuzzyVariable.input(DETECTION, new String[]{"low", "medium", "high"},
            new double[][]{{0, 0, 40}, {20, 50, 80}, {60, 100, 100}});
    }

    static FuzzyVariable skill() {
        return FuzzyVariable.input(SKILL, new String[]{"novice", "intermediate", "expert"}, NARROW_SHAPES);
    }

    static FuzzyVariable resources() {
        return FuzzyVariable.input(RESOURCES, new String[]{"limited", "moderate", "abundant"}, WIDE_SHAPES);
    }

    static FuzzyVariable time() {
        // 0 - нет давления по времени, 100 - жесткие сроки
        return FuzzyVariable.input(TIME, new String[]{"relaxed", "moderate", "urgent"}, WIDE_SHAPES);
    }

    static FuzzyVariable specific(String name, String low, String medium, String high) {
        return FuzzyVariable.input(name, new String[]{low, medium, high}, NARROW_SHAPES);
    }

    private static Map<MitreTactic, TacticRuleSet> buildRuleSets() {
        Map<MitreTactic, TacticRuleSet> sets = new EnumMap<>(MitreTactic.class);

        sets.put(MitreTactic.RECONNAISSANCE, TacticRuleSet.builder()
            .tactic(MitreTactic.RECONNAISSANCE)
            .input(DETECTION, detection())
            .input(SKILL, skill())
            .input(TARGET_EXPOSURE, specific(TARGET_EXPOSURE, "minimal", "moderate", "extensive"))
            .defaultValue(DETECTION, 70.0).defaultValue(SKILL, 30.0).defaultValue(TARGET_EXPOSURE, 60.0)
            .rule(FuzzyRule.when(TARGET_EXPOSURE, "extensive").and(SKILL, "novice").then("high"))
            .rule(FuzzyRule.when(TARGET_EXPOSURE, "moderate").and(SKILL, "intermediate").then("medium"))
            .rule(FuzzyRule.when(TARGET_EXPOSURE, "minimal").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(TARGET_EXPOSURE, "minimal").and(SKILL, "novice").then("low"))
            .rule(FuzzyRule.when(DETECTION, "low").and(TARGET_EXPOSURE, "extensive").then("very_high"))
            .rule(FuzzyRule.when(DETECTION, "high").and(TARGET_EXPOSURE, "minimal").then("very_low"))
            .build());

        sets.put(MitreTactic.RESOURCE_DEVELOPMENT, TacticRuleSet.builder()
            .tactic(MitreTactic.RESOURCE_DEVELOPMENT)
            .input(RESOURCES, resources())
            .input(SKILL, skill())
            .input(TIME, time())
            .defaultValue(RESOURCES, 60.0).defaultValue(SKILL, 50.0).defaultValue(TIME, 40.0)
            .rule(FuzzyRule.when(RESOURCES, "abundant").and(SKILL, "expert").then("very_high"))
            .rule(FuzzyRule.when(RESOURCES, "moderate").and(SKILL, "intermediate").then("high"))
            .rule(FuzzyRule.when(RESOURCES, "limited").and(SKILL, "novice").then("low"))
            .rule(FuzzyRule.when(TIME, "urgent").and(RESOURCES, "limited").then("very_low"))
            .rule(FuzzyRule.when(TIME, "relaxed").and(RESOURCES, "abundant").then("very_high"))
            .build());

        sets.put(MitreTactic.INITIAL_ACCESS, TacticRuleSet.builder()
            .tactic(MitreTactic.INITIAL_ACCESS)
            .input(ATTACK_SURFACE, specific(ATTACK_SURFACE, "small", "medium", "large"))
            .input(DETECTION, detection())
            .input(SKILL, skill())
            .defaultValue(ATTACK_SURFACE, 50.0).defaultValue(DETECTION, 60.0).defaultValue(SKILL, 60.0)
            .rule(FuzzyRule.when(ATTACK_SURFACE, "large").and(DETECTION, "high").then("high"))
            .rule(FuzzyRule.when(ATTACK_SURFACE, "small").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(ATTACK_SURFACE, "medium").and(SKILL, "intermediate").then("medium"))
            .rule(FuzzyRule.when(ATTACK_SURFACE, "small").and(SKILL, "novice").then("very_low"))
            .rule(FuzzyRule.when(DETECTION, "low").and(ATTACK_SURFACE, "large").then("very_high"))
            .build());

        sets.put(MitreTactic.EXECUTION, TacticRuleSet.builder()
            .tactic(MitreTactic.EXECUTION)
            .input(DETECTION, detection())
            .input(SKILL, skill())
            .defaultValue(DETECTION, 40.0).defaultValue(SKILL, 40.0)
            .rule(FuzzyRule.when(SKILL, "expert").and(DETECTION, "high").then("very_high"))
            .rule(FuzzyRule.when(SKILL, "intermediate").and(DETECTION, "medium").then("high"))
            .rule(FuzzyRule.when(SKILL, "novice").and(DETECTION, "low").then("medium"))
            .rule(FuzzyRule.when(DETECTION, "low").then("high"))
            .build());

        sets.put(MitreTactic.PERSISTENCE, TacticRuleSet.builder()
            .tactic(MitreTactic.PERSISTENCE)
            .input(SYSTEM_COMPLEXITY, FuzzyVariable.input(SYSTEM_COMPLEXITY,
                new String[]{"simple", "moderate", "complex"}, WIDE_SHAPES))
            .input(DETECTION, detection())
            .input(SKILL, skill())
            .defaultValue(SYSTEM_COMPLEXITY, 50.0).defaultValue(DETECTION, 70.0).defaultValue(SKILL, 70.0)
            .rule(FuzzyRule.when(SYSTEM_COMPLEXITY, "simple").and(SKILL, "intermediate").then("high"))
            .rule(FuzzyRule.when(SYSTEM_COMPLEXITY, "complex").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(DETECTION, "high").and(SYSTEM_COMPLEXITY, "moderate").then("high"))
            .rule(FuzzyRule.when(DETECTION, "low").and(SYSTEM_COMPLEXITY, "simple").then("medium"))
            .rule(FuzzyRule.when(SYSTEM_COMPLEXITY, "complex").and(SKILL, "novice").then("very_low"))
            .build());

        sets.put(MitreTactic.PRIVILEGE_ESCALATION, TacticRuleSet.builder()
            .tactic(MitreTactic.PRIVILEGE_ESCALATION)
            .input(SECURITY_HARDENING, specific(SECURITY_HARDENING, "weak", "moderate", "strong"))
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(SECURITY_HARDENING, 60.0).defaultValue(SKILL, 80.0).defaultValue(DETECTION, 80.0)
            .rule(FuzzyRule.when(SECURITY_HARDENING, "weak").and(SKILL, "intermediate").then("very_high"))
            .rule(FuzzyRule.when(SECURITY_HARDENING, "moderate").and(SKILL, "expert").then("high"))
            .rule(FuzzyRule.when(SECURITY_HARDENING, "strong").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(SECURITY_HARDENING, "strong").and(SKILL, "novice").then("very_low"))
            .rule(FuzzyRule.when(DETECTION, "high").and(SECURITY_HARDENING, "weak").then("very_high"))
            .build());

        sets.put(MitreTactic.DEFENSE_EVASION, TacticRuleSet.builder()
            .tactic(MitreTactic.DEFENSE_EVASION)
            .input(MONITORING_COVERAGE, specific(MONITORING_COVERAGE, "sparse", "moderate", "comprehensive"))
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(MONITORING_COVERAGE, 50.0).defaultValue(SKILL, 70.0).defaultValue(DETECTION, 80.0)
            .rule(FuzzyRule.when(MONITORING_COVERAGE, "sparse").and(SKILL, "intermediate").then("very_high"))
            .rule(FuzzyRule.when(MONITORING_COVERAGE, "comprehensive").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(MONITORING_COVERAGE, "moderate").and(SKILL, "expert").then("high"))
            .rule(FuzzyRule.when(MONITORING_COVERAGE, "comprehensive").and(SKILL, "novice").then("very_low"))
            .rule(FuzzyRule.when(DETECTION, "high").then("high"))
            .build());

        sets.put(MitreTactic.CREDENTIAL_ACCESS, TacticRuleSet.builder()
            .tactic(MitreTactic.CREDENTIAL_ACCESS)
            .input(PASSWORD_POLICY, specific(PASSWORD_POLICY, "weak", "moderate", "strong"))
            .input(SKILL, skill())
            .input(RESOURCES, resources())
            .defaultValue(PASSWORD_POLICY, 50.0).defaultValue(SKILL, 60.0).defaultValue(RESOURCES, 70.0)
            .rule(FuzzyRule.when(PASSWORD_POLICY, "weak").and(SKILL, "novice").then("high"))
            .rule(FuzzyRule.when(PASSWORD_POLICY, "moderate").and(SKILL, "intermediate").then("medium"))
            .rule(FuzzyRule.when(PASSWORD_POLICY, "strong").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(PASSWORD_POLICY, "strong").and(SKILL, "novice").then("low"))
            .rule(FuzzyRule.when(RESOURCES, "abundant").and(PASSWORD_POLICY, "moderate").then("high"))
            .build());

        sets.put(MitreTactic.DISCOVERY, TacticRuleSet.builder()
            .tactic(MitreTactic.DISCOVERY)
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(SKILL, 40.0).defaultValue(DETECTION, 50.0)
            .rule(FuzzyRule.when(SKILL, "novice").then("medium"))
            .rule(FuzzyRule.when(SKILL, "intermediate").then("high"))
            .rule(FuzzyRule.when(SKILL, "expert").then("very_high"))
            .rule(FuzzyRule.when(DETECTION, "low").then("high"))
            .rule(FuzzyRule.when(DETECTION, "high").and(SKILL, "expert").then("high"))
            .build());

        sets.put(MitreTactic.LATERAL_MOVEMENT, TacticRuleSet.builder()
            .tactic(MitreTactic.LATERAL_MOVEMENT)
            .input(NETWORK_SEGMENTATION, specific(NETWORK_SEGMENTATION, "poor", "moderate", "strong"))
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(NETWORK_SEGMENTATION, 50.0).defaultValue(SKILL, 70.0).defaultValue(DETECTION, 70.0)
            .rule(FuzzyRule.when(NETWORK_SEGMENTATION, "poor").and(SKILL, "intermediate").then("very_high"))
            .rule(FuzzyRule.when(NETWORK_SEGMENTATION, "moderate").and(SKILL, "expert").then("high"))
            .rule(FuzzyRule.when(NETWORK_SEGMENTATION, "strong").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(NETWORK_SEGMENTATION, "strong").and(SKILL, "novice").then("very_low"))
            .rule(FuzzyRule.when(DETECTION, "high").and(NETWORK_SEGMENTATION, "poor").then("very_high"))
            .build());

        sets.put(MitreTactic.COLLECTION, TacticRuleSet.builder()
            .tactic(MitreTactic.COLLECTION)
            .input(DATA_ACCESSIBILITY, specific(DATA_ACCESSIBILITY, "restricted", "moderate", "open"))
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(DATA_ACCESSIBILITY, 60.0).defaultValue(SKILL, 50.0).defaultValue(DETECTION, 60.0)
            .rule(FuzzyRule.when(DATA_ACCESSIBILITY, "open").and(SKILL, "novice").then("high"))
            .rule(FuzzyRule.when(DATA_ACCESSIBILITY, "moderate").and(SKILL, "intermediate").then("high"))
            .rule(FuzzyRule.when(DATA_ACCESSIBILITY, "restricted").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(DATA_ACCESSIBILITY, "restricted").and(SKILL, "novice").then("low"))
            .rule(FuzzyRule.when(DETECTION, "high").and(DATA_ACCESSIBILITY, "open").then("very_high"))
            .build());

        sets.put(MitreTactic.COMMAND_AND_CONTROL, TacticRuleSet.builder()
            .tactic(MitreTactic.COMMAND_AND_CONTROL)
            .input(NETWORK_MONITORING, specific(NETWORK_MONITORING, "minimal", "moderate", "extensive"))
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(NETWORK_MONITORING, 50.0).defaultValue(SKILL, 60.0).defaultValue(DETECTION, 70.0)
            .rule(FuzzyRule.when(NETWORK_MONITORING, "minimal").and(SKILL, "intermediate").then("very_high"))
            .rule(FuzzyRule.when(NETWORK_MONITORING, "moderate").and(SKILL, "expert").then("high"))
            .rule(FuzzyRule.when(NETWORK_MONITORING, "extensive").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(NETWORK_MONITORING, "extensive").and(SKILL, "novice").then("very_low"))
            .rule(FuzzyRule.when(DETECTION, "high").then("high"))
            .build());

        sets.put(MitreTactic.EXFILTRATION, TacticRuleSet.builder()
            .tactic(MitreTactic.EXFILTRATION)
            .input(DATA_LOSS_PREVENTION, specific(DATA_LOSS_PREVENTION, "weak", "moderate", "strong"))
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(DATA_LOSS_PREVENTION, 50.0).defaultValue(SKILL, 70.0).defaultValue(DETECTION, 80.0)
            .rule(FuzzyRule.when(DATA_LOSS_PREVENTION, "weak").and(SKILL, "intermediate").then("very_high"))
            .rule(FuzzyRule.when(DATA_LOSS_PREVENTION, "moderate").and(SKILL, "expert").then("high"))
            .rule(FuzzyRule.when(DATA_LOSS_PREVENTION, "strong").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(DATA_LOSS_PREVENTION, "strong").and(SKILL, "novice").then("low"))
            .rule(FuzzyRule.when(DETECTION, "high").and(DATA_LOSS_PREVENTION, "weak").then("very_high"))
            .build());

        sets.put(MitreTactic.IMPACT, TacticRuleSet.builder()
            .tactic(MitreTactic.IMPACT)
            .input(BACKUP_RECOVERY, specific(BACKUP_RECOVERY, "poor", "moderate", "excellent"))
            .input(SKILL, skill())
            .input(DETECTION, detection())
            .defaultValue(BACKUP_RECOVERY, 50.0).defaultValue(SKILL, 60.0).defaultValue(DETECTION, 70.0)
            .rule(FuzzyRule.when(BACKUP_RECOVERY, "poor").and(SKILL, "intermediate").then("very_high"))
            .rule(FuzzyRule.when(BACKUP_RECOVERY, "moderate").and(SKILL, "expert").then("high"))
            .rule(FuzzyRule.when(BACKUP_RECOVERY, "excellent").and(SKILL, "expert").then("medium"))
            .rule(FuzzyRule.when(BACKUP_RECOVERY, "excellent").and(SKILL, "novice").then("low"))
            .rule(FuzzyRule.when(DETECTION, "high").and(BACKUP_RECOVERY, "poor").then("very_high"))
            .build());

        return sets;
    }
}
