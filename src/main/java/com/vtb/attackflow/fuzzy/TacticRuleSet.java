package com.vtb.attackflow.fuzzy;

import com.vtb.attackflow.models.MitreTactic;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Нечеткая система одной тактики: входы, значения по умолчанию и правила.
 * Набор входов фиксирован и совпадает с ключами defaults
 */
@Value
@Builder
public class TacticRuleSet {
    MitreTactic tactic;
    @Singular
    Map<String, FuzzyVariable> inputs;
    @Singular("defaultValue")
    Map<String, Double> defaults;
    @Singular
    List<FuzzyRule> rules;
}
