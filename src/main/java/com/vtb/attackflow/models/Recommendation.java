package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Value
@Builder
public class Recommendation {
    String nodeId;
    int parentCount;
    int childCount;
    @Builder.Default
    Set<RecommendationAction> actions = EnumSet.noneOf(RecommendationAction.class);
    /** Исходная строка логического типа, для LOGIC_UNKNOWN попадает в описание */
    String logicType;

    public boolean has(RecommendationAction action) {
        return actions.contains(action);
    }

    public Optional<RecommendationAction> logicAction() {
        return actions.stream().filter(RecommendationAction::isLogic).findFirst();
    }

    /**
     * Человекочитаемые строки для аннотаций переменных
     */
    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        for (RecommendationAction action : actions) {
            switch (action) {
                case PARTITION -> messages.add(action.getSummary() + " (parents: " + parentCount + ")");
                case DIVORCE -> messages.add(action.getSummary() + " (children: " + childCount + ")");
                case LOGIC_UNKNOWN -> messages.add(action.getSummary() + ": " + logicType);
                default -> messages.add(action.getSummary());
            }
        }
        return messages;
    }
}
