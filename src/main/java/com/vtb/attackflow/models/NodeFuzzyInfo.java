package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class NodeFuzzyInfo {
    private String nodeId;
    private String nodeName;
    private String techniqueId;
    private String tacticId;
    private String tacticName;
    @Builder.Default
    private Map<String, Double> parameters = new LinkedHashMap<>();
    @Builder.Default
    private List<String> states = new ArrayList<>();
    private double[] membership;
    private double baseSuccessProbability;

    public int mostLikelyState() {
        int best = 0;
        for (int i = 1; i < membership.length; i++) {
            if (membership[i] > membership[best]) {
                best = i;
            }
        }
        return best;
    }
}
