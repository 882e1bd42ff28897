package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Value
@Builder
public class GroupingResult {
    @Builder.Default
    List<PartitionGroup> partitionGroups = new ArrayList<>();
    @Builder.Default
    List<DivorceGroup> divorceGroups = new ArrayList<>();
    @Builder.Default
    List<LogicGroup> logicGroups = new ArrayList<>();

    public Set<String> logicNodeIds() {
        return logicGroups.stream().map(LogicGroup::getNodeId).collect(Collectors.toSet());
    }

    /**
     * Все группы в порядке: partition, divorce, logic
     */
    public List<NodeGroup> allGroups() {
        List<NodeGroup> all = new ArrayList<>(partitionGroups);
        all.addAll(divorceGroups);
        all.addAll(logicGroups);
        return all;
    }
}
