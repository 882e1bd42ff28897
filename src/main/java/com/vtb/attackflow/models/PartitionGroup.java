package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Разбиение родителей узла на подгруппы размером не более maxSize.
 * Каждый родитель входит ровно в одну подгруппу
 */
@Value
@Builder
public class PartitionGroup implements NodeGroup {
    String nodeId;
    @Builder.Default
    List<List<String>> groups = new ArrayList<>();

    @Override
    public GroupType getType() {
        return GroupType.PARTITION;
    }

    public List<String> members() {
        List<String> all = new ArrayList<>();
        groups.forEach(all::addAll);
        return all;
    }
}
