package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class DivorceGroup implements NodeGroup {
    String nodeId;
    @Builder.Default
    List<String> children = new ArrayList<>();

    @Override
    public GroupType getType() {
        return GroupType.DIVORCE;
    }
}
