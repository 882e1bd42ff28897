package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Логический оператор и его входы. UNKNOWN здесь уже разрешен в AND или OR
 */
@Value
@Builder
public class LogicGroup implements NodeGroup {
    String nodeId;
    LogicKind logic;
    @Builder.Default
    List<String> members = new ArrayList<>();

    @Override
    public GroupType getType() {
        return GroupType.LOGIC;
    }
}
