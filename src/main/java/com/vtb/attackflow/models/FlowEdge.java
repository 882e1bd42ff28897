package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

/**
 * Направленное ребро графа: source -> target
 */
@Value
@Builder
public class FlowEdge {
    String source;
    String target;
    /** Откуда взято ребро: relationship, object_refs, command_ref, имя атрибута *_refs */
    String origin;

    public static FlowEdge of(String source, String target) {
        return FlowEdge.builder().source(source).target(target).origin("relationship").build();
    }
}
