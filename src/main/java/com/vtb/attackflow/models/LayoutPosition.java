package com.vtb.attackflow.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LayoutPosition {
    int left;
    int top;
    int right;
    int bottom;
    int level;
}
