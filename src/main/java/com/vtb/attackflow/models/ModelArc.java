package com.vtb.attackflow.models;

import lombok.Value;

@Value
public class ModelArc {
    String from;
    String to;
}
