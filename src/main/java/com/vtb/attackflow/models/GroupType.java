package com.vtb.attackflow.models;

public enum GroupType {
    PARTITION,
    DIVORCE,
    LOGIC
}
