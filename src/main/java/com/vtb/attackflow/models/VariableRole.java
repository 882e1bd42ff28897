package com.vtb.attackflow.models;

/**
 * Откуда появилась переменная модели
 */
public enum VariableRole {
    GRAPH_NODE,
    PARTITION_GATE,
    LOGIC_AND,
    LOGIC_OR,
    DIVORCE_HUB
}
