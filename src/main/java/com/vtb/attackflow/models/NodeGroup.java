package com.vtb.attackflow.models;

/**
 * Общий контракт групп, которые строит алгоритм группировки
 */
public interface NodeGroup {

    String getNodeId();

    GroupType getType();
}
