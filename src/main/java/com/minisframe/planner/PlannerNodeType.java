package com.minisframe.planner;

/**
 * 计划节点类型（算子种类）
 *
 * 新增算子时在这里追加类型，并在 OperatorRegistry 中注册对应的契约
 *
 * @author Mini-SFrame
 */
public enum PlannerNodeType {
    /** 整数序列源算子 */
    SEQUENCE_NODE
}
