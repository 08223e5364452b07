package com.minisframe.common;

import com.minisframe.planner.PlannerNodeType;

/**
 * 非法计划异常
 *
 * 在构造或序列化阶段抛出，例如 start > end、缺少必需参数、
 * 把其他类型的节点交给某个算子的工厂方法。
 *
 * @author Mini-SFrame
 */
public class InvalidPlanException extends QueryEvalException {

    public InvalidPlanException(String message) {
        super(message);
    }

    public InvalidPlanException(String message, PlannerNodeType operatorType) {
        super(message, operatorType, null, null);
    }

    public InvalidPlanException(String message, PlannerNodeType operatorType, String parameterName) {
        super(message, operatorType, parameterName, null);
    }

    public InvalidPlanException(String message, PlannerNodeType operatorType,
                                String parameterName, Throwable cause) {
        super(message, operatorType, parameterName, cause);
    }
}
