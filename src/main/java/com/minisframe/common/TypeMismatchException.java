package com.minisframe.common;

import com.minisframe.planner.PlannerNodeType;

/**
 * 类型不匹配异常
 *
 * 参数存在，但无法转换为算子要求的类型。
 *
 * @author Mini-SFrame
 */
public class TypeMismatchException extends QueryEvalException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(String message, PlannerNodeType operatorType,
                                 String parameterName, Throwable cause) {
        super(message, operatorType, parameterName, cause);
    }
}
