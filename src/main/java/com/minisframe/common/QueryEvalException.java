package com.minisframe.common;

import com.minisframe.planner.PlannerNodeType;
import lombok.Getter;

/**
 * 查询执行异常基类
 *
 * 所有在计划构造、序列化、静态分析和执行阶段可恢复的错误都继承自该类，
 * 调用方按子类型区分处理，不再使用断言终止进程。
 *
 * @author Mini-SFrame
 */
@Getter
public class QueryEvalException extends Exception {

    /**
     * 出错的算子类型，未知时为 null
     */
    private final PlannerNodeType operatorType;

    /**
     * 出错的参数名，与参数无关时为 null
     */
    private final String parameterName;

    public QueryEvalException(String message) {
        this(message, null, null, null);
    }

    public QueryEvalException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public QueryEvalException(String message, PlannerNodeType operatorType,
                              String parameterName, Throwable cause) {
        super(message, cause);
        this.operatorType = operatorType;
        this.parameterName = parameterName;
    }
}
