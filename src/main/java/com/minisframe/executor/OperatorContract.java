package com.minisframe.executor;

import com.minisframe.common.InvalidPlanException;
import com.minisframe.common.QueryEvalException;
import com.minisframe.flexible.FlexTypeEnum;
import com.minisframe.planner.PlannerNode;
import com.minisframe.planner.PlannerNodeType;

import java.util.List;
import java.util.OptionalLong;

/**
 * 算子契约
 *
 * 每种算子一个无状态的描述对象，提供:
 * - 类型、显示名、属性
 * - fromPlannerNode: 从计划节点构造实例（校验参数，可能失败）
 * - inferType / inferLength / repr: 纯函数，只读计划节点，不构造也不执行实例
 * - slice: 把节点收窄到输出行的一个子区间
 *
 * 各算子类型的带类型构造入口（例如 makePlannerNode(start, end)）放在具体契约类上。
 *
 * @author Mini-SFrame
 */
public interface OperatorContract {

    PlannerNodeType getType();

    String getName();

    OperatorAttributes getAttributes();

    /**
     * 从计划节点构造算子实例
     *
     * @throws InvalidPlanException 节点类型不符、缺少参数或参数取值非法
     * @throws com.minisframe.common.TypeMismatchException 参数类型无法转换
     */
    QueryOperator fromPlannerNode(PlannerNode node) throws QueryEvalException;

    /**
     * 推断输出列类型
     */
    List<FlexTypeEnum> inferType(PlannerNode node) throws QueryEvalException;

    /**
     * 推断输出行数，无法静态确定时返回 empty
     */
    OptionalLong inferLength(PlannerNode node) throws QueryEvalException;

    /**
     * 稳定的调试字符串
     */
    String repr(PlannerNode node) throws QueryEvalException;

    /**
     * 把节点收窄为其当前输出的 [begin, end) 行，返回新节点
     *
     * 默认不支持
     */
    default PlannerNode slice(PlannerNode node, long begin, long end) throws QueryEvalException {
        throw new InvalidPlanException(getName() + " does not support slicing", getType());
    }
}
