package com.minisframe.executor;

import com.minisframe.common.QueryEvalException;
import com.minisframe.executor.operator.SequenceOperatorContract;
import com.minisframe.flexible.FlexTypeEnum;
import com.minisframe.planner.PlannerNode;
import com.minisframe.planner.PlannerNodeType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * 测试用契约：带输入的节点是拼接，没有输入的节点交给序列契约
 *
 * 输入数量可变，用来在只有一种算子类型的情况下组装多阶段计划。
 *
 * @author Mini-SFrame
 */
public final class ConcatContract implements OperatorContract {

    public static final ConcatContract INSTANCE = new ConcatContract();

    /**
     * 只含这个契约的注册表
     */
    public static final OperatorRegistry REGISTRY = new OperatorRegistry(INSTANCE);

    private ConcatContract() {
    }

    public static PlannerNode makePlannerNode(PlannerNode... inputs) {
        return PlannerNode.makeShared(PlannerNodeType.SEQUENCE_NODE,
                Collections.emptyMap(), Arrays.asList(inputs));
    }

    @Override
    public PlannerNodeType getType() {
        return PlannerNodeType.SEQUENCE_NODE;
    }

    @Override
    public String getName() {
        return "concat";
    }

    @Override
    public OperatorAttributes getAttributes() {
        return new OperatorAttributes(OperatorAttributes.NONE, OperatorAttributes.VARIABLE_INPUTS);
    }

    @Override
    public QueryOperator fromPlannerNode(PlannerNode node) throws QueryEvalException {
        if (node.getInputs().isEmpty()) {
            return SequenceOperatorContract.INSTANCE.fromPlannerNode(node);
        }
        return new ConcatOperator();
    }

    @Override
    public List<FlexTypeEnum> inferType(PlannerNode node) {
        return Collections.singletonList(FlexTypeEnum.INTEGER);
    }

    @Override
    public OptionalLong inferLength(PlannerNode node) throws QueryEvalException {
        if (node.getInputs().isEmpty()) {
            return SequenceOperatorContract.INSTANCE.inferLength(node);
        }
        long total = 0;
        for (PlannerNode input : node.getInputs()) {
            total += inferLength(input).getAsLong();
        }
        return OptionalLong.of(total);
    }

    @Override
    public String repr(PlannerNode node) throws QueryEvalException {
        if (node.getInputs().isEmpty()) {
            return SequenceOperatorContract.INSTANCE.repr(node);
        }
        return "Concat(" + node.getInputs().size() + ")";
    }
}
