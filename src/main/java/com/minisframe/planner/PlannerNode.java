package com.minisframe.planner;

import com.minisframe.flexible.FlexibleValue;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 逻辑计划节点
 *
 * 逻辑计划是一张有向无环图，每个节点包含:
 * - operatorType: 算子类型
 * - operatorParameters: 参数名 -> 标量值
 * - inputs: 有序的输入节点列表
 *
 * 节点构造后不可变，任何变换都会产生新节点。输入在构造时确定，
 * 之后无法再添加边，因此图天然无环。多个消费者可以共享同一个子图，
 * 节点相等性按引用判断。
 *
 * @author Mini-SFrame
 */
@Getter
public final class PlannerNode {

    private final PlannerNodeType operatorType;

    private final Map<String, FlexibleValue> operatorParameters;

    private final List<PlannerNode> inputs;

    private PlannerNode(PlannerNodeType operatorType,
                        Map<String, FlexibleValue> operatorParameters,
                        List<PlannerNode> inputs) {
        this.operatorType = Objects.requireNonNull(operatorType, "operatorType");
        this.operatorParameters = Collections.unmodifiableMap(new LinkedHashMap<>(operatorParameters));
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        for (Map.Entry<String, FlexibleValue> entry : this.operatorParameters.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "parameter name");
            Objects.requireNonNull(entry.getValue(), "parameter " + entry.getKey());
        }
        for (PlannerNode input : this.inputs) {
            Objects.requireNonNull(input, "input");
        }
    }

    public static PlannerNode makeShared(PlannerNodeType operatorType,
                                         Map<String, FlexibleValue> operatorParameters) {
        return new PlannerNode(operatorType, operatorParameters, Collections.emptyList());
    }

    public static PlannerNode makeShared(PlannerNodeType operatorType,
                                         Map<String, FlexibleValue> operatorParameters,
                                         List<PlannerNode> inputs) {
        return new PlannerNode(operatorType, operatorParameters, inputs);
    }

    /**
     * 是否包含指定参数
     */
    public boolean hasParameter(String name) {
        return operatorParameters.containsKey(name);
    }

    /**
     * 获取参数，不存在时返回 null
     */
    public FlexibleValue getParameter(String name) {
        return operatorParameters.get(name);
    }

    /**
     * 替换（或新增）一个参数，返回新节点，输入保持共享
     */
    public PlannerNode withParameter(String name, FlexibleValue value) {
        Map<String, FlexibleValue> params = new LinkedHashMap<>(operatorParameters);
        params.put(name, value);
        return new PlannerNode(operatorType, params, inputs);
    }

    /**
     * 批量替换参数，返回新节点
     */
    public PlannerNode withParameters(Map<String, FlexibleValue> replacements) {
        Map<String, FlexibleValue> params = new LinkedHashMap<>(operatorParameters);
        params.putAll(replacements);
        return new PlannerNode(operatorType, params, inputs);
    }

    @Override
    public String toString() {
        return operatorType + operatorParameters.toString() + "(inputs=" + inputs.size() + ")";
    }
}
