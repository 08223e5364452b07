package com.minisframe.executor;

import com.minisframe.common.InvalidPlanException;
import com.minisframe.common.QueryEvalException;
import com.minisframe.executor.operator.SequenceOperatorContract;
import com.minisframe.flexible.FlexTypeEnum;
import com.minisframe.planner.PlannerNode;
import com.minisframe.planner.PlannerNodeType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * 算子契约注册表
 *
 * 进程级、只读的 类型 -> 契约 映射，类加载时初始化，之后不再修改。
 * 查询编译器和优化器通过它按节点类型分派构造、类型推断、长度推断和 repr。
 *
 * 分派前统一检查:
 * 1. 该类型已注册契约
 * 2. 节点的输入数量等于契约声明的 numInputs（可变输入数量的契约除外）
 *
 * @author Mini-SFrame
 */
public final class OperatorRegistry {

    private static final OperatorRegistry DEFAULT = new OperatorRegistry(
            SequenceOperatorContract.INSTANCE);

    private final Map<PlannerNodeType, OperatorContract> contracts;

    /**
     * 包内构造：默认注册表之外只用于组装自定义的契约集合
     */
    OperatorRegistry(OperatorContract... registered) {
        EnumMap<PlannerNodeType, OperatorContract> map = new EnumMap<>(PlannerNodeType.class);
        for (OperatorContract contract : registered) {
            if (map.put(contract.getType(), contract) != null) {
                throw new IllegalStateException("Duplicate contract for " + contract.getType());
            }
        }
        this.contracts = Collections.unmodifiableMap(map);
    }

    public static OperatorRegistry getDefault() {
        return DEFAULT;
    }

    /**
     * 查找契约，未注册时返回 null
     */
    public OperatorContract lookup(PlannerNodeType type) {
        return contracts.get(type);
    }

    /**
     * 获取契约
     *
     * @throws InvalidPlanException 该类型没有注册契约
     */
    public OperatorContract getContract(PlannerNodeType type) throws InvalidPlanException {
        OperatorContract contract = contracts.get(type);
        if (contract == null) {
            throw new InvalidPlanException("No operator registered for " + type, type);
        }
        return contract;
    }

    public Collection<OperatorContract> getContracts() {
        return contracts.values();
    }

    public QueryOperator fromPlannerNode(PlannerNode node) throws QueryEvalException {
        return checkedContract(node).fromPlannerNode(node);
    }

    public List<FlexTypeEnum> inferType(PlannerNode node) throws QueryEvalException {
        return checkedContract(node).inferType(node);
    }

    public OptionalLong inferLength(PlannerNode node) throws QueryEvalException {
        return checkedContract(node).inferLength(node);
    }

    public String repr(PlannerNode node) throws QueryEvalException {
        return checkedContract(node).repr(node);
    }

    public PlannerNode slice(PlannerNode node, long begin, long end) throws QueryEvalException {
        return checkedContract(node).slice(node, begin, end);
    }

    private OperatorContract checkedContract(PlannerNode node) throws InvalidPlanException {
        OperatorContract contract = getContract(node.getOperatorType());
        if (contract.getAttributes().hasVariableInputs()) {
            return contract;
        }
        int expected = contract.getAttributes().getNumInputs();
        if (node.getInputs().size() != expected) {
            throw new InvalidPlanException(contract.getName() + " expects " + expected
                    + " inputs but node has " + node.getInputs().size(), node.getOperatorType());
        }
        return contract;
    }
}
