package com.minisframe.executor;

import com.minisframe.common.QueryEvalException;
import com.minisframe.planner.PlannerNodeType;

/**
 * 算子实例
 *
 * 由计划节点通过对应的 {@link OperatorContract} 构造，持有算法所需的可变进度状态。
 *
 * 生命周期:
 * 1. 每个编译后的计划节点构造一次
 * 2. clone() 得到一份起始状态相同、可变状态独立的副本，用于并行/分区执行
 * 3. execute() 在一次调用内完成对所分配区间的完整处理，不可恢复，
 *    因此每个实例（或每个副本）只能 execute 一次
 *
 * 对应八股文知识点:
 * ✅ 推模型（Push）与拉模型（Pull）的区别
 * ✅ 向量化执行为什么按块传递数据
 * ✅ 算子实例为什么要可克隆（分区并行）
 *
 * @author Mini-SFrame
 */
public abstract class QueryOperator {

    private boolean executed;

    /**
     * 算子类型
     */
    public abstract PlannerNodeType getType();

    /**
     * 复制一个独立的实例，起始状态相同，可变状态不共享
     */
    @Override
    public abstract QueryOperator clone();

    /**
     * 执行算子
     *
     * @param context 执行上下文
     * @throws QueryEvalException 执行被中止或块分配失败
     * @throws IllegalStateException 同一个实例被执行第二次
     */
    public final void execute(QueryContext context) throws QueryEvalException {
        if (executed) {
            throw new IllegalStateException(getType() + " operator has already been executed; clone it instead");
        }
        executed = true;
        run(context);
    }

    /**
     * 算子的具体算法：源算子循环生成并 emit，非源算子循环 getNext 直到输入耗尽
     */
    protected abstract void run(QueryContext context) throws QueryEvalException;

    /**
     * 该算子类型的契约（静态分析函数所在处）
     */
    public OperatorContract getContract() {
        return OperatorRegistry.getDefault().lookup(getType());
    }
}
