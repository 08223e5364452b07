package com.minisframe.executor;

import com.minisframe.common.AllocationFailureException;
import com.minisframe.common.ExecutionAbortedException;

/**
 * 执行上下文
 *
 * 流水线驱动为每个算子实例提供的运行时服务，也是算子可以调用的全部接口:
 * - blockSize(): 每块最大行数，在一次执行期间固定
 * - getOutputBuffer(): 分配一个新的可写输出块
 * - emit(): 把块交给下游，下游通道满时阻塞（反压）
 * - getNext(): 从指定输入拉取下一块（仅多输入算子使用）
 *
 * emit 和 getNext 是仅有的挂起点，二者都必须检查取消标记，
 * 一旦兄弟阶段失败或查询被取消，立即抛出 ExecutionAbortedException。
 *
 * @author Mini-SFrame
 */
public interface QueryContext {

    /**
     * 每块的最大行数（正整数）
     */
    int blockSize();

    /**
     * 分配一个新的输出块，容量为 blockSize()
     */
    ColumnBlock getOutputBuffer();

    /**
     * 把块的所有权交给下游
     *
     * @param block 待发送的块，发送后被封存
     * @throws ExecutionAbortedException 观察到取消信号，或通道失败
     * @throws AllocationFailureException 块不是按当前上下文的块大小分配的
     */
    void emit(ColumnBlock block) throws ExecutionAbortedException, AllocationFailureException;

    /**
     * 输入数量
     */
    int numInputs();

    /**
     * 从指定输入拉取下一块
     *
     * @param inputIndex 输入下标
     * @return 下一块，该输入已耗尽时返回 null
     * @throws ExecutionAbortedException 观察到取消信号
     */
    ColumnBlock getNext(int inputIndex) throws ExecutionAbortedException;
}
