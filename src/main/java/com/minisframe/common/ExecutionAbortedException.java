package com.minisframe.common;

/**
 * 执行中止异常
 *
 * 在 emit / getNext 处观察到取消信号、查询超时、等待被中断，
 * 或上下游通道失败时抛出。已经提交给下游的块不会被撤回。
 *
 * @author Mini-SFrame
 */
public class ExecutionAbortedException extends QueryEvalException {

    public ExecutionAbortedException(String message) {
        super(message);
    }

    public ExecutionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
