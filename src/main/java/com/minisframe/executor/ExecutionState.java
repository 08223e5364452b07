package com.minisframe.executor;

import com.minisframe.common.ExecutionAbortedException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次执行范围内共享的取消标记
 *
 * 任意阶段失败或查询被取消时置位，所有阶段在下一个挂起点（emit / getNext）观察到后中止。
 * 只记录第一个失败原因。
 *
 * @author Mini-SFrame
 */
@Slf4j
public class ExecutionState {

    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private volatile boolean cancelled;

    /**
     * 记录失败并取消执行
     *
     * @return 是否是第一个失败
     */
    public boolean fail(Throwable cause) {
        boolean first = failure.compareAndSet(null, cause);
        cancelled = true;
        if (first) {
            log.debug("Execution failed, cancelling all stages: {}", cause.toString());
        }
        return first;
    }

    /**
     * 取消执行
     */
    public void cancel(String reason) {
        fail(new ExecutionAbortedException(reason));
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * 第一个失败原因，没有失败时返回 null
     */
    public Throwable getFailure() {
        return failure.get();
    }

    /**
     * 已取消时抛出 ExecutionAbortedException
     */
    public void checkCancelled() throws ExecutionAbortedException {
        if (cancelled) {
            throw new ExecutionAbortedException("Execution cancelled", failure.get());
        }
    }
}
