package com.minisframe.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次运行的超时期限
 *
 * 超时和运行完成只有一个能生效：谁先把 settled 从 false 改成 true 谁赢。
 * 超时赢了才会取消执行状态，运行完成后才触发的定时任务什么都不做。
 *
 * @author Mini-SFrame
 */
@Slf4j
class QueryDeadline {

    private final ExecutionState state;

    private final long timeoutMillis;

    private final AtomicBoolean settled = new AtomicBoolean(false);

    private ScheduledFuture<?> future;

    QueryDeadline(ExecutionState state, long timeoutMillis) {
        this.state = state;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * 在定时器上登记超时任务，timeoutMillis 为 0 时不登记
     */
    void arm(ScheduledExecutorService timer) {
        if (timeoutMillis > 0) {
            future = timer.schedule(this::expire, timeoutMillis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * 超时任务：运行尚未完成时取消执行
     *
     * @return 本次调用是否取消了执行
     */
    boolean expire() {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        log.warn("Query timed out after {} ms", timeoutMillis);
        state.cancel("Query timed out after " + timeoutMillis + " ms");
        return true;
    }

    /**
     * 标记运行完成
     *
     * @return false 表示超时已经先生效
     */
    boolean complete() {
        return settled.compareAndSet(false, true);
    }

    /**
     * 撤销尚未触发的定时任务
     */
    void disarm() {
        if (future != null) {
            future.cancel(false);
        }
    }
}
