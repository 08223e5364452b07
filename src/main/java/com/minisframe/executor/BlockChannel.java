package com.minisframe.executor;

import com.minisframe.common.ExecutionAbortedException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 块通道
 *
 * 生产者阶段与消费者阶段之间的有界队列，是流水线中唯一共享的可变状态。
 *
 * 反压（Backpressure）:
 * - 队列满时 put() 阻塞，生产者暂停
 * - 因此在途数据量只取决于通道容量和块大小，与总行数无关
 *
 * 取消:
 * - put() / take() 按 pollInterval 轮询，每次等待之间检查 ExecutionState
 *
 * 结束:
 * - 生产者调用 close() 放入结束标记，消费者读到后 take() 返回 null
 *
 * @author Mini-SFrame
 */
@Slf4j
public class BlockChannel {

    /**
     * 结束标记，只用于通道内部
     */
    private static final ColumnBlock END_OF_STREAM = new ColumnBlock(1);

    private final BlockingQueue<ColumnBlock> queue;

    private final ExecutionState state;

    private final long pollIntervalMillis;

    @Getter
    private final String name;

    private volatile boolean closed;

    private boolean exhausted;

    public BlockChannel(String name, int capacity, ExecutionState state, long pollIntervalMillis) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.state = state;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    /**
     * 放入一个块，通道满时阻塞
     *
     * @throws ExecutionAbortedException 等待期间执行被取消或线程被中断
     */
    public void put(ColumnBlock block) throws ExecutionAbortedException {
        if (closed) {
            throw new IllegalStateException("Channel " + name + " is already closed");
        }
        offer(block);
    }

    /**
     * 生产者正常结束，放入结束标记
     */
    public void close() throws ExecutionAbortedException {
        if (closed) {
            return;
        }
        offer(END_OF_STREAM);
        closed = true;
        log.trace("Channel {} closed", name);
    }

    /**
     * 取出下一个块，队列空时阻塞
     *
     * @return 下一个块，生产者已结束时返回 null
     * @throws ExecutionAbortedException 等待期间执行被取消或线程被中断
     */
    public ColumnBlock take() throws ExecutionAbortedException {
        if (exhausted) {
            return null;
        }
        try {
            while (true) {
                state.checkCancelled();
                ColumnBlock block = queue.poll(pollIntervalMillis, TimeUnit.MILLISECONDS);
                if (block == END_OF_STREAM) {
                    exhausted = true;
                    return null;
                }
                if (block != null) {
                    return block;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionAbortedException("Interrupted while waiting on channel " + name, e);
        }
    }

    public int size() {
        return queue.size();
    }

    private void offer(ColumnBlock block) throws ExecutionAbortedException {
        try {
            while (true) {
                state.checkCancelled();
                if (queue.offer(block, pollIntervalMillis, TimeUnit.MILLISECONDS)) {
                    return;
                }
                log.trace("Channel {} is full, waiting for consumer", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionAbortedException("Interrupted while emitting to channel " + name, e);
        }
    }
}
