package com.minisframe.executor;

import lombok.Data;

import java.util.Properties;

import static com.minisframe.common.Constants.*;

/**
 * 执行配置
 *
 * 默认值来自 {@link com.minisframe.common.Constants}，也可以从 Properties 读取
 *
 * @author Mini-SFrame
 */
@Data
public class ExecutionConfig {

    /**
     * 每块最大行数
     */
    private int blockSize = DEFAULT_BLOCK_SIZE;

    /**
     * 阶段之间通道的容量（块数）
     */
    private int channelCapacity = DEFAULT_CHANNEL_CAPACITY;

    /**
     * 阻塞等待时检查取消标记的间隔（毫秒）
     */
    private long pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;

    /**
     * 查询超时（毫秒），0 表示不限制
     */
    private long queryTimeoutMillis = DEFAULT_QUERY_TIMEOUT_MILLIS;

    public static ExecutionConfig defaults() {
        return new ExecutionConfig();
    }

    /**
     * 从 Properties 读取配置，缺失的项使用默认值
     *
     * @throws IllegalArgumentException 配置值不是数字或取值非法
     */
    public static ExecutionConfig fromProperties(Properties props) {
        ExecutionConfig config = new ExecutionConfig();
        config.setBlockSize(Integer.parseInt(
                props.getProperty(PROP_BLOCK_SIZE, String.valueOf(DEFAULT_BLOCK_SIZE)).trim()));
        config.setChannelCapacity(Integer.parseInt(
                props.getProperty(PROP_CHANNEL_CAPACITY, String.valueOf(DEFAULT_CHANNEL_CAPACITY)).trim()));
        config.setPollIntervalMillis(Long.parseLong(
                props.getProperty(PROP_POLL_INTERVAL_MILLIS, String.valueOf(DEFAULT_POLL_INTERVAL_MILLIS)).trim()));
        config.setQueryTimeoutMillis(Long.parseLong(
                props.getProperty(PROP_QUERY_TIMEOUT_MILLIS, String.valueOf(DEFAULT_QUERY_TIMEOUT_MILLIS)).trim()));
        config.validate();
        return config;
    }

    /**
     * 复制一份配置，之后对原对象的修改不影响副本
     */
    public ExecutionConfig copy() {
        ExecutionConfig copy = new ExecutionConfig();
        copy.setBlockSize(blockSize);
        copy.setChannelCapacity(channelCapacity);
        copy.setPollIntervalMillis(pollIntervalMillis);
        copy.setQueryTimeoutMillis(queryTimeoutMillis);
        return copy;
    }

    public void validate() {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockSize);
        }
        if (channelCapacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + channelCapacity);
        }
        if (pollIntervalMillis <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollIntervalMillis);
        }
        if (queryTimeoutMillis < 0) {
            throw new IllegalArgumentException("Query timeout cannot be negative: " + queryTimeoutMillis);
        }
    }
}
