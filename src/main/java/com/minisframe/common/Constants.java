package com.minisframe.common;

/**
 * 系统常量定义
 *
 * @author Mini-SFrame
 */
public class Constants {

    // ==================== 块（Block）相关常量 ====================

    /**
     * 默认块大小：每个列块最多 256 行
     *
     * 为什么是固定大小？
     * 1. 算子之间以块为单位传递数据，单块内存占用可预估
     * 2. 太小会导致每行分摊的调度开销过高
     * 3. 太大会放大流水线中在途数据的内存占用
     */
    public static final int DEFAULT_BLOCK_SIZE = 256;

    // ==================== 流水线相关常量 ====================

    /**
     * 算子之间的块通道容量（块数）
     * 通道满时上游 emit() 阻塞，形成反压
     */
    public static final int DEFAULT_CHANNEL_CAPACITY = 4;

    /**
     * 阻塞等待时检查取消标记的间隔（毫秒）
     */
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 10L;

    /**
     * 查询超时（毫秒），0 表示不限制
     */
    public static final long DEFAULT_QUERY_TIMEOUT_MILLIS = 0L;

    // ==================== 配置项名称 ====================

    public static final String PROP_BLOCK_SIZE = "minisframe.block.size";

    public static final String PROP_CHANNEL_CAPACITY = "minisframe.channel.capacity";

    public static final String PROP_POLL_INTERVAL_MILLIS = "minisframe.poll.interval.ms";

    public static final String PROP_QUERY_TIMEOUT_MILLIS = "minisframe.query.timeout.ms";

    // ==================== 私有构造函数 ====================

    private Constants() {
        // 工具类，禁止实例化
    }
}
