package com.minisframe.executor;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次运行的统计信息
 *
 * @author Mini-SFrame
 */
@Data
public class ExecutionStatistics {

    private final List<StageStatistics> stages = new ArrayList<>();

    private long elapsedMillis;

    /**
     * 交给消费者的块数
     */
    private long resultBlocks;

    /**
     * 交给消费者的行数
     */
    private long resultRows;

    public void addStage(StageStatistics stage) {
        stages.add(stage);
    }

    /**
     * 单个阶段的统计
     */
    @Data
    @AllArgsConstructor
    public static class StageStatistics {
        private String stageName;
        private long blocksEmitted;
        private long rowsEmitted;
        private long buffersAllocated;
    }
}
