package com.minisframe.executor.operator;

import com.minisframe.common.InvalidPlanException;
import com.minisframe.common.QueryEvalException;
import com.minisframe.executor.ColumnBlock;
import com.minisframe.executor.QueryContext;
import com.minisframe.executor.QueryOperator;
import com.minisframe.flexible.FlexibleValue;
import com.minisframe.planner.PlannerNodeType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 序列算子
 *
 * 功能: 生成 [start, end) 的连续整数，单列 INTEGER 输出
 *
 * 工作原理:
 * 1. cursor = start, bound = end
 * 2. 每轮分配一个块，长度为 min(bound - cursor, blockSize)
 * 3. 依次填入 cursor, cursor+1, ...，然后 emit
 * 4. cursor == bound 时结束，start == end 时不产生任何块
 *
 * 这是所有源算子的范例：进度单调、块长度不超过块大小、
 * 输出行数之和严格等于 inferLength。
 *
 * @author Mini-SFrame
 */
@Slf4j
public class SequenceOperator extends QueryOperator {

    /**
     * 起点（包含）
     */
    @Getter
    private final long start;

    /**
     * 终点（不包含）
     */
    @Getter
    private final long end;

    /**
     * 当前游标，始终满足 start <= cursor <= end
     */
    private long cursor;

    public SequenceOperator(long start, long end) throws InvalidPlanException {
        if (start > end) {
            throw new InvalidPlanException("Sequence start " + start + " is greater than end " + end,
                    PlannerNodeType.SEQUENCE_NODE, SequenceOperatorContract.START);
        }
        this.start = start;
        this.end = end;
        this.cursor = start;
    }

    @Override
    public PlannerNodeType getType() {
        return PlannerNodeType.SEQUENCE_NODE;
    }

    @Override
    public SequenceOperator clone() {
        try {
            return new SequenceOperator(start, end);
        } catch (InvalidPlanException e) {
            // start <= end 已在构造时校验
            throw new IllegalStateException(e);
        }
    }

    @Override
    protected void run(QueryContext context) throws QueryEvalException {
        log.debug("Sequence execution started: [{}, {})", start, end);
        int blocks = 0;

        while (true) {
            long remaining = end - cursor;
            if (remaining <= 0) {
                break;
            }

            ColumnBlock block = context.getOutputBuffer();
            int len = (int) Math.min(remaining, context.blockSize());
            block.resize(1, len);
            for (int row = 0; row < len; row++) {
                block.setValue(0, row, FlexibleValue.of(cursor));
                cursor++;
            }

            context.emit(block);
            blocks++;
            log.trace("Sequence emitted block {} with {} rows, cursor={}", blocks, len, cursor);
        }

        log.debug("Sequence execution finished: [{}, {}), {} blocks", start, end, blocks);
    }

    /**
     * 当前游标（测试和监控用）
     */
    public long getCursor() {
        return cursor;
    }

    @Override
    public String toString() {
        return "Sequence[" + start + ", " + end + ")";
    }
}
