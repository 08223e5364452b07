package com.minisframe.executor;

import com.minisframe.common.AllocationFailureException;
import com.minisframe.common.ExecutionAbortedException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 流水线执行上下文
 *
 * 每个阶段一个实例，把算子连接到输入通道和输出通道。
 * 有多个输出通道时，emit 把同一个（已封存的）块依次放入每个输出通道，
 * 任一通道满了都会阻塞，所以各个下游必须交替读取。
 * QueryExecutor 编译出的阶段只有一个输出通道。
 *
 * @author Mini-SFrame
 */
@Slf4j
public class PipelineQueryContext implements QueryContext {

    @Getter
    private final String stageName;

    private final int blockSize;

    private final ExecutionState state;

    private final List<BlockChannel> inputs;

    private final List<BlockChannel> outputs;

    @Getter
    private long blocksEmitted;

    @Getter
    private long rowsEmitted;

    @Getter
    private long buffersAllocated;

    public PipelineQueryContext(String stageName, int blockSize, ExecutionState state,
                                List<BlockChannel> inputs, List<BlockChannel> outputs) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockSize);
        }
        this.stageName = stageName;
        this.blockSize = blockSize;
        this.state = state;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
    }

    @Override
    public int blockSize() {
        return blockSize;
    }

    @Override
    public ColumnBlock getOutputBuffer() {
        buffersAllocated++;
        return new ColumnBlock(blockSize);
    }

    @Override
    public void emit(ColumnBlock block) throws ExecutionAbortedException, AllocationFailureException {
        state.checkCancelled();
        if (block.isSealed()) {
            throw new IllegalStateException("Block has already been emitted");
        }
        if (block.getCapacity() != blockSize) {
            throw new AllocationFailureException("Block capacity " + block.getCapacity()
                    + " does not match block size " + blockSize + " in stage " + stageName);
        }
        if (block.getNumRows() == 0) {
            return;
        }

        block.seal();
        for (BlockChannel output : outputs) {
            output.put(block);
        }
        blocksEmitted++;
        rowsEmitted += block.getNumRows();
    }

    @Override
    public int numInputs() {
        return inputs.size();
    }

    @Override
    public ColumnBlock getNext(int inputIndex) throws ExecutionAbortedException {
        if (inputIndex < 0 || inputIndex >= inputs.size()) {
            throw new IndexOutOfBoundsException("Stage " + stageName + " has no input " + inputIndex);
        }
        return inputs.get(inputIndex).take();
    }

    /**
     * 算子正常结束后关闭所有输出通道
     */
    void finish() throws ExecutionAbortedException {
        for (BlockChannel output : outputs) {
            output.close();
        }
        log.debug("Stage {} finished: {} blocks, {} rows", stageName, blocksEmitted, rowsEmitted);
    }
}
