package com.minisframe.executor;

import com.minisframe.common.AllocationFailureException;
import com.minisframe.flexible.FlexibleValue;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 列块（Column Block）
 *
 * 算子之间传递数据的基本单位：numColumns 列 × numRows 行的标量值。
 *
 * 核心约束：
 * 1. 所有列长度相同
 * 2. 行数不超过分配时确定的容量（即执行上下文的块大小）
 * 3. emit 之后块被封存（sealed），所有权转移给下游，生产者不能再修改
 *
 * 使用方式：
 * <pre>
 * ColumnBlock block = context.getOutputBuffer();
 * block.resize(1, len);
 * block.setValue(0, row, value);
 * context.emit(block);
 * </pre>
 *
 * @author Mini-SFrame
 */
public class ColumnBlock {

    /**
     * 最大行数
     */
    @Getter
    private final int capacity;

    /**
     * 列数据，columns[c][r]
     */
    private FlexibleValue[][] columns;

    @Getter
    private int numRows;

    /**
     * 是否已封存
     */
    @Getter
    private volatile boolean sealed;

    public ColumnBlock(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Block capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.columns = new FlexibleValue[0][];
        this.numRows = 0;
    }

    /**
     * 调整块的形状，新单元格初始化为 UNDEFINED
     *
     * @param numColumns 列数（> 0）
     * @param numRows    行数（0..capacity）
     * @throws AllocationFailureException 形状非法或超过容量
     */
    public void resize(int numColumns, int numRows) throws AllocationFailureException {
        checkMutable();
        if (numColumns <= 0) {
            throw new AllocationFailureException("Invalid column count: " + numColumns);
        }
        if (numRows < 0 || numRows > capacity) {
            throw new AllocationFailureException(
                    "Cannot size block to " + numRows + " rows, capacity is " + capacity);
        }

        FlexibleValue[][] resized = new FlexibleValue[numColumns][];
        for (int c = 0; c < numColumns; c++) {
            resized[c] = new FlexibleValue[numRows];
            Arrays.fill(resized[c], FlexibleValue.undefined());
        }
        this.columns = resized;
        this.numRows = numRows;
    }

    public int getNumColumns() {
        return columns.length;
    }

    public FlexibleValue getValue(int column, int row) {
        checkBounds(column, row);
        return columns[column][row];
    }

    public void setValue(int column, int row, FlexibleValue value) {
        checkMutable();
        checkBounds(column, row);
        if (value == null) {
            throw new IllegalArgumentException("Cell value cannot be null");
        }
        columns[column][row] = value;
    }

    /**
     * 获取一列的只读视图
     */
    public List<FlexibleValue> getColumn(int column) {
        if (column < 0 || column >= columns.length) {
            throw new IndexOutOfBoundsException("Invalid column index: " + column);
        }
        return Collections.unmodifiableList(Arrays.asList(columns[column]));
    }

    /**
     * 封存块，之后任何修改都会失败
     */
    void seal() {
        sealed = true;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("Block has been emitted and can no longer be modified");
        }
    }

    private void checkBounds(int column, int row) {
        if (column < 0 || column >= columns.length) {
            throw new IndexOutOfBoundsException("Invalid column index: " + column);
        }
        if (row < 0 || row >= numRows) {
            throw new IndexOutOfBoundsException("Invalid row index: " + row);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ColumnBlock[").append(numRows).append('x')
                .append(columns.length).append(']');
        for (FlexibleValue[] column : columns) {
            sb.append(Arrays.toString(column));
        }
        return sb.toString();
    }
}
