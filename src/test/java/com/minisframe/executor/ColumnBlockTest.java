package com.minisframe.executor;

import com.minisframe.common.AllocationFailureException;
import com.minisframe.flexible.FlexTypeEnum;
import com.minisframe.flexible.FlexibleValue;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 列块测试
 *
 * @author Mini-SFrame
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ColumnBlockTest {

    /**
     * 测试新块为空
     */
    @Test
    @Order(1)
    void testNewBlock() {
        ColumnBlock block = new ColumnBlock(8);
        assertEquals(8, block.getCapacity());
        assertEquals(0, block.getNumRows());
        assertEquals(0, block.getNumColumns());
        assertFalse(block.isSealed());
        assertThrows(IllegalArgumentException.class, () -> new ColumnBlock(0));
    }

    /**
     * 测试调整形状后所有列等长，单元格初始化为 UNDEFINED
     */
    @Test
    @Order(2)
    void testResize() throws AllocationFailureException {
        ColumnBlock block = new ColumnBlock(8);
        block.resize(3, 5);

        assertEquals(3, block.getNumColumns());
        assertEquals(5, block.getNumRows());
        for (int c = 0; c < 3; c++) {
            assertEquals(5, block.getColumn(c).size());
        }
        assertEquals(FlexTypeEnum.UNDEFINED, block.getValue(2, 4).getType());
    }

    /**
     * 测试超过容量的分配失败
     */
    @Test
    @Order(3)
    void testResizeBeyondCapacity() {
        ColumnBlock block = new ColumnBlock(4);
        assertThrows(AllocationFailureException.class, () -> block.resize(1, 5));
        assertThrows(AllocationFailureException.class, () -> block.resize(1, -1));
        assertThrows(AllocationFailureException.class, () -> block.resize(0, 2));
    }

    /**
     * 测试读写
     */
    @Test
    @Order(4)
    void testSetAndGet() throws AllocationFailureException {
        ColumnBlock block = new ColumnBlock(4);
        block.resize(2, 2);
        block.setValue(0, 1, FlexibleValue.of(7L));
        block.setValue(1, 0, FlexibleValue.of("x"));

        assertEquals(FlexibleValue.of(7L), block.getValue(0, 1));
        assertEquals(FlexibleValue.of("x"), block.getValue(1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> block.getValue(0, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> block.getValue(2, 0));
        assertThrows(IllegalArgumentException.class, () -> block.setValue(0, 0, null));
        assertThrows(UnsupportedOperationException.class,
                () -> block.getColumn(0).set(0, FlexibleValue.of(1L)));
    }

    /**
     * 测试封存后不可修改
     */
    @Test
    @Order(5)
    void testSealed() throws AllocationFailureException {
        ColumnBlock block = new ColumnBlock(4);
        block.resize(1, 1);
        block.seal();

        assertTrue(block.isSealed());
        assertThrows(IllegalStateException.class, () -> block.setValue(0, 0, FlexibleValue.of(1L)));
        assertThrows(IllegalStateException.class, () -> block.resize(1, 2));
    }
}
