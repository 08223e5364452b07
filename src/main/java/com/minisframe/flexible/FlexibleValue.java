package com.minisframe.flexible;

import com.minisframe.common.TypeMismatchException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 标量值（封闭的带标签联合类型）
 *
 * 计划节点参数和列块中的单元格都使用该类型表示。
 * 变体集合是封闭的：构造函数私有，只能通过静态工厂创建，
 * 所有消费方都对 {@link FlexTypeEnum} 做穷举 switch。
 *
 * 比较规则:
 * - INTEGER 与 FLOAT 之间按数值比较
 * - STRING 之间按字典序比较
 * - 其余情况按类型标签顺序比较（UNDEFINED 最小）
 *
 * 注意: 自然顺序与 equals 不一致（同 {@link java.math.BigDecimal}）。
 * of(1L).compareTo(of(1.0)) == 0，但 equals 比较类型标签和值，二者不相等。
 * 用作 TreeMap/TreeSet 的键时 1 和 1.0 是同一个键，用作 HashMap 的键时是两个键。
 *
 * @author Mini-SFrame
 */
public abstract class FlexibleValue implements Comparable<FlexibleValue> {

    private static final UndefinedValue UNDEFINED = new UndefinedValue();

    private FlexibleValue() {
    }

    public static FlexibleValue of(long value) {
        return new IntegerValue(value);
    }

    public static FlexibleValue of(double value) {
        return new FloatValue(value);
    }

    public static FlexibleValue of(String value) {
        if (value == null) {
            return UNDEFINED;
        }
        return new StringValue(value);
    }

    public static FlexibleValue undefined() {
        return UNDEFINED;
    }

    /**
     * 获取类型标签
     */
    public abstract FlexTypeEnum getType();

    /**
     * 提取为整数
     *
     * FLOAT 仅在有限且为整数值时可转换
     *
     * @return 整数值
     * @throws TypeMismatchException 无法无损转换为整数时抛出
     */
    public long toInteger() throws TypeMismatchException {
        switch (getType()) {
            case INTEGER:
                return ((IntegerValue) this).getValue();
            case FLOAT:
                double d = ((FloatValue) this).getValue();
                if (Double.isFinite(d) && d == Math.rint(d)
                        && d >= Long.MIN_VALUE && d < 0x1p63) {
                    return (long) d;
                }
                throw new TypeMismatchException("Cannot convert non-integral float to integer: " + d);
            case STRING:
            case UNDEFINED:
                throw new TypeMismatchException("Cannot convert " + getType() + " to integer: " + this);
            default:
                throw new IllegalStateException("Unknown type: " + getType());
        }
    }

    /**
     * 按数值、字典序或类型标签比较，与 equals 不一致，见类注释
     */
    @Override
    public int compareTo(FlexibleValue other) {
        FlexTypeEnum left = getType();
        FlexTypeEnum right = other.getType();

        if (isNumeric(left) && isNumeric(right)) {
            if (left == FlexTypeEnum.INTEGER && right == FlexTypeEnum.INTEGER) {
                return Long.compare(((IntegerValue) this).getValue(), ((IntegerValue) other).getValue());
            }
            return Double.compare(asDouble(), other.asDouble());
        }

        if (left != right) {
            return left.compareTo(right);
        }

        switch (left) {
            case STRING:
                return ((StringValue) this).getValue().compareTo(((StringValue) other).getValue());
            case UNDEFINED:
                return 0;
            case INTEGER:
            case FLOAT:
            default:
                throw new IllegalStateException("Unknown type: " + left);
        }
    }

    private static boolean isNumeric(FlexTypeEnum type) {
        switch (type) {
            case INTEGER:
            case FLOAT:
                return true;
            case STRING:
            case UNDEFINED:
                return false;
            default:
                throw new IllegalStateException("Unknown type: " + type);
        }
    }

    private double asDouble() {
        switch (getType()) {
            case INTEGER:
                return ((IntegerValue) this).getValue();
            case FLOAT:
                return ((FloatValue) this).getValue();
            case STRING:
            case UNDEFINED:
            default:
                throw new IllegalStateException("Not a numeric value: " + getType());
        }
    }

    /**
     * 整数值
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class IntegerValue extends FlexibleValue {
        private final long value;

        private IntegerValue(long value) {
            this.value = value;
        }

        @Override
        public FlexTypeEnum getType() {
            return FlexTypeEnum.INTEGER;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * 浮点值
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class FloatValue extends FlexibleValue {
        private final double value;

        private FloatValue(double value) {
            this.value = value;
        }

        @Override
        public FlexTypeEnum getType() {
            return FlexTypeEnum.FLOAT;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * 字符串值
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class StringValue extends FlexibleValue {
        private final String value;

        private StringValue(String value) {
            this.value = value;
        }

        @Override
        public FlexTypeEnum getType() {
            return FlexTypeEnum.STRING;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * 未定义值（单例）
     */
    public static final class UndefinedValue extends FlexibleValue {

        private UndefinedValue() {
        }

        @Override
        public FlexTypeEnum getType() {
            return FlexTypeEnum.UNDEFINED;
        }

        @Override
        public String toString() {
            return "UNDEFINED";
        }
    }
}
