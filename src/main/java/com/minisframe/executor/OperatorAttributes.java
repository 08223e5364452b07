package com.minisframe.executor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 算子属性
 *
 * attributeBitfield 是属性位集合，numInputs 是输入数量，
 * {@link #VARIABLE_INPUTS} 表示输入数量由节点决定
 *
 * @author Mini-SFrame
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OperatorAttributes {

    public static final int NONE = 0;

    /** 源算子：没有输入，自己产生数据 */
    public static final int SOURCE = 1;

    /** 线性算子：输出行与输入行一一对应 */
    public static final int LINEAR = 2;

    /** 可变输入数量，注册表不做数量检查 */
    public static final int VARIABLE_INPUTS = -1;

    private final int attributeBitfield;

    private final int numInputs;

    public OperatorAttributes(int attributeBitfield, int numInputs) {
        if (numInputs < VARIABLE_INPUTS) {
            throw new IllegalArgumentException("Invalid numInputs: " + numInputs);
        }
        if (((attributeBitfield & SOURCE) != 0) != (numInputs == 0)) {
            throw new IllegalArgumentException("SOURCE attribute must be set exactly when numInputs is 0");
        }
        this.attributeBitfield = attributeBitfield;
        this.numInputs = numInputs;
    }

    public static OperatorAttributes source() {
        return new OperatorAttributes(SOURCE, 0);
    }

    public boolean isSource() {
        return (attributeBitfield & SOURCE) != 0;
    }

    public boolean hasVariableInputs() {
        return numInputs == VARIABLE_INPUTS;
    }

    public boolean isLinear() {
        return (attributeBitfield & LINEAR) != 0;
    }
}
