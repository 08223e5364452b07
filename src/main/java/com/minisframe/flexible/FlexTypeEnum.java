package com.minisframe.flexible;

/**
 * 标量值类型标签
 *
 * 声明顺序即跨类型比较时的排序顺序
 *
 * @author Mini-SFrame
 */
public enum FlexTypeEnum {
    /** 未定义（缺失值） */
    UNDEFINED,
    /** 64 位整数 */
    INTEGER,
    /** 双精度浮点 */
    FLOAT,
    /** 字符串 */
    STRING
}
