package com.minisframe.common;

/**
 * 输出缓冲区分配失败
 *
 * 块无法按请求的形状分配（列数或行数非法、行数超过容量）。不重试，直接中止算子。
 *
 * @author Mini-SFrame
 */
public class AllocationFailureException extends QueryEvalException {

    public AllocationFailureException(String message) {
        super(message);
    }
}
