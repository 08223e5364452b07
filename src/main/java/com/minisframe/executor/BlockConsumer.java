package com.minisframe.executor;

import com.minisframe.common.QueryEvalException;

/**
 * 根阶段输出块的消费者
 *
 * 抛出异常会取消整个执行
 *
 * @author Mini-SFrame
 */
@FunctionalInterface
public interface BlockConsumer {

    void accept(ColumnBlock block) throws QueryEvalException;
}
