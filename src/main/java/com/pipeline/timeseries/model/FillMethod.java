package com.pipeline.timeseries.model;

/**
 * 缺口时间戳的填充方式
 */
public enum FillMethod {
    /** 插入空快照 */
    EMPTY,
    /** 零阶保持：复制前一个时间戳的快照 */
    ZERO_ORDER_HOLD
}
