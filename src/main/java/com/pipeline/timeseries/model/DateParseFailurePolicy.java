package com.pipeline.timeseries.model;

/**
 * 数据行日期无法解析时的处理策略
 */
public enum DateParseFailurePolicy {
    /** 写入哨兵时间戳（默认，与历史行为一致） */
    SENTINEL,
    /** 丢弃该行并记入导入报告 */
    SKIP_ROW
}
