package com.pipeline.timeseries.core;

import com.pipeline.timeseries.model.TimeGranularity;

import java.time.LocalDateTime;
import java.util.List;
import java.util.NavigableSet;

/**
 * 时间缺口补齐策略接口。
 *
 * 策略只负责回答"按某个粒度，哪些时间戳缺失"，
 * 如何填充这些时间戳（空快照或零阶保持）由存储决定。
 * 同一策略可以在不同粒度下复用，例如按日补齐日线数据、按分钟补齐分钟线数据。
 *
 * 实现约定：
 * - 只在已有时间戳的首尾范围内寻找缺口，不向外延伸
 * - 返回的时间戳必须升序，且不包含已存在的时间戳
 * - 不得修改传入的集合
 */
public interface GapFillStrategy {

    /**
     * 策略名称，用于日志与配置。
     *
     * @return 名称
     */
    String getName();

    /**
     * 计算缺失的时间戳。
     *
     * @param existing    已存在的时间戳，升序且只读；不包含哨兵时间戳
     * @param granularity 补齐粒度
     * @return 需要插入的时间戳，升序；无缺口时返回空列表（非null）
     */
    List<LocalDateTime> missingTimestamps(NavigableSet<LocalDateTime> existing, TimeGranularity granularity);
}
