package com.pipeline.timeseries.operators;

import com.pipeline.timeseries.core.TimeSeriesStore;

import java.time.LocalDateTime;

/**
 * 工作日补齐策略：与日历补齐相同，但跳过周六和周日。
 * 适用于只在交易日产生数据的行情序列。
 */
public class BusinessDayGapFillStrategy extends CalendarGapFillStrategy {

    private static final int SUNDAY = 0;
    private static final int SATURDAY = 6;

    public BusinessDayGapFillStrategy() {
        super();
    }

    public BusinessDayGapFillStrategy(int maxGapSteps) {
        super(maxGapSteps);
    }

    @Override
    public String getName() {
        return "business_day";
    }

    @Override
    protected boolean accept(LocalDateTime candidate) {
        int day = TimeSeriesStore.dayOfWeek(candidate);
        return day != SUNDAY && day != SATURDAY;
    }
}
