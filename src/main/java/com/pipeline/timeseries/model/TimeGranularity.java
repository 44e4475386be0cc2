package com.pipeline.timeseries.model;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 补齐时间缺口时使用的时间粒度
 */
public enum TimeGranularity {
    /** 逐秒 */
    SECOND(ChronoUnit.SECONDS),
    /** 逐分钟 */
    MINUTE(ChronoUnit.MINUTES),
    /** 逐小时 */
    HOURLY(ChronoUnit.HOURS),
    /** 逐日 */
    DAILY(ChronoUnit.DAYS),
    /** 逐周 */
    WEEKLY(ChronoUnit.WEEKS);

    private final ChronoUnit unit;

    TimeGranularity(ChronoUnit unit) {
        this.unit = unit;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    public LocalDateTime next(LocalDateTime timestamp) {
        return timestamp.plus(1, unit);
    }
}
