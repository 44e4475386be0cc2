package com.pipeline.timeseries.operators;

import com.pipeline.timeseries.core.GapFillStrategy;
import com.pipeline.timeseries.model.TimeGranularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;

/**
 * 日历补齐策略。
 * 在相邻两个已有时间戳之间，从前一个时间戳起按粒度逐步前进，
 * 每个不存在的时间点都视为缺口。
 *
 * 参数：
 * - maxGapSteps: 单个缺口最多补齐的步数，超过则整段跳过（默认不限制）
 */
public class CalendarGapFillStrategy implements GapFillStrategy {

    private static final Logger log = LoggerFactory.getLogger(CalendarGapFillStrategy.class);

    private final int maxGapSteps;

    public CalendarGapFillStrategy() {
        this(Integer.MAX_VALUE);
    }

    public CalendarGapFillStrategy(int maxGapSteps) {
        if (maxGapSteps < 1) {
            throw new IllegalArgumentException("maxGapSteps must be positive, got: " + maxGapSteps);
        }
        this.maxGapSteps = maxGapSteps;
    }

    @Override
    public String getName() {
        return "calendar";
    }

    public int getMaxGapSteps() {
        return maxGapSteps;
    }

    @Override
    public List<LocalDateTime> missingTimestamps(NavigableSet<LocalDateTime> existing, TimeGranularity granularity) {
        List<LocalDateTime> result = new ArrayList<>();
        if (existing.size() < 2) {
            return result;
        }

        Iterator<LocalDateTime> it = existing.iterator();
        LocalDateTime prev = it.next();
        while (it.hasNext()) {
            LocalDateTime curr = it.next();
            List<LocalDateTime> gap = new ArrayList<>();
            for (LocalDateTime ts = granularity.next(prev); ts.isBefore(curr); ts = granularity.next(ts)) {
                if (accept(ts)) {
                    gap.add(ts);
                    if (gap.size() > maxGapSteps) {
                        break;
                    }
                }
            }
            if (gap.size() > maxGapSteps) {
                log.debug("Gap between {} and {} exceeds {} steps, skipped.", prev, curr, maxGapSteps);
            } else {
                result.addAll(gap);
            }
            prev = curr;
        }
        return result;
    }

    /**
     * 候选时间点是否需要补齐，子类可排除非交易时间等
     */
    protected boolean accept(LocalDateTime candidate) {
        return true;
    }
}
