package com.pipeline.timeseries.operators;

import com.pipeline.timeseries.model.TimeGranularity;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class CalendarGapFillStrategyTest {

    private static LocalDateTime at(int day, int hour) {
        return LocalDateTime.of(2020, 1, day, hour, 0);
    }

    @Test
    void dailyGapsBetweenExistingTimestamps() {
        TreeSet<LocalDateTime> existing = new TreeSet<>(List.of(at(1, 0), at(4, 0), at(5, 0)));

        List<LocalDateTime> missing = new CalendarGapFillStrategy()
                .missingTimestamps(existing, TimeGranularity.DAILY);

        assertEquals(List.of(at(2, 0), at(3, 0)), missing);
    }

    @Test
    void hourlyGapsStayInsideRange() {
        TreeSet<LocalDateTime> existing = new TreeSet<>(List.of(at(1, 22), at(2, 1)));

        List<LocalDateTime> missing = new CalendarGapFillStrategy()
                .missingTimestamps(existing, TimeGranularity.HOURLY);

        assertEquals(List.of(at(1, 23), at(2, 0)), missing);
    }

    @Test
    void noGapsForContiguousOrTinySeries() {
        CalendarGapFillStrategy strategy = new CalendarGapFillStrategy();

        assertTrue(strategy.missingTimestamps(new TreeSet<>(), TimeGranularity.DAILY).isEmpty());
        assertTrue(strategy.missingTimestamps(new TreeSet<>(List.of(at(1, 0))), TimeGranularity.DAILY).isEmpty());
        assertTrue(strategy.missingTimestamps(new TreeSet<>(List.of(at(1, 0), at(2, 0))), TimeGranularity.DAILY).isEmpty());
    }

    @Test
    void longGapsAreSkipped() {
        TreeSet<LocalDateTime> existing = new TreeSet<>(List.of(at(1, 0), at(3, 0), at(10, 0)));

        List<LocalDateTime> missing = new CalendarGapFillStrategy(2)
                .missingTimestamps(existing, TimeGranularity.DAILY);

        // 1 -> 3 has one missing day, 3 -> 10 has six and exceeds the limit
        assertEquals(List.of(at(2, 0)), missing);
    }

    @Test
    void maxGapStepsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new CalendarGapFillStrategy(0));
    }
}
