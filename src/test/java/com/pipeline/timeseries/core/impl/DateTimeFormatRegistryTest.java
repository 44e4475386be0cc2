package com.pipeline.timeseries.core.impl;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DateTimeFormatRegistryTest {

    @Test
    void builtInFormatsInOrder() {
        DateTimeFormatRegistry registry = DateTimeFormatRegistry.withDefaults();
        assertEquals(List.of("%Y-%m-%d", "%Y-%m-%d %H:%M", "%Y-%m-%d %H:%M:%S"), registry.getPatterns());

        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 0, 0)), registry.parse("2020-03-14"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 8, 30)), registry.parse("2020-03-14 08:30"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 8, 30, 15)), registry.parse("2020-03-14 08:30:15"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 0, 0)), registry.parse("  2020-03-14 "));
    }

    @Test
    void unparseableTextYieldsEmpty() {
        DateTimeFormatRegistry registry = DateTimeFormatRegistry.withDefaults();
        assertTrue(registry.parse("not a date").isEmpty());
        assertTrue(registry.parse("").isEmpty());
        assertTrue(registry.parse(null).isEmpty());
        assertTrue(registry.parse("14-03-2020").isEmpty());
    }

    @Test
    void invalidCalendarDatesAreNotRolledOver() {
        DateTimeFormatRegistry registry = DateTimeFormatRegistry.withDefaults();
        assertTrue(registry.parse("2021-02-30").isEmpty());
        assertTrue(registry.parse("2021-13-01").isEmpty());
        assertTrue(registry.parse("2021-01-01 24:00").isEmpty());
        assertEquals(Optional.of(LocalDateTime.of(2024, 2, 29, 0, 0)), registry.parse("2024-02-29"));
    }

    @Test
    void registeredFormatIsTriedAfterBuiltIns() {
        DateTimeFormatRegistry registry = DateTimeFormatRegistry.withDefaults();
        registry.register("%d-%m-%Y");

        assertEquals(4, registry.size());
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 0, 0)), registry.parse("14-03-2020"));
    }

    @Test
    void supportsTextualAndTwelveHourDirectives() {
        DateTimeFormatRegistry registry = new DateTimeFormatRegistry();
        registry.register("%d %b %Y");
        registry.register("%m/%d/%Y %I:%M %p");

        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 0, 0)), registry.parse("14 Mar 2020"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 20, 5)), registry.parse("03/14/2020 08:05 PM"));
    }

    @Test
    void numericFieldsAcceptMissingLeadingZero() {
        DateTimeFormatRegistry registry = DateTimeFormatRegistry.withDefaults();
        registry.register("%m/%d/%Y");

        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 5, 0, 0)), registry.parse("2020-3-5"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 5, 8, 30)), registry.parse("2020-03-05 8:30"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 5, 8, 3, 7)), registry.parse("2020-3-5 8:3:7"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 5, 0, 0)), registry.parse("3/5/2020"));
        assertTrue(registry.parse("2020-003-05").isEmpty());
    }

    @Test
    void compactFormatsKeepFixedWidth() {
        DateTimeFormatRegistry registry = new DateTimeFormatRegistry();
        registry.register("%Y%m%d");
        registry.register("%Y%m%d %H%M");

        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 5, 0, 0)), registry.parse("20200305"));
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 5, 8, 30)), registry.parse("20200305 0830"));
    }

    @Test
    void unresolvedTimeFieldsDoNotCollapseToMidnight() {
        DateTimeFormatRegistry registry = new DateTimeFormatRegistry();
        registry.register("%Y-%m-%d %I:%M");

        assertTrue(registry.parse("2020-03-05 03:30").isEmpty());

        registry.register("%Y-%m-%d %I:%M %p");
        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 5, 15, 30)), registry.parse("2020-03-05 03:30 pm"));
    }

    @Test
    void sentinelMatchesAreDistinguishedFromGarbage() {
        DateTimeFormatRegistry registry = DateTimeFormatRegistry.withDefaults();

        assertTrue(registry.parsesToSentinel("1970-01-01"));
        assertTrue(registry.parsesToSentinel(" 1970-01-01 00:00 "));
        assertFalse(registry.parsesToSentinel("garbage"));
        assertFalse(registry.parsesToSentinel("2020-01-01"));
        assertFalse(registry.parsesToSentinel(null));
    }

    @Test
    void javaPatternsAreAccepted() {
        DateTimeFormatRegistry registry = new DateTimeFormatRegistry();
        registry.register("dd/MM/yyyy HH:mm");

        assertEquals(Optional.of(LocalDateTime.of(2020, 3, 14, 9, 45)), registry.parse("14/03/2020 09:45"));
        assertTrue(registry.parse("31/02/2020 09:45").isEmpty());
    }

    @Test
    void sentinelValueCountsAsFailure() {
        DateTimeFormatRegistry registry = DateTimeFormatRegistry.withDefaults();
        assertTrue(registry.parse("1970-01-01").isEmpty());
        assertTrue(registry.parse("1970-01-01 00:00").isEmpty());
        assertTrue(registry.parse("1970-01-01 00:00:01").isPresent());
    }

    @Test
    void invalidPatternsAreRejected() {
        DateTimeFormatRegistry registry = new DateTimeFormatRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("%Q"));
        assertThrows(IllegalArgumentException.class, () -> registry.register("%Y-%"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(""));
        assertThrows(IllegalArgumentException.class, () -> registry.register("{bad"));
        assertEquals(0, registry.size());
    }

    @Test
    void copyDoesNotShareRegistrations() {
        DateTimeFormatRegistry original = DateTimeFormatRegistry.withDefaults();
        DateTimeFormatRegistry copy = new DateTimeFormatRegistry(original);
        copy.register("%d-%m-%Y");

        assertEquals(3, original.size());
        assertEquals(4, copy.size());
    }
}
