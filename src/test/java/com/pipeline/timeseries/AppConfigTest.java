package com.pipeline.timeseries;

import com.pipeline.timeseries.core.impl.DefaultTimeSeriesStore;
import com.pipeline.timeseries.core.impl.NumericValueTypes;
import com.pipeline.timeseries.model.DateParseFailurePolicy;
import com.pipeline.timeseries.model.FillMethod;
import com.pipeline.timeseries.model.TimeGranularity;
import com.pipeline.timeseries.operators.BusinessDayGapFillStrategy;
import com.pipeline.timeseries.operators.CalendarGapFillStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir Path tmp;

    @Test
    void defaults() {
        AppConfig config = AppConfig.defaults();

        assertEquals("DOUBLE", config.getValueType());
        assertTrue(config.getDateFormats().isEmpty());
        assertEquals(DateParseFailurePolicy.SENTINEL, config.getDateParseFailurePolicy());
        assertNull(config.createGapFillStrategy());
        assertFalse(config.isRemoveEmptyAfterIngest());

        DefaultTimeSeriesStore<?> store = config.createStore();
        assertSame(NumericValueTypes.DOUBLE, store.getValueType());
        assertEquals(3, store.getDateFormats().size());
        assertNull(store.getGapFillStrategy());
    }

    @Test
    void loadFromFile() throws IOException {
        Path file = tmp.resolve("store.properties");
        Files.writeString(file, String.join("\n",
                "store.value.type=long",
                "store.remove.empty.after.ingest=true",
                "date.formats=%d-%m-%Y | %Y/%m/%d",
                "date.failure.policy=skip_row",
                "gapfill.strategy=business_day",
                "gapfill.granularity=HOURLY",
                "gapfill.method=ZERO_ORDER_HOLD",
                "gapfill.max.steps=10"));

        AppConfig config = AppConfig.load(file);

        assertEquals("LONG", config.getValueType());
        assertTrue(config.isRemoveEmptyAfterIngest());
        assertEquals(List.of("%d-%m-%Y", "%Y/%m/%d"), config.getDateFormats());
        assertEquals(DateParseFailurePolicy.SKIP_ROW, config.getDateParseFailurePolicy());
        assertEquals(TimeGranularity.HOURLY, config.getGapFillGranularity());
        assertEquals(FillMethod.ZERO_ORDER_HOLD, config.getGapFillMethod());
        assertInstanceOf(BusinessDayGapFillStrategy.class, config.createGapFillStrategy());
        assertEquals(10, ((CalendarGapFillStrategy) config.createGapFillStrategy()).getMaxGapSteps());

        DefaultTimeSeriesStore<?> store = config.createStore();
        assertSame(NumericValueTypes.LONG, store.getValueType());
        assertEquals(5, store.getDateFormats().size());
        assertEquals(DateParseFailurePolicy.SKIP_ROW, store.getDateParseFailurePolicy());
        assertEquals(FillMethod.ZERO_ORDER_HOLD, store.getGapFillMethod());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty("store.value.type", "STRING");
        props.setProperty("date.formats", "%Q|%d-%m-%Y");
        props.setProperty("date.failure.policy", "explode");
        props.setProperty("gapfill.strategy", "linear");
        props.setProperty("gapfill.granularity", "fortnightly");
        props.setProperty("gapfill.max.steps", "-3");

        AppConfig config = AppConfig.fromProperties(props);

        assertEquals("DOUBLE", config.getValueType());
        assertEquals(List.of("%d-%m-%Y"), config.getDateFormats());
        assertEquals(DateParseFailurePolicy.SENTINEL, config.getDateParseFailurePolicy());
        assertEquals("NONE", config.getGapFillStrategy());
        assertEquals(TimeGranularity.DAILY, config.getGapFillGranularity());
        assertEquals(Integer.MAX_VALUE, config.getGapFillMaxSteps());
    }

    @Test
    void missingFileUsesDefaults() {
        AppConfig config = AppConfig.load(tmp.resolve("nope.properties"));
        assertEquals("DOUBLE", config.getValueType());
        assertEquals("NONE", config.getGapFillStrategy());
    }

    @Test
    void bundledResourceLoads() {
        AppConfig config = AppConfig.loadResource(AppConfig.DEFAULT_RESOURCE);
        assertEquals(List.of("%d-%m-%Y"), config.getDateFormats());

        AppConfig missing = AppConfig.loadResource("does-not-exist.properties");
        assertTrue(missing.getDateFormats().isEmpty());
    }
}
