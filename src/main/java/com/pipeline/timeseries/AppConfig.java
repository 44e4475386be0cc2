package com.pipeline.timeseries;

import com.pipeline.timeseries.core.GapFillStrategy;
import com.pipeline.timeseries.core.ValueType;
import com.pipeline.timeseries.core.impl.DateTimeFormatRegistry;
import com.pipeline.timeseries.core.impl.DefaultTimeSeriesStore;
import com.pipeline.timeseries.core.impl.NumericValueTypes;
import com.pipeline.timeseries.model.DateParseFailurePolicy;
import com.pipeline.timeseries.model.FillMethod;
import com.pipeline.timeseries.model.TimeGranularity;
import com.pipeline.timeseries.operators.BusinessDayGapFillStrategy;
import com.pipeline.timeseries.operators.CalendarGapFillStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的存储参数，缺失或非法的配置项使用默认值。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String DEFAULT_RESOURCE = "timeseries-store.properties";

    // ---- 存储 ----
    private String valueType = "DOUBLE";
    private boolean removeEmptyAfterIngest = false;

    // ---- 日期解析 ----
    private List<String> dateFormats = Collections.emptyList();
    private DateParseFailurePolicy dateParseFailurePolicy = DateParseFailurePolicy.SENTINEL;

    // ---- 缺口补齐 ----
    private String gapFillStrategy = "NONE";
    private TimeGranularity gapFillGranularity = TimeGranularity.DAILY;
    private FillMethod gapFillMethod = FillMethod.EMPTY;
    private int gapFillMaxSteps = Integer.MAX_VALUE;

    public static AppConfig defaults() {
        return new AppConfig();
    }

    /**
     * 从文件加载配置；文件不存在或无法读取时使用默认值。
     */
    public static AppConfig load(Path configPath) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return defaults();
        }
        return fromProperties(props);
    }

    /**
     * 从classpath加载配置；资源不存在时使用默认值。
     */
    public static AppConfig loadResource(String resourceName) {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                log.warn("Config resource '{}' not found, using defaults.", resourceName);
                return defaults();
            }
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load config resource '{}', using defaults. Error: {}", resourceName, e.getMessage());
            return defaults();
        }
        return fromProperties(props);
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();

        String type = props.getProperty("store.value.type", "DOUBLE").trim();
        try {
            NumericValueTypes.forName(type);
            config.valueType = type.toUpperCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid store.value.type '{}', using DOUBLE.", type);
        }
        config.removeEmptyAfterIngest = Boolean.parseBoolean(
                props.getProperty("store.remove.empty.after.ingest", "false").trim());

        String formats = props.getProperty("date.formats", "");
        List<String> parsedFormats = new ArrayList<>();
        DateTimeFormatRegistry probe = new DateTimeFormatRegistry();
        for (String format : formats.split("\\|")) {
            if (format.isBlank()) {
                continue;
            }
            try {
                probe.register(format.trim());
                parsedFormats.add(format.trim());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid date format '{}' in date.formats, ignoring. Error: {}", format.trim(), e.getMessage());
            }
        }
        config.dateFormats = Collections.unmodifiableList(parsedFormats);

        config.dateParseFailurePolicy = parseEnum(props, "date.failure.policy",
                DateParseFailurePolicy.class, DateParseFailurePolicy.SENTINEL);

        String strategy = props.getProperty("gapfill.strategy", "NONE").trim().toUpperCase(Locale.ROOT);
        if (strategy.equals("NONE") || strategy.equals("CALENDAR") || strategy.equals("BUSINESS_DAY")) {
            config.gapFillStrategy = strategy;
        } else {
            log.warn("Invalid gapfill.strategy '{}', using NONE.", strategy);
        }
        config.gapFillGranularity = parseEnum(props, "gapfill.granularity",
                TimeGranularity.class, TimeGranularity.DAILY);
        config.gapFillMethod = parseEnum(props, "gapfill.method", FillMethod.class, FillMethod.EMPTY);

        String maxSteps = props.getProperty("gapfill.max.steps");
        if (maxSteps != null && !maxSteps.isBlank()) {
            try {
                int value = Integer.parseInt(maxSteps.trim());
                if (value < 1) {
                    log.warn("gapfill.max.steps must be positive, got {}, ignoring.", value);
                } else {
                    config.gapFillMaxSteps = value;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid gapfill.max.steps '{}', ignoring.", maxSteps);
            }
        }

        return config;
    }

    private static <E extends Enum<E>> E parseEnum(Properties props, String key, Class<E> type, E defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} '{}', using {}.", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * 根据配置创建补齐策略；未配置时返回null
     */
    public GapFillStrategy createGapFillStrategy() {
        switch (gapFillStrategy) {
            case "CALENDAR":
                return new CalendarGapFillStrategy(gapFillMaxSteps);
            case "BUSINESS_DAY":
                return new BusinessDayGapFillStrategy(gapFillMaxSteps);
            default:
                return null;
        }
    }

    /**
     * 按配置的值类型创建存储
     */
    public DefaultTimeSeriesStore<?> createStore() {
        return createStore(NumericValueTypes.forName(valueType));
    }

    public <T> DefaultTimeSeriesStore<T> createStore(ValueType<T> type) {
        DefaultTimeSeriesStore<T> store = new DefaultTimeSeriesStore<>(type);
        store.addDateFormats(dateFormats);
        store.setDateParseFailurePolicy(dateParseFailurePolicy);
        store.setGapFillStrategy(createGapFillStrategy(), gapFillGranularity, gapFillMethod);
        return store;
    }

    // ---- Getters ----
    public String getValueType() { return valueType; }
    public boolean isRemoveEmptyAfterIngest() { return removeEmptyAfterIngest; }
    public List<String> getDateFormats() { return dateFormats; }
    public DateParseFailurePolicy getDateParseFailurePolicy() { return dateParseFailurePolicy; }
    public String getGapFillStrategy() { return gapFillStrategy; }
    public TimeGranularity getGapFillGranularity() { return gapFillGranularity; }
    public FillMethod getGapFillMethod() { return gapFillMethod; }
    public int getGapFillMaxSteps() { return gapFillMaxSteps; }

    @Override
    public String toString() {
        return "AppConfig{valueType=" + valueType
                + ", dateFormats=" + dateFormats
                + ", dateFailurePolicy=" + dateParseFailurePolicy
                + ", gapFill=" + gapFillStrategy + "/" + gapFillGranularity + "/" + gapFillMethod
                + ", removeEmptyAfterIngest=" + removeEmptyAfterIngest + "}";
    }
}
