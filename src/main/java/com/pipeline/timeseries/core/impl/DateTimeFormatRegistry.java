package com.pipeline.timeseries.core.impl;

import com.pipeline.timeseries.core.TimeSeriesStore;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 日期格式注册表。
 *
 * 按注册顺序逐个尝试，第一个能完整解析整个字符串、且结果不是哨兵时间戳的格式胜出。
 * 只含日期的格式解析为当天零点。解析是严格的，2021-02-30 这类日期不会被顺延。
 * %m %d %H %I %M %S 接受不补零的写法（2020-3-5、8:30），与strptime一致。
 *
 * 格式支持strftime风格的转换符：
 * %Y %y %m %d %e %H %I %M %S %f %p %b %B %j %%；
 * 不含%的格式按 java.time 模式处理。
 */
public class DateTimeFormatRegistry {

    private static final ChronoField[] TIME_FIELDS = {
            ChronoField.HOUR_OF_DAY, ChronoField.CLOCK_HOUR_OF_DAY,
            ChronoField.HOUR_OF_AMPM, ChronoField.CLOCK_HOUR_OF_AMPM, ChronoField.AMPM_OF_DAY,
            ChronoField.MINUTE_OF_HOUR, ChronoField.SECOND_OF_MINUTE, ChronoField.NANO_OF_SECOND
    };

    private final List<String> patterns = new ArrayList<>();
    private final List<DateTimeFormatter> formatters = new ArrayList<>();

    public DateTimeFormatRegistry() {}

    public DateTimeFormatRegistry(DateTimeFormatRegistry other) {
        this.patterns.addAll(other.patterns);
        this.formatters.addAll(other.formatters);
    }

    public static DateTimeFormatRegistry withDefaults() {
        DateTimeFormatRegistry registry = new DateTimeFormatRegistry();
        TimeSeriesStore.DEFAULT_DATE_FORMATS.forEach(registry::register);
        return registry;
    }

    /**
     * 追加一个格式到列表末尾。
     *
     * @throws IllegalArgumentException 格式为空或包含未知转换符
     */
    public void register(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Date format must not be null or empty");
        }
        DateTimeFormatter formatter = pattern.indexOf('%') >= 0
                ? fromStrftime(pattern)
                : fromJavaPattern(pattern);
        patterns.add(pattern);
        formatters.add(formatter);
    }

    public List<String> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public int size() {
        return patterns.size();
    }

    /**
     * 解析日期字符串。
     *
     * @param text 原始日期文本
     * @return 解析结果；所有格式都失败时为空
     */
    public Optional<LocalDateTime> parse(String text) {
        if (text == null) return Optional.empty();
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return Optional.empty();

        for (DateTimeFormatter formatter : formatters) {
            LocalDateTime parsed = parseWith(formatter, trimmed);
            if (parsed != null && !TimeSeriesStore.SENTINEL_TIMESTAMP.equals(parsed)) {
                return Optional.of(parsed);
            }
        }
        return Optional.empty();
    }

    /**
     * 是否有某个格式把文本解析成了哨兵时间戳。
     * 用于区分"无法解析"和"恰好等于哨兵"两种失败。
     */
    public boolean parsesToSentinel(String text) {
        if (text == null || text.isBlank()) return false;
        String trimmed = text.trim();
        for (DateTimeFormatter formatter : formatters) {
            if (TimeSeriesStore.SENTINEL_TIMESTAMP.equals(parseWith(formatter, trimmed))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 用单个格式解析；失败返回null。
     * 格式含时间字段但无法解析出完整时刻（如%I缺少%p）时视为失败，不退化为零点。
     */
    private static LocalDateTime parseWith(DateTimeFormatter formatter, String text) {
        TemporalAccessor accessor;
        try {
            accessor = formatter.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
        LocalDate date = accessor.query(TemporalQueries.localDate());
        if (date == null) {
            return null;
        }
        LocalTime time = accessor.query(TemporalQueries.localTime());
        if (time == null) {
            for (ChronoField field : TIME_FIELDS) {
                if (accessor.isSupported(field)) {
                    return null;
                }
            }
            time = LocalTime.MIDNIGHT;
        }
        return LocalDateTime.of(date, time);
    }

    static DateTimeFormatter fromStrftime(String pattern) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%') {
                builder.appendLiteral(c);
                continue;
            }
            if (i + 1 >= pattern.length()) {
                throw new IllegalArgumentException("Dangling '%' at end of date format: " + pattern);
            }
            char directive = pattern.charAt(++i);
            switch (directive) {
                case 'Y': builder.appendPattern("uuuu"); break;
                case 'y': builder.appendPattern("uu"); break;
                case 'm': appendNumber(builder, ChronoField.MONTH_OF_YEAR, pattern, i); break;
                case 'd': appendNumber(builder, ChronoField.DAY_OF_MONTH, pattern, i); break;
                case 'e': builder.appendPattern("d"); break;
                case 'H': appendNumber(builder, ChronoField.HOUR_OF_DAY, pattern, i); break;
                case 'I': appendNumber(builder, ChronoField.CLOCK_HOUR_OF_AMPM, pattern, i); break;
                case 'M': appendNumber(builder, ChronoField.MINUTE_OF_HOUR, pattern, i); break;
                case 'S': appendNumber(builder, ChronoField.SECOND_OF_MINUTE, pattern, i); break;
                case 'f': builder.appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false); break;
                case 'p': builder.appendPattern("a"); break;
                case 'b': builder.appendPattern("MMM"); break;
                case 'B': builder.appendPattern("MMMM"); break;
                case 'j': builder.appendPattern("DDD"); break;
                case '%': builder.appendLiteral('%'); break;
                default:
                    throw new IllegalArgumentException("Unsupported directive '%" + directive
                            + "' in date format: " + pattern);
            }
        }
        return builder.toFormatter(Locale.US).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * 两位数字段：前后是分隔符或边界时接受1到2位（如 2020-3-5、8:30），
     * 与另一个转换符直接相邻时必须是2位，否则 %Y%m%d 这类紧凑格式无法切分。
     */
    private static void appendNumber(DateTimeFormatterBuilder builder, ChronoField field,
                                     String pattern, int directiveIndex) {
        int next = directiveIndex + 1;
        boolean directiveFollows = next < pattern.length() && pattern.charAt(next) == '%';
        boolean directivePrecedes = directiveIndex >= 3 && pattern.charAt(directiveIndex - 3) == '%';
        if (directiveFollows || directivePrecedes) {
            builder.appendValue(field, 2);
        } else {
            builder.appendValue(field, 1, 2, SignStyle.NOT_NEGATIVE);
        }
    }

    static DateTimeFormatter fromJavaPattern(String pattern) {
        try {
            return new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    // yyyy在STRICT模式下需要纪元
                    .parseDefaulting(ChronoField.ERA, 1)
                    .toFormatter(Locale.US)
                    .withResolverStyle(ResolverStyle.STRICT);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid date format: " + pattern, e);
        }
    }
}
