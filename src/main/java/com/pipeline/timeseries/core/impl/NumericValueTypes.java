package com.pipeline.timeseries.core.impl;

import com.pipeline.timeseries.core.ValueType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * 内置数值类型。
 * 解析失败一律返回默认值，不抛异常。
 */
public final class NumericValueTypes {

    public static final ValueType<Double> DOUBLE = new ValueType<>() {
        @Override
        public String getName() { return "DOUBLE"; }

        @Override
        public Double defaultValue() { return 0.0; }

        @Override
        public Double parse(String text) {
            String trimmed = trimToNull(text);
            if (trimmed == null) return defaultValue();
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return defaultValue();
            }
        }

        @Override
        public String render(Double value) {
            // 整数值不输出多余的 .0
            if (!value.isInfinite() && !value.isNaN() && value == Math.rint(value)
                    && Math.abs(value) < 1e15) {
                return Long.toString(value.longValue());
            }
            return value.toString();
        }
    };

    public static final ValueType<Long> LONG = new ValueType<>() {
        @Override
        public String getName() { return "LONG"; }

        @Override
        public Long defaultValue() { return 0L; }

        @Override
        public Long parse(String text) {
            String trimmed = trimToNull(text);
            if (trimmed == null) return defaultValue();
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                return defaultValue();
            }
        }

        @Override
        public String render(Long value) { return value.toString(); }
    };

    public static final ValueType<Integer> INTEGER = new ValueType<>() {
        @Override
        public String getName() { return "INTEGER"; }

        @Override
        public Integer defaultValue() { return 0; }

        @Override
        public Integer parse(String text) {
            String trimmed = trimToNull(text);
            if (trimmed == null) return defaultValue();
            try {
                return Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                return defaultValue();
            }
        }

        @Override
        public String render(Integer value) { return value.toString(); }
    };

    public static final ValueType<BigDecimal> BIG_DECIMAL = new ValueType<>() {
        @Override
        public String getName() { return "BIG_DECIMAL"; }

        @Override
        public BigDecimal defaultValue() { return BigDecimal.ZERO; }

        @Override
        public BigDecimal parse(String text) {
            String trimmed = trimToNull(text);
            if (trimmed == null) return defaultValue();
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return defaultValue();
            }
        }

        @Override
        public String render(BigDecimal value) { return value.toPlainString(); }
    };

    private static final List<ValueType<?>> ALL = List.of(DOUBLE, LONG, INTEGER, BIG_DECIMAL);

    private NumericValueTypes() {}

    /**
     * 按名称查找内置类型，大小写不敏感。
     *
     * @throws IllegalArgumentException 名称未知
     */
    public static ValueType<?> forName(String name) {
        if (name != null) {
            String upper = name.trim().toUpperCase(Locale.ROOT);
            for (ValueType<?> type : ALL) {
                if (type.getName().equals(upper)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown value type '" + name + "', expected one of DOUBLE, LONG, INTEGER, BIG_DECIMAL");
    }

    private static String trimToNull(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
