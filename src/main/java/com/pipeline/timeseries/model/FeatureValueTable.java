package com.pipeline.timeseries.model;

import com.pipeline.timeseries.core.ValueType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 单一时刻的观测快照：资产 -> 特征 -> 数值。
 *
 * 同一 (资产, 特征) 只保存第一次写入的值，后续写入被静默忽略。
 * 资产与特征的遍历顺序由HashMap决定，不保证跨运行稳定。
 *
 * @param <T> 数值类型
 */
public class FeatureValueTable<T> {

    private final ValueType<T> valueType;

    /** asset -> (feature -> value) */
    private final Map<String, Map<String, T>> values;

    /** 只读视图与源表共享同一份映射 */
    private final boolean readOnly;

    public FeatureValueTable(ValueType<T> valueType) {
        this(valueType, new HashMap<>(), false);
    }

    private FeatureValueTable(ValueType<T> valueType, Map<String, Map<String, T>> values, boolean readOnly) {
        if (valueType == null) {
            throw new IllegalArgumentException("Value type must not be null");
        }
        this.valueType = valueType;
        this.values = values;
        this.readOnly = readOnly;
    }

    /**
     * 写入 (asset, feature) 的值，仅当该位置尚无值时生效。
     *
     * @throws UnsupportedOperationException 当前对象为只读视图
     * @throws IllegalArgumentException      value为null
     */
    public void set(String asset, String feature, T value) {
        if (readOnly) {
            throw new UnsupportedOperationException("Read-only view of a feature value table");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value for '" + asset + "." + feature + "' must not be null");
        }
        values.computeIfAbsent(asset, k -> new HashMap<>()).putIfAbsent(feature, value);
    }

    /**
     * 读取 (asset, feature) 的值；不存在时返回数值类型的默认值。
     * 无法区分"不存在"与"存储的就是默认值"，需要区分时使用 {@link #find}。
     */
    public T get(String asset, String feature) {
        return find(asset, feature).orElse(valueType.defaultValue());
    }

    public Optional<T> find(String asset, String feature) {
        Map<String, T> features = values.get(asset);
        if (features == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(features.get(feature));
    }

    public boolean contains(String asset, String feature) {
        Map<String, T> features = values.get(asset);
        return features != null && features.containsKey(feature);
    }

    /** 已记录的资产数量 */
    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<String> getAssets() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Set<String> getFeatures(String asset) {
        Map<String, T> features = values.get(asset);
        return features == null ? Collections.emptySet() : Collections.unmodifiableSet(features.keySet());
    }

    public ValueType<T> getValueType() {
        return valueType;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /** 共享底层数据的只读视图 */
    public FeatureValueTable<T> readOnlyView() {
        return readOnly ? this : new FeatureValueTable<>(valueType, values, true);
    }

    /** 深拷贝，返回可写副本 */
    public FeatureValueTable<T> copy() {
        Map<String, Map<String, T>> copied = new HashMap<>();
        values.forEach((asset, features) -> copied.put(asset, new HashMap<>(features)));
        return new FeatureValueTable<>(valueType, copied, false);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        values.forEach((asset, features) -> {
            sb.append('\t').append(asset).append(":\n\t\t");
            features.forEach((feature, value) -> sb.append(feature).append(": ")
                    .append(valueType.render(value)).append('\t'));
            sb.append('\n');
        });
        return sb.toString();
    }
}
