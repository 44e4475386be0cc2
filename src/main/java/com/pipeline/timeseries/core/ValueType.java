package com.pipeline.timeseries.core;

/**
 * 数值类型接口：存储中所有观测值的类型契约。
 *
 * 存储对值类型只要求三种能力：
 *   默认值、从文本解析、渲染为文本
 *
 * 实现约定：
 * - parse 永不抛出异常，空白或格式错误的文本返回 defaultValue()
 * - parse 与 defaultValue 永不返回 null
 * - 实现应为无状态对象，可在多个存储实例间共享
 *
 * @param <T> 数值类型
 */
public interface ValueType<T> {

    /**
     * 类型名称，用于配置文件中选择值类型。
     *
     * @return 名称，如 DOUBLE
     */
    String getName();

    /**
     * 返回类型的默认值。
     * 查询未命中以及解析失败时都返回此值。
     *
     * @return 默认值，如 0.0
     */
    T defaultValue();

    /**
     * 把CSV中的原始文本转换为值。
     * 首尾空白被忽略；无法解析时返回 defaultValue()。
     *
     * @param text 原始文本，可能为null
     * @return 解析结果
     */
    T parse(String text);

    /**
     * 把值渲染为文本，用于存储的文本输出。
     *
     * @param value 值
     * @return 文本表示
     */
    String render(T value);
}
