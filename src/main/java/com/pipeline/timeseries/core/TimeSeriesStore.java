package com.pipeline.timeseries.core;

import com.pipeline.timeseries.model.FeatureValueTable;
import com.pipeline.timeseries.model.FillMethod;
import com.pipeline.timeseries.model.IngestionReport;
import com.pipeline.timeseries.model.TimeGranularity;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;

/**
 * 时序存储接口：按时间索引的多资产、多特征观测数据集。
 *
 * 数据组织为两级结构：时间戳 -> 快照（资产 -> 特征 -> 数值）。
 * 时间戳始终升序；同一时间戳的多行数据合并到同一快照中。
 * 另外维护资产 -> 特征集合的索引，以及按优先级排列的日期格式列表。
 *
 * 使用方式：
 *   构造存储 → 可选地追加日期格式 → 多次导入CSV → 点查询或按时间遍历
 *
 * 实现约定：
 * - 每个资产只能导入一次，重复导入记录告警后直接返回
 * - 文件无法打开是唯一的致命错误，其余异常数据都被吸收并计入导入报告
 * - 对外只暴露只读视图，不暴露内部可变结构
 * - 不保证并发写安全，多线程写入需要调用方自行串行化
 *
 * @param <T> 数值类型
 */
public interface TimeSeriesStore<T> extends Iterable<Map.Entry<LocalDateTime, FeatureValueTable<T>>> {

    /** 日期无法解析时使用的哨兵时间戳 */
    LocalDateTime SENTINEL_TIMESTAMP = LocalDateTime.of(1970, 1, 1, 0, 0);

    /** 内置日期格式，按优先级排列 */
    List<String> DEFAULT_DATE_FORMATS = List.of("%Y-%m-%d", "%Y-%m-%d %H:%M", "%Y-%m-%d %H:%M:%S");

    // ==================== 导入 ====================

    /**
     * 导入一个CSV文件，资产标识取文件名（去掉目录和扩展名）。
     *
     * @param path CSV文件路径
     * @return 导入报告
     * @throws java.io.UncheckedIOException 文件无法打开或读取
     */
    IngestionReport ingest(Path path);

    /**
     * 导入一个CSV文件。
     * 表头第一列被忽略，其余列为特征名；数据行第一列为日期，其余列按位置对应特征。
     * 每行在切分前去掉可打印ASCII(32-126)以外的全部字符。
     *
     * @param assetId 资产标识；已存在时不做任何修改，返回 skipped 报告
     * @param path    CSV文件路径
     * @return 导入报告
     * @throws java.io.UncheckedIOException 文件无法打开或读取
     */
    IngestionReport ingest(String assetId, Path path);

    /**
     * 追加一个日期格式，排在已有格式之后。只影响之后的导入。
     * 支持strftime风格（%Y-%m-%d），不含%的模式按java.time模式处理。
     *
     * @param pattern 日期格式
     * @throws IllegalArgumentException 格式无法识别
     */
    void addDateFormat(String pattern);

    /**
     * 批量追加日期格式，保持传入顺序。
     *
     * @param patterns 日期格式列表
     */
    void addDateFormats(List<String> patterns);

    /**
     * @return 已注册的日期格式，按优先级排列
     */
    List<String> getDateFormats();

    // ==================== 查询 ====================

    boolean containsAsset(String assetId);

    boolean containsTimestamp(LocalDateTime timestamp);

    /**
     * @return 资产 -> 特征集合的只读视图
     */
    Map<String, Set<String>> getFeatures();

    /**
     * 点查询。时间戳、资产或特征任一不存在时返回值类型的默认值。
     *
     * @return 存储的值或默认值
     */
    T getData(LocalDateTime timestamp, String assetId, String feature);

    /**
     * 点查询，能区分"不存在"与"存储的就是默认值"。
     *
     * @return 存储的值；不存在时为空
     */
    Optional<T> findData(LocalDateTime timestamp, String assetId, String feature);

    /**
     * @return 指定时间戳快照的只读视图；时间戳不存在时为空
     */
    Optional<FeatureValueTable<T>> getSnapshot(LocalDateTime timestamp);

    /**
     * @return 全部时间戳的升序只读视图
     */
    NavigableSet<LocalDateTime> timestamps();

    /** 时间戳数量 */
    int size();

    boolean isEmpty();

    /**
     * 按时间降序遍历，快照为只读视图。
     */
    Iterator<Map.Entry<LocalDateTime, FeatureValueTable<T>>> descendingIterator();

    // ==================== 维护 ====================

    /**
     * 删除所有空快照对应的时间戳。
     *
     * @return 删除的时间戳数量
     */
    int removeEmptyTimestamps();

    /**
     * 使用配置的补齐策略填充时间缺口。
     * 未配置策略时只记录日志，不做任何修改。
     *
     * @return 插入的时间戳数量
     */
    int fillGaps();

    /**
     * 使用指定策略填充时间缺口。哨兵时间戳不参与缺口计算。
     *
     * @param strategy    缺口计算策略
     * @param granularity 补齐粒度
     * @param method      填充方式
     * @return 插入的时间戳数量
     */
    int fillGaps(GapFillStrategy strategy, TimeGranularity granularity, FillMethod method);

    // ==================== 时间工具 ====================

    /**
     * 时间戳的ISO-8601扩展格式，如 2020-03-14T08:30:00。
     * 秒始终输出，纳秒部分非零时才输出。
     */
    static String formatTimestamp(LocalDateTime timestamp) {
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp);
    }

    /**
     * 星期几，0 = 星期日 ... 6 = 星期六。
     * 使用闭式同余公式计算，适用于任意公历日期（含公元前年份）。
     */
    static int dayOfWeek(LocalDateTime timestamp) {
        final int[] offsets = {0, 3, 2, 5, 0, 3, 5, 1, 4, 6, 2, 4};
        int year = timestamp.getYear();
        int month = timestamp.getMonthValue();
        int day = timestamp.getDayOfMonth();
        if (month < 3) {
            year -= 1;
        }
        int sum = year + Math.floorDiv(year, 4) - Math.floorDiv(year, 100) + Math.floorDiv(year, 400)
                + offsets[month - 1] + day;
        return Math.floorMod(sum, 7);
    }
}
