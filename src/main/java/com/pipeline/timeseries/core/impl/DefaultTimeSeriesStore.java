package com.pipeline.timeseries.core.impl;

import com.pipeline.timeseries.core.GapFillStrategy;
import com.pipeline.timeseries.core.TimeSeriesStore;
import com.pipeline.timeseries.core.ValueType;
import com.pipeline.timeseries.model.DateParseFailurePolicy;
import com.pipeline.timeseries.model.FeatureValueTable;
import com.pipeline.timeseries.model.FillMethod;
import com.pipeline.timeseries.model.IngestionReport;
import com.pipeline.timeseries.model.TimeGranularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.*;

/**
 * 时序存储默认实现。
 *
 * 时间戳 -> 快照使用TreeMap保证升序；资产索引使用HashMap。
 * 文件按ISO-8859-1读取，保证字节与字符一一对应，清洗时按字节剔除非打印字符。
 * 非线程安全。
 */
public class DefaultTimeSeriesStore<T> implements TimeSeriesStore<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultTimeSeriesStore.class);

    private final ValueType<T> valueType;

    /** 时间戳 -> 快照，升序 */
    private final TreeMap<LocalDateTime, FeatureValueTable<T>> data = new TreeMap<>();

    /** 资产 -> 表头声明的特征集合，集合本身不可变 */
    private final Map<String, Set<String>> assetFeatures = new HashMap<>();

    private final DateTimeFormatRegistry dateFormats;

    private final CsvRowTokenizer tokenizer = new CsvRowTokenizer();

    private DateParseFailurePolicy dateParseFailurePolicy = DateParseFailurePolicy.SENTINEL;

    /** 默认补齐策略，为null表示未配置 */
    private GapFillStrategy gapFillStrategy;
    private TimeGranularity gapFillGranularity = TimeGranularity.DAILY;
    private FillMethod gapFillMethod = FillMethod.EMPTY;

    public DefaultTimeSeriesStore(ValueType<T> valueType) {
        if (valueType == null) {
            throw new IllegalArgumentException("Value type must not be null");
        }
        this.valueType = valueType;
        this.dateFormats = DateTimeFormatRegistry.withDefaults();
    }

    /**
     * 深拷贝另一个存储的全部数据、索引、日期格式和策略配置。
     */
    public DefaultTimeSeriesStore(DefaultTimeSeriesStore<T> other) {
        this.valueType = other.valueType;
        this.dateFormats = new DateTimeFormatRegistry(other.dateFormats);
        other.data.forEach((timestamp, table) -> this.data.put(timestamp, table.copy()));
        this.assetFeatures.putAll(other.assetFeatures);
        this.dateParseFailurePolicy = other.dateParseFailurePolicy;
        this.gapFillStrategy = other.gapFillStrategy;
        this.gapFillGranularity = other.gapFillGranularity;
        this.gapFillMethod = other.gapFillMethod;
    }

    public static DefaultTimeSeriesStore<Double> ofDoubles() {
        return new DefaultTimeSeriesStore<>(NumericValueTypes.DOUBLE);
    }

    public DefaultTimeSeriesStore<T> copy() {
        return new DefaultTimeSeriesStore<>(this);
    }

    public DefaultTimeSeriesStore<T> setDateParseFailurePolicy(DateParseFailurePolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Date parse failure policy must not be null");
        }
        this.dateParseFailurePolicy = policy;
        return this;
    }

    public DefaultTimeSeriesStore<T> setGapFillStrategy(GapFillStrategy strategy,
                                                        TimeGranularity granularity,
                                                        FillMethod method) {
        if (granularity == null || method == null) {
            throw new IllegalArgumentException("Gap fill granularity and method must not be null");
        }
        this.gapFillStrategy = strategy;
        this.gapFillGranularity = granularity;
        this.gapFillMethod = method;
        return this;
    }

    public DateParseFailurePolicy getDateParseFailurePolicy() { return dateParseFailurePolicy; }
    public GapFillStrategy getGapFillStrategy() { return gapFillStrategy; }
    public TimeGranularity getGapFillGranularity() { return gapFillGranularity; }
    public FillMethod getGapFillMethod() { return gapFillMethod; }
    public ValueType<T> getValueType() { return valueType; }

    // ==================== 导入 ====================

    @Override
    public IngestionReport ingest(Path path) {
        return ingest(assetIdOf(path), path);
    }

    @Override
    public IngestionReport ingest(String assetId, Path path) {
        if (assetId == null) {
            throw new IllegalArgumentException("Asset id must not be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("Path must not be null");
        }

        if (assetFeatures.containsKey(assetId)) {
            log.warn("Asset '{}' already exists, ingestion of '{}' rejected.", assetId, path);
            return IngestionReport.skipped(assetId, path.toString(),
                    "Asset '" + assetId + "' already exists");
        }

        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            log.error("Failed to open CSV file '{}' for asset '{}': {}", path, assetId, e.getMessage(), e);
            throw new UncheckedIOException("Failed to open CSV file: " + path, e);
        }

        IngestionReport report = new IngestionReport(assetId, path.toString());
        try (reader) {
            List<String> features = readHeader(readRecord(reader), report);
            assetFeatures.put(assetId, Collections.unmodifiableSet(new HashSet<>(features)));
            report.setFeatureCount(features.size());

            String line;
            int lineNumber = 1;
            while ((line = readRecord(reader)) != null) {
                lineNumber++;
                ingestRow(assetId, features, line, lineNumber, report);
            }
        } catch (IOException e) {
            log.error("Failed to read CSV file '{}' for asset '{}': {}", path, assetId, e.getMessage(), e);
            throw new UncheckedIOException("Failed to read CSV file: " + path, e);
        }

        log.info("Asset '{}' ingested from '{}': {} rows read, {} stored, {} on sentinel, {} rejected, {} malformed.",
                assetId, path, report.getRowsRead(), report.getRowsStored(),
                report.getRowsOnSentinel(), report.getRowsRejected(), report.getMalformedLines());
        return report;
    }

    /**
     * 读取一条记录，只以 \n 作为行尾。
     * 行内残留的 \r 交给清洗步骤剔除，不会把一行拆成两行。
     *
     * @return 不含 \n 的记录；已到文件末尾时返回null
     */
    static String readRecord(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1) {
            if (c == '\n') {
                return sb.toString();
            }
            sb.append((char) c);
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    /**
     * 表头第一列忽略，其余列按顺序作为特征名
     */
    private List<String> readHeader(String header, IngestionReport report) {
        if (header == null) {
            report.addWarning("File is empty, asset registered without features");
            return Collections.emptyList();
        }
        List<String> tokens = tokenizeOrReport(header, 1, report);
        if (tokens == null || tokens.size() <= 1) {
            return Collections.emptyList();
        }
        return new ArrayList<>(tokens.subList(1, tokens.size()));
    }

    private void ingestRow(String assetId, List<String> features, String line,
                           int lineNumber, IngestionReport report) {
        report.incrementRowsRead();

        List<String> tokens = tokenizeOrReport(line, lineNumber, report);
        if (tokens == null) {
            return;
        }

        String dateText = tokens.isEmpty() ? "" : tokens.get(0);
        Optional<LocalDateTime> parsed = dateFormats.parse(dateText);
        LocalDateTime timestamp;
        if (parsed.isPresent()) {
            timestamp = parsed.get();
        } else {
            String reason = dateFormats.parsesToSentinel(dateText)
                    ? "date '" + dateText + "' equals the sentinel timestamp " + TimeSeriesStore.formatTimestamp(SENTINEL_TIMESTAMP)
                    : "unparseable date '" + dateText + "'";
            if (dateParseFailurePolicy == DateParseFailurePolicy.SKIP_ROW) {
                report.incrementRowsRejected();
                report.addWarning("Line " + lineNumber + ": " + reason + ", row skipped");
                log.debug("Line {} of asset '{}': {}, row skipped.", lineNumber, assetId, reason);
                return;
            }
            timestamp = SENTINEL_TIMESTAMP;
            report.incrementRowsOnSentinel();
            report.addWarning("Line " + lineNumber + ": " + reason + ", row stored at sentinel timestamp");
            log.debug("Line {} of asset '{}': {}, using sentinel timestamp.", lineNumber, assetId, reason);
        }

        FeatureValueTable<T> table = data.computeIfAbsent(timestamp, k -> new FeatureValueTable<>(valueType));

        // 按位置对齐，多余的列或缺少的列都直接截断
        int count = Math.min(features.size(), tokens.size() - 1);
        for (int i = 0; i < count; i++) {
            table.set(assetId, features.get(i), valueType.parse(tokens.get(i + 1)));
        }
        report.incrementRowsStored();
    }

    private List<String> tokenizeOrReport(String line, int lineNumber, IngestionReport report) {
        try {
            return tokenizer.tokenize(line);
        } catch (IOException e) {
            report.incrementMalformedLines();
            report.addWarning("Line " + lineNumber + ": " + e.getMessage());
            log.warn("Line {} of '{}' could not be tokenized, skipped: {}",
                    lineNumber, report.getSource(), e.getMessage());
            return null;
        }
    }

    static String assetIdOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Path has no file name: " + path);
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public void addDateFormat(String pattern) {
        dateFormats.register(pattern);
        log.debug("Date format '{}' registered at priority {}.", pattern, dateFormats.size());
    }

    @Override
    public void addDateFormats(List<String> patterns) {
        for (String pattern : patterns) {
            addDateFormat(pattern);
        }
    }

    @Override
    public List<String> getDateFormats() {
        return dateFormats.getPatterns();
    }

    // ==================== 查询 ====================

    @Override
    public boolean containsAsset(String assetId) {
        return assetFeatures.containsKey(assetId);
    }

    @Override
    public boolean containsTimestamp(LocalDateTime timestamp) {
        return timestamp != null && data.containsKey(timestamp);
    }

    @Override
    public Map<String, Set<String>> getFeatures() {
        return Collections.unmodifiableMap(assetFeatures);
    }

    @Override
    public T getData(LocalDateTime timestamp, String assetId, String feature) {
        return findData(timestamp, assetId, feature).orElse(valueType.defaultValue());
    }

    @Override
    public Optional<T> findData(LocalDateTime timestamp, String assetId, String feature) {
        if (timestamp == null) return Optional.empty();
        FeatureValueTable<T> table = data.get(timestamp);
        return table == null ? Optional.empty() : table.find(assetId, feature);
    }

    @Override
    public Optional<FeatureValueTable<T>> getSnapshot(LocalDateTime timestamp) {
        if (timestamp == null) return Optional.empty();
        FeatureValueTable<T> table = data.get(timestamp);
        return table == null ? Optional.empty() : Optional.of(table.readOnlyView());
    }

    @Override
    public NavigableSet<LocalDateTime> timestamps() {
        return Collections.unmodifiableNavigableSet(data.navigableKeySet());
    }

    @Override
    public int size() {
        return data.size();
    }

    @Override
    public boolean isEmpty() {
        return data.isEmpty();
    }

    @Override
    public Iterator<Map.Entry<LocalDateTime, FeatureValueTable<T>>> iterator() {
        return readOnlyEntries(data);
    }

    @Override
    public Iterator<Map.Entry<LocalDateTime, FeatureValueTable<T>>> descendingIterator() {
        return readOnlyEntries(data.descendingMap());
    }

    private Iterator<Map.Entry<LocalDateTime, FeatureValueTable<T>>> readOnlyEntries(
            NavigableMap<LocalDateTime, FeatureValueTable<T>> source) {
        return source.entrySet().stream()
                .map(e -> Map.entry(e.getKey(), e.getValue().readOnlyView()))
                .iterator();
    }

    // ==================== 维护 ====================

    @Override
    public int removeEmptyTimestamps() {
        int before = data.size();
        data.values().removeIf(FeatureValueTable::isEmpty);
        int removed = before - data.size();
        if (removed > 0) {
            log.info("Removed {} empty timestamps, {} remaining.", removed, data.size());
        }
        return removed;
    }

    @Override
    public int fillGaps() {
        if (gapFillStrategy == null) {
            log.info("No gap fill strategy configured, nothing to fill.");
            return 0;
        }
        return fillGaps(gapFillStrategy, gapFillGranularity, gapFillMethod);
    }

    @Override
    public int fillGaps(GapFillStrategy strategy, TimeGranularity granularity, FillMethod method) {
        if (strategy == null || granularity == null || method == null) {
            throw new IllegalArgumentException("Gap fill strategy, granularity and method must not be null");
        }

        TreeSet<LocalDateTime> existing = new TreeSet<>(data.navigableKeySet());
        existing.remove(SENTINEL_TIMESTAMP);
        if (existing.size() < 2) {
            return 0;
        }

        List<LocalDateTime> missing = strategy.missingTimestamps(
                Collections.unmodifiableNavigableSet(existing), granularity);

        int inserted = 0;
        for (LocalDateTime timestamp : missing) {
            if (data.containsKey(timestamp)) {
                continue;
            }
            data.put(timestamp, createFill(timestamp, method));
            inserted++;
        }

        log.info("Gap fill '{}' ({}, {}) inserted {} timestamps.",
                strategy.getName(), granularity, method, inserted);
        return inserted;
    }

    private FeatureValueTable<T> createFill(LocalDateTime timestamp, FillMethod method) {
        if (method == FillMethod.ZERO_ORDER_HOLD) {
            Map.Entry<LocalDateTime, FeatureValueTable<T>> previous = data.lowerEntry(timestamp);
            while (previous != null && SENTINEL_TIMESTAMP.equals(previous.getKey())) {
                previous = data.lowerEntry(previous.getKey());
            }
            if (previous != null) {
                return previous.getValue().copy();
            }
        }
        return new FeatureValueTable<>(valueType);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        data.forEach((timestamp, table) -> sb.append(TimeSeriesStore.formatTimestamp(timestamp))
                .append(":\n").append(table).append('\n'));
        return sb.toString();
    }
}
