package com.pipeline.timeseries.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次CSV导入的结果统计。
 * 导入过程中的非致命异常（无法解析的日期、无法切分的行）都汇总在这里，
 * 不会中断导入。
 */
public class IngestionReport {
    private final String assetId;
    private final String source;
    private boolean skipped;
    private int featureCount;
    /** 读取的数据行数（不含表头） */
    private int rowsRead;
    /** 实际写入存储的行数 */
    private int rowsStored;
    /** 日期无法解析、落到哨兵时间戳的行数 */
    private int rowsOnSentinel;
    /** 日期无法解析、按策略丢弃的行数 */
    private int rowsRejected;
    /** 引号或转义不合法、无法切分的行数 */
    private int malformedLines;
    private final List<String> warnings = new ArrayList<>();

    public IngestionReport(String assetId, String source) {
        this.assetId = assetId;
        this.source = source;
    }

    public static IngestionReport skipped(String assetId, String source, String reason) {
        IngestionReport report = new IngestionReport(assetId, source);
        report.skipped = true;
        report.addWarning(reason);
        return report;
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public void setFeatureCount(int featureCount) { this.featureCount = featureCount; }
    public void incrementRowsRead() { rowsRead++; }
    public void incrementRowsStored() { rowsStored++; }
    public void incrementRowsOnSentinel() { rowsOnSentinel++; }
    public void incrementRowsRejected() { rowsRejected++; }
    public void incrementMalformedLines() { malformedLines++; }

    public String getAssetId() { return assetId; }
    public String getSource() { return source; }
    public boolean isSkipped() { return skipped; }
    public int getFeatureCount() { return featureCount; }
    public int getRowsRead() { return rowsRead; }
    public int getRowsStored() { return rowsStored; }
    public int getRowsOnSentinel() { return rowsOnSentinel; }
    public int getRowsRejected() { return rowsRejected; }
    public int getMalformedLines() { return malformedLines; }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    /** 是否所有数据行都被正常解析 */
    public boolean isClean() {
        return !skipped && rowsOnSentinel == 0 && rowsRejected == 0 && malformedLines == 0;
    }

    @Override
    public String toString() {
        return "IngestionReport{asset=" + assetId
                + ", source=" + source
                + ", skipped=" + skipped
                + ", features=" + featureCount
                + ", rowsRead=" + rowsRead
                + ", rowsStored=" + rowsStored
                + ", sentinel=" + rowsOnSentinel
                + ", rejected=" + rowsRejected
                + ", malformed=" + malformedLines + "}";
    }
}
