package com.pipeline.timeseries;

import com.pipeline.timeseries.core.impl.DefaultTimeSeriesStore;
import com.pipeline.timeseries.model.FeatureValueTable;
import com.pipeline.timeseries.model.IngestionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 演示入口。
 * 按配置创建存储，依次导入命令行给出的CSV文件（资产标识取文件名），
 * 打印存储内容，并对最后一个资产按字母序第一个特征求和。
 *
 * 用法：java -jar timeseries-store.jar [--config 配置文件路径] file1.csv [file2.csv ...]
 */
public class TimeSeriesApplication {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesApplication.class);

    private final AppConfig config;
    private final PrintStream out;

    public TimeSeriesApplication(AppConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public DefaultTimeSeriesStore<?> run(List<Path> files) {
        log.info("Starting with config: {}", config);

        DefaultTimeSeriesStore<?> store = config.createStore();
        out.println(store.size());

        String lastAsset = null;
        List<IngestionReport> reports = new ArrayList<>();
        for (Path file : files) {
            IngestionReport report = store.ingest(file);
            reports.add(report);
            if (!report.isSkipped()) {
                lastAsset = report.getAssetId();
            }
            out.println(store.size());
        }

        if (config.isRemoveEmptyAfterIngest()) {
            store.removeEmptyTimestamps();
        }
        store.fillGaps();

        out.println(store);
        reports.forEach(r -> log.info("{}", r));

        if (lastAsset != null) {
            Set<String> features = store.getFeatures().get(lastAsset);
            if (features != null && !features.isEmpty()) {
                String feature = features.stream().sorted().findFirst().get();
                out.println("Sum of all " + feature + " for asset " + lastAsset + ": "
                        + sum(store, lastAsset, feature));
            }
        }
        return store;
    }

    /**
     * 对某资产某特征在全部时间戳上求和，缺失值按默认值计入
     */
    static <T> double sum(DefaultTimeSeriesStore<T> store, String asset, String feature) {
        double total = 0.0;
        for (Map.Entry<LocalDateTime, FeatureValueTable<T>> entry : store) {
            T value = entry.getValue().get(asset, feature);
            if (value instanceof Number) {
                total += ((Number) value).doubleValue();
            }
        }
        return total;
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        AppConfig config = null;
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) && i + 1 < args.length) {
                config = AppConfig.load(Paths.get(args[++i]));
            } else {
                files.add(Paths.get(args[i]));
            }
        }
        if (config == null) {
            config = AppConfig.loadResource(AppConfig.DEFAULT_RESOURCE);
        }
        if (files.isEmpty()) {
            System.err.println("Usage: TimeSeriesApplication [--config file] file1.csv [file2.csv ...]");
            System.exit(1);
        }

        new TimeSeriesApplication(config, System.out).run(files);
    }
}
