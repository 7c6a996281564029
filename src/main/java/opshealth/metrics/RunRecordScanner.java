package opshealth.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.primitives.Ints;
import lombok.extern.slf4j.Slf4j;
import opshealth.utils.JsonFiles;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 运行记录扫描器 - 读取日志目录下的 <pipeline>-metrics-*.json 并按流水线汇总
 */
@Slf4j
public class RunRecordScanner {
    public static final String METRICS_GLOB = "*-metrics-*.json";

    private final Path logsDir;

    public RunRecordScanner(Path logsDir) {
        this.logsDir = logsDir;
    }

    /**
     * 扫描窗口 [now - days, now] 内的运行记录，days为0表示不限窗口
     */
    public MetricsSummary scan(int days, Instant now) {
        int normalizedDays = Math.max(0, days);
        Instant windowStart = resolveWindowStart(normalizedDays, now).orElse(null);

        Map<PipelineName, Accumulator> accumulators = new EnumMap<>(PipelineName.class);
        Map<PipelineName, List<PipelineRunRecord>> runsByPipeline = new EnumMap<>(PipelineName.class);
        long totalRuns = 0;
        long totalCommandFailures = 0;
        long totalAlertCount = 0;

        int scanOrder = 0;
        for (Path file : discover()) {
            Optional<JsonNode> document = JsonFiles.readTree(file);
            if (document.isEmpty()) {
                continue;
            }
            Optional<PipelineRunRecord> parsed = PipelineRunRecord.fromJson(document.get(), scanOrder++);
            if (parsed.isEmpty()) {
                log.debug("跳过无效运行记录: {}", file);
                continue;
            }
            PipelineRunRecord record = parsed.get();
            if (windowStart != null && !withinWindow(record.getEventTime(), windowStart, now)) {
                continue;
            }

            totalRuns++;
            totalCommandFailures += record.getCommandFailures();
            totalAlertCount += record.getAlertCount();
            accumulators.computeIfAbsent(record.getPipeline(), k -> new Accumulator()).add(record);
            runsByPipeline.computeIfAbsent(record.getPipeline(), k -> new ArrayList<>()).add(record);
        }

        Map<PipelineName, PipelineAggregate> pipelines = new EnumMap<>(PipelineName.class);
        accumulators.forEach((pipeline, accumulator) -> pipelines.put(pipeline, accumulator.toAggregate()));
        runsByPipeline.replaceAll((pipeline, runs) -> Collections.unmodifiableList(runs));

        log.debug("运行记录扫描完成: 目录={}, 窗口={}天, 记录数={}", logsDir, normalizedDays, totalRuns);
        return MetricsSummary.builder()
                .generatedAt(now)
                .days(normalizedDays)
                .windowStart(windowStart)
                .totalRuns(Ints.saturatedCast(totalRuns))
                .pipelines(Collections.unmodifiableMap(pipelines))
                .totals(new MetricsTotals(Ints.saturatedCast(totalCommandFailures), Ints.saturatedCast(totalAlertCount)))
                .runsByPipeline(Collections.unmodifiableMap(runsByPipeline))
                .build();
    }

    public static Optional<Instant> resolveWindowStart(int days, Instant now) {
        if (days <= 0) {
            return Optional.empty();
        }
        return Optional.of(now.minus(Duration.ofDays(days)));
    }

    static boolean withinWindow(Instant eventTime, Instant windowStart, Instant now) {
        return !eventTime.isBefore(windowStart) && !eventTime.isAfter(now);
    }

    /**
     * 按文件名顺序列出运行记录文件，目录不存在时返回空
     */
    List<Path> discover() {
        if (logsDir == null || !Files.isDirectory(logsDir)) {
            return Collections.emptyList();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logsDir, METRICS_GLOB)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            log.warn("读取运行记录目录失败: {}", logsDir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private static class Accumulator {
        private int runs;
        private int successCount;
        private double durationTotal;
        private double maxDuration;
        private Instant latestTime;
        private LatestRun latestRun = new LatestRun("", false);

        void add(PipelineRunRecord record) {
            runs++;
            if (record.isSuccess()) {
                successCount++;
            }
            durationTotal += record.getDurationSec();
            if (record.getDurationSec() > maxDuration) {
                maxDuration = record.getDurationSec();
            }
            // 时间相同时后扫描到的记录生效
            if (latestTime == null || !record.getEventTime().isBefore(latestTime)) {
                latestTime = record.getEventTime();
                latestRun = new LatestRun(record.getEventTimestampText(), record.isSuccess());
            }
        }

        PipelineAggregate toAggregate() {
            return PipelineAggregate.builder()
                    .runs(runs)
                    .successCount(successCount)
                    .successRate(runs > 0 ? (double) successCount / runs : 0.0)
                    .avgDurationSec(runs > 0 ? durationTotal / runs : 0.0)
                    .maxDurationSec(maxDuration)
                    .latestRun(latestRun)
                    .build();
        }
    }
}
