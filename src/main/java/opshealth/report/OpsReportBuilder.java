package opshealth.report;

import lombok.extern.slf4j.Slf4j;
import opshealth.metrics.MetricsSummary;
import opshealth.metrics.PipelineAggregate;
import opshealth.metrics.PipelineName;
import opshealth.metrics.RunRecordScanner;
import opshealth.threshold.PipelineThreshold;
import opshealth.threshold.ThresholdCheckResult;
import opshealth.threshold.ThresholdEvaluator;
import opshealth.threshold.ThresholdSettings;
import opshealth.threshold.Violation;
import opshealth.utils.Timestamps;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 运维报告生成
 * <p>
 * 读取logs目录下的运行记录、alerts.log、运行日志和产物校验文件，汇总成一份 {@link OpsReport}
 */
@Slf4j
public class OpsReportBuilder {
    public static final String ALERT_LOG_NAME = "alerts.log";
    public static final int DEFAULT_TOP_ALERT_TYPES = 3;

    private final Path logsDir;
    private final ThresholdSettings settings;
    private final ThresholdEvaluator evaluator;
    private final RetryGuideCollector retryGuideCollector;
    private final ArtifactIntegrityLoader artifactIntegrityLoader = new ArtifactIntegrityLoader();
    private final int topAlertTypes;
    private final int retryGuideLimit;
    private final Clock clock;

    public OpsReportBuilder(Path logsDir,
                            ThresholdSettings settings,
                            ThresholdEvaluator evaluator,
                            RunbookReferences runbookReferences,
                            int topAlertTypes,
                            int retryGuideLimit,
                            Clock clock) {
        this.logsDir = logsDir;
        this.settings = settings;
        this.evaluator = evaluator;
        this.retryGuideCollector = new RetryGuideCollector(logsDir, runbookReferences);
        this.topAlertTypes = topAlertTypes;
        this.retryGuideLimit = retryGuideLimit;
        this.clock = clock;
    }

    public OpsReport build(int days) {
        return build(days, clock.instant());
    }

    public OpsReport build(int days, Instant now) {
        int normalizedDays = Math.max(0, days);
        MetricsSummary summary = new RunRecordScanner(logsDir).scan(normalizedDays, now);
        ThresholdCheckResult check = evaluator.check(summary, settings);
        Instant since = summary.getWindowStart();

        Map<String, PipelineSuccessRate> successRates = new LinkedHashMap<>();
        for (Map.Entry<PipelineName, PipelineAggregate> entry : summary.getPipelines().entrySet()) {
            successRates.put(entry.getKey().id(),
                    new PipelineSuccessRate(entry.getValue().getRuns(), entry.getValue().getSuccessRate()));
        }

        Map<String, PipelineThreshold> thresholds = new LinkedHashMap<>();
        check.getThresholds().getThresholds().forEach((pipeline, threshold) -> thresholds.put(pipeline.id(), threshold));

        Map<String, Integer> violationsByPipeline = new TreeMap<>();
        for (Violation violation : check.getViolations()) {
            violationsByPipeline.merge(violation.getPipeline().id(), 1, Integer::sum);
        }

        AlertRollup alerts = AlertRollup.of(AlertLineParser.readFile(logsDir.resolve(ALERT_LOG_NAME)), since);
        List<RetryGuide> guides = retryGuideCollector.collect(since, retryGuideLimit);
        ArtifactIntegrity integrity = artifactIntegrityLoader.load(logsDir.resolve(ArtifactIntegrityLoader.DEFAULT_FILE_NAME));

        log.info("生成运维报告: days={}, runs={}, 健康分={}, 违规={}", normalizedDays, summary.getTotalRuns(),
                check.getHealth().getScore(), check.getViolations().size());

        return OpsReport.builder()
                .schemaVersion(OpsReport.SCHEMA_VERSION)
                .generatedAt(Timestamps.format(now))
                .days(normalizedDays)
                .windowStart(since == null ? null : Timestamps.format(since))
                .totalRuns(summary.getTotalRuns())
                .thresholdProfile(check.getThresholds().getProfile().id())
                .thresholds(thresholds)
                .healthScore(check.getHealth().getScore())
                .healthBreakdown(check.getHealth().getBreakdown())
                .pipelineSuccessRates(successRates)
                .violations(check.getViolations())
                .thresholdViolationsCount(check.getViolations().size())
                .thresholdViolationsByPipeline(violationsByPipeline)
                .continuousAlert(check.getContinuousAlert())
                .topAlertTypes(alerts.topTypes(topAlertTypes))
                .dailyAlertCounts(alerts.perDay())
                .alertsByPipeline(alerts.perPipeline())
                .artifactIntegrity(integrity)
                .recentCommandFailures(summary.getTotals().getCommandFailures())
                .failedCommandRetryGuides(guides)
                .configWarnings(check.getThresholds().getWarnings())
                .build();
    }
}
