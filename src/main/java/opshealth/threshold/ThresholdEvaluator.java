package opshealth.threshold;

import lombok.extern.slf4j.Slf4j;
import opshealth.health.HealthScore;
import opshealth.health.HealthScorer;
import opshealth.metrics.MetricsSummary;
import opshealth.metrics.PipelineAggregate;
import opshealth.metrics.PipelineName;
import opshealth.metrics.PipelineRunRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 阈值评估器
 */
@Slf4j
public class ThresholdEvaluator {

    // 时间倒序，时间相同时后扫描到的记录在前
    private static final Comparator<PipelineRunRecord> NEWEST_FIRST = Comparator
            .comparing(PipelineRunRecord::getEventTime)
            .thenComparingInt(PipelineRunRecord::getScanOrder)
            .reversed();

    private final HealthScorer healthScorer;

    public ThresholdEvaluator(HealthScorer healthScorer) {
        this.healthScorer = healthScorer;
    }

    /**
     * 汇总、阈值、连续失败与健康分一次算完
     */
    public ThresholdCheckResult check(MetricsSummary summary, ThresholdSettings settings) {
        ResolvedThresholds thresholds = ThresholdResolver.resolve(settings);
        List<Violation> violations = evaluate(summary, thresholds.getThresholds());
        ContinuousAlertState continuousAlert = evaluateContinuity(summary, thresholds.getContinuityLimits());
        HealthScore health = healthScorer.score(summary, violations);

        if (!violations.isEmpty()) {
            log.warn("阈值检查发现{}项违规, 档位: {}", violations.size(), thresholds.getProfile());
        }
        if (continuousAlert.isActive()) {
            log.warn("连续失败告警: 级别={}, 流水线={}", continuousAlert.getSeverity(),
                    continuousAlert.getViolatedPipelines());
        }
        return ThresholdCheckResult.builder()
                .summary(summary)
                .thresholds(thresholds)
                .violations(violations)
                .continuousAlert(continuousAlert)
                .health(health)
                .build();
    }

    /**
     * 比较各流水线的最大耗时与失败率，无运行记录的流水线不产生违规
     */
    public List<Violation> evaluate(MetricsSummary summary, Map<PipelineName, PipelineThreshold> thresholds) {
        List<Violation> violations = new ArrayList<>();
        for (Map.Entry<PipelineName, PipelineAggregate> entry : summary.getPipelines().entrySet()) {
            PipelineName pipeline = entry.getKey();
            PipelineAggregate aggregate = entry.getValue();
            PipelineThreshold threshold = thresholds.get(pipeline);
            if (aggregate.getRuns() <= 0 || threshold == null) {
                continue;
            }

            double observedDuration = aggregate.getMaxDurationSec();
            if (observedDuration > threshold.getMaxDurationSec()) {
                violations.add(new Violation(pipeline, ThresholdMetric.MAX_DURATION_SEC.violationName(),
                        threshold.getMaxDurationSec(), observedDuration));
            }

            double observedFailureRate = Math.max(0.0, Math.min(1.0, 1.0 - aggregate.getSuccessRate()));
            if (observedFailureRate > threshold.getMaxFailureRate()) {
                violations.add(new Violation(pipeline, ThresholdMetric.MAX_FAILURE_RATE.violationName(),
                        threshold.getMaxFailureRate(), observedFailureRate));
            }
        }
        return violations;
    }

    /**
     * 从最新一次运行往前数连续失败次数，遇到第一次成功即停止
     */
    public ContinuousAlertState evaluateContinuity(MetricsSummary summary, ContinuityLimits limits) {
        Map<PipelineName, Integer> consecutiveFailures = new EnumMap<>(PipelineName.class);
        List<PipelineStreak> violated = new ArrayList<>();
        AlertSeverity overall = AlertSeverity.NONE;

        for (Map.Entry<PipelineName, List<PipelineRunRecord>> entry : summary.getRunsByPipeline().entrySet()) {
            List<PipelineRunRecord> runs = new ArrayList<>(entry.getValue());
            if (runs.isEmpty()) {
                continue;
            }
            runs.sort(NEWEST_FIRST);

            int streak = 0;
            for (PipelineRunRecord run : runs) {
                if (run.isSuccess()) {
                    break;
                }
                streak++;
            }
            consecutiveFailures.put(entry.getKey(), streak);

            AlertSeverity severity = classify(streak, limits);
            if (severity == AlertSeverity.NONE) {
                continue;
            }
            if (severity.isHigherThan(overall)) {
                overall = severity;
            }
            violated.add(new PipelineStreak(entry.getKey(), streak, runs.get(0).getEventTimestampText(), severity));
        }

        return ContinuousAlertState.builder()
                .warningLimit(limits.getWarning())
                .criticalLimit(limits.getCritical())
                .severity(overall)
                .active(overall != AlertSeverity.NONE)
                .consecutiveFailures(Collections.unmodifiableMap(consecutiveFailures))
                .violatedPipelines(Collections.unmodifiableList(violated))
                .build();
    }

    static AlertSeverity classify(int streak, ContinuityLimits limits) {
        if (streak >= limits.getCritical()) {
            return AlertSeverity.CRITICAL;
        }
        if (streak >= limits.getWarning()) {
            return AlertSeverity.WARNING;
        }
        return AlertSeverity.NONE;
    }
}
