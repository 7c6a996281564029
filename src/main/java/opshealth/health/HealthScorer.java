package opshealth.health;

import opshealth.metrics.MetricsSummary;
import opshealth.metrics.PipelineAggregate;
import opshealth.threshold.Violation;

import java.util.List;

/**
 * 运行健康分计算
 * <p>
 * 从100分开始扣分：
 * <ul>
 *     <li>成功率: (1 - 平均成功率) * 60</li>
 *     <li>阈值违规: min(25, 违规数 * 5)</li>
 *     <li>命令失败: min(10, 失败数 * 2)</li>
 *     <li>告警量: min(5, 告警数 * 0.2)</li>
 * </ul>
 * 结果四舍六入五成双取整后限制在0-100。平均成功率只统计有运行记录的流水线，没有任何运行记录时按0计。
 */
public class HealthScorer {
    public static final String FORMULA = "score = clamp(100 - ((1 - avg_success_rate) * 60 + min(25, violations * 5) "
            + "+ min(10, command_failures * 2) + min(5, alert_count * 0.2)), 0, 100)";

    public HealthScore score(MetricsSummary summary, List<Violation> violations) {
        double rateTotal = 0.0;
        int activePipelines = 0;
        for (PipelineAggregate aggregate : summary.getPipelines().values()) {
            if (aggregate.getRuns() <= 0) {
                continue;
            }
            rateTotal += Math.max(0.0, Math.min(1.0, aggregate.getSuccessRate()));
            activePipelines++;
        }
        double averageSuccessRate = activePipelines > 0 ? rateTotal / activePipelines : 0.0;

        return score(new HealthFactors(
                averageSuccessRate,
                violations == null ? 0 : violations.size(),
                Math.max(0, summary.getTotals().getCommandFailures()),
                Math.max(0, summary.getTotals().getAlertCount())));
    }

    public HealthScore score(HealthFactors factors) {
        HealthPenalties penalties = new HealthPenalties(
                (1.0 - factors.getAveragePipelineSuccessRate()) * 60.0,
                Math.min(25.0, Math.max(0, factors.getViolationCount()) * 5.0),
                Math.min(10.0, Math.max(0, factors.getCommandFailures()) * 2.0),
                Math.min(5.0, Math.max(0, factors.getAlertCount()) * 0.2));

        double raw = 100.0 - penalties.total();
        int score = (int) Math.max(0, Math.min(100, Math.rint(raw)));
        return new HealthScore(score, new HealthBreakdown(factors, penalties, FORMULA));
    }
}
