package opshealth.threshold;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import opshealth.health.HealthScore;
import opshealth.metrics.MetricsSummary;

import java.util.List;

/**
 * 一次阈值检查的完整结果
 */
@Getter
@Builder
@ToString
public class ThresholdCheckResult {
    private final MetricsSummary summary;
    private final ResolvedThresholds thresholds;
    private final List<Violation> violations;
    private final ContinuousAlertState continuousAlert;
    private final HealthScore health;
}
