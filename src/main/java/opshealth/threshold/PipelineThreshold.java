package opshealth.threshold;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 单条流水线的阈值
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineThreshold {
    private final double maxDurationSec;
    private final double maxFailureRate;

    public double get(ThresholdMetric metric) {
        return metric == ThresholdMetric.MAX_DURATION_SEC ? maxDurationSec : maxFailureRate;
    }
}
