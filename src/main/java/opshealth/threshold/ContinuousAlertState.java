package opshealth.threshold;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import opshealth.metrics.PipelineName;

import java.util.List;
import java.util.Map;

/**
 * 连续失败告警状态
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ContinuousAlertState {
    private final int warningLimit;
    private final int criticalLimit;
    private final AlertSeverity severity;
    private final boolean active;
    private final Map<PipelineName, Integer> consecutiveFailures;
    private final List<PipelineStreak> violatedPipelines;
}
