package opshealth.threshold;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import opshealth.metrics.PipelineName;

/**
 * 触发连续失败告警的流水线
 */
@Getter
@ToString
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineStreak {
    private final PipelineName pipeline;
    private final int consecutiveFailures;
    private final String latestRun;
    private final AlertSeverity severity;
}
