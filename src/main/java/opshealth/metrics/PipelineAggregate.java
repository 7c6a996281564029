package opshealth.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单条流水线在观察窗口内的汇总指标
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineAggregate {
    private final int runs;
    @JsonIgnore
    private final int successCount;
    private final double successRate;
    private final double avgDurationSec;
    private final double maxDurationSec;
    private final LatestRun latestRun;
}
