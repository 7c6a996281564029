package opshealth.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 运行记录扫描结果
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsSummary {
    private final Instant generatedAt;
    private final int days;
    private final Instant windowStart;      // days为0时为null
    private final int totalRuns;
    private final Map<PipelineName, PipelineAggregate> pipelines;
    private final MetricsTotals totals;

    // 窗口内的运行记录，按扫描顺序
    @JsonIgnore
    @ToString.Exclude
    private final Map<PipelineName, List<PipelineRunRecord>> runsByPipeline;
}
