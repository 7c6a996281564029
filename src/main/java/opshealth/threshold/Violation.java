package opshealth.threshold;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import opshealth.metrics.PipelineName;

/**
 * 阈值违规
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class Violation {
    private final PipelineName pipeline;
    private final String metric;        // max_duration_sec 或 failure_rate
    private final double threshold;
    private final double observed;
}
