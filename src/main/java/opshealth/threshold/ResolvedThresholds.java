package opshealth.threshold;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import opshealth.metrics.PipelineName;

import java.util.List;
import java.util.Map;

/**
 * 解析后的阈值
 */
@Getter
@ToString
@AllArgsConstructor
public class ResolvedThresholds {
    private final ThresholdProfile profile;
    private final Map<PipelineName, PipelineThreshold> thresholds;
    private final ContinuityLimits continuityLimits;
    // 非法配置值的说明，对应值已回退为默认值
    private final List<String> warnings;

    public PipelineThreshold get(PipelineName pipeline) {
        return thresholds.get(pipeline);
    }
}
