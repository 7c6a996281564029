package opshealth.threshold;

import com.google.common.collect.ImmutableTable;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import opshealth.metrics.PipelineName;

/**
 * 阈值与连续失败告警配置，值均为原始文本，解析与校验在 {@link ThresholdResolver} 中完成
 */
@Getter
@Builder
@ToString
public class ThresholdSettings {
    private final String profile;
    @Singular
    private final ImmutableTable<PipelineName, ThresholdMetric, String> overrides;
    private final String warningLimit;
    private final String criticalLimit;

    public static ThresholdSettings defaults() {
        return ThresholdSettings.builder().build();
    }
}
