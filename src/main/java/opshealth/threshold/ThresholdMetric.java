package opshealth.threshold;

import java.util.Optional;

/**
 * 阈值指标
 */
public enum ThresholdMetric {
    MAX_DURATION_SEC("max_duration_sec", "max_duration_sec"),
    MAX_FAILURE_RATE("max_failure_rate", "failure_rate");

    private final String configKey;
    private final String violationName;

    ThresholdMetric(String configKey, String violationName) {
        this.configKey = configKey;
        this.violationName = violationName;
    }

    /**
     * 配置中的键名
     */
    public String configKey() {
        return configKey;
    }

    /**
     * 违规记录中的指标名
     */
    public String violationName() {
        return violationName;
    }

    public static Optional<ThresholdMetric> fromConfigKey(String key) {
        for (ThresholdMetric metric : values()) {
            if (metric.configKey.equals(key)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
