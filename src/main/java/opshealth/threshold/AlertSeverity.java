package opshealth.threshold;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 连续失败告警级别，按声明顺序递增
 */
public enum AlertSeverity {
    @JsonProperty("none")
    NONE,
    @JsonProperty("warning")
    WARNING,
    @JsonProperty("critical")
    CRITICAL;

    public boolean isHigherThan(AlertSeverity other) {
        return ordinal() > other.ordinal();
    }
}
