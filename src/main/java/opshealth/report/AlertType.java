package opshealth.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * 告警类型，按告警文本关键字分类
 */
public enum AlertType {
    @JsonProperty("threshold")
    THRESHOLD,
    @JsonProperty("webhook_failed")
    WEBHOOK_FAILED,
    @JsonProperty("command_failed")
    COMMAND_FAILED,
    @JsonProperty("monthly_scheduled")
    MONTHLY_SCHEDULED,
    @JsonProperty("other")
    OTHER;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 按顺序匹配，先命中者生效
     */
    public static AlertType classify(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lower.contains("command failed")) {
            return COMMAND_FAILED;
        }
        if (lower.contains("monthly report scheduled")) {
            return MONTHLY_SCHEDULED;
        }
        if (lower.contains("webhook") && (lower.contains("failed") || lower.contains("failure"))) {
            return WEBHOOK_FAILED;
        }
        if (lower.contains("threshold")) {
            return THRESHOLD;
        }
        return OTHER;
    }

    @Override
    public String toString() {
        return id();
    }
}
