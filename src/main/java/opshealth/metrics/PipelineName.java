package opshealth.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * 被监控的定时流水线
 */
public enum PipelineName {
    @JsonProperty("daily")
    DAILY,
    @JsonProperty("weekly")
    WEEKLY,
    @JsonProperty("monthly")
    MONTHLY;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 按名称查找，忽略大小写和首尾空白
     */
    public static Optional<PipelineName> fromText(String text) {
        String normalized = StringUtils.trimToEmpty(text).toLowerCase(Locale.ROOT);
        for (PipelineName pipeline : values()) {
            if (pipeline.id().equals(normalized)) {
                return Optional.of(pipeline);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id();
    }
}
