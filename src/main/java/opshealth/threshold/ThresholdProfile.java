package opshealth.threshold;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import opshealth.metrics.PipelineName;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 阈值档位 - 各档位下每条流水线的默认阈值
 */
public enum ThresholdProfile {
    @JsonProperty("dev")
    DEV(ImmutableMap.of(
            PipelineName.DAILY, new PipelineThreshold(1800.0, 0.30),
            PipelineName.WEEKLY, new PipelineThreshold(3600.0, 0.40),
            PipelineName.MONTHLY, new PipelineThreshold(7200.0, 0.50))),
    @JsonProperty("stg")
    STG(ImmutableMap.of(
            PipelineName.DAILY, new PipelineThreshold(1200.0, 0.20),
            PipelineName.WEEKLY, new PipelineThreshold(2400.0, 0.30),
            PipelineName.MONTHLY, new PipelineThreshold(4800.0, 0.35))),
    @JsonProperty("prod")
    PROD(ImmutableMap.of());

    public static final ThresholdProfile DEFAULT = PROD;

    // 全局默认值，档位未定义的流水线使用
    static final Map<PipelineName, PipelineThreshold> GLOBAL_DEFAULTS = ImmutableMap.of(
            PipelineName.DAILY, new PipelineThreshold(900.0, 0.10),
            PipelineName.WEEKLY, new PipelineThreshold(1800.0, 0.20),
            PipelineName.MONTHLY, new PipelineThreshold(3600.0, 0.25));

    private final Map<PipelineName, PipelineThreshold> defaults;

    ThresholdProfile(Map<PipelineName, PipelineThreshold> defaults) {
        this.defaults = defaults;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public PipelineThreshold defaultsFor(PipelineName pipeline) {
        PipelineThreshold threshold = defaults.get(pipeline);
        return threshold != null ? threshold : GLOBAL_DEFAULTS.get(pipeline);
    }

    public static Optional<ThresholdProfile> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (ThresholdProfile profile : values()) {
            if (profile.id().equals(normalized)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id();
    }
}
