package opshealth.threshold;

import lombok.extern.slf4j.Slf4j;
import opshealth.metrics.PipelineName;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 阈值解析 - 优先级: 显式配置 > 档位默认值 > 全局默认值
 * <p>
 * 非法配置值不报错，回退为默认值并记录一条警告。
 */
@Slf4j
public final class ThresholdResolver {
    static final double MIN_DURATION_SEC = 1.0;
    static final double MIN_FAILURE_RATE = 0.0;
    static final double MAX_FAILURE_RATE = 1.0;

    private ThresholdResolver() {
    }

    /**
     * 档位名不是dev/stg/prod之一时使用prod
     */
    public static ThresholdProfile resolveProfile(String rawProfile) {
        return ThresholdProfile.fromText(rawProfile).orElse(ThresholdProfile.DEFAULT);
    }

    public static ResolvedThresholds resolve(ThresholdSettings settings) {
        List<String> warnings = new ArrayList<>();

        String rawProfile = settings.getProfile();
        ThresholdProfile profile = resolveProfile(rawProfile);
        if (StringUtils.isNotBlank(rawProfile) && ThresholdProfile.fromText(rawProfile).isEmpty()) {
            warnings.add(String.format("thresholds.profile: 未知档位 '%s'，使用 %s", rawProfile.trim(), profile.id()));
        }

        Map<PipelineName, PipelineThreshold> thresholds = new EnumMap<>(PipelineName.class);
        for (PipelineName pipeline : PipelineName.values()) {
            PipelineThreshold defaults = profile.defaultsFor(pipeline);
            double duration = readBoundedDouble(
                    overrideKey(pipeline, ThresholdMetric.MAX_DURATION_SEC),
                    settings.getOverrides().get(pipeline, ThresholdMetric.MAX_DURATION_SEC),
                    defaults.getMaxDurationSec(), MIN_DURATION_SEC, null, warnings);
            double failureRate = readBoundedDouble(
                    overrideKey(pipeline, ThresholdMetric.MAX_FAILURE_RATE),
                    settings.getOverrides().get(pipeline, ThresholdMetric.MAX_FAILURE_RATE),
                    defaults.getMaxFailureRate(), MIN_FAILURE_RATE, MAX_FAILURE_RATE, warnings);
            thresholds.put(pipeline, new PipelineThreshold(duration, failureRate));
        }

        ContinuityLimits limits = resolveContinuityLimits(settings, warnings);
        for (String warning : warnings) {
            log.warn("阈值配置无效: {}", warning);
        }
        return new ResolvedThresholds(profile, Collections.unmodifiableMap(thresholds), limits,
                Collections.unmodifiableList(warnings));
    }

    /**
     * warning至少为1，critical至少为warning
     */
    public static ContinuityLimits resolveContinuityLimits(ThresholdSettings settings, List<String> warnings) {
        int warning = readPositiveInt("slo.consecutive.warning", settings.getWarningLimit(),
                ContinuityLimits.DEFAULT_WARNING, 1, warnings);
        int critical = readPositiveInt("slo.consecutive.critical", settings.getCriticalLimit(),
                ContinuityLimits.DEFAULT_CRITICAL, warning, warnings);
        return new ContinuityLimits(warning, critical);
    }

    static double readBoundedDouble(String key, String raw, double defaultValue,
                                    double minimum, Double maximum, List<String> warnings) {
        if (StringUtils.isBlank(raw)) {
            return defaultValue;
        }
        Optional<Double> parsed = parseFinite(raw.trim());
        if (parsed.isEmpty()) {
            warnings.add(String.format("%s: '%s' 不是有效数字，使用默认值 %s", key, raw.trim(), defaultValue));
            return defaultValue;
        }
        double value = parsed.get();
        if (value < minimum) {
            return minimum;
        }
        if (maximum != null && value > maximum) {
            return maximum;
        }
        return value;
    }

    static int readPositiveInt(String key, String raw, int defaultValue, int minimum, List<String> warnings) {
        if (StringUtils.isBlank(raw)) {
            return Math.max(minimum, defaultValue);
        }
        String text = raw.trim();
        if (!NumberUtils.isDigits(StringUtils.removeStart(text, "-")) || text.length() > 10) {
            warnings.add(String.format("%s: '%s' 不是有效整数，使用默认值 %d", key, text, defaultValue));
            return Math.max(minimum, defaultValue);
        }
        long value = Long.parseLong(text);
        return (int) Math.max(minimum, Math.min(Integer.MAX_VALUE, value));
    }

    private static Optional<Double> parseFinite(String text) {
        if (!NumberUtils.isCreatable(text) && !NumberUtils.isParsable(text)) {
            return Optional.empty();
        }
        double value = NumberUtils.toDouble(text, Double.NaN);
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    static String overrideKey(PipelineName pipeline, ThresholdMetric metric) {
        return "thresholds.overrides." + pipeline.id() + "." + metric.configKey();
    }
}
