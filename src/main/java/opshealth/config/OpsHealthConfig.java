package opshealth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import opshealth.metrics.PipelineName;
import opshealth.threshold.ThresholdMetric;
import opshealth.threshold.ThresholdSettings;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ops-health 配置，YAML文档按点号分隔的键读取
 * <pre>
 * logs:
 *   dir: logs
 * dedup:
 *   state_path: logs/alert-dedup-state.json
 *   cooldown_sec: 600
 *   ttl_sec: 604800
 * report:
 *   output_dir: logs
 *   runbook_path: docs/runbook.md
 * thresholds:
 *   profile: stg
 *   overrides:
 *     daily:
 *       max_duration_sec: 1500
 * slo:
 *   consecutive:
 *     warning: 3
 *     critical: 5
 * </pre>
 */
@Slf4j
public class OpsHealthConfig {
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private static final String OVERRIDES_KEY = "thresholds.overrides";

    private final Map<String, Object> config;

    private OpsHealthConfig(Map<String, Object> config) {
        this.config = config;
    }

    /**
     * 加载配置文件，路径为空时使用全部默认值
     */
    @SuppressWarnings("unchecked")
    public static OpsHealthConfig load(String configPath) {
        if (StringUtils.isBlank(configPath)) {
            log.info("未指定配置文件，使用默认配置");
            return fromMap(Collections.emptyMap());
        }
        Path path = Paths.get(configPath).toAbsolutePath();
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("配置文件不存在: " + path);
        }
        try {
            Map<String, Object> loaded = yamlMapper.readValue(path.toFile(), Map.class);
            log.info("加载配置文件: {}", path);
            return fromMap(loaded == null ? Collections.emptyMap() : loaded);
        } catch (IOException e) {
            throw new ConfigurationException("加载配置文件失败: " + configPath, e);
        }
    }

    public static OpsHealthConfig fromMap(Map<String, Object> config) {
        OpsHealthConfig loaded = new OpsHealthConfig(new LinkedHashMap<>(config));
        loaded.validate();
        return loaded;
    }

    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = getValue(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("配置项{}不是整数: {}, 使用默认值{}", key, value, defaultValue);
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("配置项{}不是整数: {}, 使用默认值{}", key, value, defaultValue);
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * 获取子配置
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getSubConfig(String key) {
        Object value = getValue(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    @SuppressWarnings("unchecked")
    private Object getValue(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }

        String[] parts = key.split("\\.");
        Map<String, Object> current = config;

        for (int i = 0; i < parts.length - 1; i++) {
            Object value = current.get(parts[i]);
            if (!(value instanceof Map)) {
                return null;
            }
            current = (Map<String, Object>) value;
        }

        return current.get(parts[parts.length - 1]);
    }

    /**
     * 校验阈值覆盖配置的结构，数值合法性在阈值解析时处理
     */
    public void validate() {
        Object overrides = getValue(OVERRIDES_KEY);
        if (overrides == null) {
            return;
        }
        if (!(overrides instanceof Map)) {
            throw new ConfigurationException(OVERRIDES_KEY + " 必须是映射");
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) overrides).entrySet()) {
            String pipelineKey = String.valueOf(entry.getKey());
            if (PipelineName.fromText(pipelineKey).isEmpty()) {
                throw new ConfigurationException("未知的流水线: " + OVERRIDES_KEY + "." + pipelineKey);
            }
            if (entry.getValue() == null) {
                continue;
            }
            if (!(entry.getValue() instanceof Map)) {
                throw new ConfigurationException(OVERRIDES_KEY + "." + pipelineKey + " 必须是映射");
            }
            for (Object metricKey : ((Map<?, ?>) entry.getValue()).keySet()) {
                if (ThresholdMetric.fromConfigKey(String.valueOf(metricKey)).isEmpty()) {
                    throw new ConfigurationException("未知的阈值指标: " + OVERRIDES_KEY + "." + pipelineKey + "." + metricKey);
                }
            }
        }
    }

    /**
     * 阈值相关配置转换为 {@link ThresholdSettings}，值保持原始文本
     */
    public ThresholdSettings toThresholdSettings() {
        ThresholdSettings.ThresholdSettingsBuilder builder = ThresholdSettings.builder()
                .profile(getString("thresholds.profile"))
                .warningLimit(getString("slo.consecutive.warning"))
                .criticalLimit(getString("slo.consecutive.critical"));

        for (Map.Entry<String, Object> entry : getSubConfig(OVERRIDES_KEY).entrySet()) {
            PipelineName pipeline = PipelineName.fromText(entry.getKey()).orElseThrow();
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            for (Map.Entry<?, ?> metricEntry : ((Map<?, ?>) entry.getValue()).entrySet()) {
                if (metricEntry.getValue() == null) {
                    continue;
                }
                ThresholdMetric metric = ThresholdMetric.fromConfigKey(String.valueOf(metricEntry.getKey())).orElseThrow();
                builder.override(pipeline, metric, metricEntry.getValue().toString());
            }
        }
        return builder.build();
    }

    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
