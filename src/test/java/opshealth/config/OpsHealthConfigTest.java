package opshealth.config;

import opshealth.metrics.PipelineName;
import opshealth.threshold.ResolvedThresholds;
import opshealth.threshold.ThresholdMetric;
import opshealth.threshold.ThresholdResolver;
import opshealth.threshold.ThresholdSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpsHealthConfigTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws Exception {
        Path path = tempDir.resolve("opshealth.yml");
        Files.writeString(path, yaml, StandardCharsets.UTF_8);
        return path;
    }

    @Test
    @DisplayName("加载YAML配置并转换为阈值配置")
    void load_and_convert() throws Exception {
        Path path = writeConfig(String.join("\n",
                "logs:",
                "  dir: /var/log/ops",
                "dedup:",
                "  cooldown_sec: 120",
                "  ttl_sec: soon",
                "thresholds:",
                "  profile: STG",
                "  overrides:",
                "    daily:",
                "      max_duration_sec: 1500",
                "    weekly:",
                "      max_failure_rate: 0.05",
                "slo:",
                "  consecutive:",
                "    warning: 2",
                ""));

        OpsHealthConfig config = OpsHealthConfig.load(path.toString());

        assertThat(config.getString("logs.dir")).isEqualTo("/var/log/ops");
        assertThat(config.getLong("dedup.cooldown_sec", 600)).isEqualTo(120);
        assertThat(config.getLong("dedup.ttl_sec", 604800)).isEqualTo(604800);
        assertThat(config.getInt("report.top_alert_types", 3)).isEqualTo(3);

        ThresholdSettings settings = config.toThresholdSettings();
        assertThat(settings.getOverrides().get(PipelineName.DAILY, ThresholdMetric.MAX_DURATION_SEC)).isEqualTo("1500");

        ResolvedThresholds resolved = ThresholdResolver.resolve(settings);
        assertThat(resolved.get(PipelineName.DAILY).getMaxDurationSec()).isEqualTo(1500.0);
        assertThat(resolved.get(PipelineName.DAILY).getMaxFailureRate()).isEqualTo(0.20);
        assertThat(resolved.get(PipelineName.WEEKLY).getMaxFailureRate()).isEqualTo(0.05);
        assertThat(resolved.getContinuityLimits().getWarning()).isEqualTo(2);
        assertThat(resolved.getContinuityLimits().getCritical()).isEqualTo(5);
    }

    @Test
    @DisplayName("未指定配置文件时使用默认值")
    void blank_path_uses_defaults() {
        OpsHealthConfig config = OpsHealthConfig.load(" ");

        assertThat(config.getString("logs.dir", "logs")).isEqualTo("logs");
        assertThat(config.getSubConfig("thresholds.overrides")).isEmpty();
        assertThat(config.toThresholdSettings().getOverrides().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("配置文件不存在或无法解析时抛出异常")
    void unreadable_config_fails() throws Exception {
        assertThatThrownBy(() -> OpsHealthConfig.load(tempDir.resolve("missing.yml").toString()))
                .isInstanceOf(OpsHealthConfig.ConfigurationException.class);

        Path broken = writeConfig("thresholds: [unclosed");
        assertThatThrownBy(() -> OpsHealthConfig.load(broken.toString()))
                .isInstanceOf(OpsHealthConfig.ConfigurationException.class);
    }

    @Test
    @DisplayName("阈值覆盖配置结构错误时抛出异常")
    void structural_errors_fail() {
        assertThatThrownBy(() -> OpsHealthConfig.fromMap(Map.of("thresholds", Map.of("overrides", "daily"))))
                .isInstanceOf(OpsHealthConfig.ConfigurationException.class);
        assertThatThrownBy(() -> OpsHealthConfig.fromMap(Map.of("thresholds",
                Map.of("overrides", Map.of("hourly", Map.of("max_duration_sec", 10))))))
                .isInstanceOf(OpsHealthConfig.ConfigurationException.class)
                .hasMessageContaining("hourly");
        assertThatThrownBy(() -> OpsHealthConfig.fromMap(Map.of("thresholds",
                Map.of("overrides", Map.of("daily", Map.of("min_duration_sec", 10))))))
                .isInstanceOf(OpsHealthConfig.ConfigurationException.class)
                .hasMessageContaining("min_duration_sec");
    }

    @Test
    @DisplayName("非法数值不在加载时报错，解析阈值时记录警告")
    void invalid_values_become_warnings() {
        OpsHealthConfig config = OpsHealthConfig.fromMap(Map.of("thresholds",
                Map.of("overrides", Map.of("monthly", Map.of("max_failure_rate", "lots")))));

        ResolvedThresholds resolved = ThresholdResolver.resolve(config.toThresholdSettings());

        assertThat(resolved.get(PipelineName.MONTHLY).getMaxFailureRate()).isEqualTo(0.25);
        assertThat(resolved.getWarnings()).hasSize(1);
    }
}
