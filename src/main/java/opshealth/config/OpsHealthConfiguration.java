package opshealth.config;

import lombok.extern.slf4j.Slf4j;
import opshealth.dedup.AlertDedupService;
import opshealth.dedup.DedupStateStore;
import opshealth.dedup.FileDedupStateStore;
import opshealth.health.HealthScorer;
import opshealth.report.OpsReportBuilder;
import opshealth.report.OpsReportWriter;
import opshealth.report.RetryGuideCollector;
import opshealth.report.RunbookReferences;
import opshealth.threshold.ThresholdEvaluator;
import opshealth.threshold.ThresholdSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class OpsHealthConfiguration {

    @Autowired
    private OpsHealthPaths opsHealthPaths;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OpsHealthConfig opsHealthConfig() {
        return OpsHealthConfig.load(opsHealthPaths.configPath);
    }

    @Bean
    public ThresholdSettings thresholdSettings(OpsHealthConfig config) {
        ThresholdSettings settings = config.toThresholdSettings();
        log.info("阈值配置: {}", settings);
        return settings;
    }

    @Bean
    public DedupStateStore dedupStateStore(OpsHealthConfig config) {
        Path logsDir = logsDir(config);
        String statePath = config.getString("dedup.state_path");
        return new FileDedupStateStore(statePath == null
                ? logsDir.resolve(FileDedupStateStore.DEFAULT_FILE_NAME)
                : resolve(statePath));
    }

    @Bean
    public AlertDedupService alertDedupService(DedupStateStore store, OpsHealthConfig config, Clock clock) {
        Duration cooldown = Duration.ofSeconds(config.getLong("dedup.cooldown_sec",
                AlertDedupService.DEFAULT_COOLDOWN.getSeconds()));
        Duration ttl = Duration.ofSeconds(config.getLong("dedup.ttl_sec",
                AlertDedupService.DEFAULT_TTL.getSeconds()));
        log.info("告警去重: state={}, cooldown={}s, ttl={}s", store.location(), cooldown.getSeconds(), ttl.getSeconds());
        return new AlertDedupService(store, cooldown, ttl, clock);
    }

    @Bean
    public HealthScorer healthScorer() {
        return new HealthScorer();
    }

    @Bean
    public ThresholdEvaluator thresholdEvaluator(HealthScorer healthScorer) {
        return new ThresholdEvaluator(healthScorer);
    }

    @Bean
    public RunbookReferences runbookReferences(OpsHealthConfig config) {
        String runbookPath = config.getString("report.runbook_path", RunbookReferences.DEFAULT_PATH);
        return new RunbookReferences(runbookPath, resolve(runbookPath));
    }

    @Bean
    public OpsReportBuilder opsReportBuilder(OpsHealthConfig config,
                                             ThresholdSettings thresholdSettings,
                                             ThresholdEvaluator thresholdEvaluator,
                                             RunbookReferences runbookReferences,
                                             Clock clock) {
        return new OpsReportBuilder(logsDir(config), thresholdSettings, thresholdEvaluator, runbookReferences,
                config.getInt("report.top_alert_types", OpsReportBuilder.DEFAULT_TOP_ALERT_TYPES),
                config.getInt("report.retry_guide_limit", RetryGuideCollector.DEFAULT_LIMIT),
                clock);
    }

    @Bean
    public OpsReportWriter opsReportWriter(OpsHealthConfig config) {
        String outputDir = config.getString("report.output_dir");
        return new OpsReportWriter(outputDir == null ? logsDir(config) : resolve(outputDir));
    }

    private Path logsDir(OpsHealthConfig config) {
        return resolve(config.getString("logs.dir", "logs"));
    }

    private Path resolve(String path) {
        return Paths.get(opsHealthPaths.baseDir).resolve(path);
    }
}
