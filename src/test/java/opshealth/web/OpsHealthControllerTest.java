package opshealth.web;

import opshealth.dedup.AlertDedupService;
import opshealth.dedup.InMemoryDedupStateStore;
import opshealth.health.HealthScorer;
import opshealth.report.OpsReportBuilder;
import opshealth.report.OpsReportWriter;
import opshealth.report.RetryGuideCollector;
import opshealth.report.RunbookReferences;
import opshealth.threshold.ThresholdEvaluator;
import opshealth.threshold.ThresholdSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class OpsHealthControllerTest {

    private static final Instant NOW = Instant.parse("2024-06-10T00:00:00Z");

    @TempDir
    Path logsDir;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AlertDedupService dedupService = new AlertDedupService(new InMemoryDedupStateStore(),
                Duration.ofSeconds(600), Duration.ofDays(7), clock);
        OpsReportBuilder reportBuilder = new OpsReportBuilder(logsDir, ThresholdSettings.defaults(),
                new ThresholdEvaluator(new HealthScorer()),
                new RunbookReferences(RunbookReferences.DEFAULT_PATH, logsDir.resolve("runbook.md")),
                OpsReportBuilder.DEFAULT_TOP_ALERT_TYPES, RetryGuideCollector.DEFAULT_LIMIT, clock);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new OpsHealthController(dedupService, reportBuilder, new OpsReportWriter(logsDir.resolve("out"))))
                .build();
    }

    @Test
    @DisplayName("重复告警在冷却期内被抑制")
    void emit_then_suppress() throws Exception {
        String body = "{\"line\":\"[2024-06-10T00:00:00Z] ERROR daily pipeline: command failed: make test\"}";

        mockMvc.perform(post("/api/dedup/emit").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.send").value(true))
                .andExpect(jsonPath("$.sent_at").value("2024-06-10T00:00:00Z"))
                .andExpect(jsonPath("$.cooldown_sec").value(600));

        mockMvc.perform(post("/api/dedup/emit").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.send").value(false))
                .andExpect(jsonPath("$.sent_at").value(nullValue()));

        mockMvc.perform(post("/api/dedup/emit").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"line\":\"[x] ERROR daily pipeline: command failed: make test\",\"cooldown_sec\":0}"))
                .andExpect(jsonPath("$.send").value(true));

        mockMvc.perform(get("/api/dedup/summary").param("top", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entry_count").value(1))
                .andExpect(jsonPath("$.top_signatures", hasSize(1)));
    }

    @Test
    @DisplayName("空告警行返回400")
    void blank_line_is_rejected() throws Exception {
        mockMvc.perform(post("/api/dedup/emit").contentType(MediaType.APPLICATION_JSON).content("{\"line\":\" \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("重置与清理")
    void reset_and_prune() throws Exception {
        mockMvc.perform(post("/api/dedup/emit").contentType(MediaType.APPLICATION_JSON).content("{\"line\":\"a\"}"));

        mockMvc.perform(post("/api/dedup/reset").param("backup", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.existed").value(true))
                .andExpect(jsonPath("$.entry_count_before").value(1))
                .andExpect(jsonPath("$.entry_count_after").value(0));

        mockMvc.perform(post("/api/dedup/prune"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed_count").value(0));
    }

    @Test
    @DisplayName("生成并写入运维报告")
    void ops_report() throws Exception {
        Files.writeString(logsDir.resolve("daily-metrics-1.json"),
                "{\"pipeline\":\"daily\",\"finished_at\":\"2024-06-09T00:00:00Z\",\"duration_sec\":5,\"success\":true}",
                StandardCharsets.UTF_8);

        mockMvc.perform(get("/api/ops-report").param("days", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_runs").value(1))
                .andExpect(jsonPath("$.pipeline_success_rates.daily.success_rate").value(1.0))
                .andExpect(jsonPath("$.threshold_profile").value("prod"));

        mockMvc.perform(post("/api/ops-report").param("days", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.total_runs").value(1));

        assertThat(logsDir.resolve("out").resolve("ops-report-2024-06-10.json")).exists();
        assertThat(logsDir.resolve("out").resolve(OpsReportWriter.LATEST_FILE_NAME)).exists();
    }
}
