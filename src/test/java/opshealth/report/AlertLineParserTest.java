package opshealth.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class AlertLineParserTest {

    @Test
    @DisplayName("按关键字分类，先命中者生效")
    void classify_first_match_wins() {
        assertThat(AlertType.classify("daily pipeline: COMMAND FAILED: make test")).isEqualTo(AlertType.COMMAND_FAILED);
        assertThat(AlertType.classify("Monthly report scheduled; webhook failed")).isEqualTo(AlertType.MONTHLY_SCHEDULED);
        assertThat(AlertType.classify("Webhook delivery failure")).isEqualTo(AlertType.WEBHOOK_FAILED);
        assertThat(AlertType.classify("webhook sent")).isEqualTo(AlertType.OTHER);
        assertThat(AlertType.classify("Threshold exceeded for weekly")).isEqualTo(AlertType.THRESHOLD);
        assertThat(AlertType.classify("disk almost full")).isEqualTo(AlertType.OTHER);
    }

    @Test
    @DisplayName("识别流水线名")
    void detect_pipeline() {
        assertThat(AlertLineParser.detectPipeline("ERROR Weekly Pipeline: timeout")).isEqualTo("weekly");
        assertThat(AlertLineParser.detectPipeline("{\"pipeline\":\"monthly\",\"status\":\"x\"}")).isEqualTo("monthly");
        assertThat(AlertLineParser.detectPipeline("threshold pipeline=daily metric=failure_rate")).isEqualTo("daily");
        assertThat(AlertLineParser.detectPipeline("webhook failed")).isEqualTo(AlertLineParser.UNKNOWN_PIPELINE);
    }

    @Test
    @DisplayName("解析时间戳前缀，没有前缀时时间戳为空")
    void parse_line() {
        ParsedAlert parsed = AlertLineParser.parse("[2024-06-01T10:00:00+09:00] WARN weekly pipeline: threshold exceeded");

        assertThat(parsed.getTimestamp()).isEqualTo(Instant.parse("2024-06-01T01:00:00Z"));
        assertThat(parsed.getMessage()).isEqualTo("WARN weekly pipeline: threshold exceeded");
        assertThat(parsed.getPipeline()).isEqualTo("weekly");
        assertThat(parsed.getAlertType()).isEqualTo(AlertType.THRESHOLD);

        assertThat(AlertLineParser.parse("webhook failed").getTimestamp()).isNull();
        assertThat(AlertLineParser.parse("[not a time] webhook failed").getTimestamp()).isNull();
    }

    @Test
    @DisplayName("告警日志含非法UTF-8字节时，其余行仍被解析")
    void read_file_with_invalid_bytes(@TempDir Path tempDir) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("[2024-06-01T00:00:00Z] ERROR daily pipeline: command failed: make test\n"
                .getBytes(StandardCharsets.UTF_8));
        bytes.write(new byte[]{'b', 'a', 'd', ' ', (byte) 0xFF, (byte) 0xFE, '\n'});
        bytes.write("[2024-06-02T00:00:00Z] WARN weekly pipeline: threshold exceeded\n"
                .getBytes(StandardCharsets.UTF_8));
        Path alertLog = tempDir.resolve(OpsReportBuilder.ALERT_LOG_NAME);
        Files.write(alertLog, bytes.toByteArray());

        List<ParsedAlert> alerts = AlertLineParser.readFile(alertLog);

        assertThat(alerts)
                .extracting(ParsedAlert::getPipeline, ParsedAlert::getAlertType)
                .containsExactly(
                        tuple("daily", AlertType.COMMAND_FAILED),
                        tuple(AlertLineParser.UNKNOWN_PIPELINE, AlertType.OTHER),
                        tuple("weekly", AlertType.THRESHOLD));
        assertThat(alerts.get(1).getMessage()).isEqualTo("bad \uFFFD\uFFFD");
    }
}
