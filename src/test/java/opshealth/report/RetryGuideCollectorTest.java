package opshealth.report;

import org.junit.jupiter.api.BeforeEach;
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

class RetryGuideCollectorTest {

    @TempDir
    Path logsDir;

    private RetryGuideCollector collector;

    @BeforeEach
    void setUp() throws Exception {
        Path runbook = logsDir.resolve("runbook.md");
        Files.writeString(runbook, "## Daily pipeline recovery\n", StandardCharsets.UTF_8);
        collector = new RetryGuideCollector(logsDir, new RunbookReferences("docs/runbook.md", runbook));
    }

    private void write(String name, String... lines) throws Exception {
        Files.writeString(logsDir.resolve(name), String.join("\n", lines), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("按时间倒序收集失败命令，相同流水线和命令只保留最新一条")
    void collect_newest_first_and_dedupe() throws Exception {
        write("daily-run-20240605-010000.log",
                "[2024-06-05T01:00:05Z] INFO daily pipeline: started",
                "[2024-06-05T01:00:10Z] ERROR daily pipeline: command failed: make test",
                "[2024-06-05T01:00:20Z] error DAILY pipeline: Command Failed: make lint  ");
        write("weekly-run-20240606-020000.log",
                "[2024-06-06T02:00:10Z] ERROR weekly pipeline: command failed: make report");
        write("daily-run-20240607-030000.log",
                "[2024-06-07T03:00:10Z] ERROR daily pipeline: command failed: make test");

        List<RetryGuide> guides = collector.collect(Instant.parse("2024-06-01T00:00:00Z"), 12);

        assertThat(guides)
                .extracting(RetryGuide::getPipeline, RetryGuide::getFailedCommand)
                .containsExactly(
                        tuple("daily", "make test"),
                        tuple("weekly", "make report"),
                        tuple("daily", "make lint"));
        RetryGuide first = guides.get(0);
        assertThat(first.getSuggestedRetryCommand()).isEqualTo("make test");
        assertThat(first.getRunbookReference()).isEqualTo("docs/runbook.md#daily-pipeline-recovery");
        assertThat(first.getRunbookReferenceAnchor()).isEqualTo("#daily-pipeline-recovery");
        assertThat(guides.get(1).getRunbookReference()).isEqualTo("docs/runbook.md");
        assertThat(guides.get(1).getRunbookReferenceAnchor()).isEmpty();
    }

    @Test
    @DisplayName("窗口外的文件与记录被忽略，无法解析的行时间取文件名时间")
    void window_filtering() throws Exception {
        write("daily-run-20240520-000000.log",
                "[2024-06-05T00:00:00Z] ERROR daily pipeline: command failed: old file");
        write("daily-run-20240602-000000.log",
                "[2024-05-01T00:00:00Z] ERROR daily pipeline: command failed: old line",
                "[garbage] ERROR daily pipeline: command failed: fallback to file time");
        write("hourly-run-20240602-000000.log",
                "[2024-06-02T00:00:00Z] ERROR daily pipeline: command failed: unknown file");
        write("daily-run-2024060-000000.log",
                "[2024-06-02T00:00:00Z] ERROR daily pipeline: command failed: bad name");

        List<RetryGuide> guides = collector.collect(Instant.parse("2024-06-01T00:00:00Z"), 12);

        assertThat(guides).extracting(RetryGuide::getFailedCommand).containsExactly("fallback to file time");
    }

    @Test
    @DisplayName("数量上限与空目录")
    void limit_and_missing_directory() throws Exception {
        write("daily-run-20240605-010000.log",
                "[2024-06-05T01:00:01Z] ERROR daily pipeline: command failed: a",
                "[2024-06-05T01:00:02Z] ERROR daily pipeline: command failed: b",
                "[2024-06-05T01:00:03Z] ERROR daily pipeline: command failed: c");

        assertThat(collector.collect(null, 2)).extracting(RetryGuide::getFailedCommand).containsExactly("c", "b");
        assertThat(collector.collect(null, 0)).isEmpty();

        RetryGuideCollector empty = new RetryGuideCollector(logsDir.resolve("missing"),
                new RunbookReferences("docs/runbook.md", logsDir.resolve("none.md")));
        assertThat(empty.collect(null, 12)).isEmpty();
    }

    @Test
    @DisplayName("运行日志含非法UTF-8字节时，仍能收集其余失败命令")
    void run_log_with_invalid_bytes() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("[2024-06-05T01:00:01Z] ERROR daily pipeline: command failed: make test\n"
                .getBytes(StandardCharsets.UTF_8));
        bytes.write(new byte[]{'[', (byte) 0xFF, ']', ' ', 'n', 'o', 'i', 's', 'e', '\n'});
        bytes.write("[2024-06-05T01:00:02Z] ERROR daily pipeline: command failed: make lint\n"
                .getBytes(StandardCharsets.UTF_8));
        Files.write(logsDir.resolve("daily-run-20240605-010000.log"), bytes.toByteArray());

        List<RetryGuide> guides = collector.collect(Instant.parse("2024-06-01T00:00:00Z"), 12);

        assertThat(guides).extracting(RetryGuide::getFailedCommand).containsExactly("make lint", "make test");
    }
}
