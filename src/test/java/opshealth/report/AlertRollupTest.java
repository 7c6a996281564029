package opshealth.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class AlertRollupTest {

    private static final List<String> LINES = List.of(
            "[2024-06-01T00:00:00Z] ERROR daily pipeline: command failed: make a",
            "[2024-06-08T01:00:00Z] ERROR daily pipeline: command failed: make b",
            "[2024-06-08T02:00:00Z] WARN weekly pipeline: threshold exceeded",
            "[2024-06-09T03:00:00Z] ERROR webhook failed",
            "[2024-06-09T04:00:00Z] ERROR weekly pipeline: command failed: make c",
            "[2024-06-09T05:00:00Z] INFO monthly report scheduled",
            "no timestamp webhook failed");

    @Test
    @DisplayName("窗口外和无时间戳的告警不计入")
    void rollup_within_window() {
        AlertRollup rollup = AlertRollup.of(AlertLineParser.parseAll(LINES), Instant.parse("2024-06-03T00:00:00Z"));

        assertThat(rollup.total()).isEqualTo(5);
        assertThat(rollup.topTypes(3))
                .extracting(AlertTypeCount::getType, AlertTypeCount::getCount)
                .containsExactly(
                        tuple(AlertType.COMMAND_FAILED, 2),
                        tuple(AlertType.MONTHLY_SCHEDULED, 1),
                        tuple(AlertType.THRESHOLD, 1));
        assertThat(rollup.perDay())
                .extracting(DailyAlertCount::getDate, DailyAlertCount::getAlertCount)
                .containsExactly(tuple("2024-06-08", 2), tuple("2024-06-09", 3));
        assertThat(rollup.perPipeline())
                .containsEntry("daily", 1)
                .containsEntry("weekly", 2)
                .containsEntry("unknown", 2);
    }

    @Test
    @DisplayName("窗口起点为空时统计全部带时间戳的告警")
    void unbounded_window() {
        AlertRollup rollup = AlertRollup.of(AlertLineParser.parseAll(LINES), null);

        assertThat(rollup.total()).isEqualTo(6);
        assertThat(rollup.topTypes(1)).extracting(AlertTypeCount::getType).containsExactly(AlertType.COMMAND_FAILED);
    }
}
