package opshealth.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.primitives.Ints;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import opshealth.utils.Timestamps;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.time.Instant;
import java.util.Optional;

/**
 * 单次流水线运行的遥测记录
 */
@Getter
@Builder
@ToString
public class PipelineRunRecord {
    private final PipelineName pipeline;
    private final String startedAt;
    private final String finishedAt;
    private final double durationSec;
    private final boolean success;
    private final int commandFailures;
    private final int alertCount;

    // finished_at优先，缺失时取started_at
    private final String eventTimestampText;
    private final Instant eventTime;
    private final int scanOrder;

    /**
     * 宽松解码：未知字段忽略，数值字段缺失或非法时取0，success缺失时为false
     *
     * @return pipeline未知或事件时间无法解析时返回空
     */
    public static Optional<PipelineRunRecord> fromJson(JsonNode node, int scanOrder) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        Optional<PipelineName> pipeline = PipelineName.fromText(text(node, "pipeline"));
        if (pipeline.isEmpty()) {
            return Optional.empty();
        }

        String startedAt = text(node, "started_at");
        String finishedAt = text(node, "finished_at");
        String eventText = StringUtils.isNotBlank(finishedAt) ? finishedAt.trim() : StringUtils.trimToEmpty(startedAt);
        Optional<Instant> eventTime = Timestamps.parse(eventText);
        if (eventTime.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(PipelineRunRecord.builder()
                .pipeline(pipeline.get())
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .durationSec(toDouble(node.get("duration_sec")))
                .success(toBoolean(node.get("success")))
                .commandFailures(toInt(node.get("command_failures")))
                .alertCount(toInt(node.get("alert_count")))
                .eventTimestampText(eventText)
                .eventTime(eventTime.get())
                .scanOrder(scanOrder)
                .build());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static double toDouble(JsonNode value) {
        if (value == null || value.isNull()) {
            return 0.0;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            double parsed = NumberUtils.toDouble(value.textValue().trim(), 0.0);
            return Double.isFinite(parsed) ? parsed : 0.0;
        }
        return 0.0;
    }

    private static int toInt(JsonNode value) {
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            if (value.canConvertToInt()) {
                return value.intValue();
            }
            return value.doubleValue() > 0 ? Integer.MAX_VALUE : 0;
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            if (NumberUtils.isDigits(text)) {
                long parsed = NumberUtils.toLong(text, -1L);
                return parsed < 0 ? Integer.MAX_VALUE : Ints.saturatedCast(parsed);
            }
            return NumberUtils.toInt(text, 0);
        }
        return 0;
    }

    private static boolean toBoolean(JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.asBoolean(false);
    }
}
