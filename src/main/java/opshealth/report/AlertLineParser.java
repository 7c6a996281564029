package opshealth.report;

import lombok.extern.slf4j.Slf4j;
import opshealth.metrics.PipelineName;
import opshealth.utils.TextFiles;
import opshealth.utils.Timestamps;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 告警日志解析，行格式: [时间戳] LEVEL 文本
 */
@Slf4j
public final class AlertLineParser {
    public static final String UNKNOWN_PIPELINE = "unknown";

    private static final Pattern ALERT_LINE = Pattern.compile("^\\[(?<timestamp>[^\\]]+)\\]\\s*(?<message>.*)$");

    private AlertLineParser() {
    }

    public static ParsedAlert parse(String line) {
        String stripped = StringUtils.strip(StringUtils.defaultString(line));
        Matcher matcher = ALERT_LINE.matcher(stripped);
        if (!matcher.matches()) {
            return new ParsedAlert(line, stripped, null, detectPipeline(stripped), AlertType.classify(stripped));
        }
        String message = matcher.group("message").trim();
        return new ParsedAlert(line, message,
                Timestamps.parse(matcher.group("timestamp")).orElse(null),
                detectPipeline(message), AlertType.classify(message));
    }

    public static List<ParsedAlert> parseAll(List<String> lines) {
        return lines.stream()
                .filter(StringUtils::isNotBlank)
                .map(AlertLineParser::parse)
                .collect(Collectors.toList());
    }

    /**
     * 读取告警日志，文件不存在或无法读取时返回空列表
     */
    public static List<ParsedAlert> readFile(Path alertLog) {
        if (!Files.isRegularFile(alertLog)) {
            return Collections.emptyList();
        }
        try {
            return parseAll(TextFiles.readLines(alertLog));
        } catch (IOException e) {
            log.warn("读取告警日志失败: {}", alertLog, e);
            return Collections.emptyList();
        }
    }

    static String detectPipeline(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (PipelineName pipeline : PipelineName.values()) {
            String id = pipeline.id();
            if (lower.contains(id + " pipeline")
                    || lower.contains("\"pipeline\":\"" + id + "\"")
                    || lower.contains("pipeline=" + id)) {
                return id;
            }
        }
        return UNKNOWN_PIPELINE;
    }
}
