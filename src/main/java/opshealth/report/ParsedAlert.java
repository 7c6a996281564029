package opshealth.report;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 解析后的一行告警日志
 */
@Getter
@ToString
@AllArgsConstructor
public class ParsedAlert {
    private final String rawLine;
    private final String message;
    private final Instant timestamp;    // 无时间戳或无法解析时为null
    private final String pipeline;      // daily/weekly/monthly/unknown
    private final AlertType alertType;
}
