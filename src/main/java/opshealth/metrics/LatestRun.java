package opshealth.metrics;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 最近一次运行快照
 */
@Getter
@ToString
@AllArgsConstructor
public class LatestRun {
    private final String timestamp;
    private final boolean success;
}
