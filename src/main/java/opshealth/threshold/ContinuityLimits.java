package opshealth.threshold;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 连续失败告警上限，warning不大于critical
 */
@Getter
@ToString
@AllArgsConstructor
public class ContinuityLimits {
    public static final int DEFAULT_WARNING = 3;
    public static final int DEFAULT_CRITICAL = 5;

    private final int warning;
    private final int critical;
}
