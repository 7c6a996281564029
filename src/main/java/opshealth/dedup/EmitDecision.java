package opshealth.dedup;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 告警发送判定结果
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EmitDecision {
    private final boolean send;
    private final String signature;
    private final String lastSent;      // 上次发送时间，首次出现为null
    private final long cooldownSec;
    private final long ttlSec;
    private final int prunedCount;
    private final String sentAt;        // 本次发送时间，被抑制时为null
}
