package opshealth.dedup;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 去重状态重置结果
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResetResult {
    private final String statePath;
    private final boolean existed;
    private final long ttlSec;
    private final int prunedCount;
    private final int entryCountBeforePrune;
    private final int entryCountBefore;
    private final int entryCountAfter;
    private final String backupPath;    // 未备份时为空字符串
}
