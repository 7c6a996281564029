package opshealth.dedup;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 过期记录清理结果
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PruneResult {
    private final String statePath;
    private final long ttlSec;
    private final int entryCountBefore;
    private final int entryCountAfter;
    private final int removedCount;
}
