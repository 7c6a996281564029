package opshealth.dedup;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 去重状态概要
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DedupSummary {
    private final String statePath;
    private final boolean exists;
    private final long ttlSec;
    private final int prunedCount;
    private final int entryCount;
    private final String oldestTimestamp;
    private final String newestTimestamp;
    private final List<SignatureEntry> topSignatures;

    @Getter
    @ToString
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SignatureEntry {
        private final String signature;
        private final String signaturePreview;
        private final String timestamp;
    }
}
