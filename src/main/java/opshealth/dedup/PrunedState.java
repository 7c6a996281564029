package opshealth.dedup;

import lombok.AllArgsConstructor;
import lombok.Getter;
import opshealth.utils.Timestamps;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * TTL清理结果
 */
@Getter
@AllArgsConstructor
public class PrunedState {
    private final Map<String, String> retained;
    private final int removedCount;
    private final int countBeforePrune;

    /**
     * 清理早于 now - ttl 的记录；ttl不大于0表示永不过期，无法解析的时间戳保留
     */
    public static PrunedState of(Map<String, String> state, Duration ttl, Instant now) {
        Map<String, String> retained = new LinkedHashMap<>();
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            retained.putAll(state);
            return new PrunedState(retained, 0, state.size());
        }

        Instant cutoff = now.minus(ttl);
        int removed = 0;
        for (Map.Entry<String, String> entry : state.entrySet()) {
            Optional<Instant> sentAt = Timestamps.parse(entry.getValue());
            if (sentAt.isEmpty() || !sentAt.get().isBefore(cutoff)) {
                retained.put(entry.getKey(), entry.getValue());
            } else {
                removed++;
            }
        }
        return new PrunedState(retained, removed, state.size());
    }
}
