package opshealth.dedup;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import opshealth.utils.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 告警去重服务 - 冷却时间内的重复告警只发送一次
 */
@Slf4j
public class AlertDedupService {
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(600);
    public static final Duration DEFAULT_TTL = Duration.ofDays(7);
    public static final int DEFAULT_PREVIEW_LENGTH = 12;
    private static final int MIN_PREVIEW_LENGTH = 4;

    private final DedupStateStore store;
    @Getter
    private final Duration cooldown;
    @Getter
    private final Duration ttl;
    private final Clock clock;

    public AlertDedupService(DedupStateStore store, Duration cooldown, Duration ttl, Clock clock) {
        this.store = store;
        this.cooldown = nonNegative(cooldown);
        this.ttl = nonNegative(ttl);
        this.clock = clock;
    }

    public EmitDecision shouldEmit(String line) {
        return shouldEmit(line, cooldown, ttl, clock.instant());
    }

    public EmitDecision shouldEmit(String line, Duration cooldown, Duration ttl) {
        return shouldEmit(line, cooldown, ttl, clock.instant());
    }

    /**
     * 判定告警是否需要发送；需要发送时立即记录本次发送时间并持久化
     */
    public EmitDecision shouldEmit(String line, Duration cooldown, Duration ttl, Instant now) {
        Duration effectiveCooldown = nonNegative(cooldown);
        Duration effectiveTtl = nonNegative(ttl);
        String signature = AlertSignatures.of(line);

        PrunedState pruned = store.loadPruned(effectiveTtl, now);
        Map<String, String> state = pruned.getRetained();
        String lastSent = state.get(signature);
        boolean send = cooldownElapsed(lastSent, effectiveCooldown, now);

        EmitDecision.EmitDecisionBuilder decision = EmitDecision.builder()
                .send(send)
                .signature(signature)
                .lastSent(lastSent)
                .cooldownSec(effectiveCooldown.getSeconds())
                .ttlSec(effectiveTtl.getSeconds())
                .prunedCount(pruned.getRemovedCount());

        if (send) {
            String sentAt = Timestamps.format(now);
            state.put(signature, sentAt);
            store.saveAtomically(state);
            decision.sentAt(sentAt);
        } else {
            log.debug("告警重复，已抑制: {}, 上次发送: {}, 冷却: {}秒", signature, lastSent, effectiveCooldown.getSeconds());
        }
        return decision.build();
    }

    static boolean cooldownElapsed(String lastSent, Duration cooldown, Instant now) {
        if (cooldown.isZero()) {
            return true;
        }
        Optional<Instant> last = Timestamps.parse(lastSent);
        if (last.isEmpty()) {
            return true;
        }
        return Duration.between(last.get(), now).compareTo(cooldown) >= 0;
    }

    public PruneResult prune() {
        return prune(ttl, clock.instant());
    }

    public PruneResult prune(Duration ttl, Instant now) {
        Duration effectiveTtl = nonNegative(ttl);
        PrunedState pruned = store.loadPruned(effectiveTtl, now);
        if (pruned.getRemovedCount() > 0) {
            log.info("清理过期去重记录: {}条, 存储: {}", pruned.getRemovedCount(), store.location());
        }
        return PruneResult.builder()
                .statePath(store.location())
                .ttlSec(effectiveTtl.getSeconds())
                .entryCountBefore(pruned.getCountBeforePrune())
                .entryCountAfter(pruned.getCountBeforePrune() - pruned.getRemovedCount())
                .removedCount(pruned.getRemovedCount())
                .build();
    }

    /**
     * 清空全部记录，可选先备份
     */
    public ResetResult reset(boolean backup) {
        Instant now = clock.instant();
        PrunedState before = store.loadPruned(ttl, now);
        boolean existed = store.exists();

        String backupPath = "";
        if (existed && backup) {
            backupPath = store.backup(now).orElse("");
        }

        store.saveAtomically(Map.of());
        log.info("去重状态已重置: {}, 清除{}条", store.location(), before.getRetained().size());
        return ResetResult.builder()
                .statePath(store.location())
                .existed(existed)
                .ttlSec(ttl.getSeconds())
                .prunedCount(before.getRemovedCount())
                .entryCountBeforePrune(before.getCountBeforePrune())
                .entryCountBefore(before.getRetained().size())
                .entryCountAfter(0)
                .backupPath(backupPath)
                .build();
    }

    public DedupSummary summarize(int topN) {
        return summarize(topN, DEFAULT_PREVIEW_LENGTH);
    }

    /**
     * 汇总当前状态；汇总前会按配置的TTL清理过期记录并写回
     */
    public DedupSummary summarize(int topN, int previewLength) {
        PrunedState pruned = store.loadPruned(ttl, clock.instant());

        List<Row> rows = pruned.getRetained().entrySet().stream()
                .map(entry -> new Row(entry.getKey(), entry.getValue(), Timestamps.parse(entry.getValue()).orElse(null)))
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());

        List<Instant> parsed = rows.stream()
                .map(row -> row.parsed)
                .filter(instant -> instant != null)
                .collect(Collectors.toList());
        String oldest = parsed.stream().min(Comparator.naturalOrder()).map(Timestamps::format).orElse("");
        String newest = parsed.stream().max(Comparator.naturalOrder()).map(Timestamps::format).orElse("");

        int limit = Math.max(0, topN);
        int preview = Math.max(MIN_PREVIEW_LENGTH, previewLength);
        List<DedupSummary.SignatureEntry> top = new ArrayList<>();
        for (Row row : rows.subList(0, Math.min(limit, rows.size()))) {
            top.add(new DedupSummary.SignatureEntry(row.signature, preview(row.signature, preview), row.timestamp));
        }

        return DedupSummary.builder()
                .statePath(store.location())
                .exists(store.exists())
                .ttlSec(ttl.getSeconds())
                .prunedCount(pruned.getRemovedCount())
                .entryCount(rows.size())
                .oldestTimestamp(oldest)
                .newestTimestamp(newest)
                .topSignatures(top)
                .build();
    }

    static String preview(String signature, int length) {
        if (signature.length() <= length) {
            return signature;
        }
        return signature.substring(0, length) + "...";
    }

    private static Duration nonNegative(Duration value) {
        if (value == null || value.isNegative()) {
            return Duration.ZERO;
        }
        return value;
    }

    // 按时间倒序，无法解析的时间戳排在最后
    private static final Comparator<Row> NEWEST_FIRST = Comparator.comparing(
            (Row row) -> row.parsed, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed();

    private static class Row {
        private final String signature;
        private final String timestamp;
        private final Instant parsed;

        Row(String signature, String timestamp, Instant parsed) {
            this.signature = signature;
            this.timestamp = timestamp;
            this.parsed = parsed;
        }
    }
}
