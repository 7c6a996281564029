package opshealth.dedup;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * 告警去重状态存储接口 - 保存 签名 -> 最近一次发送时间
 */
public interface DedupStateStore {
    /**
     * 加载全部记录，文档缺失或损坏时返回空映射
     */
    Map<String, String> load();

    /**
     * 原子保存全部记录
     */
    void saveAtomically(Map<String, String> lastSentBySignature);

    /**
     * 状态文档是否存在
     */
    boolean exists();

    /**
     * 备份当前状态，返回备份位置
     */
    Optional<String> backup(Instant now);

    /**
     * 存储位置描述
     */
    String location();

    /**
     * 加载并清理过期记录，有记录被清理时写回
     */
    default PrunedState loadPruned(Duration ttl, Instant now) {
        PrunedState pruned = PrunedState.of(load(), ttl, now);
        if (pruned.getRemovedCount() > 0) {
            saveAtomically(pruned.getRetained());
        }
        return pruned;
    }
}
