package opshealth.dedup;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内去重状态存储，不落盘
 */
public class InMemoryDedupStateStore implements DedupStateStore {
    private volatile Map<String, String> state;
    private final Map<String, Map<String, String>> backups = new ConcurrentHashMap<>();

    @Override
    public Map<String, String> load() {
        Map<String, String> current = state;
        return current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
    }

    @Override
    public synchronized void saveAtomically(Map<String, String> lastSentBySignature) {
        this.state = Map.copyOf(lastSentBySignature);
    }

    @Override
    public boolean exists() {
        return state != null;
    }

    @Override
    public Optional<String> backup(Instant now) {
        Map<String, String> current = state;
        if (current == null) {
            return Optional.empty();
        }
        String key = "memory-backup-" + now.toEpochMilli();
        backups.put(key, current);
        return Optional.of(key);
    }

    public Optional<Map<String, String>> getBackup(String key) {
        return Optional.ofNullable(backups.get(key));
    }

    @Override
    public String location() {
        return "memory";
    }
}
