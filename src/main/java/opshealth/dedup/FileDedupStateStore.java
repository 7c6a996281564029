package opshealth.dedup;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import opshealth.OpsHealthException;
import opshealth.utils.JsonFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 基于单个JSON文件的去重状态存储
 * <p>
 * 文档格式: {"last_sent": {"签名": "2024-01-01T00:00:00Z"}}
 */
@Slf4j
public class FileDedupStateStore implements DedupStateStore {
    public static final String DEFAULT_FILE_NAME = "alert-dedup-state.json";
    static final String LAST_SENT_FIELD = "last_sent";
    private static final DateTimeFormatter BACKUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final Path statePath;
    private final Object writeLock = new Object();

    public FileDedupStateStore(Path statePath) {
        this.statePath = statePath;
    }

    @Override
    public Map<String, String> load() {
        Optional<JsonNode> document = JsonFiles.readTree(statePath);
        if (document.isEmpty()) {
            return new LinkedHashMap<>();
        }

        JsonNode lastSent = document.get().get(LAST_SENT_FIELD);
        if (lastSent == null || !lastSent.isObject()) {
            log.debug("去重状态缺少{}字段，按空状态处理: {}", LAST_SENT_FIELD, statePath);
            return new LinkedHashMap<>();
        }

        Map<String, String> state = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = lastSent.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                state.put(field.getKey(), field.getValue().textValue());
            }
        }
        return state;
    }

    @Override
    public void saveAtomically(Map<String, String> lastSentBySignature) {
        Map<String, Object> document = Collections.singletonMap(
                LAST_SENT_FIELD, new LinkedHashMap<>(lastSentBySignature));
        synchronized (writeLock) {
            try {
                JsonFiles.writeAtomically(statePath, document);
            } catch (IOException e) {
                log.error("写入去重状态失败: {}", statePath, e);
                throw new OpsHealthException("写入去重状态失败: " + statePath, e);
            }
        }
    }

    @Override
    public boolean exists() {
        return Files.exists(statePath);
    }

    /**
     * 复制为 <文件名>-<yyyyMMdd-HHmmss>.bak<扩展名>
     */
    @Override
    public Optional<String> backup(Instant now) {
        if (!exists()) {
            return Optional.empty();
        }
        Path backupPath = statePath.resolveSibling(backupFileName(statePath.getFileName().toString(), now));
        try {
            Files.copy(statePath, backupPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("去重状态已备份: {}", backupPath);
            return Optional.of(backupPath.toString());
        } catch (IOException e) {
            log.error("备份去重状态失败: {}", statePath, e);
            throw new OpsHealthException("备份去重状态失败: " + statePath, e);
        }
    }

    static String backupFileName(String fileName, Instant now) {
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String suffix = dot > 0 ? fileName.substring(dot) : "";
        return stem + "-" + BACKUP_STAMP.format(now) + ".bak" + suffix;
    }

    @Override
    public String location() {
        return statePath.toString();
    }
}
