package opshealth.dedup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FileDedupStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("文件不存在或内容非法时按空状态处理")
    void missing_or_corrupt_document_loads_empty() throws Exception {
        Path statePath = tempDir.resolve("state.json");
        FileDedupStateStore store = new FileDedupStateStore(statePath);
        assertThat(store.exists()).isFalse();
        assertThat(store.load()).isEmpty();

        Files.writeString(statePath, "{not json", StandardCharsets.UTF_8);
        assertThat(store.load()).isEmpty();

        Files.writeString(statePath, "{\"last_sent\": [1, 2]}", StandardCharsets.UTF_8);
        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("写入后可读回，且不残留临时文件")
    void save_then_load() throws Exception {
        Path statePath = tempDir.resolve("nested").resolve("state.json");
        FileDedupStateStore store = new FileDedupStateStore(statePath);

        store.saveAtomically(Map.of("abc", "2024-01-01T00:00:00Z"));

        assertThat(store.exists()).isTrue();
        assertThat(store.load()).containsExactly(Map.entry("abc", "2024-01-01T00:00:00Z"));
        assertThat(Files.readString(statePath)).contains("\"last_sent\"");
        try (Stream<Path> files = Files.list(statePath.getParent())) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("state.json");
        }
    }

    @Test
    @DisplayName("备份文件名带UTC时间戳")
    void backup_copies_document() throws Exception {
        Path statePath = tempDir.resolve("alert-dedup-state.json");
        FileDedupStateStore store = new FileDedupStateStore(statePath);
        Instant now = Instant.parse("2024-03-05T06:07:08Z");

        assertThat(store.backup(now)).isEmpty();

        store.saveAtomically(Map.of("sig", "2024-03-05T06:00:00Z"));
        Optional<String> backup = store.backup(now);

        assertThat(backup).hasValue(tempDir.resolve("alert-dedup-state-20240305-060708.bak.json").toString());
        assertThat(Files.readString(Path.of(backup.get()))).isEqualTo(Files.readString(statePath));
    }

    @Test
    @DisplayName("无扩展名时备份后缀为.bak")
    void backup_file_name_without_extension() {
        assertThat(FileDedupStateStore.backupFileName("state", Instant.parse("2024-01-02T03:04:05Z")))
                .isEqualTo("state-20240102-030405.bak");
    }
}
