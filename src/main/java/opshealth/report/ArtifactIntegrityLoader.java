package opshealth.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.primitives.Ints;
import lombok.extern.slf4j.Slf4j;
import opshealth.utils.JsonFiles;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 读取产物校验文档
 * <p>
 * 格式: {"checks": [{"path": "...", "status": "OK|MISSING"}], "summary": {"ok": 1, "missing": 0, "total": 1}}
 */
@Slf4j
public class ArtifactIntegrityLoader {
    public static final String DEFAULT_FILE_NAME = "weekly-artifact-verify.json";

    public ArtifactIntegrity load(Path verifyFile) {
        String source = verifyFile.toString();
        Optional<JsonNode> document = JsonFiles.readTree(verifyFile);
        if (document.isEmpty() || !document.get().isObject()) {
            return ArtifactIntegrity.empty(source);
        }

        List<ArtifactCheck> files = new ArrayList<>();
        JsonNode checks = document.get().path("checks");
        if (checks.isArray()) {
            for (JsonNode item : checks) {
                if (!item.isObject()) {
                    continue;
                }
                String path = StringUtils.trimToEmpty(item.path("path").asText(""));
                if (path.isEmpty()) {
                    continue;
                }
                String status = StringUtils.trimToEmpty(item.path("status").asText("")).toUpperCase(Locale.ROOT);
                files.add(new ArtifactCheck(path, "OK".equals(status) ? ArtifactStatus.OK : ArtifactStatus.MISSING));
            }
        }

        long ok = files.stream().filter(file -> file.getStatus() == ArtifactStatus.OK).count();
        JsonNode summary = document.get().path("summary");
        int okCount = count(summary, "ok", (int) ok);
        int missingCount = count(summary, "missing", files.size() - (int) ok);
        int totalCount = count(summary, "total", files.size());
        log.debug("产物校验: ok={}, missing={}, total={}", okCount, missingCount, totalCount);

        return ArtifactIntegrity.builder()
                .source(source)
                .okCount(Math.max(0, okCount))
                .missingCount(Math.max(0, missingCount))
                .totalCount(Math.max(0, totalCount))
                .files(files)
                .build();
    }

    private static int count(JsonNode summary, String field, int defaultValue) {
        JsonNode value = summary.path(field);
        if (value.isNumber()) {
            if (value.canConvertToLong()) {
                return Ints.saturatedCast(value.longValue());
            }
            return value.doubleValue() > 0 ? Integer.MAX_VALUE : Integer.MIN_VALUE;
        }
        String text = value.isTextual() ? value.textValue().trim() : "";
        if (NumberUtils.isDigits(text)) {
            // 超出long范围的数字串同样按上限处理
            long parsed = NumberUtils.toLong(text, -1L);
            return parsed < 0 ? Integer.MAX_VALUE : Ints.saturatedCast(parsed);
        }
        return defaultValue;
    }
}
