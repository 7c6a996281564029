package opshealth.report;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import opshealth.metrics.PipelineName;
import opshealth.utils.TextFiles;

/**
 * 运维手册引用 - 找到各流水线对应的章节标题并生成GitHub风格锚点
 */
@Slf4j
public class RunbookReferences {
    public static final String DEFAULT_PATH = "docs/runbook.md";

    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+(?<heading>.+?)\\s*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ANCHOR_CHARS = Pattern.compile("[^\\w\\-\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DASHES = Pattern.compile("-+");

    private static final Map<PipelineName, String> JAPANESE_TITLES = Map.of(
            PipelineName.DAILY, "日次パイプライン",
            PipelineName.WEEKLY, "週次パイプライン",
            PipelineName.MONTHLY, "月次パイプライン");

    private final String displayPath;
    private final Path runbookFile;
    private final LoadingCache<Path, Map<PipelineName, String>> headingCache;

    /**
     * @param displayPath 报告中展示的手册路径，如 docs/runbook.md
     * @param runbookFile 实际读取的手册文件
     */
    public RunbookReferences(String displayPath, Path runbookFile) {
        this.displayPath = displayPath;
        this.runbookFile = runbookFile;
        this.headingCache = CacheBuilder.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(4)
                .build(CacheLoader.from(RunbookReferences::loadHeadings));
    }

    public Reference referenceFor(PipelineName pipeline) {
        String heading = headingCache.getUnchecked(runbookFile).get(pipeline);
        if (heading == null) {
            return new Reference(displayPath, "");
        }
        String slug = githubAnchor(heading);
        if (slug.isEmpty()) {
            return new Reference(displayPath, "");
        }
        return new Reference(displayPath + "#" + slug, "#" + slug);
    }

    /**
     * 每条流水线取第一个匹配的标题
     */
    static Map<PipelineName, String> loadHeadings(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Collections.emptyMap();
        }
        List<String> lines;
        try {
            lines = TextFiles.readLines(file);
        } catch (IOException e) {
            log.warn("读取运维手册失败: {}", file, e);
            return Collections.emptyMap();
        }

        Map<PipelineName, String> headings = new EnumMap<>(PipelineName.class);
        for (String line : lines) {
            Matcher matcher = HEADING.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String heading = matcher.group("heading").trim();
            String lowered = heading.toLowerCase(Locale.ROOT);
            for (PipelineName pipeline : PipelineName.values()) {
                if (lowered.contains(pipeline.id() + " pipeline") || heading.contains(JAPANESE_TITLES.get(pipeline))) {
                    headings.putIfAbsent(pipeline, heading);
                    break;
                }
            }
        }
        return headings;
    }

    static String githubAnchor(String heading) {
        String normalized = WHITESPACE.matcher(heading.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
        normalized = NON_ANCHOR_CHARS.matcher(normalized).replaceAll("");
        normalized = DASHES.matcher(normalized.replace(' ', '-')).replaceAll("-");
        return normalized.replaceAll("^-+|-+$", "");
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class Reference {
        private final String reference;
        private final String anchor;
    }
}
