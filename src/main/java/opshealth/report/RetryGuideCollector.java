package opshealth.report;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import opshealth.metrics.PipelineName;
import opshealth.utils.TextFiles;
import opshealth.utils.Timestamps;
import org.apache.commons.collections4.CollectionUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从流水线运行日志中收集失败命令，生成重试指引
 */
@Slf4j
public class RetryGuideCollector {
    public static final int DEFAULT_LIMIT = 12;

    private static final Pattern RUN_LOG_NAME = Pattern.compile("^(daily|weekly|monthly)-run-(\\d{8})-(\\d{6})\\.log$");
    private static final Pattern FAILED_COMMAND = Pattern.compile(
            "^\\[(?<timestamp>[^\\]]+)\\]\\s+ERROR\\s+(?<pipeline>daily|weekly|monthly)\\s+pipeline:\\s+command failed:\\s+(?<command>.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Path logsDir;
    private final RunbookReferences runbookReferences;

    public RetryGuideCollector(Path logsDir, RunbookReferences runbookReferences) {
        this.logsDir = logsDir;
        this.runbookReferences = runbookReferences;
    }

    /**
     * @param since 窗口起点，为null时不限
     */
    public List<RetryGuide> collect(Instant since, int limit) {
        List<FailedCommand> rows = new ArrayList<>();
        for (Path file : runLogs()) {
            Matcher name = RUN_LOG_NAME.matcher(file.getFileName().toString());
            if (!name.matches()) {
                continue;
            }
            Instant fileTime;
            try {
                fileTime = LocalDateTime.parse(name.group(2) + name.group(3), FILE_TIMESTAMP).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                log.debug("运行日志文件名时间非法: {}", file);
                continue;
            }
            if (since != null && fileTime.isBefore(since)) {
                continue;
            }
            rows.addAll(readFailures(file, fileTime, since));
        }

        rows.sort(Comparator.comparing((FailedCommand row) -> row.eventTime).reversed());

        Set<String> seen = new HashSet<>();
        List<RetryGuide> guides = new ArrayList<>();
        int max = Math.max(0, limit);
        for (FailedCommand row : rows) {
            if (guides.size() >= max) {
                break;
            }
            if (!seen.add(row.pipeline.id() + "\n" + row.command)) {
                continue;
            }
            RunbookReferences.Reference reference = runbookReferences.referenceFor(row.pipeline);
            guides.add(RetryGuide.builder()
                    .pipeline(row.pipeline.id())
                    .failedCommand(row.command)
                    .suggestedRetryCommand(row.command)
                    .runbookReference(reference.getReference())
                    .runbookReferenceAnchor(reference.getAnchor())
                    .build());
        }
        return guides;
    }

    private List<FailedCommand> readFailures(Path file, Instant fileTime, Instant since) {
        List<String> lines;
        try {
            lines = TextFiles.readLines(file);
        } catch (IOException e) {
            log.warn("读取运行日志失败: {}", file, e);
            return List.of();
        }

        List<FailedCommand> rows = new ArrayList<>();
        for (String line : lines) {
            Matcher matcher = FAILED_COMMAND.matcher(line.trim());
            if (!matcher.matches()) {
                continue;
            }
            String command = matcher.group("command").trim();
            if (command.isEmpty()) {
                continue;
            }
            PipelineName pipeline = PipelineName.fromText(matcher.group("pipeline").toLowerCase(Locale.ROOT))
                    .orElse(null);
            if (pipeline == null) {
                continue;
            }
            Instant eventTime = Timestamps.parse(matcher.group("timestamp").trim()).orElse(fileTime);
            if (since != null && eventTime.isBefore(since)) {
                continue;
            }
            rows.add(new FailedCommand(eventTime, pipeline, command));
        }
        return rows;
    }

    private List<Path> runLogs() {
        if (!Files.isDirectory(logsDir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logsDir, "*-run-*.log")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.warn("列出运行日志失败: {}", logsDir, e);
            return List.of();
        }
        if (CollectionUtils.isEmpty(files)) {
            return files;
        }
        // 文件名倒序，时间相同的记录保持较新文件在前
        files.sort(Comparator.comparing((Path path) -> path.getFileName().toString()).reversed());
        return files;
    }

    @AllArgsConstructor
    private static class FailedCommand {
        private final Instant eventTime;
        private final PipelineName pipeline;
        private final String command;
    }
}
