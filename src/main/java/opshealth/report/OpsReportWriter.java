package opshealth.report;

import lombok.extern.slf4j.Slf4j;
import opshealth.OpsHealthException;
import opshealth.utils.JsonFiles;
import opshealth.utils.Timestamps;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 报告落盘: ops-report-yyyy-MM-dd.json 与 latest_ops_report.json
 */
@Slf4j
public class OpsReportWriter {
    public static final String LATEST_FILE_NAME = "latest_ops_report.json";

    private final Path outputDir;

    public OpsReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * @return 按日期命名的报告文件
     */
    public Path write(OpsReport report) {
        Path dated = outputDir.resolve(datedFileName(report));
        Path latest = outputDir.resolve(LATEST_FILE_NAME);
        try {
            JsonFiles.writeAtomically(dated, report);
            JsonFiles.writeAtomically(latest, report);
        } catch (IOException e) {
            log.error("写入运维报告失败: {}", dated, e);
            throw new OpsHealthException("写入运维报告失败: " + dated, e);
        }
        log.info("运维报告已写入: {}", dated);
        return dated;
    }

    static String datedFileName(OpsReport report) {
        Instant generatedAt = Timestamps.parse(report.getGeneratedAt()).orElseGet(Instant::now);
        return "ops-report-" + Timestamps.utcDate(generatedAt) + ".json";
    }
}
