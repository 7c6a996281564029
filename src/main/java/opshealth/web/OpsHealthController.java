package opshealth.web;

import lombok.extern.slf4j.Slf4j;
import opshealth.dedup.AlertDedupService;
import opshealth.dedup.DedupSummary;
import opshealth.dedup.EmitDecision;
import opshealth.dedup.PruneResult;
import opshealth.dedup.ResetResult;
import opshealth.report.OpsReport;
import opshealth.report.OpsReportBuilder;
import opshealth.report.OpsReportWriter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class OpsHealthController {

    private final AlertDedupService alertDedupService;
    private final OpsReportBuilder opsReportBuilder;
    private final OpsReportWriter opsReportWriter;

    @Autowired
    public OpsHealthController(AlertDedupService alertDedupService,
                               OpsReportBuilder opsReportBuilder,
                               OpsReportWriter opsReportWriter) {
        this.alertDedupService = alertDedupService;
        this.opsReportBuilder = opsReportBuilder;
        this.opsReportWriter = opsReportWriter;
    }

    @PostMapping("/dedup/emit")
    public EmitDecision emit(@RequestBody EmitRequest request) {
        if (request == null || StringUtils.isBlank(request.getLine())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "line不能为空");
        }
        if (request.getCooldownSec() == null && request.getTtlSec() == null) {
            return alertDedupService.shouldEmit(request.getLine());
        }
        Duration cooldown = request.getCooldownSec() == null
                ? alertDedupService.getCooldown() : Duration.ofSeconds(request.getCooldownSec());
        Duration ttl = request.getTtlSec() == null
                ? alertDedupService.getTtl() : Duration.ofSeconds(request.getTtlSec());
        return alertDedupService.shouldEmit(request.getLine(), cooldown, ttl);
    }

    @GetMapping("/dedup/summary")
    public DedupSummary summary(@RequestParam(value = "top", defaultValue = "10") int top,
                                @RequestParam(value = "preview", defaultValue = "12") int preview) {
        return alertDedupService.summarize(top, preview);
    }

    @PostMapping("/dedup/reset")
    public ResetResult reset(@RequestParam(value = "backup", defaultValue = "false") boolean backup) {
        return alertDedupService.reset(backup);
    }

    @PostMapping("/dedup/prune")
    public PruneResult prune() {
        return alertDedupService.prune();
    }

    @GetMapping("/ops-report")
    public OpsReport opsReport(@RequestParam(value = "days", defaultValue = "7") int days) {
        return opsReportBuilder.build(days);
    }

    /**
     * 生成报告并落盘
     */
    @PostMapping("/ops-report")
    public Map<String, Object> writeOpsReport(@RequestParam(value = "days", defaultValue = "7") int days) {
        OpsReport report = opsReportBuilder.build(days);
        Path written = opsReportWriter.write(report);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("path", written.toString());
        response.put("report", report);
        return response;
    }
}
