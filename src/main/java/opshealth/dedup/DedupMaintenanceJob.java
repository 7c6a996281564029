package opshealth.dedup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期清理过期的去重记录
 */
@Slf4j
@Component
public class DedupMaintenanceJob {

    @Autowired
    private AlertDedupService alertDedupService;

    @Scheduled(initialDelayString = "${opshealth.dedup.prune-interval-ms:3600000}",
            fixedDelayString = "${opshealth.dedup.prune-interval-ms:3600000}")
    public void pruneExpired() {
        try {
            PruneResult result = alertDedupService.prune();
            log.debug("去重状态维护完成: {}", result);
        } catch (Exception e) {
            log.error("去重状态维护失败", e);
        }
    }
}
