package opshealth.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import opshealth.health.HealthBreakdown;
import opshealth.threshold.ContinuousAlertState;
import opshealth.threshold.PipelineThreshold;
import opshealth.threshold.Violation;

import java.util.List;
import java.util.Map;

/**
 * 运维报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OpsReport {
    public static final String SCHEMA_VERSION = "1.0.0";

    private String schemaVersion;
    private String generatedAt;
    private int days;
    private String windowStart;
    private int totalRuns;
    private String thresholdProfile;
    private Map<String, PipelineThreshold> thresholds;
    private int healthScore;
    private HealthBreakdown healthBreakdown;
    private Map<String, PipelineSuccessRate> pipelineSuccessRates;
    private List<Violation> violations;
    private int thresholdViolationsCount;
    private Map<String, Integer> thresholdViolationsByPipeline;
    private ContinuousAlertState continuousAlert;
    private List<AlertTypeCount> topAlertTypes;
    private List<DailyAlertCount> dailyAlertCounts;
    private Map<String, Integer> alertsByPipeline;
    private ArtifactIntegrity artifactIntegrity;
    private int recentCommandFailures;
    private List<RetryGuide> failedCommandRetryGuides;
    private List<String> configWarnings;
}
