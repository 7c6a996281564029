package opshealth.health;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 健康分输入
 */
@Getter
@ToString
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthFactors {
    private final double averagePipelineSuccessRate;
    private final int violationCount;
    private final int commandFailures;
    private final int alertCount;
}
