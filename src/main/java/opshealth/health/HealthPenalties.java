package opshealth.health;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 各项扣分
 */
@Getter
@ToString
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthPenalties {
    private final double successRate;
    private final double violations;
    private final double commandFailures;
    private final double alerts;

    public double total() {
        return successRate + violations + commandFailures + alerts;
    }
}
