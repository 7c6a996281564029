package opshealth.health;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 运行健康分，取值0-100
 */
@Getter
@ToString
@AllArgsConstructor
public class HealthScore {
    private final int score;
    private final HealthBreakdown breakdown;
}
