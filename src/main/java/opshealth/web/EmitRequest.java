package opshealth.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 告警发送判定请求，冷却与TTL为空时使用配置值
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EmitRequest {
    private String line;
    private Long cooldownSec;
    private Long ttlSec;
}
