package opshealth.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 失败命令重试指引
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetryGuide {
    private final String pipeline;
    private final String failedCommand;
    private final String suggestedRetryCommand;
    private final String runbookReference;
    private final String runbookReferenceAnchor;
}
