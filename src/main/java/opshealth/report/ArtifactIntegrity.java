package opshealth.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 产物完整性校验结果
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ArtifactIntegrity {
    private final String source;
    private final int okCount;
    private final int missingCount;
    private final int totalCount;
    private final List<ArtifactCheck> files;

    public static ArtifactIntegrity empty(String source) {
        return ArtifactIntegrity.builder()
                .source(source)
                .files(Collections.emptyList())
                .build();
    }
}
