package opshealth.report;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ArtifactCheck {
    private final String path;
    private final ArtifactStatus status;
}
