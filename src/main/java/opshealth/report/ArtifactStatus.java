package opshealth.report;

public enum ArtifactStatus {
    OK,
    MISSING
}
