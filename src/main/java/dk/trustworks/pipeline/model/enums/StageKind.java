package dk.trustworks.pipeline.model.enums;

public enum StageKind {
    PRE_SALES,
    PIPELINE,
    CLOSED,
    UNKNOWN
}
