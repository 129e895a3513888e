package dk.trustworks.pipeline.model.enums;

public enum RateKind {
    /** won / (won + lost) */
    WIN,
    /** won / (won + lost + open pipeline) */
    CLOSE
}
