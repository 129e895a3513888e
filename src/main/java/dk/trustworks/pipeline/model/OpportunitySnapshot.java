package dk.trustworks.pipeline.model;

import dk.trustworks.pipeline.model.enums.PipelineStage;
import dk.trustworks.pipeline.utils.NumberUtils;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Dated, immutable record of an opportunity's state at ingestion time.
 * Snapshots of one opportunity form an append-only sequence ordered by {@link #snapshotDate}.
 */
@Value
@Builder(toBuilder = true)
public class OpportunitySnapshot {

    String opportunityId;

    LocalDate snapshotDate;

    /**
     * Raw stage label as exported. Use {@link #getPipelineStage()} for classification.
     */
    String stage;

    Double amount;

    /**
     * Annualized (year 1 ARR) value.
     */
    Double annualizedValue;

    /**
     * Expected close date while open, actual close date once closed.
     */
    LocalDate closeDate;

    LocalDate enteredPipeline;

    /**
     * Only populated when the stage is Closed Lost.
     */
    String lossReason;

    public PipelineStage getPipelineStage() {
        return PipelineStage.fromLabel(stage);
    }

    public String getCanonicalStage() {
        return PipelineStage.canonicalLabel(stage);
    }

    public double amountOrZero() {
        return NumberUtils.nullToZero(amount);
    }

    /**
     * Annualized value when known, otherwise the amount.
     */
    public double annualizedValueOrAmount() {
        return annualizedValue != null ? annualizedValue : amountOrZero();
    }

    /**
     * A snapshot without a stage or date cannot be placed in a history.
     */
    public boolean isWellFormed() {
        return opportunityId != null && snapshotDate != null && stage != null && !stage.isBlank();
    }
}
