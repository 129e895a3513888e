package dk.trustworks.pipeline.analytics.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A stage transition between two chronologically adjacent snapshots of one opportunity.
 * Derived on every query, never stored.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageMovementDTO {

    private String opportunityId;

    private String crmId;

    private String opportunityName;

    private String clientName;

    private String fromStage;

    private String toStage;

    /**
     * Snapshot date of the later snapshot, the day the move was observed.
     */
    private LocalDate date;

    /**
     * Amount of the later snapshot.
     */
    private double value;

    /**
     * Amount of the earlier snapshot, used for value change analysis.
     */
    private double previousValue;
}
