package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Drill-down row behind a closed-deal count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosedDealDTO {

    private String opportunityId;

    private String name;

    private String clientName;

    private String stage;

    private double value;

    private LocalDate closeDate;
}
