package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How far expected close dates drift while opportunities sit in a stage.
 * Positive days mean the close date moved later.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DateSlippageDTO {

    private String stage;

    private double avgSlippageDays;

    private long totalSlippageDays;

    private int opportunityCount;
}
