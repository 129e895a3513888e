package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Average time opportunities spend in a stage.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeInStageDTO {

    private String stage;

    /**
     * Mean days per opportunity, one decimal.
     */
    private double avgDays;

    private int opportunityCount;
}
