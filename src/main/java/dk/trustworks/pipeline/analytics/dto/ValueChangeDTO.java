package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Amount changes observed on one kind of stage transition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValueChangeDTO {

    private String fromStage;

    private String toStage;

    private int opportunityCount;

    private double totalChange;

    private double avgChange;

    /**
     * totalChange relative to the summed amounts before the move; missing when those sum to zero.
     */
    private MetricValue changePercentage;
}
