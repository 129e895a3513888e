package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cell of the loss reason x previous stage heat map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LossReasonByStageDTO {

    private String reason;

    private String previousStage;

    private int count;

    private double totalValue;

    private double percentage;
}
