package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the stage progression funnel.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FunnelStageDTO {

    private String stage;

    /**
     * Distinct opportunities that moved out of the stage in the window.
     */
    private int started;

    /**
     * Distinct opportunities among {@link #started} that moved forward, to Closed Won
     * or to a stage outside the known order.
     */
    private int advanced;

    /**
     * advanced / started as a percentage, 0 when nothing started.
     */
    private double stageRate;

    /**
     * Composed probability of progressing through the funnel up to and including this stage.
     */
    private double cumulativeRate;
}
