package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of the closed deals that passed through one stage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosingProbabilityDTO {

    private String stage;

    private int totalDeals;

    private int closedWon;

    private int closedLost;

    /**
     * closedWon / totalDeals as a percentage, one decimal.
     */
    private double winRate;

    private List<ClosedDealDTO> deals;
}
