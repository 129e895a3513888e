package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Win or close rate for one window ending at an anchor date, with the deals it was computed from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowRateDTO {

    private LocalDate windowStart;

    private LocalDate windowEnd;

    private int wonCount;

    private int lostCount;

    /**
     * Open pipeline as of the anchor. Only part of the denominator for close rates.
     */
    private int openCount;

    private MetricValue rate;

    private List<ClosedDealDTO> wonDeals;

    private List<ClosedDealDTO> lostDeals;
}
