package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Share of the opportunities that entered the pipeline in the trailing window and are won by the anchor date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortCloseRateDTO {

    private LocalDate anchorDate;

    private LocalDate windowStart;

    private LocalDate windowEnd;

    private int enteredCount;

    private int wonCount;

    private MetricValue rate;
}
