package dk.trustworks.pipeline.analytics.dto;

import dk.trustworks.pipeline.model.enums.RateKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One point of the win/close rate over time chart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RatePointDTO {

    private LocalDate anchorDate;

    /**
     * Fiscal year label of the anchor, e.g. "FY2026".
     */
    private String fiscalYear;

    private RateKind kind;

    private WindowRateDTO fiscalYearToDate;

    private WindowRateDTO rolling;
}
