package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FiscalQuarterPipelineDTO {

    /**
     * e.g. "2025 Q3"
     */
    private String fiscalQuarter;

    private LocalDate quarterStart;

    private double value;

    private int opportunityCount;
}
