package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Open pipeline value on one snapshot date.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineValuePointDTO {

    private LocalDate date;

    private double value;

    private int opportunityCount;
}
