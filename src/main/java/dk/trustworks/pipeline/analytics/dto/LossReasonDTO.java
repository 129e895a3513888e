package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LossReasonDTO {

    private String reason;

    private int count;

    private double totalValue;

    /**
     * Share of all losses in the window, one decimal.
     */
    private double percentage;
}
