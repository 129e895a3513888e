package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClosedWonSummaryDTO {

    private double totalValue;

    private int totalCount;

    private List<ClosedDealDTO> deals;
}
