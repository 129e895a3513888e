package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentLossDTO {

    private String opportunityId;

    private String opportunityName;

    private String clientName;

    private String lossReason;

    private double value;

    private LocalDate lossDate;

    private String previousStage;
}
