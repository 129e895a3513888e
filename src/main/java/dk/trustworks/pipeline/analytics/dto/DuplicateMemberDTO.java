package dk.trustworks.pipeline.analytics.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateMemberDTO {

    private String opportunityId;

    private String crmId;

    private String name;

    private String owner;

    private boolean active;

    /**
     * Stage of the current state, null when the opportunity has no snapshots.
     */
    private String currentStage;

    private double currentAmount;

    private LocalDate closeDate;
}
