package dk.trustworks.pipeline.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Opportunities sharing a client name: renewals, extensions or accidental duplicates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateGroupDTO {

    private String clientName;

    private List<DuplicateMemberDTO> activeOpportunities;

    private List<DuplicateMemberDTO> previousOpportunities;

    /**
     * Sum of every member's current amount.
     */
    private double totalValue;

    private int totalOpportunitiesCount;

    private int activeOpportunitiesCount;
}
