package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.DuplicateGroupDTO;
import dk.trustworks.pipeline.analytics.dto.DuplicateMemberDTO;
import dk.trustworks.pipeline.model.Opportunity;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups opportunities by client name to surface renewals and duplicates.
 * <p>
 * Matching is exact equality on the stored client name; blank names are never grouped.
 * Only groups with more than one opportunity are returned.
 */
@JBossLog
@ApplicationScoped
public class DuplicateOpportunityGrouper {

    public List<DuplicateGroupDTO> group(Collection<OpportunityHistory> histories) {
        Map<String, List<OpportunityHistory>> byClient = new LinkedHashMap<>();
        for (OpportunityHistory history : histories) {
            String clientName = history.getOpportunity().getClientName();
            if (clientName == null || clientName.isBlank()) continue;
            byClient.computeIfAbsent(clientName, c -> new ArrayList<>()).add(history);
        }

        List<DuplicateGroupDTO> groups = new ArrayList<>();
        byClient.forEach((clientName, members) -> {
            if (members.size() > 1) groups.add(toGroup(clientName, members));
        });
        groups.sort(Comparator.comparingDouble(DuplicateGroupDTO::getTotalValue).reversed()
                .thenComparing(DuplicateGroupDTO::getClientName));
        log.debugf("Duplicate analysis: %d client groups with more than one opportunity", groups.size());
        return groups;
    }

    private DuplicateGroupDTO toGroup(String clientName, List<OpportunityHistory> members) {
        List<DuplicateMemberDTO> active = new ArrayList<>();
        List<DuplicateMemberDTO> previous = new ArrayList<>();
        double totalValue = 0.0;
        for (OpportunityHistory history : members) {
            DuplicateMemberDTO member = toMember(history);
            totalValue += member.getCurrentAmount();
            if (member.isActive()) active.add(member);
            else previous.add(member);
        }
        Comparator<DuplicateMemberDTO> byAmount = Comparator.comparingDouble(DuplicateMemberDTO::getCurrentAmount).reversed();
        active.sort(byAmount);
        previous.sort(byAmount);
        return DuplicateGroupDTO.builder()
                .clientName(clientName)
                .activeOpportunities(active)
                .previousOpportunities(previous)
                .totalValue(totalValue)
                .totalOpportunitiesCount(members.size())
                .activeOpportunitiesCount(active.size())
                .build();
    }

    private DuplicateMemberDTO toMember(OpportunityHistory history) {
        Opportunity opportunity = history.getOpportunity();
        OpportunitySnapshot current = history.currentState().orElse(null);
        return DuplicateMemberDTO.builder()
                .opportunityId(opportunity.getId())
                .crmId(opportunity.getCrmId())
                .name(opportunity.getName())
                .owner(opportunity.getOwner())
                .active(opportunity.isActive())
                .currentStage(current == null ? null : current.getStage())
                .currentAmount(current == null ? 0.0 : current.amountOrZero())
                .closeDate(current == null ? null : current.getCloseDate())
                .build();
    }
}
