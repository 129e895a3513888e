package dk.trustworks.pipeline.snapshot;

import dk.trustworks.pipeline.model.Opportunity;
import dk.trustworks.pipeline.model.OpportunitySnapshot;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read access to opportunities and their snapshots. Persistence lives outside the engine;
 * implementations only have to hand over materialized records.
 */
public interface SnapshotStore {

    List<Opportunity> findAllOpportunities();

    /**
     * Snapshots of the given opportunities, in any order.
     */
    List<OpportunitySnapshot> findSnapshots(Collection<String> opportunityIds);

    /**
     * Every opportunity grouped with its snapshots. Opportunities are loaded first and
     * snapshots fetched for their ids, so snapshots pointing at unknown opportunities are ignored.
     */
    default List<OpportunityHistory> findHistories() {
        List<Opportunity> opportunities = findAllOpportunities();
        Set<String> ids = opportunities.stream().map(Opportunity::getId).collect(Collectors.toSet());
        Map<String, List<OpportunitySnapshot>> byOpportunity = findSnapshots(ids).stream()
                .filter(s -> s.getOpportunityId() != null)
                .collect(Collectors.groupingBy(OpportunitySnapshot::getOpportunityId));
        return opportunities.stream()
                .map(o -> OpportunityHistory.of(o, byOpportunity.getOrDefault(o.getId(), List.of())))
                .toList();
    }
}
