package dk.trustworks.pipeline.snapshot;

import dk.trustworks.pipeline.model.Opportunity;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Snapshot store backed by memory. Used by callers that load records themselves
 * (an ingestion job, an export) and by the tests.
 * <p>
 * Snapshots are append-only: there is no update or delete.
 */
@JBossLog
@ApplicationScoped
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, Opportunity> opportunities = new LinkedHashMap<>();
    private final List<OpportunitySnapshot> snapshots = new CopyOnWriteArrayList<>();

    public synchronized void saveOpportunity(Opportunity opportunity) {
        opportunities.put(opportunity.getId(), opportunity);
    }

    public void appendSnapshot(OpportunitySnapshot snapshot) {
        snapshots.add(snapshot);
    }

    public void appendSnapshots(Collection<OpportunitySnapshot> batch) {
        snapshots.addAll(batch);
        log.debugf("Appended %d snapshots, store now holds %d", batch.size(), snapshots.size());
    }

    @Override
    public synchronized List<Opportunity> findAllOpportunities() {
        return new ArrayList<>(opportunities.values());
    }

    @Override
    public List<OpportunitySnapshot> findSnapshots(Collection<String> opportunityIds) {
        Set<String> ids = new HashSet<>(opportunityIds);
        return snapshots.stream().filter(s -> ids.contains(s.getOpportunityId())).toList();
    }
}
