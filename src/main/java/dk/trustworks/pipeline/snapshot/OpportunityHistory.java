package dk.trustworks.pipeline.snapshot;

import dk.trustworks.pipeline.model.Opportunity;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One opportunity together with its snapshots, sorted ascending by snapshot date.
 * <p>
 * Snapshots missing a stage or a date are dropped on construction, and stage labels are
 * rewritten to their canonical form ("discover " becomes "Discover"). Every aggregator works
 * on histories, so malformed records and spelling variants never reach the calculations.
 */
@JBossLog
public final class OpportunityHistory {

    private final Opportunity opportunity;
    private final List<OpportunitySnapshot> snapshots;

    private OpportunityHistory(Opportunity opportunity, List<OpportunitySnapshot> snapshots) {
        this.opportunity = opportunity;
        this.snapshots = snapshots;
    }

    public static OpportunityHistory of(Opportunity opportunity, Collection<OpportunitySnapshot> snapshots) {
        Objects.requireNonNull(opportunity, "opportunity");
        List<OpportunitySnapshot> wellFormed = new ArrayList<>();
        if (snapshots != null) {
            for (OpportunitySnapshot snapshot : snapshots) {
                if (snapshot == null) continue;
                if (!snapshot.isWellFormed()) {
                    log.debugf("Skipping malformed snapshot for opportunity %s: date=%s, stage=%s",
                            opportunity.getId(), snapshot.getSnapshotDate(), snapshot.getStage());
                    continue;
                }
                String canonical = snapshot.getCanonicalStage();
                wellFormed.add(canonical.equals(snapshot.getStage()) ? snapshot : snapshot.toBuilder().stage(canonical).build());
            }
        }
        // stable sort keeps ingestion order for snapshots sharing a date
        wellFormed.sort(Comparator.comparing(OpportunitySnapshot::getSnapshotDate));
        return new OpportunityHistory(opportunity, List.copyOf(wellFormed));
    }

    public Opportunity getOpportunity() {
        return opportunity;
    }

    public String getOpportunityId() {
        return opportunity.getId();
    }

    public List<OpportunitySnapshot> getSnapshots() {
        return snapshots;
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    /**
     * The chronologically last snapshot.
     */
    public Optional<OpportunitySnapshot> currentState() {
        return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
    }

    /**
     * Latest snapshot taken on or before the given day. A null day means "now", the current state.
     */
    public Optional<OpportunitySnapshot> stateAsOf(LocalDate date) {
        if (date == null) return currentState();
        int low = 0;
        int high = snapshots.size() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (snapshots.get(mid).getSnapshotDate().isAfter(date)) {
                high = mid - 1;
            } else {
                found = mid;
                low = mid + 1;
            }
        }
        return found < 0 ? Optional.empty() : Optional.of(snapshots.get(found));
    }
}
