package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.StageMovementDTO;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.model.Opportunity;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Derives stage transitions from an opportunity's snapshot history.
 * <p>
 * A movement exists for each pair of chronologically adjacent snapshots whose stage label
 * differs. It is dated at the later snapshot and valued at its amount. Pairs where both
 * stages are closed are not movements: a closed deal does not move further.
 * <p>
 * Window filtering happens after detection ({@link #inWindow}), so a transition that
 * straddles a window boundary is always placed by the day it landed.
 */
@JBossLog
@ApplicationScoped
public class MovementDetector {

    public List<StageMovementDTO> detect(OpportunityHistory history) {
        List<OpportunitySnapshot> snapshots = history.getSnapshots();
        List<StageMovementDTO> movements = new ArrayList<>();
        for (int i = 1; i < snapshots.size(); i++) {
            OpportunitySnapshot previous = snapshots.get(i - 1);
            OpportunitySnapshot current = snapshots.get(i);
            if (isMovement(previous, current)) {
                movements.add(toMovement(history.getOpportunity(), previous, current));
            }
        }
        return movements;
    }

    /**
     * Movements of every history, ordered by date and then opportunity id.
     */
    public List<StageMovementDTO> detectAll(Collection<OpportunityHistory> histories) {
        List<StageMovementDTO> movements = new ArrayList<>();
        for (OpportunityHistory history : histories) {
            movements.addAll(detect(history));
        }
        movements.sort(Comparator.comparing(StageMovementDTO::getDate)
                .thenComparing(StageMovementDTO::getOpportunityId, Comparator.nullsLast(Comparator.naturalOrder())));
        log.debugf("Detected %d stage movements across %d opportunities", movements.size(), histories.size());
        return movements;
    }

    public List<StageMovementDTO> inWindow(List<StageMovementDTO> movements, DateRange range) {
        if (range == null || !range.isBounded()) return movements;
        return movements.stream().filter(m -> range.contains(m.getDate())).toList();
    }

    /**
     * True when the later snapshot records a different stage and the pair is not closed-to-closed.
     * Labels are compared in canonical form, so case and whitespace variants are the same stage.
     */
    boolean isMovement(OpportunitySnapshot previous, OpportunitySnapshot current) {
        if (previous.getCanonicalStage().equals(current.getCanonicalStage())) return false;
        return !(previous.getPipelineStage().isClosed() && current.getPipelineStage().isClosed());
    }

    private StageMovementDTO toMovement(Opportunity opportunity, OpportunitySnapshot previous, OpportunitySnapshot current) {
        return StageMovementDTO.builder()
                .opportunityId(opportunity.getId())
                .crmId(opportunity.getCrmId())
                .opportunityName(opportunity.getName())
                .clientName(opportunity.getClientName())
                .fromStage(previous.getCanonicalStage())
                .toStage(current.getCanonicalStage())
                .date(current.getSnapshotDate())
                .value(current.amountOrZero())
                .previousValue(previous.amountOrZero())
                .build();
    }
}
