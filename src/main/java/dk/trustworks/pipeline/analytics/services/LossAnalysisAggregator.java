package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.LossReasonByStageDTO;
import dk.trustworks.pipeline.analytics.dto.LossReasonDTO;
import dk.trustworks.pipeline.analytics.dto.RecentLossDTO;
import dk.trustworks.pipeline.config.PipelineAnalyticsConfig;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.model.Opportunity;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import dk.trustworks.pipeline.utils.NumberUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed-lost breakdowns by loss reason and by the stage a deal was lost from.
 * <p>
 * A loss is the snapshot where an opportunity enters Closed Lost. Its previous stage is the
 * stage of the snapshot before it, or {@value #DIRECT_IMPORT} when the opportunity was first
 * ingested already lost. The loss date is the close date when known, otherwise the snapshot date.
 * Loss values are annualized (first-year) values, falling back to the amount where none was recorded.
 */
@JBossLog
@ApplicationScoped
public class LossAnalysisAggregator {

    public static final String DIRECT_IMPORT = "Direct Import";
    public static final String UNKNOWN_REASON = "Unknown";

    private static final Comparator<Aggregate> BY_COUNT_THEN_VALUE = Comparator
            .comparingInt((Aggregate a) -> a.count).reversed()
            .thenComparing(Comparator.comparingDouble((Aggregate a) -> a.totalValue).reversed());

    @Inject
    PipelineAnalyticsConfig config;

    public List<LossReasonDTO> byReason(Collection<OpportunityHistory> histories, DateRange range) {
        List<LossEvent> losses = lossesInWindow(histories, range);
        Map<String, Aggregate> byReason = new LinkedHashMap<>();
        for (LossEvent loss : losses) {
            byReason.computeIfAbsent(loss.reason(), r -> new Aggregate(r, null)).add(loss.value());
        }
        return byReason.values().stream()
                .sorted(BY_COUNT_THEN_VALUE)
                .map(a -> new LossReasonDTO(a.reason, a.count, a.totalValue, share(a.count, losses.size())))
                .toList();
    }

    public List<LossReasonByStageDTO> byReasonAndPreviousStage(Collection<OpportunityHistory> histories, DateRange range) {
        List<LossEvent> losses = lossesInWindow(histories, range);
        Map<String, Aggregate> cells = new LinkedHashMap<>();
        for (LossEvent loss : losses) {
            String key = loss.reason() + '\u0000' + loss.previousStage();
            cells.computeIfAbsent(key, k -> new Aggregate(loss.reason(), loss.previousStage())).add(loss.value());
        }
        return cells.values().stream()
                .sorted(BY_COUNT_THEN_VALUE.thenComparing(a -> a.reason).thenComparing(a -> a.previousStage))
                .map(a -> new LossReasonByStageDTO(a.reason, a.previousStage, a.count, a.totalValue, share(a.count, losses.size())))
                .toList();
    }

    public List<RecentLossDTO> recentLosses(Collection<OpportunityHistory> histories) {
        return recentLosses(histories, config.recentLossesLimit());
    }

    /**
     * Most recent losses first.
     */
    public List<RecentLossDTO> recentLosses(Collection<OpportunityHistory> histories, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must not be negative, was " + limit);
        return lossesInWindow(histories, DateRange.UNBOUNDED).stream()
                .sorted(Comparator.comparing(LossEvent::lossDate).reversed()
                        .thenComparing(l -> l.opportunity().getId(), Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(limit)
                .map(l -> RecentLossDTO.builder()
                        .opportunityId(l.opportunity().getId())
                        .opportunityName(l.opportunity().getName())
                        .clientName(l.opportunity().getClientName())
                        .lossReason(l.reason())
                        .value(l.value())
                        .lossDate(l.lossDate())
                        .previousStage(l.previousStage())
                        .build())
                .toList();
    }

    List<LossEvent> lossesInWindow(Collection<OpportunityHistory> histories, DateRange range) {
        List<LossEvent> losses = new ArrayList<>();
        for (OpportunityHistory history : histories) {
            List<OpportunitySnapshot> snapshots = history.getSnapshots();
            for (int i = 0; i < snapshots.size(); i++) {
                OpportunitySnapshot snapshot = snapshots.get(i);
                if (!snapshot.getPipelineStage().isLost()) continue;
                OpportunitySnapshot previous = i > 0 ? snapshots.get(i - 1) : null;
                if (previous != null && previous.getPipelineStage().isLost()) continue;

                LocalDate lossDate = snapshot.getCloseDate() != null ? snapshot.getCloseDate() : snapshot.getSnapshotDate();
                if (range != null && !range.contains(lossDate)) continue;

                losses.add(new LossEvent(
                        history.getOpportunity(),
                        reasonOf(snapshot),
                        previous == null ? DIRECT_IMPORT : previous.getStage(),
                        snapshot.annualizedValueOrAmount(),
                        lossDate));
            }
        }
        log.debugf("Found %d losses in window %s", losses.size(), range);
        return losses;
    }

    private static String reasonOf(OpportunitySnapshot snapshot) {
        String reason = snapshot.getLossReason();
        return reason == null || reason.isBlank() ? UNKNOWN_REASON : reason.trim();
    }

    private static double share(int count, int total) {
        return NumberUtils.round(NumberUtils.percentage(count, total), 1);
    }

    record LossEvent(Opportunity opportunity, String reason, String previousStage, double value, LocalDate lossDate) {
    }

    private static final class Aggregate {
        final String reason;
        final String previousStage;
        int count;
        double totalValue;

        Aggregate(String reason, String previousStage) {
            this.reason = reason;
            this.previousStage = previousStage;
        }

        void add(double value) {
            count++;
            totalValue += value;
        }
    }
}
