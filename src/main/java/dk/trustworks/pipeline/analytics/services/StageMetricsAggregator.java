package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.ClosedDealDTO;
import dk.trustworks.pipeline.analytics.dto.ClosingProbabilityDTO;
import dk.trustworks.pipeline.analytics.dto.FunnelStageDTO;
import dk.trustworks.pipeline.analytics.dto.StageDistributionDTO;
import dk.trustworks.pipeline.analytics.dto.StageMovementDTO;
import dk.trustworks.pipeline.analytics.dto.TimeInStageDTO;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
import dk.trustworks.pipeline.model.enums.PipelineStage;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import dk.trustworks.pipeline.utils.DateUtils;
import dk.trustworks.pipeline.utils.NumberUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Stage distribution, time in stage, the stage progression funnel and closing probability by stage.
 */
@JBossLog
@ApplicationScoped
public class StageMetricsAggregator {

    @Inject
    MovementDetector movementDetector;

    /**
     * Buckets each opportunity's state at the end of the range (its current state when the
     * range is unbounded) by stage.
     *
     * @param activeOnly leave out Closed Won and Closed Lost, the "active pipeline" view
     */
    public List<StageDistributionDTO> stageDistribution(Collection<OpportunityHistory> histories, DateRange range, boolean activeOnly) {
        LocalDate asOf = range != null && range.isBounded() ? range.endDate() : null;
        Map<String, StageDistributionDTO> byStage = new TreeMap<>(StageOrdering.BY_STAGE);
        for (OpportunityHistory history : histories) {
            Optional<OpportunitySnapshot> state = history.stateAsOf(asOf);
            if (state.isEmpty()) continue;
            OpportunitySnapshot snapshot = state.get();
            if (activeOnly && snapshot.getPipelineStage().isClosed()) continue;
            StageDistributionDTO bucket = byStage.computeIfAbsent(snapshot.getStage(), s -> new StageDistributionDTO(s, 0, 0.0));
            bucket.setCount(bucket.getCount() + 1);
            bucket.setTotalValue(bucket.getTotalValue() + snapshot.amountOrZero());
        }
        return new ArrayList<>(byStage.values());
    }

    /**
     * The days between two consecutive snapshots count towards the earlier snapshot's stage.
     * A pair is included when its later snapshot falls in the range. Days are summed per
     * opportunity and stage, then averaged over the opportunities that spent time in the stage.
     * Closed stages are not reported.
     */
    public List<TimeInStageDTO> timeInStage(Collection<OpportunityHistory> histories, DateRange range) {
        Map<String, StageTiming> timings = new TreeMap<>(StageOrdering.BY_STAGE);
        for (OpportunityHistory history : histories) {
            List<OpportunitySnapshot> snapshots = history.getSnapshots();
            Map<String, Integer> daysByStage = new HashMap<>();
            for (int i = 1; i < snapshots.size(); i++) {
                OpportunitySnapshot earlier = snapshots.get(i - 1);
                OpportunitySnapshot later = snapshots.get(i);
                if (range != null && !range.contains(later.getSnapshotDate())) continue;
                if (earlier.getPipelineStage().isClosed()) continue;
                int days = DateUtils.countDaysBetween(earlier.getSnapshotDate(), later.getSnapshotDate());
                daysByStage.merge(earlier.getStage(), days, Integer::sum);
            }
            daysByStage.forEach((stage, days) -> timings.computeIfAbsent(stage, s -> new StageTiming()).add(days));
        }

        List<TimeInStageDTO> result = new ArrayList<>();
        timings.forEach((stage, timing) -> result.add(new TimeInStageDTO(
                stage,
                NumberUtils.round((double) timing.totalDays / timing.opportunities, 1),
                timing.opportunities)));
        log.debugf("Time in stage computed for %d stages", result.size());
        return result;
    }

    public List<FunnelStageDTO> progressionFunnel(Collection<OpportunityHistory> histories, DateRange range) {
        List<StageMovementDTO> movements = movementDetector.inWindow(movementDetector.detectAll(histories), range);
        return progressionFunnel(movements);
    }

    /**
     * Progression funnel over the ordered stages, from already window-filtered movements.
     * <p>
     * For each stage S, {@code started} counts distinct opportunities moving out of S and
     * {@code advanced} those among them landing on a later stage, Closed Won or an unknown
     * stage; Closed Lost never counts as advancing.
     * <p>
     * Cumulative rate: the first stage reports its own rate. Every later stage S composes its
     * own rate with the rates of the stages from the second stage up to the one before S,
     * dividing by 100 at each step. The first stage's rate is not part of those products.
     */
    public List<FunnelStageDTO> progressionFunnel(List<StageMovementDTO> movements) {
        Map<PipelineStage, Set<String>> startedBy = new HashMap<>();
        Map<PipelineStage, Set<String>> advancedBy = new HashMap<>();

        for (StageMovementDTO movement : movements) {
            PipelineStage from = PipelineStage.fromLabel(movement.getFromStage());
            PipelineStage to = PipelineStage.fromLabel(movement.getToStage());
            if (from.isClosed() && to.isClosed()) continue;
            if (!from.isOrdered()) continue;

            startedBy.computeIfAbsent(from, s -> new HashSet<>()).add(movement.getOpportunityId());
            if (isAdvance(from, to)) {
                advancedBy.computeIfAbsent(from, s -> new HashSet<>()).add(movement.getOpportunityId());
            }
        }

        List<PipelineStage> ordered = PipelineStage.ordered();
        double[] stageRates = new double[ordered.size()];
        List<FunnelStageDTO> funnel = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            PipelineStage stage = ordered.get(i);
            int started = startedBy.getOrDefault(stage, Set.of()).size();
            int advanced = advancedBy.getOrDefault(stage, Set.of()).size();
            stageRates[i] = NumberUtils.percentage(advanced, started);

            double cumulative = stageRates[i];
            for (int j = 1; j < i; j++) {
                cumulative = cumulative * stageRates[j] / 100.0;
            }
            funnel.add(new FunnelStageDTO(stage.getLabel(), started, advanced, stageRates[i], cumulative));
        }
        return funnel;
    }

    /**
     * For every ordered stage, how the closed deals that ever sat in it ended. A deal is closed
     * when its current state is Closed Won or Closed Lost; its close date (the snapshot date when
     * none is recorded) must fall in the range. Each deal counts once per stage it visited.
     * Only stages with at least one deal are returned, in stage order.
     */
    public List<ClosingProbabilityDTO> closingProbability(Collection<OpportunityHistory> histories, DateRange range) {
        Map<PipelineStage, List<ClosedDealDTO>> dealsByStage = new EnumMap<>(PipelineStage.class);
        for (OpportunityHistory history : histories) {
            Optional<OpportunitySnapshot> current = history.currentState();
            if (current.isEmpty() || !current.get().getPipelineStage().isClosed()) continue;
            OpportunitySnapshot last = current.get();
            LocalDate closeDate = last.getCloseDate() != null ? last.getCloseDate() : last.getSnapshotDate();
            if (range != null && !range.contains(closeDate)) continue;

            ClosedDealDTO deal = ClosedDealDTO.builder()
                    .opportunityId(history.getOpportunityId())
                    .name(history.getOpportunity().getName())
                    .clientName(history.getOpportunity().getClientName())
                    .stage(last.getStage())
                    .value(last.amountOrZero())
                    .closeDate(closeDate)
                    .build();
            Set<PipelineStage> visited = EnumSet.noneOf(PipelineStage.class);
            for (OpportunitySnapshot snapshot : history.getSnapshots()) {
                if (snapshot.getPipelineStage().isOrdered()) visited.add(snapshot.getPipelineStage());
            }
            visited.forEach(stage -> dealsByStage.computeIfAbsent(stage, s -> new ArrayList<>()).add(deal));
        }

        List<ClosingProbabilityDTO> result = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.ordered()) {
            List<ClosedDealDTO> deals = dealsByStage.get(stage);
            if (deals == null) continue;
            deals.sort(Comparator.comparing(ClosedDealDTO::getCloseDate)
                    .thenComparing(ClosedDealDTO::getOpportunityId, Comparator.nullsLast(Comparator.naturalOrder())));
            int won = (int) deals.stream().filter(d -> PipelineStage.fromLabel(d.getStage()).isWon()).count();
            result.add(ClosingProbabilityDTO.builder()
                    .stage(stage.getLabel())
                    .totalDeals(deals.size())
                    .closedWon(won)
                    .closedLost(deals.size() - won)
                    .winRate(NumberUtils.round(NumberUtils.percentage(won, deals.size()), 1))
                    .deals(List.copyOf(deals))
                    .build());
        }
        log.debugf("Closing probability computed for %d stages", result.size());
        return result;
    }

    private static boolean isAdvance(PipelineStage from, PipelineStage to) {
        if (to.isLost()) return false;
        if (to.isWon() || to == PipelineStage.UNKNOWN) return true;
        return to.getOrder() > from.getOrder();
    }

    private static final class StageTiming {
        long totalDays;
        int opportunities;

        void add(int days) {
            totalDays += days;
            opportunities++;
        }
    }
}
