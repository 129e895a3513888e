package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.ClosedDealDTO;
import dk.trustworks.pipeline.analytics.dto.ClosedWonSummaryDTO;
import dk.trustworks.pipeline.analytics.dto.DateSlippageDTO;
import dk.trustworks.pipeline.analytics.dto.FiscalQuarterPipelineDTO;
import dk.trustworks.pipeline.analytics.dto.MetricValue;
import dk.trustworks.pipeline.analytics.dto.PipelineValuePointDTO;
import dk.trustworks.pipeline.analytics.dto.StageMovementDTO;
import dk.trustworks.pipeline.analytics.dto.ValueChangeDTO;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.daterange.DateRangeResolver;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Pipeline value views: open pipeline over time and by fiscal quarter, close date slippage,
 * value changes on stage transitions and the closed-won summary.
 */
@JBossLog
@ApplicationScoped
public class PipelineValueAggregator {

    @Inject
    MovementDetector movementDetector;

    @Inject
    DateRangeResolver dateRangeResolver;

    /**
     * Sum of open (pre-sales and pipeline) amounts on each snapshot date in the range.
     * A date where every snapshot is closed yields a zero point.
     */
    public List<PipelineValuePointDTO> valueOverTime(Collection<OpportunityHistory> histories, DateRange range) {
        Map<LocalDate, PipelineValuePointDTO> byDate = new TreeMap<>();
        for (OpportunityHistory history : histories) {
            for (OpportunitySnapshot snapshot : history.getSnapshots()) {
                if (range != null && !range.contains(snapshot.getSnapshotDate())) continue;
                PipelineValuePointDTO point = byDate.computeIfAbsent(snapshot.getSnapshotDate(), d -> new PipelineValuePointDTO(d, 0.0, 0));
                if (!snapshot.getPipelineStage().isOpen()) continue;
                point.setValue(point.getValue() + snapshot.amountOrZero());
                point.setOpportunityCount(point.getOpportunityCount() + 1);
            }
        }
        return new ArrayList<>(byDate.values());
    }

    /**
     * Open pipeline as of the given day, grouped by the fiscal quarter of its expected close date.
     * Opportunities without an expected close date are left out.
     */
    public List<FiscalQuarterPipelineDTO> pipelineByFiscalQuarter(Collection<OpportunityHistory> histories, LocalDate asOf) {
        Map<LocalDate, FiscalQuarterPipelineDTO> byQuarter = new TreeMap<>();
        for (OpportunityHistory history : histories) {
            Optional<OpportunitySnapshot> state = history.stateAsOf(asOf);
            if (state.isEmpty()) continue;
            OpportunitySnapshot snapshot = state.get();
            if (!snapshot.getPipelineStage().isOpen() || snapshot.getCloseDate() == null) continue;
            LocalDate quarterStart = DateUtils.fiscalQuarterStart(snapshot.getCloseDate());
            FiscalQuarterPipelineDTO bucket = byQuarter.computeIfAbsent(quarterStart, q ->
                    new FiscalQuarterPipelineDTO(dateRangeResolver.fiscalQuarterLabel(q), q, 0.0, 0));
            bucket.setValue(bucket.getValue() + snapshot.amountOrZero());
            bucket.setOpportunityCount(bucket.getOpportunityCount() + 1);
        }
        return new ArrayList<>(byQuarter.values());
    }

    /**
     * For every contiguous run of snapshots in one open stage, the slippage is the expected close
     * date at the end of the run minus the one at its start. Runs are counted when their last
     * snapshot lies in the range; runs with a missing close date at either end are skipped.
     */
    public List<DateSlippageDTO> dateSlippage(Collection<OpportunityHistory> histories, DateRange range) {
        Map<String, long[]> byStage = new LinkedHashMap<>();
        for (OpportunityHistory history : histories) {
            List<OpportunitySnapshot> snapshots = history.getSnapshots();
            int runStart = 0;
            for (int i = 1; i <= snapshots.size(); i++) {
                boolean runEnds = i == snapshots.size() || !snapshots.get(i).getStage().equals(snapshots.get(runStart).getStage());
                if (!runEnds) continue;
                OpportunitySnapshot first = snapshots.get(runStart);
                OpportunitySnapshot last = snapshots.get(i - 1);
                runStart = i;
                if (!first.getPipelineStage().isOpen()) continue;
                if (first.getCloseDate() == null || last.getCloseDate() == null) continue;
                if (range != null && !range.contains(last.getSnapshotDate())) continue;
                long[] acc = byStage.computeIfAbsent(first.getStage(), s -> new long[2]);
                acc[0] += DateUtils.countDaysBetween(first.getCloseDate(), last.getCloseDate());
                acc[1]++;
            }
        }
        List<DateSlippageDTO> result = new ArrayList<>();
        byStage.forEach((stage, acc) -> result.add(new DateSlippageDTO(
                stage, NumberUtils.round((double) acc[0] / acc[1], 1), acc[0], (int) acc[1])));
        result.sort(Comparator.comparingDouble((DateSlippageDTO d) -> Math.abs(d.getAvgSlippageDays())).reversed()
                .thenComparing(DateSlippageDTO::getStage, StageOrdering.BY_STAGE));
        return result;
    }

    /**
     * Amount changes per (from stage, to stage) for movements landing in the range.
     */
    public List<ValueChangeDTO> valueChanges(Collection<OpportunityHistory> histories, DateRange range) {
        List<StageMovementDTO> movements = movementDetector.inWindow(movementDetector.detectAll(histories), range);
        Map<String, double[]> byTransition = new LinkedHashMap<>();
        Map<String, StageMovementDTO> firstSeen = new LinkedHashMap<>();
        for (StageMovementDTO movement : movements) {
            String key = movement.getFromStage() + '\u0000' + movement.getToStage();
            firstSeen.putIfAbsent(key, movement);
            double[] acc = byTransition.computeIfAbsent(key, k -> new double[3]);
            acc[0]++;
            acc[1] += movement.getValue() - movement.getPreviousValue();
            acc[2] += movement.getPreviousValue();
        }
        List<ValueChangeDTO> result = new ArrayList<>();
        byTransition.forEach((key, acc) -> {
            StageMovementDTO sample = firstSeen.get(key);
            result.add(ValueChangeDTO.builder()
                    .fromStage(sample.getFromStage())
                    .toStage(sample.getToStage())
                    .opportunityCount((int) acc[0])
                    .totalChange(acc[1])
                    .avgChange(NumberUtils.round(acc[1] / acc[0], 2))
                    .changePercentage(acc[2] == 0 ? MetricValue.missing() : MetricValue.present(NumberUtils.round(acc[1] / acc[2] * 100.0, 1)))
                    .build());
        });
        result.sort(Comparator.comparing(ValueChangeDTO::getFromStage, StageOrdering.BY_STAGE)
                .thenComparing(ValueChangeDTO::getToStage, StageOrdering.BY_STAGE));
        return result;
    }

    /**
     * Deals whose current state is Closed Won with a close date in the range.
     */
    public ClosedWonSummaryDTO closedWonSummary(Collection<OpportunityHistory> histories, DateRange range) {
        List<ClosedDealDTO> deals = new ArrayList<>();
        for (OpportunityHistory history : histories) {
            Optional<OpportunitySnapshot> current = history.currentState();
            if (current.isEmpty() || !current.get().getPipelineStage().isWon()) continue;
            OpportunitySnapshot snapshot = current.get();
            if (snapshot.getCloseDate() == null) continue;
            if (range != null && !range.contains(snapshot.getCloseDate())) continue;
            deals.add(ClosedDealDTO.builder()
                    .opportunityId(history.getOpportunityId())
                    .name(history.getOpportunity().getName())
                    .clientName(history.getOpportunity().getClientName())
                    .stage(snapshot.getStage())
                    .value(snapshot.amountOrZero())
                    .closeDate(snapshot.getCloseDate())
                    .build());
        }
        deals.sort(Comparator.comparingDouble(ClosedDealDTO::getValue).reversed());
        double total = deals.stream().mapToDouble(ClosedDealDTO::getValue).sum();
        return new ClosedWonSummaryDTO(total, deals.size(), deals);
    }
}
