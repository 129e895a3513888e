package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.ClosedWonSummaryDTO;
import dk.trustworks.pipeline.analytics.dto.ClosingProbabilityDTO;
import dk.trustworks.pipeline.analytics.dto.CohortCloseRateDTO;
import dk.trustworks.pipeline.analytics.dto.DateSlippageDTO;
import dk.trustworks.pipeline.analytics.dto.DuplicateGroupDTO;
import dk.trustworks.pipeline.analytics.dto.FiscalQuarterPipelineDTO;
import dk.trustworks.pipeline.analytics.dto.FunnelStageDTO;
import dk.trustworks.pipeline.analytics.dto.LossReasonByStageDTO;
import dk.trustworks.pipeline.analytics.dto.LossReasonDTO;
import dk.trustworks.pipeline.analytics.dto.PipelineValuePointDTO;
import dk.trustworks.pipeline.analytics.dto.RatePointDTO;
import dk.trustworks.pipeline.analytics.dto.RecentLossDTO;
import dk.trustworks.pipeline.analytics.dto.StageDistributionDTO;
import dk.trustworks.pipeline.analytics.dto.StageMovementDTO;
import dk.trustworks.pipeline.analytics.dto.TimeInStageDTO;
import dk.trustworks.pipeline.analytics.dto.ValueChangeDTO;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.daterange.DateRangeResolver;
import dk.trustworks.pipeline.model.PipelineFilter;
import dk.trustworks.pipeline.model.enums.PeriodSelector;
import dk.trustworks.pipeline.model.enums.RateKind;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import dk.trustworks.pipeline.snapshot.SnapshotStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for dashboard queries. Every call resolves its period against today's date,
 * loads the snapshot histories, applies the filter and hands over to the aggregators.
 * Nothing is cached between calls.
 */
@JBossLog
@ApplicationScoped
public class PipelineAnalyticsService {

    @Inject
    SnapshotStore snapshotStore;

    @Inject
    Clock clock;

    @Inject
    DateRangeResolver dateRangeResolver;

    @Inject
    MovementDetector movementDetector;

    @Inject
    StageMetricsAggregator stageMetricsAggregator;

    @Inject
    RateTimeSeriesBuilder rateTimeSeriesBuilder;

    @Inject
    LossAnalysisAggregator lossAnalysisAggregator;

    @Inject
    DuplicateOpportunityGrouper duplicateOpportunityGrouper;

    @Inject
    PipelineValueAggregator pipelineValueAggregator;

    public List<StageMovementDTO> movements(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        List<StageMovementDTO> result = movementDetector.inWindow(movementDetector.detectAll(histories(filter)), range);
        log.debugf("Movements %s [%s to %s]: %d", selector, range.startDate(), range.endDate(), result.size());
        return result;
    }

    public List<StageDistributionDTO> stageDistribution(PeriodSelector selector, DateRange custom, PipelineFilter filter, boolean activeOnly) {
        DateRange range = resolve(selector, custom);
        return stageMetricsAggregator.stageDistribution(histories(filter), range, activeOnly);
    }

    public List<TimeInStageDTO> timeInStage(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return stageMetricsAggregator.timeInStage(histories(filter), range);
    }

    public List<FunnelStageDTO> progressionFunnel(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return stageMetricsAggregator.progressionFunnel(histories(filter), range);
    }

    public List<RatePointDTO> winRateSeries(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        return rateSeries(RateKind.WIN, selector, custom, filter);
    }

    public List<RatePointDTO> closeRateSeries(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        return rateSeries(RateKind.CLOSE, selector, custom, filter);
    }

    public List<ClosingProbabilityDTO> closingProbability(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return stageMetricsAggregator.closingProbability(histories(filter), range);
    }

    public List<CohortCloseRateDTO> cohortCloseRateSeries(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        List<OpportunityHistory> histories = histories(filter);
        List<LocalDate> anchors = range.isBounded()
                ? dateRangeResolver.monthlyAnchors(range)
                : rateTimeSeriesBuilder.anchorsFromSnapshotDates(histories, range);
        return rateTimeSeriesBuilder.cohortCloseRateSeries(histories, anchors);
    }

    public List<LossReasonDTO> lossByReason(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return lossAnalysisAggregator.byReason(histories(filter), range);
    }

    public List<LossReasonByStageDTO> lossByReasonAndPreviousStage(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return lossAnalysisAggregator.byReasonAndPreviousStage(histories(filter), range);
    }

    /**
     * Most recent losses regardless of period.
     */
    public List<RecentLossDTO> recentLosses(PipelineFilter filter) {
        return lossAnalysisAggregator.recentLosses(histories(filter));
    }

    /**
     * Clients with more than one opportunity. Not limited to a period.
     */
    public List<DuplicateGroupDTO> duplicateGroups(PipelineFilter filter) {
        List<DuplicateGroupDTO> groups = duplicateOpportunityGrouper.group(histories(filter));
        log.debugf("Duplicate groups: %d", groups.size());
        return groups;
    }

    public List<PipelineValuePointDTO> valueOverTime(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return pipelineValueAggregator.valueOverTime(histories(filter), range);
    }

    /**
     * Open pipeline by expected close quarter as of the end of the period, or today for open-ended periods.
     */
    public List<FiscalQuarterPipelineDTO> fiscalQuarterPipeline(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        LocalDate asOf = range.isBounded() ? range.endDate() : today();
        return pipelineValueAggregator.pipelineByFiscalQuarter(histories(filter), asOf);
    }

    public List<DateSlippageDTO> dateSlippage(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return pipelineValueAggregator.dateSlippage(histories(filter), range);
    }

    public List<ValueChangeDTO> valueChanges(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        return pipelineValueAggregator.valueChanges(histories(filter), range);
    }

    public ClosedWonSummaryDTO closedWonSummary(PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        ClosedWonSummaryDTO summary = pipelineValueAggregator.closedWonSummary(histories(filter), range);
        log.debugf("Closed won %s [%s to %s]: %d deals, %.2f total", selector, range.startDate(), range.endDate(),
                summary.getTotalCount(), summary.getTotalValue());
        return summary;
    }

    private List<RatePointDTO> rateSeries(RateKind kind, PeriodSelector selector, DateRange custom, PipelineFilter filter) {
        DateRange range = resolve(selector, custom);
        List<OpportunityHistory> histories = histories(filter);
        // all-time has no month grid to anchor on
        List<LocalDate> anchors = range.isBounded()
                ? dateRangeResolver.monthlyAnchors(range)
                : rateTimeSeriesBuilder.anchorsFromSnapshotDates(histories, range);
        List<RatePointDTO> series = rateTimeSeriesBuilder.series(kind, histories, anchors);
        log.debugf("%s rate series %s: %d anchors, %d points", kind, selector, anchors.size(), series.size());
        return series;
    }

    private DateRange resolve(PeriodSelector selector, DateRange custom) {
        Objects.requireNonNull(selector, "selector");
        return dateRangeResolver.resolve(selector, today(), custom);
    }

    private List<OpportunityHistory> histories(PipelineFilter filter) {
        List<OpportunityHistory> all = snapshotStore.findHistories();
        if (filter == null || filter.isEmpty()) return all;
        List<OpportunityHistory> filtered = all.stream()
                .filter(h -> filter.matches(h.getOpportunity(), h.currentState().orElse(null)))
                .toList();
        log.debugf("Filter kept %d of %d opportunities", filtered.size(), all.size());
        return filtered;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
