package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.ClosedDealDTO;
import dk.trustworks.pipeline.analytics.dto.CohortCloseRateDTO;
import dk.trustworks.pipeline.analytics.dto.MetricValue;
import dk.trustworks.pipeline.analytics.dto.RatePointDTO;
import dk.trustworks.pipeline.analytics.dto.WindowRateDTO;
import dk.trustworks.pipeline.config.PipelineAnalyticsConfig;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.daterange.DateRangeResolver;
import dk.trustworks.pipeline.model.Opportunity;
import dk.trustworks.pipeline.model.OpportunitySnapshot;
import dk.trustworks.pipeline.model.enums.PipelineStage;
import dk.trustworks.pipeline.model.enums.RateKind;
import dk.trustworks.pipeline.model.enums.StageKind;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Win rate and close rate over time.
 * <p>
 * For every anchor date the state of each opportunity as of that day is reconstructed from
 * its history. Deals in a closed state count towards the window their close date falls in:
 * fiscal year to date ([FY start, anchor]) and rolling ([anchor - N months, anchor]).
 * <ul>
 *   <li>win rate = won / (won + lost)</li>
 *   <li>close rate = won / (won + lost + open pipeline as of the anchor)</li>
 * </ul>
 * Outlier policy: a point where either rate is above the configured threshold is left out
 * of the series and logged. The threshold defaults to 40%; see {@link PipelineAnalyticsConfig}.
 * <p>
 * The cohort close rate looks at the other end of the funnel: of the opportunities that entered
 * the pipeline in the trailing window, how many are won as of the anchor.
 */
@JBossLog
@ApplicationScoped
public class RateTimeSeriesBuilder {

    @Inject
    PipelineAnalyticsConfig config;

    @Inject
    DateRangeResolver dateRangeResolver;

    public List<RatePointDTO> winRateSeries(Collection<OpportunityHistory> histories, List<LocalDate> anchors) {
        return series(RateKind.WIN, histories, anchors);
    }

    public List<RatePointDTO> closeRateSeries(Collection<OpportunityHistory> histories, List<LocalDate> anchors) {
        return series(RateKind.CLOSE, histories, anchors);
    }

    /**
     * Distinct snapshot dates within the range, the anchors the over-time charts plot.
     */
    public List<LocalDate> anchorsFromSnapshotDates(Collection<OpportunityHistory> histories, DateRange range) {
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (OpportunityHistory history : histories) {
            for (OpportunitySnapshot snapshot : history.getSnapshots()) {
                if (range == null || range.contains(snapshot.getSnapshotDate())) dates.add(snapshot.getSnapshotDate());
            }
        }
        return new ArrayList<>(dates);
    }

    public List<RatePointDTO> series(RateKind kind, Collection<OpportunityHistory> histories, List<LocalDate> anchors) {
        double threshold = threshold(kind);
        List<RatePointDTO> points = new ArrayList<>();
        int outliers = 0;
        for (LocalDate anchor : new TreeSet<>(anchors)) {
            RatePointDTO point = ratePoint(kind, histories, anchor);
            if (point.getFiscalYearToDate().getRate().isMissing() && point.getRolling().getRate().isMissing()) {
                continue;
            }
            if (point.getFiscalYearToDate().getRate().exceeds(threshold) || point.getRolling().getRate().exceeds(threshold)) {
                outliers++;
                log.infof("Leaving out %s rate point %s above %.1f%% (FY: %s, rolling: %s)", kind, anchor, threshold,
                        point.getFiscalYearToDate().getRate().getValue(), point.getRolling().getRate().getValue());
                continue;
            }
            points.add(point);
        }
        log.debugf("%s rate series: %d points, %d left out as outliers", kind, points.size(), outliers);
        return points;
    }

    /**
     * Both windows for one anchor, without the outlier policy applied.
     */
    public RatePointDTO ratePoint(RateKind kind, Collection<OpportunityHistory> histories, LocalDate anchor) {
        DateRange fiscalYearToDate = dateRangeResolver.fiscalYearToDate(anchor);
        DateRange rolling = dateRangeResolver.lastMonths(anchor, config.rollingWindowMonths());

        WindowAccumulator fy = new WindowAccumulator(fiscalYearToDate);
        WindowAccumulator trailing = new WindowAccumulator(rolling);
        int open = 0;

        for (OpportunityHistory history : histories) {
            Optional<OpportunitySnapshot> state = history.stateAsOf(anchor);
            if (state.isEmpty()) continue;
            OpportunitySnapshot snapshot = state.get();
            PipelineStage stage = snapshot.getPipelineStage();
            if (stage.isOpenPipeline()) {
                open++;
                continue;
            }
            if (!stage.isClosed() || snapshot.getCloseDate() == null) continue;
            fy.accept(history.getOpportunity(), snapshot);
            trailing.accept(history.getOpportunity(), snapshot);
        }

        int openInDenominator = kind == RateKind.CLOSE ? open : 0;
        return RatePointDTO.builder()
                .anchorDate(anchor)
                .fiscalYear(dateRangeResolver.fiscalYearLabel(anchor))
                .kind(kind)
                .fiscalYearToDate(fy.toDto(open, openInDenominator))
                .rolling(trailing.toDto(open, openInDenominator))
                .build();
    }

    /**
     * Cohort close rate per anchor. Anchors with an empty cohort are skipped and points above
     * the cohort threshold are left out and logged.
     */
    public List<CohortCloseRateDTO> cohortCloseRateSeries(Collection<OpportunityHistory> histories, List<LocalDate> anchors) {
        double threshold = config.cohortCloseRate().outlierThreshold();
        List<CohortCloseRateDTO> points = new ArrayList<>();
        for (LocalDate anchor : new TreeSet<>(anchors)) {
            CohortCloseRateDTO point = cohortCloseRate(histories, anchor);
            if (point.getRate().isMissing()) continue;
            if (point.getRate().exceeds(threshold)) {
                log.infof("Leaving out cohort close rate point %s above %.1f%% (%s)", anchor, threshold, point.getRate().getValue());
                continue;
            }
            points.add(point);
        }
        log.debugf("Cohort close rate series: %d points from %d anchors", points.size(), anchors.size());
        return points;
    }

    /**
     * The cohort is every opportunity whose state as of the anchor is past pre-sales and whose
     * pipeline entry date lies in [anchor - N months, anchor]. The entry date is the one recorded
     * on that state, or the opportunity's creation date when none is recorded.
     * rate = cohort members in Closed Won / cohort size.
     */
    public CohortCloseRateDTO cohortCloseRate(Collection<OpportunityHistory> histories, LocalDate anchor) {
        DateRange window = dateRangeResolver.lastMonths(anchor, config.rollingWindowMonths());
        int entered = 0;
        int won = 0;
        for (OpportunityHistory history : histories) {
            Optional<OpportunitySnapshot> state = history.stateAsOf(anchor);
            if (state.isEmpty()) continue;
            OpportunitySnapshot snapshot = state.get();
            PipelineStage stage = snapshot.getPipelineStage();
            if (stage.getKind() == StageKind.PRE_SALES) continue;
            LocalDate entryDate = snapshot.getEnteredPipeline() != null
                    ? snapshot.getEnteredPipeline()
                    : history.getOpportunity().getCreatedDate();
            if (entryDate == null || !window.contains(entryDate)) continue;
            entered++;
            if (stage.isWon()) won++;
        }
        return CohortCloseRateDTO.builder()
                .anchorDate(anchor)
                .windowStart(window.startDate())
                .windowEnd(window.endDate())
                .enteredCount(entered)
                .wonCount(won)
                .rate(MetricValue.ratio(won, entered))
                .build();
    }

    private double threshold(RateKind kind) {
        return kind == RateKind.CLOSE
                ? config.closeRate().outlierThreshold()
                : config.winRate().outlierThreshold();
    }

    private static final class WindowAccumulator {
        private final DateRange window;
        private final List<ClosedDealDTO> won = new ArrayList<>();
        private final List<ClosedDealDTO> lost = new ArrayList<>();

        WindowAccumulator(DateRange window) {
            this.window = window;
        }

        void accept(Opportunity opportunity, OpportunitySnapshot snapshot) {
            if (!window.contains(snapshot.getCloseDate())) return;
            ClosedDealDTO deal = ClosedDealDTO.builder()
                    .opportunityId(opportunity.getId())
                    .name(opportunity.getName())
                    .clientName(opportunity.getClientName())
                    .stage(snapshot.getStage())
                    .value(snapshot.amountOrZero())
                    .closeDate(snapshot.getCloseDate())
                    .build();
            if (snapshot.getPipelineStage().isWon()) won.add(deal);
            else lost.add(deal);
        }

        WindowRateDTO toDto(int open, int openInDenominator) {
            Comparator<ClosedDealDTO> byCloseDate = Comparator.comparing(ClosedDealDTO::getCloseDate)
                    .thenComparing(ClosedDealDTO::getOpportunityId, Comparator.nullsLast(Comparator.naturalOrder()));
            won.sort(byCloseDate);
            lost.sort(byCloseDate);
            return WindowRateDTO.builder()
                    .windowStart(window.startDate())
                    .windowEnd(window.endDate())
                    .wonCount(won.size())
                    .lostCount(lost.size())
                    .openCount(open)
                    .rate(MetricValue.ratio(won.size(), won.size() + lost.size() + openInDenominator))
                    .wonDeals(List.copyOf(won))
                    .lostDeals(List.copyOf(lost))
                    .build();
        }
    }
}
