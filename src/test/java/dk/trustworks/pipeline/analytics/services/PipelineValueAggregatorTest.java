package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.ClosedWonSummaryDTO;
import dk.trustworks.pipeline.analytics.dto.DateSlippageDTO;
import dk.trustworks.pipeline.analytics.dto.FiscalQuarterPipelineDTO;
import dk.trustworks.pipeline.analytics.dto.PipelineValuePointDTO;
import dk.trustworks.pipeline.analytics.dto.ValueChangeDTO;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.daterange.DateRangeResolver;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dk.trustworks.pipeline.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineValueAggregator Tests")
class PipelineValueAggregatorTest {

    private PipelineValueAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new PipelineValueAggregator();
        aggregator.movementDetector = new MovementDetector();
        aggregator.dateRangeResolver = new DateRangeResolver();
    }

    @Test
    @DisplayName("valueOverTime - should sum open amounts per snapshot date, zero when everything is closed")
    void valueOverTime() {
        List<OpportunityHistory> histories = List.of(
                history("o1",
                        snapshot("o1", date(2025, 1, 1), DISCOVER, 10_000),
                        snapshot("o1", date(2025, 2, 1), ROI, 10_000),
                        snapshot("o1", date(2025, 3, 1), CLOSED_WON, 12_000)),
                history("o2",
                        snapshot("o2", date(2025, 1, 1), VALIDATION, 5_000),
                        snapshot("o2", date(2025, 2, 1), CLOSED_LOST, 5_000)));

        List<PipelineValuePointDTO> points = aggregator.valueOverTime(histories, DateRange.UNBOUNDED);

        assertEquals(3, points.size());
        assertEquals(new PipelineValuePointDTO(date(2025, 1, 1), 15_000, 2), points.get(0));
        assertEquals(new PipelineValuePointDTO(date(2025, 2, 1), 10_000, 1), points.get(1));
        assertEquals(new PipelineValuePointDTO(date(2025, 3, 1), 0, 0), points.get(2));

        assertEquals(1, aggregator.valueOverTime(histories, DateRange.of(date(2025, 2, 1), date(2025, 2, 28))).size());
    }

    @Test
    @DisplayName("pipelineByFiscalQuarter - open deals grouped by expected close quarter in chronological order")
    void pipelineByFiscalQuarter() {
        List<OpportunityHistory> histories = List.of(
                history("o1", snapshot("o1", date(2025, 3, 1), ROI, 10_000, date(2025, 6, 10))),
                history("o2", snapshot("o2", date(2025, 3, 1), DISCOVER, 20_000, date(2025, 11, 20))),
                history("o3", snapshot("o3", date(2025, 3, 1), NEGOTIATION, 5_000, date(2025, 6, 30))),
                history("o4", snapshot("o4", date(2025, 3, 1), CLOSED_WON, 99_000, date(2025, 3, 1))),
                history("o5", snapshot("o5", date(2025, 3, 1), DISCOVER, 1_000)),
                history("o6", snapshot("o6", date(2025, 4, 1), DISCOVER, 1_000, date(2025, 6, 1))));

        List<FiscalQuarterPipelineDTO> quarters = aggregator.pipelineByFiscalQuarter(histories, date(2025, 3, 15));

        assertEquals(2, quarters.size());
        assertEquals("2025 Q2", quarters.get(0).getFiscalQuarter());
        assertEquals(date(2025, 5, 1), quarters.get(0).getQuarterStart());
        assertEquals(15_000, quarters.get(0).getValue());
        assertEquals(2, quarters.get(0).getOpportunityCount());
        assertEquals("2026 Q4", quarters.get(1).getFiscalQuarter());
        assertEquals(date(2025, 11, 1), quarters.get(1).getQuarterStart());
    }

    @Test
    @DisplayName("dateSlippage - close date drift per stage run, largest average first")
    void dateSlippage() {
        List<OpportunityHistory> histories = List.of(
                history("o1",
                        snapshot("o1", date(2025, 1, 1), DISCOVER, 1, date(2025, 3, 31)),
                        snapshot("o1", date(2025, 1, 15), DISCOVER, 1, date(2025, 4, 30)),
                        snapshot("o1", date(2025, 2, 1), ROI, 1, date(2025, 4, 30)),
                        snapshot("o1", date(2025, 2, 15), ROI, 1, date(2025, 4, 20)),
                        snapshot("o1", date(2025, 3, 1), CLOSED_WON, 1, date(2025, 3, 1))),
                history("o2",
                        snapshot("o2", date(2025, 1, 1), DISCOVER, 1, date(2025, 3, 31)),
                        snapshot("o2", date(2025, 2, 1), DISCOVER, 1, date(2025, 3, 31)),
                        snapshot("o2", date(2025, 2, 8), NEGOTIATION, 1),
                        snapshot("o2", date(2025, 2, 20), NEGOTIATION, 1, date(2025, 5, 1))));

        List<DateSlippageDTO> result = aggregator.dateSlippage(histories, DateRange.UNBOUNDED);

        assertEquals(2, result.size());
        DateSlippageDTO discover = result.get(0);
        assertEquals(DISCOVER, discover.getStage());
        assertEquals(15.0, discover.getAvgSlippageDays());
        assertEquals(30, discover.getTotalSlippageDays());
        assertEquals(2, discover.getOpportunityCount());
        DateSlippageDTO roi = result.get(1);
        assertEquals(ROI, roi.getStage());
        assertEquals(-10.0, roi.getAvgSlippageDays());
    }

    @Test
    @DisplayName("valueChanges - amount change per transition relative to the amounts before the move")
    void valueChanges() {
        List<OpportunityHistory> histories = List.of(
                history("o1",
                        snapshot("o1", date(2025, 1, 1), DISCOVER, 10_000),
                        snapshot("o1", date(2025, 2, 1), ROI, 12_000),
                        snapshot("o1", date(2025, 3, 1), CLOSED_WON, 15_000)),
                history("o2",
                        snapshot("o2", date(2025, 1, 1), DISCOVER, 5_000),
                        snapshot("o2", date(2025, 2, 1), ROI, 4_000)),
                history("o3",
                        snapshot("o3", date(2025, 1, 1), VALIDATION, 0),
                        snapshot("o3", date(2025, 2, 1), DISCOVER, 1_000)));

        List<ValueChangeDTO> result = aggregator.valueChanges(histories, DateRange.UNBOUNDED);

        assertEquals(3, result.size());
        ValueChangeDTO presales = result.get(0);
        assertEquals(VALIDATION, presales.getFromStage());
        assertTrue(presales.getChangePercentage().isMissing());

        ValueChangeDTO discoverToRoi = result.get(1);
        assertEquals(2, discoverToRoi.getOpportunityCount());
        assertEquals(1_000, discoverToRoi.getTotalChange());
        assertEquals(500, discoverToRoi.getAvgChange());
        assertEquals(6.7, discoverToRoi.getChangePercentage().orZero());

        ValueChangeDTO roiToWon = result.get(2);
        assertEquals(CLOSED_WON, roiToWon.getToStage());
        assertEquals(25.0, roiToWon.getChangePercentage().orZero());
    }

    @Test
    @DisplayName("closedWonSummary - won deals with a close date in the range")
    void closedWonSummary() {
        List<OpportunityHistory> histories = List.of(
                closedDeal("w1", CLOSED_WON, 12_000, date(2025, 3, 1)),
                closedDeal("w2", CLOSED_WON, 30_000, date(2025, 4, 1)),
                closedDeal("w3", CLOSED_WON, 50_000, date(2025, 1, 10)),
                closedDeal("l1", CLOSED_LOST, 70_000, date(2025, 3, 1)),
                history("o1", snapshot("o1", date(2025, 3, 1), DISCOVER, 1_000, date(2025, 3, 20))));

        ClosedWonSummaryDTO summary = aggregator.closedWonSummary(histories, DateRange.of(date(2025, 2, 1), date(2025, 4, 30)));

        assertEquals(2, summary.getTotalCount());
        assertEquals(42_000, summary.getTotalValue());
        assertEquals("w2", summary.getDeals().get(0).getOpportunityId());
    }

    @Test
    @DisplayName("valueOverTime - empty input should give no points for bounded and unbounded ranges")
    void valueOverTimeEmptyInput() {
        assertTrue(aggregator.valueOverTime(List.of(), DateRange.of(date(2025, 2, 1), date(2025, 2, 28))).isEmpty());
        assertTrue(aggregator.valueOverTime(List.of(history("o1")), DateRange.UNBOUNDED).isEmpty());
    }

    @Test
    @DisplayName("empty input - every view should be empty or zeroed")
    void emptyInput() {
        assertTrue(aggregator.valueOverTime(List.of(), DateRange.UNBOUNDED).isEmpty());
        assertTrue(aggregator.pipelineByFiscalQuarter(List.of(), date(2025, 3, 15)).isEmpty());
        assertTrue(aggregator.dateSlippage(List.of(), DateRange.UNBOUNDED).isEmpty());
        assertTrue(aggregator.valueChanges(List.of(), DateRange.UNBOUNDED).isEmpty());
        assertEquals(0, aggregator.closedWonSummary(List.of(), DateRange.UNBOUNDED).getTotalCount());
    }
}
