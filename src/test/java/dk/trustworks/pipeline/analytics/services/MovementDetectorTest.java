package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.analytics.dto.StageMovementDTO;
import dk.trustworks.pipeline.daterange.DateRange;
import dk.trustworks.pipeline.snapshot.OpportunityHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dk.trustworks.pipeline.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MovementDetector Tests")
class MovementDetectorTest {

    private final MovementDetector detector = new MovementDetector();

    private OpportunityHistory discoverToWon() {
        return history("o1",
                snapshot("o1", date(2025, 1, 1), DISCOVER, 10_000),
                snapshot("o1", date(2025, 2, 1), ROI, 10_000),
                snapshot("o1", date(2025, 3, 1), CLOSED_WON, 12_000));
    }

    @Test
    @DisplayName("detect - should emit one movement per stage change, dated at the later snapshot")
    void detectsMovements() {
        List<StageMovementDTO> movements = detector.detect(discoverToWon());

        assertEquals(2, movements.size());
        StageMovementDTO first = movements.get(0);
        assertEquals(DISCOVER, first.getFromStage());
        assertEquals(ROI, first.getToStage());
        assertEquals(date(2025, 2, 1), first.getDate());

        StageMovementDTO second = movements.get(1);
        assertEquals(ROI, second.getFromStage());
        assertEquals(CLOSED_WON, second.getToStage());
        assertEquals(date(2025, 3, 1), second.getDate());
        assertEquals(12_000, second.getValue());
        assertEquals(10_000, second.getPreviousValue());
        assertEquals("OPP-o1", second.getCrmId());
    }

    @Test
    @DisplayName("detect - unchanged stage should not be a movement")
    void ignoresSameStage() {
        OpportunityHistory history = history("o1",
                snapshot("o1", date(2025, 1, 1), DISCOVER, 10_000),
                snapshot("o1", date(2025, 1, 8), DISCOVER, 15_000));

        assertTrue(detector.detect(history).isEmpty());
    }

    @Test
    @DisplayName("detect - case and whitespace variants of one stage should not be a movement")
    void ignoresLabelVariants() {
        OpportunityHistory history = history("o1",
                snapshot("o1", date(2025, 1, 1), DISCOVER, 10_000),
                snapshot("o1", date(2025, 1, 8), "discover", 10_000),
                snapshot("o1", date(2025, 1, 15), " Developing Champions ", 10_000),
                snapshot("o1", date(2025, 1, 22), "developing champions", 10_000));

        List<StageMovementDTO> movements = detector.detect(history);

        assertEquals(1, movements.size());
        assertEquals(DISCOVER, movements.get(0).getFromStage());
        assertEquals(DEVELOPING_CHAMPIONS, movements.get(0).getToStage());
        assertEquals(date(2025, 1, 15), movements.get(0).getDate());
    }

    @Test
    @DisplayName("detect - closed to closed should not be a movement")
    void ignoresClosedToClosed() {
        OpportunityHistory history = history("o1",
                snapshot("o1", date(2025, 1, 1), CLOSED_WON, 10_000),
                snapshot("o1", date(2025, 2, 1), CLOSED_LOST, 10_000));

        assertTrue(detector.detect(history).isEmpty());
    }

    @Test
    @DisplayName("inWindow - should place a movement by its later snapshot date")
    void windowFiltering() {
        List<StageMovementDTO> all = detector.detectAll(List.of(discoverToWon()));

        List<StageMovementDTO> february = detector.inWindow(all, DateRange.of(date(2025, 2, 1), date(2025, 2, 28)));
        assertEquals(1, february.size());
        assertEquals(ROI, february.get(0).getToStage());

        assertEquals(2, detector.inWindow(all, DateRange.UNBOUNDED).size());
        assertTrue(detector.inWindow(all, DateRange.of(date(2025, 1, 1), date(2025, 1, 31))).isEmpty());
    }

    @Test
    @DisplayName("detectAll - should order by date across opportunities")
    void detectAllOrdering() {
        OpportunityHistory other = history("o0",
                snapshot("o0", date(2025, 1, 1), VALIDATION, 1_000),
                snapshot("o0", date(2025, 2, 15), DISCOVER, 1_000));

        List<StageMovementDTO> movements = detector.detectAll(List.of(discoverToWon(), other));

        assertEquals(List.of(date(2025, 2, 1), date(2025, 2, 15), date(2025, 3, 1)),
                movements.stream().map(StageMovementDTO::getDate).toList());
    }
}
