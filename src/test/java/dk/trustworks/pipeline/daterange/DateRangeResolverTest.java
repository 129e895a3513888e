package dk.trustworks.pipeline.daterange;

import dk.trustworks.pipeline.exceptions.InvalidDateRangeException;
import dk.trustworks.pipeline.model.enums.PeriodSelector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static dk.trustworks.pipeline.utils.TestDataBuilders.date;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DateRangeResolver Tests")
class DateRangeResolverTest {

    private final DateRangeResolver resolver = new DateRangeResolver();

    private static final LocalDate MID_MARCH = date(2025, 3, 15);

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("FY to date - should start on Feb 1 of the current fiscal year")
        void fiscalYearToDate() {
            assertEquals(DateRange.of(date(2025, 2, 1), MID_MARCH), resolver.resolve(PeriodSelector.FY_TO_DATE, MID_MARCH));
        }

        @Test
        @DisplayName("FY to date - January belongs to the fiscal year that started the previous February")
        void fiscalYearToDateInJanuary() {
            LocalDate today = date(2025, 1, 20);
            assertEquals(DateRange.of(date(2024, 2, 1), today), resolver.resolve(PeriodSelector.FY_TO_DATE, today));
        }

        @Test
        @DisplayName("current FQ - should start on the first day of the fiscal quarter")
        void currentFiscalQuarter() {
            assertEquals(DateRange.of(date(2025, 2, 1), MID_MARCH), resolver.resolve(PeriodSelector.CURRENT_FQ, MID_MARCH));
            LocalDate september = date(2025, 9, 3);
            assertEquals(DateRange.of(date(2025, 8, 1), september), resolver.resolve(PeriodSelector.CURRENT_FQ, september));
        }

        @Test
        @DisplayName("last FQ - from Q1 should wrap to Nov 1 - Jan 31 of the previous fiscal year")
        void lastFiscalQuarterWrapsFromQ1() {
            assertEquals(DateRange.of(date(2024, 11, 1), date(2025, 1, 31)), resolver.resolve(PeriodSelector.LAST_FQ, MID_MARCH));
        }

        @Test
        @DisplayName("last FQ - from Q2 should be Feb 1 - Apr 30")
        void lastFiscalQuarterFromQ2() {
            assertEquals(DateRange.of(date(2025, 2, 1), date(2025, 4, 30)), resolver.resolve(PeriodSelector.LAST_FQ, date(2025, 6, 10)));
        }

        @Test
        @DisplayName("last FQ - from January (Q4) should be Aug 1 - Oct 31")
        void lastFiscalQuarterFromJanuary() {
            assertEquals(DateRange.of(date(2024, 8, 1), date(2024, 10, 31)), resolver.resolve(PeriodSelector.LAST_FQ, date(2025, 1, 10)));
        }

        @Test
        @DisplayName("last FY - should be the full previous fiscal year")
        void lastFiscalYear() {
            assertEquals(DateRange.of(date(2024, 2, 1), date(2025, 1, 31)), resolver.resolve(PeriodSelector.LAST_FY, MID_MARCH));
        }

        @Test
        @DisplayName("month to date - should start on the first of the month")
        void monthToDate() {
            assertEquals(DateRange.of(date(2025, 3, 1), MID_MARCH), resolver.resolve(PeriodSelector.MONTH_TO_DATE, MID_MARCH));
        }

        @Test
        @DisplayName("rolling - should subtract calendar months")
        void rollingMonths() {
            assertEquals(DateRange.of(date(2024, 12, 15), MID_MARCH), resolver.resolve(PeriodSelector.LAST_3_MONTHS, MID_MARCH));
            assertEquals(DateRange.of(date(2024, 3, 15), MID_MARCH), resolver.resolve(PeriodSelector.LAST_12_MONTHS, MID_MARCH));
        }

        @Test
        @DisplayName("rolling - should clamp the day to the target month")
        void rollingMonthsClampsDay() {
            assertEquals(date(2025, 2, 28), resolver.lastMonths(date(2025, 3, 31), 1).startDate());
        }

        @Test
        @DisplayName("all time - should be unbounded")
        void allTime() {
            DateRange range = resolver.resolve(PeriodSelector.ALL_TIME, MID_MARCH);
            assertFalse(range.isBounded());
            assertTrue(range.contains(date(1999, 1, 1)));
        }

        @Test
        @DisplayName("custom - should return the caller's bounds")
        void customWithBounds() {
            DateRange custom = DateRange.of(date(2024, 6, 1), date(2024, 6, 30));
            assertSame(custom, resolver.resolve(PeriodSelector.CUSTOM, MID_MARCH, custom));
        }

        @Test
        @DisplayName("custom - without bounds should fall back to FY to date")
        void customWithoutBounds() {
            assertEquals(DateRange.of(date(2025, 2, 1), MID_MARCH), resolver.resolve(PeriodSelector.CUSTOM, MID_MARCH, null));
            assertEquals(DateRange.of(date(2025, 2, 1), MID_MARCH), resolver.resolve(PeriodSelector.CUSTOM, MID_MARCH, DateRange.UNBOUNDED));
        }

        @Test
        @DisplayName("resolve - should reject a null selector")
        void nullSelector() {
            assertThrows(NullPointerException.class, () -> resolver.resolve(null, MID_MARCH));
        }

        @Test
        @DisplayName("lastMonths - should reject non-positive month counts")
        void lastMonthsRejectsZero() {
            assertThrows(IllegalArgumentException.class, () -> resolver.lastMonths(MID_MARCH, 0));
        }
    }

    @Nested
    @DisplayName("labels")
    class Labels {

        @Test
        @DisplayName("fiscalYearLabel - should be named after the calendar year the fiscal year ends in")
        void fiscalYearLabel() {
            assertEquals("FY2026", resolver.fiscalYearLabel(date(2025, 3, 15)));
            assertEquals("FY2025", resolver.fiscalYearLabel(date(2025, 1, 15)));
            assertEquals(2024, resolver.fiscalYearOf(date(2025, 1, 15)));
        }

        @Test
        @DisplayName("fiscalQuarterLabel - Q4 should carry the year it ends in")
        void fiscalQuarterLabel() {
            assertEquals("2025 Q1", resolver.fiscalQuarterLabel(date(2025, 3, 1)));
            assertEquals("2025 Q3", resolver.fiscalQuarterLabel(date(2025, 8, 1)));
            assertEquals("2026 Q4", resolver.fiscalQuarterLabel(date(2025, 11, 15)));
            assertEquals("2026 Q4", resolver.fiscalQuarterLabel(date(2026, 1, 15)));
        }
    }

    @Nested
    @DisplayName("monthlyAnchors")
    class MonthlyAnchors {

        @Test
        @DisplayName("monthlyAnchors - should end on the range end when it stops mid-month")
        void endsMidMonth() {
            List<LocalDate> anchors = resolver.monthlyAnchors(DateRange.of(date(2025, 2, 1), date(2025, 4, 15)));
            assertEquals(List.of(date(2025, 2, 28), date(2025, 3, 31), date(2025, 4, 15)), anchors);
        }

        @Test
        @DisplayName("monthlyAnchors - should not repeat a month end that is also the range end")
        void endsOnMonthEnd() {
            List<LocalDate> anchors = resolver.monthlyAnchors(DateRange.of(date(2025, 2, 1), date(2025, 4, 30)));
            assertEquals(List.of(date(2025, 2, 28), date(2025, 3, 31), date(2025, 4, 30)), anchors);
        }

        @Test
        @DisplayName("monthlyAnchors - should reject an unbounded range")
        void rejectsUnbounded() {
            assertThrows(IllegalArgumentException.class, () -> resolver.monthlyAnchors(DateRange.UNBOUNDED));
        }
    }

    @Test
    @DisplayName("DateRange - should reject inverted and half-open bounds")
    void dateRangeValidation() {
        assertThrows(InvalidDateRangeException.class, () -> DateRange.of(date(2025, 3, 2), date(2025, 3, 1)));
        assertThrows(InvalidDateRangeException.class, () -> DateRange.of(date(2025, 3, 1), null));
        assertTrue(DateRange.of(date(2025, 3, 1), date(2025, 3, 1)).contains(date(2025, 3, 1)));
    }
}
