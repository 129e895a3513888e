package dk.trustworks.pipeline.daterange;

import dk.trustworks.pipeline.model.enums.PeriodSelector;
import dk.trustworks.pipeline.utils.DateUtils;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps a period selector to a concrete date window on the Feb 1 - Jan 31 fiscal calendar.
 * <p>
 * Every "to date", fiscal quarter and rolling window the dashboard shows is resolved here.
 * The reference day is always passed in, so results only depend on the arguments.
 */
@JBossLog
@ApplicationScoped
public class DateRangeResolver {

    public DateRange resolve(PeriodSelector selector, LocalDate today) {
        return resolve(selector, today, null);
    }

    /**
     * @param selector period to resolve
     * @param today    reference day, the end of every "to date" window
     * @param custom   caller bounds, only read for {@link PeriodSelector#CUSTOM}
     * @return resolved window, {@link DateRange#UNBOUNDED} for all time
     */
    public DateRange resolve(PeriodSelector selector, LocalDate today, DateRange custom) {
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(today, "today");

        if (selector.isRolling()) {
            return lastMonths(today, selector.getRollingMonths());
        }

        return switch (selector) {
            case ALL_TIME -> DateRange.UNBOUNDED;
            case FY_TO_DATE -> fiscalYearToDate(today);
            case CURRENT_FQ -> DateRange.of(DateUtils.fiscalQuarterStart(today), today);
            case LAST_FQ -> lastFiscalQuarter(today);
            case LAST_FY -> lastFiscalYear(today);
            case MONTH_TO_DATE -> DateRange.of(today.withDayOfMonth(1), today);
            case CUSTOM -> {
                if (custom != null && custom.isBounded()) yield custom;
                log.debugf("Custom period requested without bounds, falling back to FY to date as of %s", today);
                yield fiscalYearToDate(today);
            }
            default -> throw new IllegalArgumentException("Unhandled period selector " + selector);
        };
    }

    public DateRange fiscalYearToDate(LocalDate today) {
        return DateRange.of(DateUtils.fiscalYearStart(today), today);
    }

    /**
     * [today - months, today] using calendar month arithmetic; the day is clamped
     * to the length of the target month (Mar 31 minus one month is Feb 28/29).
     */
    public DateRange lastMonths(LocalDate today, int months) {
        if (months <= 0) throw new IllegalArgumentException("months must be positive, was " + months);
        return DateRange.of(today.minusMonths(months), today);
    }

    /**
     * The full quarter before the one containing today. From Q1 (Feb-Apr) this wraps to
     * Q4 of the previous fiscal year, Nov 1 - Jan 31.
     */
    public DateRange lastFiscalQuarter(LocalDate today) {
        LocalDate currentQuarterStart = DateUtils.fiscalQuarterStart(today);
        LocalDate start;
        if (currentQuarterStart.getMonth() == Month.FEBRUARY) {
            start = LocalDate.of(currentQuarterStart.getYear() - 1, Month.NOVEMBER, 1);
        } else {
            start = currentQuarterStart.minusMonths(3);
        }
        return DateRange.of(start, start.plusMonths(3).minusDays(1));
    }

    public DateRange lastFiscalYear(LocalDate today) {
        LocalDate start = DateUtils.fiscalYearStart(today).minusYears(1);
        return DateRange.of(start, DateUtils.fiscalYearEnd(start));
    }

    /**
     * Calendar year in which the fiscal year containing the date started.
     */
    public int fiscalYearOf(LocalDate date) {
        return DateUtils.fiscalYearStart(date).getYear();
    }

    /**
     * Dashboard label for the fiscal year, named after the calendar year it ends in:
     * Feb 1 2025 - Jan 31 2026 is "FY2026".
     */
    public String fiscalYearLabel(LocalDate date) {
        return "FY" + (fiscalYearOf(date) + 1);
    }

    /**
     * "2025 Q1" for Feb-Apr 2025. Q4 is labelled with the calendar year it ends in,
     * so both Nov 2025 and Jan 2026 are "2026 Q4".
     */
    public String fiscalQuarterLabel(LocalDate date) {
        int quarter = DateUtils.fiscalQuarter(date);
        int year = quarter == 4 ? fiscalYearOf(date) + 1 : date.getYear();
        return year + " Q" + quarter;
    }

    /**
     * Month-end anchor dates covering a bounded range. The last anchor is the range end
     * when the range stops mid-month.
     */
    public List<LocalDate> monthlyAnchors(DateRange range) {
        Objects.requireNonNull(range, "range");
        if (!range.isBounded()) {
            throw new IllegalArgumentException("Monthly anchors need a bounded range");
        }
        List<LocalDate> anchors = new ArrayList<>();
        LocalDate anchor = DateUtils.getLastDayOfMonth(range.startDate());
        while (anchor.isBefore(range.endDate())) {
            anchors.add(anchor);
            anchor = DateUtils.getLastDayOfMonth(anchor.plusDays(1));
        }
        anchors.add(range.endDate());
        return anchors;
    }
}
