package dk.trustworks.pipeline.utils;

import java.time.LocalDate;
import java.time.YearMonth;

import static java.time.temporal.ChronoUnit.DAYS;
import static java.time.temporal.ChronoUnit.MONTHS;

public final class DateUtils {

    /**
     * First month of the fiscal year. The fiscal year runs Feb 1 - Jan 31.
     */
    public static final int FISCAL_START_MONTH = 2;

    private DateUtils() {
    }

    /**
     * Both date inclusive. A null bound is treated as open.
     * @param testDate
     * @param from
     * @param to
     * @return
     */
    public static boolean isBetweenBothIncluded(LocalDate testDate, LocalDate from, LocalDate to) {
        if(testDate == null) return false;
        if(from != null && testDate.isBefore(from)) return false;
        return to == null || !testDate.isAfter(to);
    }

    /**
     * Fra 1. jan til 5. jan giver 4 dage.
     *
     * @param dateBefore inclusive
     * @param dateAfter exclusive
     * @return
     */
    public static int countDaysBetween(LocalDate dateBefore, LocalDate dateAfter) {
        return Math.toIntExact(DAYS.between(dateBefore, dateAfter));
    }

    public static LocalDate getLastDayOfMonth(LocalDate localDate) {
        YearMonth month = YearMonth.from(localDate);
        return month.atEndOfMonth();
    }

    public static LocalDate fiscalYearStart(LocalDate d) {
        int y = (d.getMonthValue() >= FISCAL_START_MONTH) ? d.getYear() : d.getYear() - 1;
        return LocalDate.of(y, FISCAL_START_MONTH, 1);
    }

    public static LocalDate fiscalYearEnd(LocalDate d) {
        return fiscalYearStart(d).plusYears(1).minusDays(1);
    }

    /**
     * First day of the fiscal quarter containing the date.
     * Q1 Feb-Apr, Q2 May-Jul, Q3 Aug-Oct, Q4 Nov-Jan.
     */
    public static LocalDate fiscalQuarterStart(LocalDate d) {
        int monthsIntoYear = monthsIntoFiscalYear(d);
        return fiscalYearStart(d).plusMonths((monthsIntoYear / 3) * 3L);
    }

    /**
     * @return fiscal quarter number 1-4
     */
    public static int fiscalQuarter(LocalDate d) {
        int monthsIntoYear = monthsIntoFiscalYear(d);
        return monthsIntoYear / 3 + 1;
    }

    private static int monthsIntoFiscalYear(LocalDate d) {
        return Math.toIntExact(MONTHS.between(YearMonth.from(fiscalYearStart(d)), YearMonth.from(d)));
    }
}
