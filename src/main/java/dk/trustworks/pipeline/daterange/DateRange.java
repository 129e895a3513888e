package dk.trustworks.pipeline.daterange;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dk.trustworks.pipeline.exceptions.InvalidDateRangeException;
import dk.trustworks.pipeline.utils.DateUtils;

import java.time.LocalDate;

/**
 * Inclusive date window. Either both bounds are set (bounded) or neither is (all time).
 *
 * @param startDate first day of the window, inclusive
 * @param endDate   last day of the window, inclusive
 */
public record DateRange(LocalDate startDate, LocalDate endDate) {

    public static final DateRange UNBOUNDED = new DateRange(null, null);

    public DateRange {
        if ((startDate == null) != (endDate == null)) {
            throw new InvalidDateRangeException("Date range must have both bounds or none, got " + startDate + " - " + endDate);
        }
        if (startDate != null && startDate.isAfter(endDate)) {
            throw new InvalidDateRangeException("Date range start " + startDate + " is after end " + endDate);
        }
    }

    public static DateRange of(LocalDate startDate, LocalDate endDate) {
        return new DateRange(startDate, endDate);
    }

    @JsonIgnore
    public boolean isBounded() {
        return startDate != null;
    }

    /**
     * Inclusive on both ends. An unbounded range contains every non-null date.
     */
    public boolean contains(LocalDate date) {
        return DateUtils.isBetweenBothIncluded(date, startDate, endDate);
    }
}
