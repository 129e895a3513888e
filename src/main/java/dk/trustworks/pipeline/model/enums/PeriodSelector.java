package dk.trustworks.pipeline.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Symbolic period choices offered by the dashboard date pickers.
 */
public enum PeriodSelector {

    ALL_TIME("all-time", "All Time", 0),
    FY_TO_DATE("fy-to-date", "FY to Date", 0),
    CURRENT_FQ("current-fq", "Current FQ", 0),
    LAST_FQ("last-fq", "Last FQ", 0),
    LAST_FY("last-fy", "Last FY", 0),
    MONTH_TO_DATE("month-to-date", "Month to Date", 0),
    LAST_1_MONTH("last-1-month", "Last 1 Month", 1),
    LAST_3_MONTHS("last-3-months", "Last 3 Months", 3),
    LAST_6_MONTHS("last-6-months", "Last 6 Months", 6),
    LAST_12_MONTHS("last-12-months", "Last 12 Months", 12),
    CUSTOM("custom", "Custom", 0);

    private final String id;
    private final String label;
    private final int rollingMonths;

    PeriodSelector(String id, String label, int rollingMonths) {
        this.id = id;
        this.label = label;
        this.rollingMonths = rollingMonths;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return months in a rolling "Last N Months" window, 0 for every other selector
     */
    public int getRollingMonths() {
        return rollingMonths;
    }

    public boolean isRolling() {
        return rollingMonths > 0;
    }

    /**
     * Accepts the id ("fy-to-date"), the display label ("FY to Date") or the enum name.
     * The legacy compact ids ("fytodate", "last12months") are accepted too.
     */
    @JsonCreator
    public static PeriodSelector fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Period selector must not be blank");
        }
        String trimmed = value.trim();
        String compact = compact(trimmed);
        for (PeriodSelector selector : values()) {
            if (selector.id.equalsIgnoreCase(trimmed)
                    || selector.label.equalsIgnoreCase(trimmed)
                    || selector.name().equalsIgnoreCase(trimmed)
                    || compact(selector.id).equals(compact)) {
                return selector;
            }
        }
        throw new IllegalArgumentException("Unknown period selector: " + value);
    }

    private static String compact(String s) {
        return s.replaceAll("[^A-Za-z0-9]", "").toLowerCase();
    }
}
