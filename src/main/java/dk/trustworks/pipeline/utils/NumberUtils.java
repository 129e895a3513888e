package dk.trustworks.pipeline.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class NumberUtils {

    public static double round(double value, int places) {
        if (places < 0) throw new IllegalArgumentException();
        if (Double.isInfinite(value) || Double.isNaN(value)) value = 0.0;
        BigDecimal bd = BigDecimal.valueOf(value);
        bd = bd.setScale(places, RoundingMode.HALF_UP);
        return bd.doubleValue();
    }

    /**
     * Ratio as a percentage. Returns 0 when the denominator is 0.
     */
    public static double percentage(double part, double whole) {
        if (whole == 0) return 0.0;
        double pct = part / whole * 100.0;
        if (Double.isInfinite(pct) || Double.isNaN(pct)) return 0.0;
        return pct;
    }

    public static double nullToZero(Double d) {
        return d == null ? 0.0 : d;
    }
}
