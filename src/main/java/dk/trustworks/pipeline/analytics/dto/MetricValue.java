package dk.trustworks.pipeline.analytics.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A metric that is either present or missing. Missing means "no data to compute from",
 * which downstream consumers must be able to tell apart from a computed zero.
 * <p>
 * Serialized as the bare number, or {@code null} when missing.
 */
public final class MetricValue {

    private static final MetricValue MISSING = new MetricValue(null);

    private final Double value;

    private MetricValue(Double value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException for NaN or infinite values
     */
    public static MetricValue present(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Metric value must be finite, was " + value);
        }
        return new MetricValue(value);
    }

    public static MetricValue missing() {
        return MISSING;
    }

    @JsonCreator
    public static MetricValue ofNullable(Double value) {
        return value == null ? MISSING : present(value);
    }

    /**
     * part / whole as a percentage, missing when whole is zero.
     */
    public static MetricValue ratio(double part, double whole) {
        if (whole == 0) return MISSING;
        return present(part / whole * 100.0);
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isMissing() {
        return value == null;
    }

    @JsonValue
    public Double getValue() {
        return value;
    }

    public OptionalDouble asOptional() {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Numeric view for charts that need a number. Never NaN.
     */
    public double orZero() {
        return value == null ? 0.0 : value;
    }

    public boolean exceeds(double threshold) {
        return value != null && value > threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((MetricValue) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "MetricValue{missing}" : "MetricValue{" + value + '}';
    }
}
