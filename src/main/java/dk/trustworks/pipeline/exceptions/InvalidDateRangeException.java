package dk.trustworks.pipeline.exceptions;

/**
 * Exception thrown when a date range has its start after its end,
 * or only one of its bounds set.
 */
public class InvalidDateRangeException extends PipelineAnalyticsException {

    public InvalidDateRangeException(String message) {
        super(message);
    }
}
