package dk.trustworks.pipeline.exceptions;

/**
 * Generic exception for pipeline analytics operations.
 * Thrown when a caller hands the engine arguments it cannot work with.
 */
public class PipelineAnalyticsException extends RuntimeException {

    public PipelineAnalyticsException(String message) {
        super(message);
    }

    public PipelineAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
