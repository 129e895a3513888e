package dk.trustworks.pipeline.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Tunable policies of the analytics engine.
 */
@ConfigMapping(prefix = "pipeline.analytics")
public interface PipelineAnalyticsConfig {

    RateConfig winRate();

    RateConfig closeRate();

    /**
     * Entered-pipeline cohort close rate. Shipped at 80 in application.properties.
     */
    RateConfig cohortCloseRate();

    /**
     * Length of the trailing window used for the rolling rate series.
     */
    @WithDefault("12")
    int rollingWindowMonths();

    /**
     * Rows returned by the recent losses table when the caller gives no limit.
     */
    @WithDefault("20")
    int recentLossesLimit();

    interface RateConfig {
        /**
         * Rate points above this percentage are treated as data artifacts and left out
         * of the series. Set to 100 to keep every point.
         */
        @WithDefault("40")
        double outlierThreshold();
    }
}
