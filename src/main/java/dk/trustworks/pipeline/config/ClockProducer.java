package dk.trustworks.pipeline.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Supplies the clock that decides "today" for period selectors.
 */
@JBossLog
@ApplicationScoped
public class ClockProducer {

    @ConfigProperty(name = "pipeline.clock.zone", defaultValue = "Europe/Copenhagen")
    String zone;

    @Produces
    @ApplicationScoped
    Clock clock() {
        log.infof("Pipeline analytics clock uses zone %s", zone);
        return Clock.system(ZoneId.of(zone));
    }
}
