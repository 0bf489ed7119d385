package net.shelfwatch.scheduler;

import java.util.Optional;
import net.shelfwatch.application.scan.ScanSweepService;
import net.shelfwatch.application.scan.SweepSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily sweep that enqueues every page not scanned within the refresh interval.
 */
@Component
public class ScanSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScanSweepScheduler.class);

    private final ScanSweepService sweepService;
    private final boolean schedulerEnabled;

    public ScanSweepScheduler(ScanSweepService sweepService, SweepConfiguration config) {
        this.sweepService = sweepService;
        this.schedulerEnabled = config.schedulerEnabled();
    }

    @Component
    public static class ConfigLoader {
        @Bean
        public SweepConfiguration sweepConfiguration(
            @Value("${shelfwatch.sweep.enabled:true}") boolean schedulerEnabled
        ) {
            return new SweepConfiguration(schedulerEnabled);
        }
    }

    public record SweepConfiguration(boolean schedulerEnabled) {}

    @Scheduled(cron = "${shelfwatch.sweep.cron:0 0 3 * * *}", zone = "${shelfwatch.scan.zone:UTC}")
    public void runScheduledSweep() {
        runSweep(false);
    }

    /**
     * Runs a sweep now, even when the scheduled sweep is disabled.
     */
    public SweepSummary forceRunSweep() {
        return runSweep(true).orElseThrow();
    }

    private Optional<SweepSummary> runSweep(boolean forceExecution) {
        if (!forceExecution && !schedulerEnabled) {
            log.info("Scheduled scan sweep is disabled via configuration.");
            return Optional.empty();
        }
        try {
            return Optional.of(sweepService.triggerScheduledSweep());
        } catch (RuntimeException exception) {
            log.error("Scheduled scan sweep failed.", exception);
            throw exception;
        }
    }
}
