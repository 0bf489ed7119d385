package net.shelfwatch.config;

import jakarta.annotation.PostConstruct;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the scan-to-alert pipeline.
 */
@Component
@ConfigurationProperties(prefix = "shelfwatch.scan")
public class ScanProperties {

    /**
     * Minimum detector confidence for a FAIL or WARNING to become an issue candidate.
     */
    private double confidenceThreshold = 0.7;

    /**
     * Minimum AI confidence for an AI page finding to be applied.
     */
    private double aiFindingConfidenceThreshold = 0.7;

    /**
     * Page load time above which a slow-load finding is raised.
     */
    private long slowLoadThresholdMs = 5000;

    /**
     * Delay before the confirmation rescan of a first-seen high-severity issue.
     */
    private Duration rescanDelay = Duration.ofMinutes(30);

    /**
     * Age after which a page is due for its scheduled scan.
     */
    private Duration refreshInterval = Duration.ofHours(24);

    /**
     * Weekday on which every scan runs deep.
     */
    private DayOfWeek deepScanDay = DayOfWeek.MONDAY;

    /**
     * Zone used to decide the current weekday.
     */
    private String zone = "UTC";

    /**
     * Number of worker threads executing scans.
     */
    private int workerThreads = 2;

    /**
     * Total attempts per scan job, first attempt included.
     */
    private int maxAttempts = 3;

    /**
     * Wait before the first retry; later retries grow by {@link #backoffMultiplier}.
     */
    private Duration initialBackoff = Duration.ofSeconds(10);

    private double backoffMultiplier = 2.0;

    @PostConstruct
    void validate() {
        Assert.isTrue(confidenceThreshold >= 0.0 && confidenceThreshold <= 1.0,
            "shelfwatch.scan.confidence-threshold must be within [0, 1]");
        Assert.isTrue(aiFindingConfidenceThreshold >= 0.0 && aiFindingConfidenceThreshold <= 1.0,
            "shelfwatch.scan.ai-finding-confidence-threshold must be within [0, 1]");
        Assert.isTrue(slowLoadThresholdMs > 0, "shelfwatch.scan.slow-load-threshold-ms must be positive");
        Assert.isTrue(!rescanDelay.isNegative(), "shelfwatch.scan.rescan-delay must be non-negative");
        Assert.isTrue(!refreshInterval.isNegative() && !refreshInterval.isZero(),
            "shelfwatch.scan.refresh-interval must be positive");
        Assert.isTrue(workerThreads > 0, "shelfwatch.scan.worker-threads must be positive");
        Assert.isTrue(maxAttempts > 0, "shelfwatch.scan.max-attempts must be positive");
        Assert.isTrue(!initialBackoff.isNegative(), "shelfwatch.scan.initial-backoff must be non-negative");
        Assert.isTrue(backoffMultiplier >= 1.0, "shelfwatch.scan.backoff-multiplier must be at least 1");
        ZoneId.of(zone);
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public double getAiFindingConfidenceThreshold() {
        return aiFindingConfidenceThreshold;
    }

    public void setAiFindingConfidenceThreshold(double aiFindingConfidenceThreshold) {
        this.aiFindingConfidenceThreshold = aiFindingConfidenceThreshold;
    }

    public long getSlowLoadThresholdMs() {
        return slowLoadThresholdMs;
    }

    public void setSlowLoadThresholdMs(long slowLoadThresholdMs) {
        this.slowLoadThresholdMs = slowLoadThresholdMs;
    }

    public Duration getRescanDelay() {
        return rescanDelay;
    }

    public void setRescanDelay(Duration rescanDelay) {
        this.rescanDelay = rescanDelay;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(Duration refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public DayOfWeek getDeepScanDay() {
        return deepScanDay;
    }

    public void setDeepScanDay(DayOfWeek deepScanDay) {
        this.deepScanDay = deepScanDay;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }
}
