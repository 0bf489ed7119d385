package net.shelfwatch.domain.scan;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A product detail page registered for monitoring.
 */
public record MonitoredPage(
    UUID id,
    UUID tenantId,
    String title,
    String url,
    boolean monitoringEnabled,
    @Nullable Instant lastScannedAt,
    PageHealth health,
    @Nullable Instant deletedAt
) {

    public MonitoredPage {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(url, "url must not be null");
        health = health == null ? PageHealth.PENDING : health;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Due when never scanned or when the last scan is older than {@code refreshInterval}.
     */
    public boolean isDue(Instant now, Duration refreshInterval) {
        return lastScannedAt == null || lastScannedAt.isBefore(now.minus(refreshInterval));
    }

    /**
     * Absolute URL for the scan engine; relative paths are joined to the storefront base URL.
     */
    public String resolveUrl(String storefrontBaseUrl) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        String base = storefrontBaseUrl.endsWith("/")
            ? storefrontBaseUrl.substring(0, storefrontBaseUrl.length() - 1)
            : storefrontBaseUrl;
        return url.startsWith("/") ? base + url : base + "/" + url;
    }

    public String displayName() {
        return title != null && !title.isBlank() ? title : url;
    }

    public MonitoredPage withHealth(PageHealth newHealth) {
        return new MonitoredPage(id, tenantId, title, url, monitoringEnabled, lastScannedAt, newHealth, deletedAt);
    }

    public MonitoredPage withLastScannedAt(Instant scannedAt) {
        return new MonitoredPage(id, tenantId, title, url, monitoringEnabled, scannedAt, health, deletedAt);
    }
}
