package net.shelfwatch.domain.scan;

import jakarta.annotation.Nullable;

/**
 * A failed network request observed while the page loaded.
 */
public record NetworkFailure(String url, @Nullable String resourceType, @Nullable Integer status, @Nullable String failure) {

    public NetworkFailure {
        url = url == null ? "" : url;
    }
}
