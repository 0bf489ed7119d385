package net.shelfwatch.domain.scan;

import java.util.Optional;

/**
 * Read access to screenshots the scan engine uploaded.
 */
public interface ScreenshotStore {

    /**
     * @param reference storage key or URL recorded on the scan run
     * @return image bytes, empty when storage is unconfigured or the object is missing
     */
    Optional<byte[]> load(String reference);
}
