package net.shelfwatch.domain.scan;

/**
 * Port to the browser automation engine that renders a page and runs detectors.
 */
public interface ScanEngine {

    /**
     * Renders the requested page.
     *
     * @return engine result; {@code success=false} when the page could not be rendered
     * @throws RuntimeException when the engine itself is unreachable
     */
    ScanEngineResult run(ScanRequest request);
}
