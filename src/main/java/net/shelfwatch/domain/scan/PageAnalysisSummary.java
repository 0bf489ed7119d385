package net.shelfwatch.domain.scan;

/**
 * AI page-level verdict stored on a scan run.
 */
public record PageAnalysisSummary(String summary, boolean pageHealthy, int findingsCount) {
}
