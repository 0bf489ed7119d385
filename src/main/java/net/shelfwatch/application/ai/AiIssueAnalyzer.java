package net.shelfwatch.application.ai;

/**
 * Port to the AI backend that reviews pages and issues.
 */
public interface AiIssueAnalyzer {

    /**
     * Whether the backend is configured. Callers skip AI work when it is not.
     */
    boolean isAvailable();

    /**
     * @throws AiAnalysisException when the backend fails or returns an unusable response
     */
    PageAnalysis analyzePage(PageAnalysisRequest request);

    /**
     * @throws AiAnalysisException when the backend fails or returns an unusable response
     */
    IssueAnalysis analyzeIssue(IssueAnalysisRequest request);
}
