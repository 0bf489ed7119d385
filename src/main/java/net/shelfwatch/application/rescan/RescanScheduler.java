package net.shelfwatch.application.rescan;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/**
 * Requests a confirmation rescan when a pass surfaced a first-seen, unconfirmed high-severity issue.
 *
 * <p>AI-confirmed issues alert immediately and need no second look.</p>
 */
@Service
public class RescanScheduler {

    private static final Logger log = LoggerFactory.getLogger(RescanScheduler.class);

    private final RescanRequester rescanRequester;
    private final Duration rescanDelay;

    public RescanScheduler(@Lazy RescanRequester rescanRequester, ScanProperties scanProperties) {
        this.rescanRequester = rescanRequester;
        this.rescanDelay = scanProperties.getRescanDelay();
    }

    /**
     * @param issues issues created or updated during the pass, in their final state
     * @return whether a rescan was requested
     */
    public boolean scheduleIfNeeded(UUID pageId, List<Issue> issues) {
        long unconfirmed = issues.stream().filter(RescanScheduler::needsConfirmation).count();
        if (unconfirmed == 0) {
            return false;
        }
        log.info("Scheduling rescan of pageId={} in {} for {} unconfirmed high severity issue(s)",
            pageId, rescanDelay, unconfirmed);
        rescanRequester.scheduleRescan(pageId, rescanDelay);
        return true;
    }

    static boolean needsConfirmation(Issue issue) {
        return issue.isOpen()
            && issue.severity() == IssueSeverity.HIGH
            && issue.occurrenceCount() == 1
            && !issue.isAiConfirmed();
    }
}
