package org.netpreserve.sweeper.fanout;

import org.netpreserve.sweeper.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves a job's target in the ledger and crawls it.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private final Ledger ledger;
    private final Orchestrator orchestrator;

    public JobRunner(Ledger ledger, Orchestrator orchestrator) {
        this.ledger = ledger;
        this.orchestrator = orchestrator;
    }

    public JobResult run(CrawlJob job, SessionProvider sessions) {
        Optional<Target> target = job.targetId() != null ? ledger.getTarget(job.targetId()) :
                ledger.findTarget(job.username());
        long targetId = job.targetId() != null ? job.targetId() : target.map(Target::id).orElse(-1L);
        if (target.isEmpty()) {
            log.atWarn().addKeyValue("job", job).log("Job names an unknown target");
            return new JobResult(job, CrawlOutcome.failed(targetId, CrawlState.NAVIGATING,
                    FailureKind.TARGET_NOT_FOUND, "Unknown target"));
        }
        if (!target.get().alive()) {
            log.atInfo().addKeyValue("job", job).log("Skipping target previously found gone");
            return new JobResult(job, CrawlOutcome.failed(targetId, CrawlState.NAVIGATING,
                    FailureKind.TARGET_NOT_FOUND, "Target is gone"));
        }
        log.atInfo().addKeyValue("job", job).addKeyValue("target", target.get().username()).log("Running job");
        return new JobResult(job, orchestrator.crawl(target.get(), sessions));
    }
}
