package org.netpreserve.sweeper.fanout;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.netpreserve.sweeper.CrawlOutcome;
import org.netpreserve.sweeper.CrawlState;
import org.netpreserve.sweeper.FailureKind;

import static org.junit.jupiter.api.Assertions.*;

class JobResultTest {
    private static final CrawlJob JOB = new CrawlJob(5L, null, null, 0);

    private static JobResult failed(FailureKind kind) {
        return new JobResult(JOB, CrawlOutcome.failed(5, CrawlState.NAVIGATING, kind, "failed"));
    }

    @Test
    public void exitCodes() {
        var done = new CrawlOutcome(5, CrawlState.DONE, null, null, null, 0, 0, 0, 0, false);
        assertEquals(JobResult.EXIT_OK, new JobResult(JOB, done).exitCode());
        assertEquals(JobResult.EXIT_OK, failed(FailureKind.TARGET_NOT_FOUND).exitCode());
        assertEquals(JobResult.EXIT_SESSION_LOST, failed(FailureKind.SESSION_LOST).exitCode());
        assertEquals(JobResult.EXIT_RETRY, failed(FailureKind.DEADLINE_EXCEEDED).exitCode());
        assertEquals(JobResult.EXIT_RETRY, JobResult.skipped(JOB).exitCode());
        assertTrue(failed(FailureKind.SESSION_LOST).sessionLost());
        assertFalse(JobResult.skipped(JOB).sessionLost());
    }

    @Test
    public void jobMessage() throws Exception {
        var job = new ObjectMapper().readValue("""
                {"target_id": 5, "worker_id": 2, "retry_count": 1, "queued_by": "scheduler"}
                """, CrawlJob.class);
        assertEquals(new CrawlJob(5L, null, 2L, 1), job);
        assertEquals(2, job.nextAttempt().retryCount());

        var byName = new ObjectMapper().readValue("{\"username\": \"someone\"}", CrawlJob.class);
        assertEquals(CrawlJob.forUsername("someone"), byName);
        assertThrows(IllegalArgumentException.class, () -> new CrawlJob(null, " ", null, 0));
    }
}
