package org.netpreserve.sweeper.fanout;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.SessionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.function.Consumer;

/**
 * Takes jobs from a shared queue and runs them one at a time with its own browser.
 */
public class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    final String id;
    private final SessionProvider sessions;
    private final JobRunner runner;
    private final RetryPolicy retryPolicy;
    private volatile boolean closed = false;
    private volatile Info info;

    public Worker(String id, SessionProvider sessions, JobRunner runner, RetryPolicy retryPolicy) {
        this.id = id;
        this.sessions = sessions;
        this.runner = runner;
        this.retryPolicy = retryPolicy;
        this.info = new Info(id, null, Instant.now());
    }

    /**
     * Runs jobs until the queue is empty, the worker is closed or its session is lost for good.
     */
    void run(Queue<CrawlJob> queue, Consumer<JobResult> results) {
        log.info("Starting worker {}", id);
        while (!closed) {
            CrawlJob job = queue.poll();
            if (job == null) {
                log.info("No work left for worker {}", id);
                return;
            }
            JobResult result;
            try {
                result = process(job);
            } catch (InterruptedException e) {
                log.info("Worker {} interrupted", id);
                results.accept(JobResult.skipped(job));
                return;
            }
            results.accept(result);
            if (result.sessionLost()) {
                log.error("Worker {} stopping, browser session lost and retries exhausted", id);
                return;
            }
        }
    }

    /**
     * Runs a job, retrying it as the retry policy allows.
     */
    public JobResult process(CrawlJob job) throws InterruptedException {
        while (true) {
            info = new Info(id, job, Instant.now());
            JobResult result;
            try {
                result = runner.run(job, sessions);
            } finally {
                info = new Info(id, null, Instant.now());
            }
            if (result.sessionLost()) sessions.reset();
            var delay = retryPolicy.retryDelay(result.outcome(), job.retryCount());
            if (delay.isEmpty() || closed) return result;
            log.atInfo().addKeyValue("job", job).addKeyValue("failure", result.outcome().failure())
                    .addKeyValue("delay", delay.get()).log("Retrying job");
            sleep(delay.get());
            job = job.nextAttempt();
        }
    }

    private static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero()) Thread.sleep(delay.toMillis());
    }

    public void closeAsyncGraceful() {
        closed = true;
    }

    public Info info() {
        return info;
    }

    public record Info(
            String id,
            @Nullable CrawlJob job,
            Instant updateTime) {
    }
}
