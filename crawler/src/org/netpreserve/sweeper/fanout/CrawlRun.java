package org.netpreserve.sweeper.fanout;

import org.netpreserve.sweeper.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;

/**
 * Runs a list of jobs across several workers. Each worker owns its browser, jobs are taken from a shared queue.
 */
public class CrawlRun implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CrawlRun.class);
    private final List<Worker> workers;
    private final ExecutorService executor;

    public CrawlRun(List<Worker> workers) {
        if (workers.isEmpty()) throw new IllegalArgumentException("At least one worker is needed");
        this.workers = List.copyOf(workers);
        this.executor = Executors.newFixedThreadPool(workers.size(), new NamedThreadFactory("Worker"));
    }

    /**
     * Runs all jobs and waits for them to finish. Jobs left in the queue because every worker stopped early are
     * reported as skipped.
     */
    public List<JobResult> run(List<CrawlJob> jobs) throws InterruptedException {
        var queue = new ConcurrentLinkedQueue<>(jobs);
        var results = Collections.synchronizedList(new ArrayList<JobResult>());
        log.info("Running {} jobs on {} workers", jobs.size(), workers.size());
        var futures = new ArrayList<Future<?>>();
        for (Worker worker : workers) {
            futures.add(executor.submit(() -> worker.run(queue, results::add)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Worker crashed", e.getCause());
            }
        }
        for (CrawlJob job = queue.poll(); job != null; job = queue.poll()) {
            results.add(JobResult.skipped(job));
        }
        return new ArrayList<>(results);
    }

    public List<Worker.Info> workerInfo() {
        return workers.stream().map(Worker::info).toList();
    }

    @Override
    public void close() {
        workers.forEach(Worker::closeAsyncGraceful);
        executor.shutdownNow();
    }
}
