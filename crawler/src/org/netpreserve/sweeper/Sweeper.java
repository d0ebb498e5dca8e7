package org.netpreserve.sweeper;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.sweeper.browser.NavigationException;
import org.netpreserve.sweeper.browser.PageReadException;
import org.netpreserve.sweeper.browser.RenderSession;
import org.netpreserve.sweeper.browser.SessionLostException;
import org.netpreserve.sweeper.config.CrawlMode;
import org.netpreserve.sweeper.config.DeviceProfile;
import org.netpreserve.sweeper.config.SweeperConfig;
import org.netpreserve.sweeper.extract.ExtractionStrategy;
import org.netpreserve.sweeper.extract.SelectorExtractionStrategy;
import org.netpreserve.sweeper.fanout.*;
import org.netpreserve.sweeper.sink.DualSinkWriter;
import org.netpreserve.sweeper.sink.EventPublisher;
import org.netpreserve.sweeper.sink.KafkaEventPublisher;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Command-line entry point. Wires the ledger, event stream, extraction strategy and browsers together for one
 * job directory.
 */
public class Sweeper implements AutoCloseable {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Sweeper.class);
    private final Path jobDir;
    private final SweeperConfig config;
    private final Database db;
    private final EventPublisher publisher;
    private final Ledger ledger;
    private final ExtractionStrategy strategy;
    private final JobRunner runner;
    private final List<BrowserManager> browsers = new ArrayList<>();

    public Sweeper(Path jobDir, SweeperConfig config) throws IOException {
        this.jobDir = jobDir;
        this.config = config;
        Files.createDirectories(jobDir);
        this.db = Database.open(jobDir.resolve(config.storage().database()));
        this.publisher = KafkaEventPublisher.create(config.stream());
        this.ledger = new Ledger(db);
        var clock = Clock.system(config.crawl().timeZone());
        this.strategy = new SelectorExtractionStrategy(config.selectors(), config.crawl(), clock);
        var orchestrator = new Orchestrator(ledger, new DualSinkWriter(ledger, publisher), strategy, config.crawl(),
                clock);
        this.runner = new JobRunner(ledger, orchestrator);
    }

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of("data");
        Long workerId = null;
        DeviceProfile profile = null;
        Integer maxItems = null;
        Integer maxTargets = null;
        CrawlMode mode = null;
        boolean recrawl = false;
        Integer workers = null;
        Path jobFile = null;
        String username = null;
        boolean loginOnly = false;
        boolean dumpConfig = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--job" -> jobFile = Path.of(args[++i]);
                case "--job-dir", "-j" -> jobDir = Path.of(args[++i]);
                case "--log-file" -> startLogFile(args[++i]);
                case "--login-only" -> loginOnly = true;
                case "--max-items" -> maxItems = Integer.parseInt(args[++i]);
                case "--max-targets" -> maxTargets = Integer.parseInt(args[++i]);
                case "--mode" -> mode = CrawlMode.fromString(args[++i]);
                case "--profile" -> profile = DeviceProfile.fromString(args[++i]);
                case "--recrawl" -> recrawl = true;
                case "--target", "-t" -> username = args[++i];
                case "--worker-id", "-w" -> workerId = Long.parseLong(args[++i]);
                case "--workers" -> workers = Integer.parseInt(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: sweeper [options]");
                    System.out.println("Options:");
                    System.out.println("  -h, --help");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("      --job FILE           Run the single job message in FILE");
                    System.out.println("  -j, --job-dir DIR        Directory for job data (default: data)");
                    System.out.println("      --log-file FILE      Also write the log to FILE");
                    System.out.println("      --login-only         Only check that the browser profile is logged in");
                    System.out.println("      --max-items N        Light records to collect per target");
                    System.out.println("      --max-targets N      Targets to take from the roster");
                    System.out.println("      --mode light|heavy|both");
                    System.out.println("                           Listing only, flagged detail pages only, or both");
                    System.out.println("      --profile pc|vps     Device profile for the browser");
                    System.out.println("      --recrawl            Fetch detail pages again even if already stored");
                    System.out.println("  -t, --target USERNAME    Crawl a single target");
                    System.out.println("  -w, --worker-id ID       Crawl the targets assigned to worker ID");
                    System.out.println("      --workers N          Number of parallel workers");
                    System.exit(0);
                }
                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    System.exit(1);
                }
            }
        }

        SweeperConfig config = loadConfig(jobDir);
        if (profile != null) {
            config = new SweeperConfig(config.crawl(), config.browser().withProfile(profile), config.storage(),
                    config.stream(), config.selectors(), config.fanout());
        }
        if (maxItems != null) {
            config = new SweeperConfig(config.crawl().withMaxItemsPerTarget(maxItems), config.browser(),
                    config.storage(), config.stream(), config.selectors(), config.fanout());
        }
        if (maxTargets != null) {
            config = new SweeperConfig(config.crawl().withMaxTargets(maxTargets), config.browser(),
                    config.storage(), config.stream(), config.selectors(), config.fanout());
        }
        if (mode != null) {
            config = new SweeperConfig(config.crawl().withMode(mode), config.browser(), config.storage(),
                    config.stream(), config.selectors(), config.fanout());
        }
        if (recrawl) {
            config = new SweeperConfig(config.crawl().withRecrawl(true), config.browser(), config.storage(),
                    config.stream(), config.selectors(), config.fanout());
        }
        if (workers != null) {
            config = new SweeperConfig(config.crawl(), config.browser(), config.storage(), config.stream(),
                    config.selectors(), config.fanout().withWorkers(workers));
        }
        if (dumpConfig) {
            System.out.println(yamlMapper().writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        int exitCode;
        try (var sweeper = new Sweeper(jobDir, config)) {
            if (loginOnly) {
                exitCode = sweeper.checkLogin();
            } else if (jobFile != null) {
                var job = new ObjectMapper().readValue(jobFile.toFile(), CrawlJob.class);
                exitCode = sweeper.runJob(job).exitCode();
            } else if (username != null) {
                exitCode = sweeper.runJob(CrawlJob.forUsername(username)).exitCode();
            } else if (workerId != null) {
                exitCode = sweeper.runWorker(workerId);
            } else {
                System.err.println("Nothing to do: give --target, --job, --worker-id or --login-only");
                exitCode = 1;
            }
        }
        System.exit(exitCode);
    }

    /**
     * Checks that the browser profile is logged in to the site.
     *
     * @return exit code, 0 if logged in
     */
    public int checkLogin() {
        BrowserManager browser = newBrowser(0);
        try (RenderSession session = browser.acquire()) {
            if (strategy.checkSession(session)) {
                log.info("Browser profile is logged in");
                return JobResult.EXIT_OK;
            }
            log.error("Browser profile is not logged in");
        } catch (IOException | NavigationException | SessionLostException | PageReadException e) {
            log.error("Login check failed", e);
        }
        return JobResult.EXIT_SESSION_LOST;
    }

    public JobResult runJob(CrawlJob job) throws InterruptedException {
        var worker = new Worker("0", newBrowser(0), runner, retryPolicy());
        JobResult result = worker.process(job);
        log.atInfo().addKeyValue("job", job).addKeyValue("exitCode", result.exitCode()).log("Job finished");
        return result;
    }

    /**
     * Crawls the targets assigned to a worker account.
     *
     * @return exit code, non-zero if any worker lost its browser session
     */
    public int runWorker(long workerId) throws InterruptedException {
        var jobs = ledger.targetsForWorker(workerId, config.crawl().maxTargets()).stream()
                .map(CrawlJob::forTarget).toList();
        int workerCount = Math.max(1, config.fanout().workers());
        var workers = new ArrayList<Worker>();
        for (int i = 0; i < workerCount; i++) {
            workers.add(new Worker(String.valueOf(i), newBrowser(i), runner, retryPolicy()));
        }
        List<JobResult> results;
        try (var run = new CrawlRun(workers)) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> run.workerInfo().stream()
                    .filter(info -> info.job() != null)
                    .forEach(info -> log.warn("Worker {} was still running {}", info.id(), info.job())),
                    "shutdown-hook"));
            results = run.run(jobs);
        }
        long done = results.stream().filter(r -> r.exitCode() == JobResult.EXIT_OK).count();
        boolean sessionLost = results.stream().anyMatch(JobResult::sessionLost);
        log.atInfo().addKeyValue("workerId", workerId).addKeyValue("jobs", jobs.size()).addKeyValue("done", done)
                .addKeyValue("sessionLost", sessionLost).log("Run finished");
        return sessionLost ? JobResult.EXIT_SESSION_LOST : JobResult.EXIT_OK;
    }

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(config.fanout().maxRetries(), config.fanout().retryDelay());
    }

    private BrowserManager newBrowser(int workerIndex) {
        var browser = new BrowserManager(config.browser(), config.browser().profileDirFor(jobDir, workerIndex));
        browsers.add(browser);
        return browser;
    }

    @Override
    public void close() {
        browsers.forEach(BrowserManager::close);
        publisher.close();
        db.close();
    }

    /**
     * Loads the built-in defaults overlaid with the job directory's config.yaml, if there is one.
     */
    public static SweeperConfig loadConfig(Path jobDir) throws IOException {
        var mapper = yamlMapper();
        JsonNode configTree;
        try (InputStream defaults = Objects.requireNonNull(Sweeper.class.getResourceAsStream("config/defaults.yaml"),
                "missing config/defaults.yaml")) {
            configTree = mapper.readTree(defaults);
        }
        Path configFile = jobDir.resolve("config.yaml");
        if (Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        return mapper.treeToValue(configTree, SweeperConfig.class);
    }

    private static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    private static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    private static void startLogFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{36} %kvp %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("log-file");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
    }
}
