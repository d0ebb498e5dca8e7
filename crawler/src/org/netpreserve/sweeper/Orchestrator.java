package org.netpreserve.sweeper;

import org.jdbi.v3.core.JdbiException;
import org.netpreserve.sweeper.browser.*;
import org.netpreserve.sweeper.config.CrawlConfig;
import org.netpreserve.sweeper.config.CrawlMode;
import org.netpreserve.sweeper.config.DetailNavigation;
import org.netpreserve.sweeper.extract.*;
import org.netpreserve.sweeper.sink.DualSinkWriter;
import org.netpreserve.sweeper.sink.PersistenceException;
import org.netpreserve.sweeper.util.MustUpdate;
import org.netpreserve.sweeper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Crawls one target: opens its listing, stores what the listing shows about each item, then visits the detail
 * page of every item that still needs it.
 * <p>
 * Progress is checkpointed in the {@link Ledger} as it happens, so a crawl that dies part way can simply be run
 * again and carries on with the items that are still flagged.
 */
public class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private final Ledger ledger;
    private final DualSinkWriter writer;
    private final ExtractionStrategy strategy;
    private final CrawlConfig config;
    private final Pacer pacer;
    private final Clock clock;

    public Orchestrator(Ledger ledger, DualSinkWriter writer, ExtractionStrategy strategy, CrawlConfig config,
                        Clock clock) {
        this.ledger = ledger;
        this.writer = writer;
        this.strategy = strategy;
        this.config = config;
        this.pacer = new Pacer(config.minPause(), config.maxPause());
        this.clock = clock;
    }

    /**
     * Crawls a target with a session from {@code sessions}. The session is held for the duration of the crawl and
     * closed before returning. Failures are reported in the outcome rather than thrown.
     */
    public CrawlOutcome crawl(Target target, SessionProvider sessions) {
        return new TargetCrawl(target).run(sessions);
    }

    private static class Abort extends Exception {
        private final FailureKind kind;

        Abort(FailureKind kind, String message) {
            super(message);
            this.kind = kind;
        }
    }

    private class TargetCrawl {
        private final Target target;
        private final Deadline deadline;
        private final CrawlMode mode;
        private final Map<Url, Integer> listingPositions = new HashMap<>();
        private DetailNavigation detailNavigation;
        private CrawlState state = CrawlState.NAVIGATING;
        private int lightCommitted;
        private int heavyCommitted;
        private int heavyFailed;
        private int itemsGone;

        TargetCrawl(Target target) {
            this.target = target;
            this.deadline = Deadline.after(clock, config.targetDeadline());
            this.mode = config.mode() == null ? CrawlMode.BOTH : config.mode();
            if (mode == CrawlMode.HEAVY) {
                // without a listing sync there are no tile positions to click
                this.detailNavigation = DetailNavigation.DIRECT_URL;
            } else {
                this.detailNavigation = config.detailNavigation() == null ? DetailNavigation.INDEXED_CLICK :
                        config.detailNavigation();
            }
        }

        CrawlOutcome run(SessionProvider sessions) {
            enter(CrawlState.NAVIGATING);
            try (RenderSession session = sessions.acquire()) {
                PageHandle listing;
                try {
                    listing = strategy.openTarget(session, target);
                } catch (TargetNotFoundException e) {
                    ledger.markTargetGone(target.id());
                    return fail(FailureKind.TARGET_NOT_FOUND, e);
                } catch (NavigationTimedOutException e) {
                    return fail(FailureKind.NAVIGATION_TIMEOUT, e);
                } catch (NavigationException e) {
                    return fail(FailureKind.NAVIGATION_FAILURE, e);
                }
                ledger.touchLastCrawled(target.id(), clock.instant());

                enter(CrawlState.LIGHT_SYNC);
                collectProfile(session);
                if (mode != CrawlMode.HEAVY) syncLight(session, listing);

                enter(CrawlState.HEAVY_DECISION);
                HeavyPlan plan = decide();

                enter(CrawlState.HEAVY_SWEEP);
                sweep(session, plan);

                enter(CrawlState.RECONCILE);
                boolean swept = plan instanceof HeavyPlan.FullSweep && ledger.markSwept(target.id());
                ledger.touchLastCrawled(target.id(), clock.instant());

                enter(CrawlState.DONE);
                var outcome = new CrawlOutcome(target.id(), CrawlState.DONE, null, null, null, lightCommitted,
                        heavyCommitted, heavyFailed, itemsGone, swept);
                log.atInfo().addKeyValue("targetId", target.id()).addKeyValue("target", target.username())
                        .addKeyValue("light", lightCommitted).addKeyValue("heavy", heavyCommitted)
                        .addKeyValue("heavyFailed", heavyFailed).addKeyValue("gone", itemsGone)
                        .addKeyValue("swept", swept).log("Target crawled");
                return outcome;
            } catch (Abort e) {
                return fail(e.kind, e);
            } catch (SessionLostException e) {
                return fail(FailureKind.SESSION_LOST, e);
            } catch (IOException e) {
                return fail(FailureKind.SESSION_LOST, e);
            } catch (JdbiException | MustUpdate.Exception e) {
                return fail(FailureKind.PERSISTENCE_FAILURE, e);
            } catch (PageReadException e) {
                return fail(FailureKind.NAVIGATION_FAILURE, e);
            } catch (RuntimeException e) {
                log.atError().addKeyValue("targetId", target.id()).addKeyValue("state", state).setCause(e)
                        .log("Unexpected error crawling target");
                return fail(FailureKind.UNEXPECTED, e);
            }
        }

        private void enter(CrawlState next) {
            state = next;
            log.atDebug().addKeyValue("targetId", target.id()).addKeyValue("state", next).log("Crawl state");
        }

        private CrawlOutcome fail(FailureKind kind, Exception e) {
            var level = kind == FailureKind.TARGET_NOT_FOUND ? Level.INFO : Level.WARN;
            log.atLevel(level).addKeyValue("targetId", target.id()).addKeyValue("target", target.username())
                    .addKeyValue("state", state).addKeyValue("failure", kind)
                    .log("Target crawl failed: {}", e.getMessage());
            if (kind != FailureKind.TARGET_NOT_FOUND && kind != FailureKind.DEADLINE_EXCEEDED) {
                log.debug("Target crawl failure", e);
            }
            return new CrawlOutcome(target.id(), CrawlState.FAILED, state, kind, e.getMessage(), lightCommitted,
                    heavyCommitted, heavyFailed, itemsGone, false);
        }

        private void collectProfile(RenderSession session) {
            try {
                strategy.collectDisplayName(session).ifPresent(name -> ledger.saveDisplayName(target.id(), name));
            } catch (JdbiException | MustUpdate.Exception | PageReadException e) {
                log.atWarn().addKeyValue("targetId", target.id()).setCause(e).log("Unable to save display name");
            }
            try {
                ZoneId zone = config.timeZone() != null ? config.timeZone() : clock.getZone();
                strategy.collectFollowers(session).ifPresent(followers -> ledger.recordFollowers(target.id(),
                        LocalDate.now(clock.withZone(zone)), followers.text(), followers.count()));
            } catch (JdbiException | PageReadException e) {
                log.atWarn().addKeyValue("targetId", target.id()).setCause(e).log("Unable to save follower count");
            }
        }

        private void syncLight(RenderSession session, PageHandle listing) throws Abort {
            int maxItems = config.maxItemsPerTarget() > 0 ? config.maxItemsPerTarget() : Integer.MAX_VALUE;
            LightCursor cursor = strategy.collectLight(session, listing, maxItems);
            try {
                for (LightRecord record = cursor.next(); record != null; record = cursor.next()) {
                    checkContinue();
                    listingPositions.put(record.url(), record.position());
                    try {
                        writer.commit(target, record);
                        lightCommitted++;
                    } catch (PersistenceException e) {
                        log.atWarn().addKeyValue("targetId", target.id()).addKeyValue("itemId", record.key().itemId())
                                .setCause(e).log("Light record not stored");
                    }
                }
            } catch (NavigationException | PageReadException e) {
                log.atWarn().addKeyValue("targetId", target.id()).addKeyValue("light", lightCommitted)
                        .log("Listing only partially loaded: {}", e.getMessage());
            }
        }

        private HeavyPlan decide() {
            if (mode != CrawlMode.LIGHT && config.recrawl()) {
                int flagged = ledger.flagAllForUpdate(target.id());
                log.atInfo().addKeyValue("targetId", target.id()).addKeyValue("items", flagged)
                        .log("Flagged all items for recrawl");
            }
            HeavyPlan plan;
            if (mode == CrawlMode.LIGHT) {
                plan = new HeavyPlan.LightOnly();
            } else if (target.isNew() && mode == CrawlMode.BOTH) {
                if (!ledger.beginFullSweep(target.id(), clock.instant())) {
                    log.atInfo().addKeyValue("targetId", target.id()).log("Resuming full sweep");
                }
                plan = new HeavyPlan.FullSweep(ledger.itemsNeedingUpdate(target.id()));
            } else {
                plan = new HeavyPlan.Targeted(ledger.itemsNeedingUpdate(target.id()));
            }
            log.atInfo().addKeyValue("targetId", target.id()).addKeyValue("target", target.username())
                    .addKeyValue("plan", plan.getClass().getSimpleName())
                    .addKeyValue("candidates", plan.candidates().size()).log("Heavy sweep planned");
            return plan;
        }

        private void sweep(RenderSession session, HeavyPlan plan) throws Abort {
            Set<String> candidateIds = plan.candidates().stream().map(Item::itemId)
                    .collect(Collectors.toCollection(HashSet::new));
            Set<String> attempted = new HashSet<>();
            List<Item> remaining = plan.candidates();
            while (!remaining.isEmpty()) {
                var batch = remaining.subList(0, Math.min(config.batchSize(), remaining.size()));
                log.atInfo().addKeyValue("targetId", target.id()).addKeyValue("batch", batch.size())
                        .addKeyValue("remaining", remaining.size()).log("Starting batch");
                for (Item item : batch) {
                    checkContinue();
                    if (!attempted.isEmpty()) pause();
                    attempted.add(item.itemId());
                    sweepItem(session, item);
                }
                remaining = ledger.itemsNeedingUpdate(target.id()).stream()
                        .filter(item -> candidateIds.contains(item.itemId()) && !attempted.contains(item.itemId()))
                        .toList();
            }
        }

        private void sweepItem(RenderSession session, Item item) {
            Integer position = detailNavigation == DetailNavigation.INDEXED_CLICK ?
                    listingPositions.get(item.url()) : null;
            boolean clicked = false;
            try {
                PageHandle detail = null;
                if (position != null) {
                    clicked = true;
                    try {
                        detail = strategy.openDetailByIndex(session, position);
                    } catch (NavigationException e) {
                        clicked = false;
                        useDirectUrls("click on tile " + position + " failed: " + e.getMessage());
                    }
                } else if (detailNavigation == DetailNavigation.INDEXED_CLICK) {
                    useDirectUrls("item " + item.itemId() + " is not on the loaded listing");
                }

                HeavyRecord record = null;
                if (detail != null) {
                    record = strategy.collectHeavy(session, detail);
                    if (!record.key().itemId().equals(item.itemId())) {
                        useDirectUrls("tile " + position + " opened item " + record.key().itemId() + " instead of " +
                                      item.itemId());
                        record = null;
                    }
                }
                if (record == null) {
                    record = strategy.collectHeavy(session, strategy.openDetailByUrl(session, item.url()));
                    if (!record.key().itemId().equals(item.itemId())) {
                        throw new ExtractionException("Detail page " + item.url() + " shows item " +
                                                      record.key().itemId());
                    }
                }
                writer.commit(target, record);
                heavyCommitted++;
            } catch (ItemUnavailableException e) {
                itemsGone++;
                log.atInfo().addKeyValue("targetId", target.id()).addKeyValue("itemId", item.itemId())
                        .log("Item unavailable: {}", e.getMessage());
                try {
                    ledger.markItemGone(target.id(), item.itemId());
                } catch (JdbiException | MustUpdate.Exception e2) {
                    log.atError().addKeyValue("itemId", item.itemId()).setCause(e2).log("Unable to mark item gone");
                }
            } catch (NavigationException | ExtractionException | PersistenceException e) {
                recordFailure(item, e);
            } catch (SessionLostException e) {
                throw e;
            } catch (RuntimeException e) {
                recordFailure(item, e);
            } finally {
                if (clicked && detailNavigation == DetailNavigation.INDEXED_CLICK) returnToListing(session);
            }
        }

        private void returnToListing(RenderSession session) {
            try {
                strategy.returnToListing(session, target);
            } catch (NavigationException e) {
                useDirectUrls("return to listing failed: " + e.getMessage());
            }
        }

        private void useDirectUrls(String reason) {
            if (detailNavigation == DetailNavigation.DIRECT_URL) return;
            detailNavigation = DetailNavigation.DIRECT_URL;
            listingPositions.clear();
            log.atWarn().addKeyValue("targetId", target.id()).log("Switching to direct URL navigation, {}", reason);
        }

        private void recordFailure(Item item, Exception e) {
            heavyFailed++;
            log.atWarn().addKeyValue("targetId", target.id()).addKeyValue("itemId", item.itemId())
                    .log("Heavy fetch failed: {}", e.getMessage());
            try {
                ledger.recordItemFailure(target.id(), item.itemId(), e);
            } catch (JdbiException | MustUpdate.Exception e2) {
                log.atError().addKeyValue("itemId", item.itemId()).setCause(e2).log("Unable to record item failure");
            }
        }

        private void checkContinue() throws Abort {
            if (Thread.currentThread().isInterrupted()) {
                throw new Abort(FailureKind.INTERRUPTED, "Interrupted");
            }
            if (deadline.expired()) {
                throw new Abort(FailureKind.DEADLINE_EXCEEDED, "Deadline " + deadline.expiry() + " exceeded");
            }
        }

        private void pause() throws Abort {
            try {
                pacer.pause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new Abort(FailureKind.INTERRUPTED, "Interrupted");
            }
        }
    }
}
