package org.netpreserve.sweeper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.sweeper.browser.PageReadException;
import org.netpreserve.sweeper.config.CrawlConfig;
import org.netpreserve.sweeper.config.CrawlMode;
import org.netpreserve.sweeper.config.DetailNavigation;
import org.netpreserve.sweeper.sink.DualSinkWriter;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class OrchestratorTest {
    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
    private final Database database;
    private final Ledger ledger;
    private final RecordingPublisher publisher = new RecordingPublisher();
    private final FakeSessions sessions = new FakeSessions();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T03:00:00Z"), TOKYO);

    OrchestratorTest(Database database) {
        this.database = database;
        this.ledger = new Ledger(database);
    }

    @BeforeEach
    void clear() {
        InMemoryDatabaseTestExtension.clear(database);
    }

    private static CrawlConfig config(int batchSize, Duration deadline) {
        return new CrawlConfig(batchSize, 0, 10, 10, Duration.ofSeconds(5), deadline, Duration.ZERO, Duration.ZERO,
                TOKYO, DetailNavigation.INDEXED_CLICK, CrawlMode.BOTH, false);
    }

    private Orchestrator orchestrator(FakeSite site, CrawlConfig config) {
        return new Orchestrator(ledger, new DualSinkWriter(ledger, publisher), site, config, clock);
    }

    private Orchestrator orchestrator(FakeSite site, Duration deadline) {
        return orchestrator(site, config(100, deadline));
    }

    private CrawlOutcome crawl(FakeSite site, long targetId) {
        return crawl(site, targetId, config(100, Duration.ofHours(1)));
    }

    private CrawlOutcome crawl(FakeSite site, long targetId, CrawlConfig config) {
        return orchestrator(site, config).crawl(ledger.getTarget(targetId).orElseThrow(), sessions);
    }

    private long newTarget() {
        return database.targets().insert("someone", 0, 1L);
    }

    private static List<String> descending(List<String> ids) {
        return ids.stream().sorted(Comparator.reverseOrder()).toList();
    }

    @Test
    public void newTargetIsSweptInBatchesAndResumesAfterRestart() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(100000, 150);
        site.loseSessionAfter = 100;

        var first = crawl(site, targetId);
        assertEquals(CrawlState.FAILED, first.state());
        assertEquals(FailureKind.SESSION_LOST, first.failure());
        assertEquals(CrawlState.HEAVY_SWEEP, first.failedIn());
        assertEquals(150, first.lightCommitted());
        assertEquals(100, first.heavyCommitted());
        assertEquals(descending(site.itemIds).subList(0, 100), site.visitedIds().subList(0, 100));
        assertEquals(50, ledger.itemsNeedingUpdate(targetId).size());
        assertTrue(ledger.getTarget(targetId).orElseThrow().isNew());

        var restarted = new FakeSite(clock).withItems(100000, 150);
        var second = crawl(restarted, targetId);
        assertEquals(CrawlState.DONE, second.state());
        assertEquals(50, second.heavyCommitted());
        assertEquals(descending(site.itemIds).subList(100, 150), restarted.visitedIds());
        assertTrue(second.swept());
        assertFalse(ledger.getTarget(targetId).orElseThrow().isNew());
        assertTrue(ledger.itemsNeedingUpdate(targetId).isEmpty());
        assertEquals(sessions.acquired, sessions.closed);
    }

    @Test
    public void sweptTargetOnlyVisitsFlaggedItems() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(200, 5);
        assertTrue(crawl(site, targetId).swept());

        site.itemIds.add("205");
        site.itemIds.add("206");
        database.useHandle(handle -> handle.execute(
                "UPDATE items SET needs_update = 1 WHERE target_id = ? AND item_id = '202'", targetId));
        site.visits.clear();

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.DONE, outcome.state());
        assertFalse(outcome.swept());
        assertEquals(List.of("206", "205", "202"), site.visitedIds());
        assertEquals(3, outcome.heavyCommitted());
    }

    @Test
    public void sweptIsSetOnlyOnce() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(300, 3);
        assertTrue(crawl(site, targetId).swept());
        assertFalse(ledger.markSwept(targetId));
        assertFalse(crawl(site, targetId).swept());
    }

    @Test
    public void missingTargetIsMarkedGone() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(400, 3);
        site.missing = true;

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.FAILED, outcome.state());
        assertEquals(FailureKind.TARGET_NOT_FOUND, outcome.failure());
        assertEquals(CrawlState.NAVIGATING, outcome.failedIn());
        assertFalse(ledger.getTarget(targetId).orElseThrow().alive());
        assertNull(ledger.getTarget(targetId).orElseThrow().lastCrawled());
        assertTrue(database.items().listByTarget(targetId).isEmpty());
        assertTrue(ledger.targetsForWorker(1, 10).isEmpty());
        assertEquals(1, sessions.closed);
    }

    @Test
    public void failedReturnToListingSwitchesToDirectUrls() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(500, 10);
        site.failReturnOn = 3;

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(10, outcome.heavyCommitted());
        assertEquals(List.of("click:509", "click:508", "click:507", "url:506", "url:505", "url:504", "url:503",
                "url:502", "url:501", "url:500"), site.visits);
        assertEquals(3, site.returns);
        assertEquals(10, site.heavyCollected);
        assertEquals(10, outcome.lightCommitted());
        assertTrue(outcome.swept());
    }

    @Test
    public void itemFailureIsNotFatal() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(600, 4);
        site.broken.add("602");

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(3, outcome.heavyCommitted());
        assertEquals(1, outcome.heavyFailed());
        assertTrue(outcome.swept());

        var failed = ledger.getItem(targetId, "602").orElseThrow();
        assertTrue(failed.needsUpdate());
        assertEquals(1, failed.failures());
        assertNotNull(failed.lastError());
        assertEquals(List.of("602"), ledger.itemsNeedingUpdate(targetId).stream().map(Item::itemId).toList());
    }

    @Test
    public void unavailableItemIsMarkedGone() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(700, 3);
        site.unavailable.add("701");

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(1, outcome.itemsGone());
        assertEquals(0, outcome.heavyFailed());

        var gone = ledger.getItem(targetId, "701").orElseThrow();
        assertFalse(gone.alive());
        assertFalse(gone.needsUpdate());
        assertEquals(0, gone.failures());
        // the click landed on the detail view, so the listing has to be restored
        assertEquals(3, site.returns);
    }

    @Test
    public void sessionLossKeepsCommittedItems() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(800, 5);
        site.loseSessionAfter = 2;

        var outcome = crawl(site, targetId);
        assertEquals(FailureKind.SESSION_LOST, outcome.failure());
        assertEquals(2, outcome.heavyCommitted());
        assertEquals(3, ledger.itemsNeedingUpdate(targetId).size());
        assertTrue(ledger.getTarget(targetId).orElseThrow().isNew());
        assertEquals(1, sessions.acquired);
        assertEquals(1, sessions.closed);
    }

    @Test
    public void deadlineAbortsSweep() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(900, 5);
        site.heavyCost = Duration.ofMinutes(20);

        var outcome = orchestrator(site, Duration.ofMinutes(30)).crawl(ledger.getTarget(targetId).orElseThrow(),
                sessions);
        assertEquals(FailureKind.DEADLINE_EXCEEDED, outcome.failure());
        assertEquals(2, outcome.heavyCommitted());
        assertEquals(3, ledger.itemsNeedingUpdate(targetId).size());
        assertTrue(ledger.getTarget(targetId).orElseThrow().isNew());
    }

    @Test
    public void browserThatWontStartIsSessionLoss() {
        long targetId = newTarget();
        sessions.unavailable = true;
        var outcome = crawl(new FakeSite(clock), targetId);
        assertEquals(FailureKind.SESSION_LOST, outcome.failure());
        assertNull(ledger.getTarget(targetId).orElseThrow().lastCrawled());
    }

    @Test
    public void profileAndProgressAreRecorded() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1000, 2);
        site.heavyCost = Duration.ofMinutes(1);

        var outcome = crawl(site, targetId);
        assertTrue(outcome.succeeded());
        var target = ledger.getTarget(targetId).orElseThrow();
        assertEquals("Some One", target.displayName());
        assertEquals(clock.instant(), target.lastCrawled());
        var history = database.metrics().followerHistory(targetId);
        assertEquals(1, history.size());
        assertEquals("2024-05-01", history.get(0).collectedOn());
        assertEquals(12000L, history.get(0).followerCount());
        assertEquals(4, publisher.events.size());
    }

    @Test
    public void driverErrorOnOneItemIsAnItemFailure() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1100, 5);
        site.crashing.add("1102");

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(4, outcome.heavyCommitted());
        assertEquals(1, outcome.heavyFailed());
        assertEquals(5, site.returns);
        assertTrue(outcome.swept());

        var failed = ledger.getItem(targetId, "1102").orElseThrow();
        assertTrue(failed.needsUpdate());
        assertEquals(1, failed.failures());
        assertTrue(failed.lastError().contains("stale frame"));
    }

    @Test
    public void unreadableTargetPageIsAFailedOutcome() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1150, 2);
        site.openTargetError = new PageReadException("frame detached", new IllegalStateException());

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.FAILED, outcome.state());
        assertEquals(FailureKind.NAVIGATION_FAILURE, outcome.failure());
        assertEquals(CrawlState.NAVIGATING, outcome.failedIn());

        site.openTargetError = new IllegalStateException("renderer crashed");
        outcome = crawl(site, targetId);
        assertEquals(FailureKind.UNEXPECTED, outcome.failure());
        assertTrue(outcome.failure().retryable());
        assertEquals(2, sessions.closed);
        assertNull(ledger.getTarget(targetId).orElseThrow().lastCrawled());
    }

    @Test
    public void clickOpeningTheWrongItemSwitchesToDirectUrls() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1300, 4);
        site.clicksOpen = 0;

        var outcome = crawl(site, targetId);
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(List.of("click:1300", "url:1303", "url:1302", "url:1301", "url:1300"), site.visits);
        assertEquals(4, outcome.heavyCommitted());
        assertEquals(0, outcome.heavyFailed());
        assertTrue(outcome.swept());
        assertTrue(ledger.itemsNeedingUpdate(targetId).isEmpty());
        // 4 light events and one heavy event per item, nothing for the misdirected click
        assertEquals(8, publisher.events.size());
    }

    @Test
    public void itemsClearedByAnotherProcessMidRunAreNotVisited() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1200, 6);
        site.afterHeavy = id -> {
            if (id.equals("1205")) {
                database.useHandle(handle -> handle.execute(
                        "UPDATE items SET needs_update = 0 WHERE target_id = ? AND item_id = '1201'", targetId));
            }
        };

        var outcome = crawl(site, targetId, config(2, Duration.ofHours(1)));
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(List.of("1205", "1204", "1203", "1202", "1200"), site.visitedIds());
        assertEquals(5, outcome.heavyCommitted());
        assertTrue(outcome.swept());
    }

    @Test
    public void lightModeOnlyReadsTheListing() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1400, 3);

        var outcome = crawl(site, targetId, config(100, Duration.ofHours(1)).withMode(CrawlMode.LIGHT));
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(3, outcome.lightCommitted());
        assertEquals(0, outcome.heavyCommitted());
        assertFalse(outcome.swept());
        assertTrue(site.visits.isEmpty());
        var target = ledger.getTarget(targetId).orElseThrow();
        assertTrue(target.isNew());
        assertNull(target.sweepStartedAt());
        assertEquals(3, ledger.itemsNeedingUpdate(targetId).size());

        // a later full crawl still performs the first sweep
        outcome = crawl(site, targetId);
        assertEquals(3, outcome.heavyCommitted());
        assertTrue(outcome.swept());
    }

    @Test
    public void heavyModeVisitsFlaggedItemsByUrlWithoutTheListing() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1500, 3);
        crawl(site, targetId, config(100, Duration.ofHours(1)).withMode(CrawlMode.LIGHT));
        site.itemIds.add("1503");

        var outcome = crawl(site, targetId, config(100, Duration.ofHours(1)).withMode(CrawlMode.HEAVY));
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(0, outcome.lightCommitted());
        assertEquals(List.of("url:1502", "url:1501", "url:1500"), site.visits);
        assertEquals(0, site.returns);
        assertFalse(outcome.swept());
        assertTrue(ledger.getTarget(targetId).orElseThrow().isNew());
        assertTrue(ledger.itemsNeedingUpdate(targetId).isEmpty());
    }

    @Test
    public void recrawlFetchesStoredItemsAgain() {
        long targetId = newTarget();
        var site = new FakeSite(clock).withItems(1600, 3);
        assertTrue(crawl(site, targetId).swept());
        site.visits.clear();

        var light = crawl(site, targetId, config(100, Duration.ofHours(1)).withMode(CrawlMode.LIGHT)
                .withRecrawl(true));
        assertEquals(0, light.heavyCommitted());
        assertTrue(ledger.itemsNeedingUpdate(targetId).isEmpty());

        var outcome = crawl(site, targetId, config(100, Duration.ofHours(1)).withRecrawl(true));
        assertEquals(CrawlState.DONE, outcome.state());
        assertEquals(List.of("1602", "1601", "1600"), site.visitedIds());
        assertEquals(3, outcome.heavyCommitted());
        assertFalse(outcome.swept());
        assertTrue(ledger.itemsNeedingUpdate(targetId).isEmpty());
    }
}
