package org.netpreserve.sweeper;

import org.netpreserve.sweeper.db.FollowerMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable crawl progress: which targets still need their first full sweep, which items still need heavy data and
 * when each target was last crawled. Every method commits before returning, so progress survives a crash between
 * any two calls.
 */
public class Ledger {
    private static final Logger log = LoggerFactory.getLogger(Ledger.class);
    private final Database db;

    public Ledger(Database db) {
        this.db = db;
    }

    public Optional<Target> getTarget(long targetId) {
        return db.targets().find(targetId);
    }

    public Optional<Target> findTarget(String username) {
        return db.targets().findByUsername(username);
    }

    /**
     * Alive targets assigned to a worker: never crawled first, then by priority, then least recently crawled.
     */
    public List<Target> targetsForWorker(long workerId, int limit) {
        return db.targets().forWorker(workerId, limit);
    }

    public void upsertItem(Item item) {
        db.items().upsert(item);
    }

    public Optional<Item> getItem(long targetId, String itemId) {
        return db.items().find(targetId, itemId);
    }

    /**
     * Alive items whose heavy data is missing or stale, highest item id first.
     */
    public List<Item> itemsNeedingUpdate(long targetId) {
        return db.items().needingUpdate(targetId);
    }

    /**
     * Starts the first full sweep of a new target by flagging all its known items for update. Does nothing if a
     * sweep was already started by an earlier, interrupted crawl so that its remaining items are picked up where
     * it left off.
     *
     * @return true if a new sweep was started
     */
    public boolean beginFullSweep(long targetId, Instant now) {
        return db.inTransaction(txn -> {
            if (txn.targets().beginSweep(targetId, now) == 0) return false;
            int flagged = txn.items().flagAllForUpdate(targetId);
            log.atInfo().addKeyValue("targetId", targetId).addKeyValue("items", flagged).log("Full sweep started");
            return true;
        });
    }

    /**
     * Flags every alive item of a target for a fresh heavy fetch, whether or not it already has heavy data.
     *
     * @return number of items flagged
     */
    public int flagAllForUpdate(long targetId) {
        return db.items().flagAllForUpdate(targetId);
    }

    /**
     * Records that the first full sweep of a target has completed.
     *
     * @return false if the target was already marked swept
     */
    public boolean markSwept(long targetId) {
        return db.targets().markSwept(targetId) > 0;
    }

    /**
     * Advances the target's last-crawled time. Never moves it backwards.
     */
    public void touchLastCrawled(long targetId, Instant when) {
        db.targets().touchLastCrawled(targetId, when);
    }

    public void markTargetGone(long targetId) {
        db.targets().markGone(targetId);
    }

    public void markItemGone(long targetId, String itemId) {
        db.items().markGone(targetId, itemId);
    }

    public void recordItemFailure(long targetId, String itemId, Throwable error) {
        var buffer = new StringWriter();
        error.printStackTrace(new PrintWriter(buffer));
        db.items().recordFailure(targetId, itemId, buffer.toString());
    }

    public void saveDisplayName(long targetId, String displayName) {
        db.targets().setDisplayName(targetId, displayName);
    }

    public void recordFollowers(long targetId, LocalDate day, String text, Long count) {
        db.metrics().upsertFollowers(new FollowerMetric(targetId, day.toString(), text, count));
    }
}
