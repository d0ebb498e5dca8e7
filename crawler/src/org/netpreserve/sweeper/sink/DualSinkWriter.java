package org.netpreserve.sweeper.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.JdbiException;
import org.netpreserve.sweeper.Item;
import org.netpreserve.sweeper.Ledger;
import org.netpreserve.sweeper.Target;
import org.netpreserve.sweeper.extract.HeavyRecord;
import org.netpreserve.sweeper.extract.ItemRecord;
import org.netpreserve.sweeper.extract.LightRecord;
import org.netpreserve.sweeper.util.MustUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each record to the ledger and then announces it on the event stream. The ledger is the source of truth:
 * a failed write is reported to the caller, a failed publication is only logged.
 */
public class DualSinkWriter {
    private static final Logger log = LoggerFactory.getLogger(DualSinkWriter.class);
    private final Ledger ledger;
    private final EventPublisher publisher;
    private final ObjectMapper mapper = new ObjectMapper();

    public DualSinkWriter(Ledger ledger, EventPublisher publisher) {
        this.ledger = ledger;
        this.publisher = publisher;
    }

    public void commit(Target target, ItemRecord record) throws PersistenceException {
        try {
            ledger.upsertItem(toItem(target.id(), record));
        } catch (JdbiException | MustUpdate.Exception e) {
            throw new PersistenceException("Failed to store item " + record.key().itemId() + " of " +
                                           target.username(), e);
        }
        var event = ItemEvent.of(target, record);
        try {
            publisher.publish(event);
        } catch (PublicationException e) {
            log.atWarn().addKeyValue("targetId", target.id()).addKeyValue("itemId", event.itemId())
                    .setCause(e).log("Event not published, item is stored");
        }
    }

    private Item toItem(long targetId, ItemRecord record) throws PersistenceException {
        if (record instanceof LightRecord light) {
            return new Item(targetId, light.key().itemId(), light.url(), true, true,
                    light.thumbnailUrl(), light.altText(), light.countText(), light.count(),
                    light.algorithm(), light.crawledAt(),
                    null, null, null, null, null, null, null, null, null, null, null, null, null, null, null,
                    0, null);
        }
        var heavy = (HeavyRecord) record;
        String comments;
        try {
            comments = mapper.writeValueAsString(heavy.comments());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Unable to serialize comments of " + heavy.url(), e);
        }
        var audio = heavy.audio();
        return new Item(targetId, heavy.key().itemId(), heavy.url(), true, false,
                null, null, null, null, null, null,
                heavy.title(), heavy.publishedText(), heavy.publishedAt(), heavy.audioText(),
                audio == null ? null : audio.title(), audio == null ? null : audio.author(),
                heavy.likeCountText(), heavy.likeCount(), heavy.commentCountText(), heavy.commentCount(),
                heavy.collectCountText(), heavy.collectCount(), comments,
                heavy.algorithm(), heavy.crawledAt(), 0, null);
    }
}
