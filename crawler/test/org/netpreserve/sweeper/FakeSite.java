package org.netpreserve.sweeper;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.browser.*;
import org.netpreserve.sweeper.extract.*;
import org.netpreserve.sweeper.parse.ItemKey;
import org.netpreserve.sweeper.util.Url;
import org.openqa.selenium.WebDriverException;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;

/**
 * In-memory stand-in for the crawled site. Records every detail visit so tests can check how items were reached.
 */
public class FakeSite implements ExtractionStrategy {
    public static final String ALGORITHM = "fake/1";
    private final Clock clock;
    public final List<String> itemIds = new ArrayList<>();
    public final List<String> visits = new ArrayList<>();
    public final Set<String> unavailable = new HashSet<>();
    public final Set<String> broken = new HashSet<>();
    /**
     * Reading these items fails with a raw driver error rather than an extraction failure.
     */
    public final Set<String> crashing = new HashSet<>();
    public boolean missing;
    public RuntimeException openTargetError;
    /**
     * Every click opens the tile at this position instead of the one asked for, null for the right one.
     */
    public Integer clicksOpen;
    /**
     * Called with the item id after each heavy record is read, before it is stored.
     */
    public Consumer<String> afterHeavy = id -> {};
    /**
     * Returning to the listing fails on this call (1 based), 0 for never.
     */
    public int failReturnOn;
    /**
     * The session is lost when opening a detail page after this many heavy records, -1 for never.
     */
    public int loseSessionAfter = -1;
    /**
     * Clock is advanced by this much on every heavy record.
     */
    public Duration heavyCost = Duration.ZERO;
    public int heavyCollected;
    public int returns;

    public FakeSite(Clock clock) {
        this.clock = clock;
    }

    public FakeSite withItems(long firstId, int count) {
        for (int i = 0; i < count; i++) {
            itemIds.add(String.valueOf(firstId + i));
        }
        return this;
    }

    public static Url itemUrl(String itemId) {
        return new Url("https://www.example.com/@someone/video/" + itemId);
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public PageHandle openTarget(RenderSession session, Target target) throws TargetNotFoundException {
        if (missing) throw new TargetNotFoundException(target.username(), "Couldn't find this account");
        if (openTargetError != null) throw openTargetError;
        return new PageHandle(new Url("https://www.example.com/@" + target.username()), target.username(),
                clock.instant());
    }

    @Override
    public Optional<String> collectDisplayName(RenderSession session) {
        return Optional.of("Some One");
    }

    @Override
    public Optional<FollowerCount> collectFollowers(RenderSession session) {
        return Optional.of(new FollowerCount("1.2万", 12000L));
    }

    @Override
    public LightCursor collectLight(RenderSession session, PageHandle listing, int maxItems) {
        var ids = List.copyOf(itemIds);
        return new LightCursor() {
            int position;

            @Override
            public @Nullable LightRecord next() {
                if (position >= ids.size() || position >= maxItems) return null;
                String id = ids.get(position);
                Url url = itemUrl(id);
                var record = new LightRecord(ItemKey.fromUrl(url), url, position,
                        "https://cdn.example.com/obj/" + id + "~tplv.jpeg?x-expires=1", "alt " + id,
                        "1,000", 1000L, ALGORITHM, clock.instant());
                position++;
                return record;
            }
        };
    }

    @Override
    public PageHandle openDetailByIndex(RenderSession session, int position) throws ItemUnavailableException {
        String id = itemIds.get(clicksOpen != null ? clicksOpen : position);
        visits.add("click:" + id);
        return open(id);
    }

    @Override
    public PageHandle openDetailByUrl(RenderSession session, Url url) throws ItemUnavailableException {
        String id = ItemKey.fromUrl(url).itemId();
        visits.add("url:" + id);
        return open(id);
    }

    private PageHandle open(String id) throws ItemUnavailableException {
        if (loseSessionAfter >= 0 && heavyCollected >= loseSessionAfter) {
            throw new SessionLostException("browser crashed");
        }
        if (unavailable.contains(id)) throw new ItemUnavailableException(itemUrl(id), "Video currently unavailable");
        return new PageHandle(itemUrl(id), "item " + id, clock.instant());
    }

    @Override
    public void returnToListing(RenderSession session, Target target) throws NavigationException {
        returns++;
        if (returns == failReturnOn) {
            throw new NavigationFailedException(new Url("https://www.example.com/"), "listing gone");
        }
    }

    @Override
    public HeavyRecord collectHeavy(RenderSession session, PageHandle detail) throws ExtractionException {
        var key = ItemKey.fromUrl(detail.url());
        if (broken.contains(key.itemId())) throw new ExtractionException("Nothing readable on " + detail.url());
        if (crashing.contains(key.itemId())) throw new WebDriverException("stale frame");
        heavyCollected++;
        if (clock instanceof MutableClock mutableClock) mutableClock.advance(heavyCost);
        afterHeavy.accept(key.itemId());
        return new HeavyRecord(key, detail.url(), "Title " + key.itemId(), "3時間前", clock.instant(),
                "original sound - someone", null, "1.2万", 12000L, "34", 34L, "5", 5L,
                List.of(new Comment("fan", "nice", 3L)), ALGORITHM, clock.instant());
    }

    @Override
    public boolean checkSession(RenderSession session) {
        return true;
    }

    /**
     * Ids of items visited, in order, regardless of how they were reached.
     */
    public List<String> visitedIds() {
        return visits.stream().map(v -> v.substring(v.indexOf(':') + 1)).toList();
    }
}
