package org.netpreserve.sweeper.extract;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.Target;
import org.netpreserve.sweeper.browser.*;
import org.netpreserve.sweeper.config.CrawlConfig;
import org.netpreserve.sweeper.config.SelectorsConfig;
import org.netpreserve.sweeper.parse.AudioCredit;
import org.netpreserve.sweeper.parse.CountParser;
import org.netpreserve.sweeper.parse.ItemKey;
import org.netpreserve.sweeper.parse.TimeTextParser;
import org.netpreserve.sweeper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * Extraction driven entirely by {@link SelectorsConfig}, so that a site layout change is a configuration change.
 */
public class SelectorExtractionStrategy implements ExtractionStrategy {
    private static final Logger log = LoggerFactory.getLogger(SelectorExtractionStrategy.class);
    private static final String ALGORITHM = "selectors/1";
    private static final int SCROLL_STEPS_PER_LOAD = 3;
    private final SelectorsConfig selectors;
    private final Duration itemTimeout;
    private final int maxScrolls;
    private final ZoneId zone;
    private final Clock clock;

    public SelectorExtractionStrategy(SelectorsConfig selectors, CrawlConfig crawl, Clock clock) {
        this.selectors = selectors;
        this.itemTimeout = crawl.itemTimeout();
        this.maxScrolls = crawl.maxScrolls();
        this.zone = crawl.timeZone();
        this.clock = clock;
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public PageHandle openTarget(RenderSession session, Target target) throws TargetNotFoundException, NavigationException {
        Url url = selectors.targetUrl(target.username());
        PageHandle page = session.navigate(url);
        checkTargetPresent(session, target);
        if (!session.waitFor(selectors.listingReady(), itemTimeout)) {
            checkTargetPresent(session, target);
            // an account without any posts has no listing but is not an error
            log.atInfo().addKeyValue("target", target.username()).log("Listing did not appear");
        }
        return page;
    }

    private void checkTargetPresent(RenderSession session, Target target) throws TargetNotFoundException {
        var error = session.extractField(selectors.errorTitle());
        if (error.isPresent() && matchesAny(error.get(), selectors.targetMissingTexts())) {
            throw new TargetNotFoundException(target.username(), error.get());
        }
    }

    @Override
    public Optional<String> collectDisplayName(RenderSession session) {
        return session.extractField(selectors.displayName()).map(String::strip);
    }

    @Override
    public Optional<FollowerCount> collectFollowers(RenderSession session) {
        return session.extractField(selectors.followers())
                .map(text -> new FollowerCount(text, CountParser.parse(text).orElse(null)));
    }

    @Override
    public LightCursor collectLight(RenderSession session, PageHandle listing, int maxItems) {
        return new ListingCursor(session, listing.url(), maxItems);
    }

    @Override
    public PageHandle openDetailByIndex(RenderSession session, int position)
            throws NavigationException, ItemUnavailableException {
        PageHandle page = session.click(selectors.listingItem(), position);
        return awaitDetail(session, page.url());
    }

    @Override
    public PageHandle openDetailByUrl(RenderSession session, Url url) throws NavigationException, ItemUnavailableException {
        session.navigate(url);
        return awaitDetail(session, url);
    }

    private PageHandle awaitDetail(RenderSession session, Url url) throws NavigationException, ItemUnavailableException {
        checkItemPresent(session, url);
        if (!session.waitFor(selectors.detailReady(), itemTimeout)) {
            checkItemPresent(session, url);
            throw new NavigationTimedOutException(url, "Detail view not ready after " + itemTimeout);
        }
        return session.current();
    }

    private void checkItemPresent(RenderSession session, Url url) throws ItemUnavailableException {
        var error = session.extractField(selectors.errorTitle());
        if (error.isPresent() && matchesAny(error.get(), selectors.itemMissingTexts())) {
            throw new ItemUnavailableException(url, error.get());
        }
    }

    @Override
    public void returnToListing(RenderSession session, Target target) throws NavigationException {
        session.click(selectors.closeDetail(), 0);
        if (!session.waitFor(selectors.listingItem(), itemTimeout)) {
            throw new NavigationFailedException(session.current().url(), "Listing did not reappear after closing detail view");
        }
    }

    @Override
    public HeavyRecord collectHeavy(RenderSession session, PageHandle detail)
            throws ExtractionException, ItemUnavailableException {
        Url url = detail.url().canonical();
        ItemKey key;
        try {
            key = ItemKey.fromUrl(url);
        } catch (IllegalArgumentException e) {
            throw new ExtractionException("Detail view has no item URL: " + detail.url(), e);
        }
        checkItemPresent(session, url);

        String title = text(session, selectors.title());
        String likeCountText = text(session, selectors.likeCount());
        if (title == null && likeCountText == null) {
            throw new ExtractionException("Nothing readable on detail view " + url);
        }
        String commentCountText = text(session, selectors.commentCount());
        String collectCountText = text(session, selectors.collectCount());
        String publishedText = publishedText(text(session, selectors.published()));
        String audioText = text(session, selectors.audio());
        var base = ZonedDateTime.now(clock).withZoneSameInstant(zone);

        return new HeavyRecord(key, url, title,
                publishedText, TimeTextParser.parse(publishedText, base).orElse(null),
                audioText, AudioCredit.parse(audioText),
                likeCountText, CountParser.parse(likeCountText).orElse(null),
                commentCountText, CountParser.parse(commentCountText).orElse(null),
                collectCountText, CountParser.parse(collectCountText).orElse(null),
                comments(session), ALGORITHM, clock.instant());
    }

    private @Nullable String publishedText(@Nullable String text) {
        if (text == null) return null;
        String separator = selectors.publishedSeparator();
        if (separator != null && !separator.isEmpty()) {
            int i = text.lastIndexOf(separator);
            if (i >= 0) text = text.substring(i + separator.length());
        }
        text = text.strip();
        return text.isEmpty() ? null : text;
    }

    private List<Comment> comments(RenderSession session) {
        var comments = new ArrayList<Comment>();
        for (Element element : session.findAll(selectors.comment())) {
            if (comments.size() >= selectors.maxComments()) break;
            var text = element.extractField(selectors.commentText());
            if (text.isEmpty()) continue;
            var author = element.extractField(selectors.commentAuthor()).orElse(null);
            var likes = element.extractField(selectors.commentLikes()).flatMap(CountParser::parse).orElse(null);
            comments.add(new Comment(author, text.get(), likes));
        }
        return comments;
    }

    @Override
    public boolean checkSession(RenderSession session) throws NavigationException {
        session.navigate(selectors.baseUrl());
        return session.waitFor(selectors.loggedIn(), itemTimeout);
    }

    private static @Nullable String text(RenderSession session, SelectorSpec selector) {
        return session.extractField(selector).map(String::strip).orElse(null);
    }

    private static boolean matchesAny(String text, List<String> candidates) {
        if (candidates == null) return false;
        for (String candidate : candidates) {
            if (text.contains(candidate)) return true;
        }
        return false;
    }

    private class ListingCursor implements LightCursor {
        private final RenderSession session;
        private final Url listingUrl;
        private final int maxItems;
        private final Set<Url> seen = new HashSet<>();
        private final Deque<LightRecord> pending = new ArrayDeque<>();
        private int scanned;
        private int scrolls;
        private int emitted;
        private boolean exhausted;

        ListingCursor(RenderSession session, Url listingUrl, int maxItems) {
            this.session = session;
            this.listingUrl = listingUrl;
            this.maxItems = maxItems;
        }

        @Override
        public @Nullable LightRecord next() throws NavigationException {
            if (emitted >= maxItems) return null;
            while (pending.isEmpty()) {
                if (exhausted) return null;
                List<Element> tiles = session.findAll(selectors.listingItem());
                if (tiles.size() > scanned) {
                    for (int i = scanned; i < tiles.size(); i++) {
                        LightRecord record = read(tiles.get(i), i);
                        if (record != null && seen.add(record.url())) pending.add(record);
                    }
                    scanned = tiles.size();
                } else if (scrolls >= maxScrolls) {
                    log.atInfo().addKeyValue("url", listingUrl).addKeyValue("items", emitted)
                            .log("Scroll limit reached");
                    exhausted = true;
                } else {
                    int before = tiles.size();
                    scrolls++;
                    session.scrollUntil(s -> s.findAll(selectors.listingItem()).size() > before, SCROLL_STEPS_PER_LOAD);
                    if (session.findAll(selectors.listingItem()).size() <= before) exhausted = true;
                }
            }
            emitted++;
            return pending.poll();
        }

        private @Nullable LightRecord read(Element tile, int position) {
            var href = tile.extractField(selectors.itemLink());
            if (href.isEmpty()) {
                log.atDebug().addKeyValue("position", position).log("Tile without link");
                return null;
            }
            Url url;
            ItemKey key;
            try {
                url = listingUrl.resolve(href.get()).canonical();
                key = ItemKey.fromUrl(url);
            } catch (IllegalArgumentException e) {
                log.atDebug().addKeyValue("href", href.get()).log("Skipping tile: {}", e.getMessage());
                return null;
            }
            String countText = tile.extractField(selectors.itemCount()).map(String::strip).orElse(null);
            return new LightRecord(key, url, position,
                    tile.extractField(selectors.itemThumbnail()).orElse(null),
                    tile.extractField(selectors.itemAlt()).orElse(null),
                    countText, CountParser.parse(countText).orElse(null),
                    ALGORITHM, clock.instant());
        }
    }
}
