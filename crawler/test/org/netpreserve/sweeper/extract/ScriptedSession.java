package org.netpreserve.sweeper.extract;

import org.netpreserve.sweeper.browser.*;
import org.netpreserve.sweeper.util.Url;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;

/**
 * A render session over a hand-written page: fields keyed by selector, a listing that grows as it is scrolled and
 * a set of selectors that are present.
 */
class ScriptedSession implements RenderSession {
    final Map<SelectorSpec, String> fields = new HashMap<>();
    final Set<SelectorSpec> present = new HashSet<>();
    final Map<SelectorSpec, List<Map<SelectorSpec, String>>> lists = new HashMap<>();
    final List<String> log = new ArrayList<>();
    /**
     * Elements of each list visible before any scrolling.
     */
    int visible = Integer.MAX_VALUE;
    int loadPerScroll = 1;
    private Url currentUrl = new Url("about:blank");

    private static Element element(Map<SelectorSpec, String> fields) {
        return selector -> Optional.ofNullable(fields.get(selector));
    }

    private PageHandle page() {
        return new PageHandle(currentUrl, "", Instant.EPOCH);
    }

    @Override
    public PageHandle navigate(Url url) {
        log.add("navigate " + url);
        currentUrl = url;
        return page();
    }

    @Override
    public PageHandle scrollUntil(Predicate<RenderSession> condition, int maxIterations) {
        for (int i = 0; i < maxIterations && !condition.test(this); i++) {
            log.add("scroll");
            visible += loadPerScroll;
        }
        return page();
    }

    @Override
    public PageHandle click(SelectorSpec selector, int index) throws NavigationException {
        log.add("click " + selector + " " + index);
        if (!lists.containsKey(selector)) return page();
        var elements = findAll(selector);
        if (index >= elements.size()) throw new NavigationFailedException(currentUrl, "no element " + index);
        var href = lists.get(selector).get(index).values().stream().filter(v -> v.startsWith("/")).findFirst();
        href.ifPresent(h -> currentUrl = currentUrl.resolve(h));
        return page();
    }

    @Override
    public Optional<String> extractField(SelectorSpec selector) {
        return Optional.ofNullable(fields.get(selector));
    }

    @Override
    public List<Element> findAll(SelectorSpec selector) {
        var all = lists.getOrDefault(selector, List.of());
        return all.subList(0, Math.min(visible, all.size())).stream().map(ScriptedSession::element).toList();
    }

    @Override
    public boolean waitFor(SelectorSpec selector, Duration timeout) {
        return present.contains(selector) || !findAll(selector).isEmpty();
    }

    @Override
    public PageHandle current() {
        return page();
    }

    @Override
    public void close() {
    }
}
