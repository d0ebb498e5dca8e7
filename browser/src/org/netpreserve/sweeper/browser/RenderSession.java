package org.netpreserve.sweeper.browser;

import org.netpreserve.sweeper.util.Url;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A single logical browser session. Calls block until the browser has finished the step or failed, and may be
 * slow. A session has exactly one "current page" and is not safe for concurrent use.
 * <p>
 * Any call may throw {@link SessionLostException} if the underlying browser goes away, and reads of the page may
 * throw {@link PageReadException} if the browser rejects them while the session is still alive.
 */
public interface RenderSession extends AutoCloseable {
    PageHandle navigate(Url url) throws NavigationException;

    /**
     * Scrolls the current page until {@code condition} holds, the page stops growing or {@code maxIterations}
     * scroll steps have been made, whichever comes first.
     */
    PageHandle scrollUntil(Predicate<RenderSession> condition, int maxIterations) throws NavigationException;

    /**
     * Clicks the {@code index}th element (zero based) matching {@code selector}.
     */
    PageHandle click(SelectorSpec selector, int index) throws NavigationException;

    Optional<String> extractField(SelectorSpec selector);

    List<Element> findAll(SelectorSpec selector);

    /**
     * Waits up to {@code timeout} for an element matching {@code selector} to be present.
     *
     * @return false if the wait timed out
     */
    boolean waitFor(SelectorSpec selector, Duration timeout);

    PageHandle current();

    @Override
    void close();
}
