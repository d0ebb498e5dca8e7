package org.netpreserve.sweeper;

import org.netpreserve.sweeper.browser.RenderSession;

import java.io.IOException;

/**
 * Hands out rendering sessions, one at a time.
 */
public interface SessionProvider {
    /**
     * @throws IOException if no browser could be started
     */
    RenderSession acquire() throws IOException;

    /**
     * Throws away the current browser after its session was lost. The next {@link #acquire()} starts a fresh one.
     */
    default void reset() {
    }
}
