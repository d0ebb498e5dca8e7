package org.netpreserve.sweeper.browser;

import org.netpreserve.sweeper.util.Url;

import java.time.Instant;

/**
 * The page a {@link RenderSession} is showing after a navigation step.
 *
 * @param url      URL reported by the browser (after redirects)
 * @param title    document title, may be empty
 * @param loadedAt when the navigation step completed
 */
public record PageHandle(Url url, String title, Instant loadedAt) {
}
