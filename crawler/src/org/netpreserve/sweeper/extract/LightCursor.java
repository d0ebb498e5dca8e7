package org.netpreserve.sweeper.extract;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.browser.NavigationException;

/**
 * Lazily reads light records off a listing, loading more of it as needed. Each record is returned once per cursor.
 */
public interface LightCursor {
    /**
     * @return the next record, or null once the listing is exhausted or the item limit has been reached
     */
    @Nullable LightRecord next() throws NavigationException;
}
