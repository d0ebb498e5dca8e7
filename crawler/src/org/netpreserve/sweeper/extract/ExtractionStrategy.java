package org.netpreserve.sweeper.extract;

import org.netpreserve.sweeper.Target;
import org.netpreserve.sweeper.browser.NavigationException;
import org.netpreserve.sweeper.browser.PageHandle;
import org.netpreserve.sweeper.browser.RenderSession;
import org.netpreserve.sweeper.util.Url;

import java.util.Optional;

/**
 * Knows how to read a particular site's pages. Swapping the strategy is how a site layout change is handled, so
 * nothing outside the strategy should know about selectors or page structure.
 * <p>
 * Any method may throw {@link org.netpreserve.sweeper.browser.SessionLostException} or
 * {@link org.netpreserve.sweeper.browser.PageReadException}.
 */
public interface ExtractionStrategy {
    /**
     * Name and version recorded as the provenance of every record this strategy produces.
     */
    String algorithm();

    /**
     * Navigates to the target's listing.
     *
     * @throws TargetNotFoundException if the site reports the account missing or private
     */
    PageHandle openTarget(RenderSession session, Target target) throws TargetNotFoundException, NavigationException;

    Optional<String> collectDisplayName(RenderSession session);

    Optional<FollowerCount> collectFollowers(RenderSession session);

    /**
     * Starts reading light records from the listing opened by {@link #openTarget}. Calling it again after
     * re-opening the listing starts over.
     */
    LightCursor collectLight(RenderSession session, PageHandle listing, int maxItems);

    /**
     * Opens an item's detail view by clicking its tile on the current listing.
     *
     * @param position the tile position from {@link LightRecord#position()}
     */
    PageHandle openDetailByIndex(RenderSession session, int position)
            throws NavigationException, ItemUnavailableException;

    PageHandle openDetailByUrl(RenderSession session, Url url) throws NavigationException, ItemUnavailableException;

    /**
     * Leaves a detail view opened by {@link #openDetailByIndex} and returns to the listing with its loaded tiles and
     * positions intact. Never reloads the listing.
     *
     * @throws NavigationException if the listing couldn't be restored
     */
    void returnToListing(RenderSession session, Target target) throws NavigationException;

    HeavyRecord collectHeavy(RenderSession session, PageHandle detail)
            throws ExtractionException, ItemUnavailableException;

    /**
     * Checks whether the browser profile is logged in to the site.
     */
    boolean checkSession(RenderSession session) throws NavigationException;
}
