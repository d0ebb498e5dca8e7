package org.netpreserve.sweeper.extract;

import org.netpreserve.sweeper.util.Url;

/**
 * The item's detail page says the item has been removed or made private.
 */
public class ItemUnavailableException extends Exception {
    private final Url url;

    public ItemUnavailableException(Url url, String reason) {
        super(url + ": " + reason);
        this.url = url;
    }

    public Url url() {
        return url;
    }
}
