package org.netpreserve.sweeper.browser;

import org.netpreserve.sweeper.util.Url;

public class NavigationException extends Exception {
    protected final Url url;

    public NavigationException(Url url, String message) {
        super(message + " for " + url);
        this.url = url;
    }

    public NavigationException(Url url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
    }

    public Url url() {
        return url;
    }
}
