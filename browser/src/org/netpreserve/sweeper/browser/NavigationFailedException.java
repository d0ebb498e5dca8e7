package org.netpreserve.sweeper.browser;

import org.netpreserve.sweeper.util.Url;

public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(Url url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    public NavigationFailedException(Url url, String errorText, Throwable cause) {
        super(url, errorText, cause);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
