package org.netpreserve.sweeper.browser;

/**
 * The browser session behind a {@link RenderSession} is gone (browser crashed, driver session invalidated, logged
 * out). Nothing further can be done with the session.
 */
public class SessionLostException extends RuntimeException {
    public SessionLostException(String message) {
        super(message);
    }

    public SessionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
