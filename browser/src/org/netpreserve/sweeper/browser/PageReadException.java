package org.netpreserve.sweeper.browser;

/**
 * The browser refused a read of the current page, for example because the frame was detached mid-query. The
 * session itself is still usable.
 */
public class PageReadException extends RuntimeException {
    public PageReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
