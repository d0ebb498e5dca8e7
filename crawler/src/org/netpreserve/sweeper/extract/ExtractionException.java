package org.netpreserve.sweeper.extract;

/**
 * A page was reached but didn't contain what was expected.
 */
public class ExtractionException extends Exception {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
