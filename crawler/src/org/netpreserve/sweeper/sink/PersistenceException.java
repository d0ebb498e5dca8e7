package org.netpreserve.sweeper.sink;

/**
 * A record could not be written to the ledger.
 */
public class PersistenceException extends Exception {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
