package org.netpreserve.sweeper.sink;

public class PublicationException extends Exception {
    public PublicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
