package org.netpreserve.sweeper.extract;

/**
 * The target's page says the account doesn't exist or can't be viewed.
 */
public class TargetNotFoundException extends Exception {
    private final String username;

    public TargetNotFoundException(String username, String reason) {
        super(username + ": " + reason);
        this.username = username;
    }

    public String username() {
        return username;
    }
}
