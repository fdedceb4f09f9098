package com.programmersdiary.marketdaemon.cache;

public class PartialInvalidationException extends RuntimeException {

    private final InvalidationResult result;

    public PartialInvalidationException(InvalidationResult result) {
        super("Failed to delete " + result.failedKeys().size() + " of " + result.matched()
                + " cache keys for '" + result.pattern() + "', first failure: " + result.failedKeys().get(0));
        this.result = result;
    }

    public InvalidationResult result() {
        return result;
    }
}
