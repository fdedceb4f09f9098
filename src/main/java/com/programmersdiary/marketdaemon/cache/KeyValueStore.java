package com.programmersdiary.marketdaemon.cache;

import java.util.List;

/**
 * The subset of the dashboard's key-value store used for invalidation.
 */
public interface KeyValueStore {

    /**
     * Lists keys matching a Redis glob pattern.
     */
    List<String> keys(String pattern);

    /**
     * Deletes one key and returns how many keys were removed (0 or 1).
     */
    long delete(String key);

    /**
     * Fails with {@link ConfigurationMissingException} when the store cannot be reached
     * for lack of credentials.
     */
    default void requireConfigured() {
    }
}
