package com.programmersdiary.marketdaemon.cache;

import java.util.ArrayList;
import java.util.List;

public record InvalidationResult(
        String pattern,
        int matched,
        int deletedCount,
        List<String> deletedKeys,
        List<String> failedKeys) {

    public InvalidationResult {
        deletedKeys = List.copyOf(deletedKeys);
        failedKeys = List.copyOf(failedKeys);
    }

    public static InvalidationResult empty(String pattern) {
        return new InvalidationResult(pattern, 0, 0, List.of(), List.of());
    }

    public boolean isComplete() {
        return failedKeys.isEmpty();
    }

    public InvalidationResult requireComplete() {
        if (!isComplete()) {
            throw new PartialInvalidationException(this);
        }
        return this;
    }

    public InvalidationResult merge(InvalidationResult other) {
        var deleted = new ArrayList<>(deletedKeys);
        deleted.addAll(other.deletedKeys);
        var failed = new ArrayList<>(failedKeys);
        failed.addAll(other.failedKeys);
        return new InvalidationResult(pattern + "," + other.pattern,
                matched + other.matched, deletedCount + other.deletedCount, deleted, failed);
    }
}
