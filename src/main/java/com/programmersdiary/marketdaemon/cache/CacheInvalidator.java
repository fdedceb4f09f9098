package com.programmersdiary.marketdaemon.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Bulk deletion of cache keys by prefix or pattern.
 * <p>
 * Deletions run concurrently and are not transactional: keys deleted before a
 * failure stay deleted, and the failed keys are reported in the
 * {@link InvalidationResult}.
 */
@Service
public class CacheInvalidator {

    private static final Logger log = LoggerFactory.getLogger(CacheInvalidator.class);
    private static final int SAMPLE_SIZE = 5;

    private final KeyValueStore store;
    private final Executor deleteExecutor;

    public CacheInvalidator(KeyValueStore store, @Qualifier("cacheDeleteExecutor") Executor deleteExecutor) {
        this.store = store;
        this.deleteExecutor = deleteExecutor;
    }

    public InvalidationResult clearByPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Prefix must not be empty");
        }
        store.requireConfigured();
        var keys = store.keys(escapeGlob(prefix) + "*").stream()
                .filter(key -> key.startsWith(prefix))
                .distinct()
                .toList();
        return deleteAll(prefix + "*", keys);
    }

    public InvalidationResult clearByPattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Pattern must not be empty");
        }
        store.requireConfigured();
        return deleteAll(pattern, store.keys(pattern).stream().distinct().toList());
    }

    public InvalidationResult clearKeys(Collection<String> keys) {
        store.requireConfigured();
        return deleteAll(String.join(",", keys), List.copyOf(keys));
    }

    public InvalidationResult clearTarget(CacheTarget target) {
        store.requireConfigured();
        var results = new ArrayList<InvalidationResult>();
        if (!target.keys().isEmpty()) {
            results.add(clearKeys(target.keys()));
        }
        target.prefixes().forEach(prefix -> results.add(clearByPrefix(prefix)));
        return results.stream()
                .reduce(InvalidationResult::merge)
                .orElseGet(() -> InvalidationResult.empty(target.type()));
    }

    // Material price keys look like material_prices:<m1,m2,...>:<start>:<end>:<interval>.
    // No list clears every price key; an empty list matches nothing.
    public InvalidationResult clearMaterialPrices(Collection<String> materials) {
        if (materials == null) {
            return clearTarget(CacheTarget.MATERIAL_PRICES);
        }
        store.requireConfigured();
        var prefix = CacheTarget.MATERIAL_PRICES.prefixes().get(0);
        var keys = store.keys(escapeGlob(prefix) + "*").stream()
                .filter(key -> key.startsWith(prefix))
                .filter(key -> mentionsAny(key, materials))
                .distinct()
                .toList();
        return deleteAll(prefix + "*[" + String.join(",", materials) + "]", keys);
    }

    public InvalidationResult clearAll() {
        return clearByPattern("*");
    }

    public CacheStatus status() {
        store.requireConfigured();
        var all = store.keys("*");
        var prefix = CacheTarget.MATERIAL_PRICES.prefixes().get(0);
        int materialPrices = (int) all.stream().filter(key -> key.startsWith(prefix)).count();
        int marketIndicators = (int) all.stream().filter(CacheTarget.MARKET_INDICATORS.keys()::contains).count();
        return new CacheStatus(materialPrices, marketIndicators, all.size(),
                all.stream().limit(SAMPLE_SIZE).toList());
    }

    private InvalidationResult deleteAll(String pattern, List<String> keys) {
        if (keys.isEmpty()) {
            log.info("No cache keys matched '{}'", pattern);
            return InvalidationResult.empty(pattern);
        }
        var deletions = keys.stream()
                .map(key -> CompletableFuture.supplyAsync(() -> store.delete(key), deleteExecutor)
                        .handle((removed, error) -> new Deletion(key, removed, error)))
                .toList();
        var deleted = new ArrayList<String>();
        var failed = new ArrayList<String>();
        for (var future : deletions) {
            var deletion = future.join();
            if (deletion.error() != null) {
                failed.add(deletion.key());
                log.error("Failed to delete cache key {}: {}", deletion.key(), deletion.errorMessage());
            } else if (deletion.removed() > 0) {
                deleted.add(deletion.key());
            } else {
                log.debug("Cache key {} was already gone", deletion.key());
            }
        }
        if (failed.isEmpty()) {
            log.info("Deleted {} cache keys matching '{}'", deleted.size(), pattern);
        } else {
            log.warn("Deleted {} of {} cache keys matching '{}', {} failed",
                    deleted.size(), keys.size(), pattern, failed.size());
        }
        return new InvalidationResult(pattern, keys.size(), deleted.size(), deleted, failed);
    }

    private static boolean mentionsAny(String key, Collection<String> materials) {
        var segments = key.split(":");
        if (segments.length < 2) {
            return false;
        }
        return Arrays.stream(segments[1].split(","))
                .anyMatch(keyMaterial -> materials.stream().anyMatch(keyMaterial::contains));
    }

    static String escapeGlob(String literal) {
        var escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private record Deletion(String key, Long removed, Throwable error) {

        String errorMessage() {
            var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            return cause.getMessage();
        }
    }
}
