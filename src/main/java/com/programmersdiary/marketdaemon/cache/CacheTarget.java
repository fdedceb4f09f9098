package com.programmersdiary.marketdaemon.cache;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Key families the dashboard writes to the cache.
 */
public enum CacheTarget {

    MATERIAL_PRICES("material_prices", List.of(), List.of("material_prices:")),
    MARKET_INDICATORS("market_indicators", List.of("market_indicators"), List.of()),
    TECHNICAL_ARTICLES("technical_articles", List.of("technical_articles_list"), List.of("technical_articles:"));

    private final String type;
    private final List<String> keys;
    private final List<String> prefixes;

    CacheTarget(String type, List<String> keys, List<String> prefixes) {
        this.type = type;
        this.keys = keys;
        this.prefixes = prefixes;
    }

    public String type() {
        return type;
    }

    public List<String> keys() {
        return keys;
    }

    public List<String> prefixes() {
        return prefixes;
    }

    public static Optional<CacheTarget> fromType(String type) {
        return Arrays.stream(values()).filter(t -> t.type.equals(type)).findFirst();
    }
}
