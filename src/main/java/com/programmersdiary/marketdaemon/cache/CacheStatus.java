package com.programmersdiary.marketdaemon.cache;

import java.util.List;

public record CacheStatus(int materialPrices, int marketIndicators, int totalKeys, List<String> sampleKeys) {
}
