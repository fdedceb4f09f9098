package com.programmersdiary.marketdaemon.web;

import com.programmersdiary.marketdaemon.cache.CacheInvalidator;
import com.programmersdiary.marketdaemon.cache.CacheStatus;
import com.programmersdiary.marketdaemon.cache.CacheTarget;
import com.programmersdiary.marketdaemon.cache.InvalidationResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/cache")
public class CacheController {

    private static final int MAX_REPORTED_KEYS = 10;

    private final CacheInvalidator cacheInvalidator;
    private final String operatorPrefix;

    public CacheController(CacheInvalidator cacheInvalidator,
                           @Value("${marketdaemon.cache.operator-prefix:material_prices:}") String operatorPrefix) {
        if (operatorPrefix == null || operatorPrefix.isEmpty()) {
            throw new IllegalArgumentException("marketdaemon.cache.operator-prefix must not be empty");
        }
        this.cacheInvalidator = cacheInvalidator;
        this.operatorPrefix = operatorPrefix;
    }

    @PostMapping("/clear")
    public ClearResponse clear() {
        var result = cacheInvalidator.clearByPrefix(operatorPrefix).requireComplete();
        var message = result.deletedCount() == 0
                ? "No cache keys to delete"
                : result.deletedCount() + " cache keys deleted";
        return new ClearResponse(true, message, result.deletedCount());
    }

    @PostMapping("/invalidate")
    public InvalidateResponse invalidate(@RequestBody InvalidateRequest request) {
        var type = request.type() == null ? "" : request.type().trim();
        InvalidationResult result;
        if ("all".equals(type)) {
            result = cacheInvalidator.clearAll();
        } else if ("pattern".equals(type)) {
            if (request.pattern() == null || request.pattern().isBlank()) {
                throw new InvalidActionException("Pattern invalidation requires a non-empty 'pattern'");
            }
            result = cacheInvalidator.clearByPattern(request.pattern());
        } else if (CacheTarget.MATERIAL_PRICES.type().equals(type)) {
            if (request.materials() != null
                    && request.materials().stream().anyMatch(material -> material == null || material.isBlank())) {
                throw new InvalidActionException("Material names must not be null or blank");
            }
            result = cacheInvalidator.clearMaterialPrices(request.materials());
        } else {
            var target = CacheTarget.fromType(type).orElseThrow(() -> new InvalidActionException(
                    "Invalid cache invalidation type '" + type
                            + "', use: material_prices, market_indicators, technical_articles, all, or pattern"));
            result = cacheInvalidator.clearTarget(target);
        }
        result.requireComplete();
        var reported = result.deletedKeys().stream().limit(MAX_REPORTED_KEYS).toList();
        return new InvalidateResponse(true, "Cache invalidated successfully", type, result.deletedCount(), reported);
    }

    @GetMapping("/invalidate")
    public StatusResponse status() {
        return new StatusResponse(true, cacheInvalidator.status());
    }

    public record InvalidateRequest(String type, List<String> materials, String pattern) {}

    public record ClearResponse(boolean success, String message, int deletedCount) {}

    public record InvalidateResponse(boolean success, String message, String type, int deletedCount,
                                     List<String> deletedKeys) {}

    public record StatusResponse(boolean success, CacheStatus cacheStatus) {}
}
