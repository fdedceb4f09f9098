package com.programmersdiary.marketdaemon.web;

import com.programmersdiary.marketdaemon.cache.CacheStoreException;
import com.programmersdiary.marketdaemon.cache.ConfigurationMissingException;
import com.programmersdiary.marketdaemon.cache.PartialInvalidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidActionException.class)
    public ResponseEntity<Map<String, Object>> invalidAction(InvalidActionException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_action", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Request body must be a JSON object");
    }

    @ExceptionHandler(ConfigurationMissingException.class)
    public ResponseEntity<Map<String, Object>> configurationMissing(ConfigurationMissingException e) {
        log.error("Configuration missing: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "configuration_missing", e.getMessage());
    }

    @ExceptionHandler(CacheStoreException.class)
    public ResponseEntity<Map<String, Object>> storeFailure(CacheStoreException e) {
        log.error("Cache store call failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "store_unavailable", e.getMessage());
    }

    @ExceptionHandler(PartialInvalidationException.class)
    public ResponseEntity<Map<String, Object>> partialInvalidation(PartialInvalidationException e) {
        var response = error(HttpStatus.BAD_GATEWAY, "partial_invalidation", e.getMessage());
        response.getBody().put("deletedCount", e.result().deletedCount());
        response.getBody().put("failedKeys", e.result().failedKeys());
        return response;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
