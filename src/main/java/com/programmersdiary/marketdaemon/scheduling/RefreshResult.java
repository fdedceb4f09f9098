package com.programmersdiary.marketdaemon.scheduling;

import com.fasterxml.jackson.databind.JsonNode;

public record RefreshResult(boolean success, Integer status, JsonNode payload, String error) {

    public static RefreshResult ok(int status, JsonNode payload) {
        return new RefreshResult(true, status, payload, null);
    }

    public static RefreshResult failed(Integer status, String error) {
        return new RefreshResult(false, status, null, error);
    }
}
