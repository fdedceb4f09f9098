package com.programmersdiary.marketdaemon.cache;

public class ConfigurationMissingException extends RuntimeException {

    public ConfigurationMissingException(String message) {
        super(message);
    }
}
