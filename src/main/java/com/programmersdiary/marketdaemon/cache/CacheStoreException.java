package com.programmersdiary.marketdaemon.cache;

public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
