package com.dailyprojects.core.cache;

/**
 * Thrown when the cache store cannot be reached or times out.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
