package com.deck.mirror.cache;

/**
 * Persisted cache file could not be read or written.
 * Never escapes a cache: it is logged and the cache carries on as if empty.
 */
public class CacheIOException extends RuntimeException {

    public CacheIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
