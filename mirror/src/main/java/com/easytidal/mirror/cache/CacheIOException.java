package com.easytidal.mirror.cache;

/**
 * The snapshot file exists but can't be read or parsed, or can't be written.
 * A missing file is not an error; it just means there is no snapshot.
 */
public class CacheIOException extends RuntimeException {

    public CacheIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
