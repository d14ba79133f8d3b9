package com.easytidal.mirror.history;

/**
 * The history file can't be read, parsed, or written.
 */
public class HistoryIOException extends RuntimeException {

    public HistoryIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
