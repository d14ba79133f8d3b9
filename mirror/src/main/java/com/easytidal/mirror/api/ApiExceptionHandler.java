package com.easytidal.mirror.api;

import com.easytidal.mirror.api.dto.ErrorResponse;
import com.easytidal.mirror.cache.CacheIOException;
import com.easytidal.mirror.history.HistoryIOException;
import com.easytidal.mirror.layout.CyclicGraphException;
import com.easytidal.mirror.scheduler.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * Maps domain failures to HTTP responses with a {@link ErrorResponse} body,
 * so that clients can tell a Tidal outage from a bad request or a broken
 * cache file.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(SchedulerException.class)
    public ResponseEntity<ErrorResponse> scheduler(SchedulerException e) {
        HttpStatus status = e.getKind() == SchedulerException.Kind.NOT_FOUND
                ? HttpStatus.NOT_FOUND
                : HttpStatus.SERVICE_UNAVAILABLE;
        log.warn("Tidal API call failed: {}", e.getMessage());
        return body(status, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(CyclicGraphException.class)
    public ResponseEntity<ErrorResponse> cyclic(CyclicGraphException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "CYCLIC_GRAPH", e.getMessage());
    }

    @ExceptionHandler(CacheIOException.class)
    public ResponseEntity<ErrorResponse> cache(CacheIOException e) {
        log.error("Snapshot cache failure", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "CACHE_IO", e.getMessage());
    }

    @ExceptionHandler(HistoryIOException.class)
    public ResponseEntity<ErrorResponse> history(HistoryIOException e) {
        log.error("History log failure", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "HISTORY_IO", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(kind, message, clock.instant()));
    }
}
