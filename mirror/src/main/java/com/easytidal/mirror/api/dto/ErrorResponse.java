package com.easytidal.mirror.api.dto;

import java.time.Instant;

/**
 * Error body for every failed request.
 *
 * @param error   machine-readable kind, e.g. "TIMEOUT" or "CYCLIC_GRAPH"
 * @param message the underlying failure message
 */
public record ErrorResponse(String error, String message, Instant timestamp) {}
