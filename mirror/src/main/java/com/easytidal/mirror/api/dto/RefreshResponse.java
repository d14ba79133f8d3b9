package com.easytidal.mirror.api.dto;

import java.time.Instant;

/** Response body for POST /api/refresh. */
public record RefreshResponse(
        boolean success,
        String  message,
        int     jobCount,
        int     edgeCount,
        Instant timestamp
) {}
