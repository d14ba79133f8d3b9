package com.easytidal.mirror.api.dto;

import com.easytidal.mirror.history.HistoryEntry;

import java.util.List;

/**
 * Response body for the history endpoints. job is null when the entries
 * span all jobs.
 */
public record HistoryResponse(String job, List<HistoryEntry> history) {}
