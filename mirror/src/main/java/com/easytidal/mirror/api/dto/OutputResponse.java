package com.easytidal.mirror.api.dto;

public record OutputResponse(String jobId, String output) {}
