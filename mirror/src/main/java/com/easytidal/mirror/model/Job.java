package com.easytidal.mirror.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One job as listed by the scheduler.
 *
 * Start and end times are kept as the raw text the scheduler sent; they are
 * not guaranteed to be well-formed, so {@link #startedAt()} and
 * {@link #endedAt()} parse them on demand and return empty on garbage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
        @JsonProperty("id")         String    id,
        @JsonProperty("name")       String    name,
        @JsonProperty("status")     JobStatus status,
        @JsonProperty("start_time") String    startTime,
        @JsonProperty("end_time")   String    endTime
) {

    public Job {
        Objects.requireNonNull(id, "job id");
        Objects.requireNonNull(name, "job name");
        if (status == null) status = JobStatus.UNKNOWN;
    }

    public Job(String id, String name, JobStatus status) {
        this(id, name, status, null, null);
    }

    @JsonIgnore
    public Optional<Instant> startedAt() {
        return Timestamps.parse(startTime);
    }

    @JsonIgnore
    public Optional<Instant> endedAt() {
        return Timestamps.parse(endTime);
    }
}
