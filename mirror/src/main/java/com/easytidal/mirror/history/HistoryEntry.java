package com.easytidal.mirror.history;

import com.easytidal.mirror.model.JobStatus;
import com.easytidal.mirror.model.LenientInstantDeserializer;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.Objects;

/**
 * One observation of a job's status.
 *
 * Stored with snake_case keys. Timestamps are written as ISO-8601 instants;
 * older files with zone-less local times are read as UTC.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryEntry(
        @JsonProperty("timestamp")
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        @JsonDeserialize(using = LenientInstantDeserializer.class)
        Instant   timestamp,
        @JsonProperty("job_id")    String    jobId,
        @JsonProperty("job_name")  String    jobName,
        @JsonProperty("status")    JobStatus status,
        @JsonProperty("output")    String    output,
        @JsonProperty("error_log") String    errorLog
) {

    public HistoryEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(jobName, "jobName");
        if (status == null) status = JobStatus.UNKNOWN;
    }

    public HistoryEntry(Instant timestamp, String jobId, String jobName, JobStatus status) {
        this(timestamp, jobId, jobName, status, null, null);
    }

    /** True if this entry belongs to the job with the given name or id. */
    public boolean matches(String nameOrId) {
        return jobName.equals(nameOrId) || jobId.equals(nameOrId);
    }
}
