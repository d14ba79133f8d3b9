package com.easytidal.mirror.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A scheduler-declared "when this job completes, start that one" link.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trigger(@JsonProperty("triggered_job_name") String triggeredJobName) {}
