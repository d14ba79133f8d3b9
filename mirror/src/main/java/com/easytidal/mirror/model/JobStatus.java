package com.easytidal.mirror.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of a job as reported by the scheduler.
 *
 * The set is closed; anything the scheduler sends that we don't recognise
 * (including a missing value) becomes UNKNOWN so that new upstream states
 * never break deserialisation.
 */
public enum JobStatus {
    SUCCESS,
    FAILED,
    RUNNING,
    PENDING,
    UNKNOWN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWire(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
