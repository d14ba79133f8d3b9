package com.easytidal.mirror.scheduler;

import com.easytidal.mirror.config.MirrorProperties;
import com.easytidal.mirror.model.Job;
import com.easytidal.mirror.model.JobStatus;
import com.easytidal.mirror.model.Trigger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * HTTP client for the Tidal scheduler's REST API.
 *
 * Every call carries basic-auth credentials and an explicit request timeout.
 * All failures come out as {@link SchedulerException}; nothing from
 * java.net.http leaks to callers.
 *
 * Calls are blocking. The service invokes them from request threads, one
 * call at a time.
 */
@Component
public class TidalClient {

    private static final Logger log = LoggerFactory.getLogger(TidalClient.class);

    private static final TypeReference<List<Job>>     JOB_LIST     = new TypeReference<>() {};
    private static final TypeReference<List<Trigger>> TRIGGER_LIST = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       authHeader;
    private final Duration     timeout;

    public TidalClient(MirrorProperties properties, ObjectMapper objectMapper) {
        MirrorProperties.Scheduler cfg = properties.scheduler();
        this.baseUrl    = cfg.baseUrl();
        this.timeout    = cfg.timeout();
        this.json       = objectMapper;
        this.authHeader = basicAuth(cfg.username(), cfg.password());
        this.http       = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Jobs and triggers
    // ------------------------------------------------------------------

    /**
     * List the jobs in a directory.
     *
     * Tidal answers either with a bare array or with {"jobs": [...]},
     * depending on the server version; both are accepted.
     *
     * @param directory job directory, or null/blank for all jobs
     */
    public List<Job> listJobs(String directory) {
        String path = "/api/jobs";
        if (directory != null && !directory.isBlank()) {
            path += "?directory=" + URLEncoder.encode(directory, StandardCharsets.UTF_8);
        }
        String body = get(path, "listJobs");
        JsonNode root = readTree(body, "listJobs");
        JsonNode array = root.isArray() ? root : root.path("jobs");
        if (!array.isArray()) {
            throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                    "listJobs: expected a JSON array or an object with a 'jobs' array");
        }
        List<Job> jobs = convert(array, JOB_LIST, "listJobs");
        log.info("Fetched {} jobs from directory '{}'", jobs.size(), directory);
        return jobs;
    }

    /**
     * Jobs started when {@code jobId} completes.
     */
    public List<Trigger> listTriggers(String jobId) {
        String op = "listTriggers for job " + jobId;
        String body = get("/api/jobs/" + encodePath(jobId) + "/dependencies", op);
        List<Trigger> triggers = convert(readTree(body, op), TRIGGER_LIST, op);
        for (Trigger t : triggers) {
            if (t.triggeredJobName() == null || t.triggeredJobName().isBlank()) {
                throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                        op + ": trigger without triggered_job_name");
            }
        }
        return triggers;
    }

    /** Current status of a job; a missing status field reads as UNKNOWN. */
    public JobStatus getStatus(String jobId) {
        String op = "getStatus for job " + jobId;
        JsonNode root = readTree(get("/api/jobs/" + encodePath(jobId) + "/status", op), op);
        if (!root.isObject()) {
            throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                    op + ": expected a JSON object");
        }
        return JobStatus.fromWire(root.path("status").asText(null));
    }

    // ------------------------------------------------------------------
    // Output and logs
    // ------------------------------------------------------------------

    /**
     * Execution output of a job. Returns the "output" field when the server
     * wraps it in an object, otherwise the raw body.
     */
    public String getOutput(String jobId) {
        String op = "getOutput for job " + jobId;
        String body = get("/api/jobs/" + encodePath(jobId) + "/output", op);
        try {
            JsonNode root = json.readTree(body);
            if (root != null && root.isObject()) {
                return root.path("output").asText("");
            }
        } catch (JsonProcessingException e) {
            log.debug("{}: body is not JSON, returning it as text", op);
        }
        return body;
    }

    /**
     * A specific log stream for a job.
     *
     * @param logType e.g. "stdout" or "stderr"
     */
    public String getLog(String jobId, String logType) {
        return get("/api/jobs/" + encodePath(jobId) + "/logs/" + encodePath(logType),
                "getLog(" + logType + ") for job " + jobId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** GET with the configured timeout; returns the response body on 2xx. */
    private String get(String path, String opName) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (authHeader != null) {
            req.header("Authorization", authHeader);
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SchedulerException(SchedulerException.Kind.TIMEOUT,
                    opName + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (ConnectException e) {
            throw new SchedulerException(SchedulerException.Kind.CONNECTION,
                    opName + ": unable to connect to " + baseUrl, e);
        } catch (IOException e) {
            throw new SchedulerException(SchedulerException.Kind.CONNECTION,
                    opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulerException(SchedulerException.Kind.CONNECTION,
                    opName + " interrupted", e);
        }

        int code = resp.statusCode();
        if (code >= 200 && code < 300) {
            return resp.body();
        }
        SchedulerException.Kind kind = switch (code) {
            case 401, 403 -> SchedulerException.Kind.AUTH;
            case 404      -> SchedulerException.Kind.NOT_FOUND;
            default       -> SchedulerException.Kind.CONNECTION;
        };
        throw new SchedulerException(kind, opName + " failed, HTTP " + code + ": " + resp.body());
    }

    private JsonNode readTree(String body, String opName) {
        try {
            JsonNode node = json.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                        opName + ": empty response body");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                    opName + ": response is not valid JSON", e);
        }
    }

    /** Convert a JSON array; a null body or a null element is malformed. */
    private <T> List<T> convert(JsonNode node, TypeReference<List<T>> type, String opName) {
        List<T> values;
        try {
            values = json.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                    opName + ": unexpected response shape: " + e.getMessage(), e);
        }
        if (values == null) {
            throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                    opName + ": expected a JSON array, got null");
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new SchedulerException(SchedulerException.Kind.MALFORMED_RESPONSE,
                        opName + ": null element at index " + i);
            }
        }
        return values;
    }

    private static String encodePath(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String basicAuth(String username, String password) {
        if (username == null || username.isBlank()) return null;
        String raw = username + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
