package com.easytidal.mirror.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Everything the mirror needs to know about its environment.
 *
 * Bound from the {@code easytidal.*} keys in application.yml and handed to
 * each collaborator through its constructor; nothing reads configuration
 * from a static location.
 */
@ConfigurationProperties(prefix = "easytidal")
public record MirrorProperties(
        @DefaultValue Scheduler scheduler,
        @DefaultValue Cache     cache,
        @DefaultValue History   history,
        @DefaultValue Layout    layout
) {

    /**
     * Connection details for the Tidal REST API.
     *
     * @param baseUrl   e.g. "https://tidal.example.com" (trailing slash is ignored)
     * @param username  basic-auth user
     * @param password  basic-auth password
     * @param directory job directory passed to listJobs
     * @param timeout   per-request deadline
     */
    public record Scheduler(
            @DefaultValue("http://localhost:8081") String baseUrl,
            String username,
            String password,
            String directory,
            @DefaultValue("30s") Duration timeout) {

        public Scheduler {
            if (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    public record Cache(
            @DefaultValue("data/job_graph_cache.json") Path file,
            @DefaultValue("24h") Duration ttl) {}

    /**
     * @param file           JSON array of history entries
     * @param cap            maximum number of entries retained
     * @param captureOutput  also fetch job output (and stderr for failed jobs) on refresh
     */
    public record History(
            @DefaultValue("data/job_history.json") Path file,
            @DefaultValue("1000") int cap,
            @DefaultValue("false") boolean captureOutput) {

        public History {
            if (cap < 1) throw new IllegalArgumentException("history cap must be positive: " + cap);
        }
    }

    public record Layout(
            @DefaultValue("200") double horizontalSpacing,
            @DefaultValue("100") double verticalSpacing) {}
}
