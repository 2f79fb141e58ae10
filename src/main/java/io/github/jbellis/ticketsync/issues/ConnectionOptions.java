package io.github.jbellis.ticketsync.issues;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where an issue was fetched from. Stored alongside the raw payload in the cached snapshot so that
 * an issue can be rebuilt later without asking the tracker.
 */
public record ConnectionOptions(
        @JsonProperty("server") String server,
        @JsonProperty("rest_api_version") String restApiVersion) {

    public static final String DEFAULT_REST_API_VERSION = "2";

    public ConnectionOptions(String server) {
        this(server, DEFAULT_REST_API_VERSION);
    }
}
