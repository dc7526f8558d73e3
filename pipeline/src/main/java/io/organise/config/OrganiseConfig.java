package io.organise.config;

import java.util.Map;

/**
 * Run settings read from system properties, falling back to environment variables.
 *
 * @param validationLogLimit  validation failures logged in full per run before the rest are only counted
 * @param httpTimeoutSeconds  connect and request timeout for spreadsheet downloads
 * @param httpAttempts        total download attempts, including the first
 * @param httpBackoffMillis   base delay between download attempts
 */
public record OrganiseConfig(
        int validationLogLimit,
        int httpTimeoutSeconds,
        int httpAttempts,
        long httpBackoffMillis
) {
    public OrganiseConfig {
        if (validationLogLimit < 0) throw new IllegalArgumentException("validationLogLimit must be >= 0");
        if (httpTimeoutSeconds <= 0) throw new IllegalArgumentException("httpTimeoutSeconds must be > 0");
        if (httpAttempts <= 0) throw new IllegalArgumentException("httpAttempts must be > 0");
        if (httpBackoffMillis < 0) throw new IllegalArgumentException("httpBackoffMillis must be >= 0");
    }

    public static OrganiseConfig defaults() {
        return new OrganiseConfig(25, 30, 3, 250);
    }

    public static OrganiseConfig fromEnv() {
        return from(System.getenv());
    }

    static OrganiseConfig from(Map<String, String> env) {
        int limit = Integer.parseInt(System.getProperty("organise.validation.logLimit", env.getOrDefault("ORGANISE_VALIDATION_LOG_LIMIT", "25")));
        int timeout = Integer.parseInt(System.getProperty("organise.http.timeoutSeconds", env.getOrDefault("ORGANISE_HTTP_TIMEOUT_SECONDS", "30")));
        int attempts = Integer.parseInt(System.getProperty("organise.http.attempts", env.getOrDefault("ORGANISE_HTTP_ATTEMPTS", "3")));
        long backoff = Long.parseLong(System.getProperty("organise.http.backoffMillis", env.getOrDefault("ORGANISE_HTTP_BACKOFF_MILLIS", "250")));
        return new OrganiseConfig(limit, timeout, attempts, backoff);
    }
}
