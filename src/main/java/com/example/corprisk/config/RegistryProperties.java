package com.example.corprisk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the registry client and the analysis engine.
 */
@ConfigurationProperties(prefix = "registry")
public record RegistryProperties(
        String baseUrl,
        String webBaseUrl,
        String apiKey,
        Duration responseTimeout,
        RateLimit rateLimit,
        Cache cache,
        Retry retry,
        Analysis analysis
) {

    /**
     * Sliding window budget shared by every caller in the process.
     *
     * @param maxRequests requests allowed in any trailing window
     * @param window      window length
     */
    public record RateLimit(int maxRequests, Duration window) {}

    /**
     * Response cache settings.
     *
     * @param defaultTtl age after which a cached response is treated as absent
     * @param maxEntries Caffeine size bound
     * @param maxAge     hard expiry ceiling applied by Caffeine regardless of per-call TTL
     */
    public record Cache(Duration defaultTtl, long maxEntries, Duration maxAge) {}

    /**
     * Retry schedule.
     *
     * @param rateLimitedBackoff one delay per retry after an upstream 429
     * @param serverErrorRetries retries after a 5xx or network failure
     * @param serverErrorDelay   fixed delay between those retries
     */
    public record Retry(List<Duration> rateLimitedBackoff, int serverErrorRetries, Duration serverErrorDelay) {}

    /**
     * Analyzer bounds that cap upstream calls per request.
     *
     * @param maxTraceDepth        deepest company level the ownership tracer expands
     * @param orbitSampleSize      connected companies whose profiles are classified
     * @param orbitDirectorSample  directors whose appointments feed the orbit
     * @param phoenixCandidates    dissolved companies examined per director
     */
    public record Analysis(int maxTraceDepth, int orbitSampleSize, int orbitDirectorSample, int phoenixCandidates) {}
}
