package com.example.corprisk.http;

import com.example.corprisk.config.RegistryProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The one chokepoint for upstream registry calls: cache first, then the shared rate
 * limiter, then the transport with retry.
 * <ul>
 *   <li>429: retried once per configured backoff step (10s/30s/60s by default)</li>
 *   <li>5xx or network failure: retried {@code serverErrorRetries} times with a fixed delay</li>
 *   <li>404: {@link RegistryResult#notFound()}, never retried</li>
 *   <li>other 4xx: unavailable immediately</li>
 * </ul>
 * Company profiles are never cached.
 */
@Component
public class CachingRegistryClient implements RegistryClient {

    private static final Logger log = LoggerFactory.getLogger(CachingRegistryClient.class);

    private static final Pattern PROFILE_PATH = Pattern.compile("^/company/[^/]+/?$");

    private final RegistryTransport transport;
    private final RegistryCache cache;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Duration defaultTtl;
    private final List<Duration> rateLimitedBackoff;
    private final int serverErrorRetries;
    private final Duration serverErrorDelay;

    public CachingRegistryClient(RegistryTransport transport,
                                 RegistryCache cache,
                                 SlidingWindowRateLimiter rateLimiter,
                                 RegistryProperties properties) {
        this.transport = transport;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.defaultTtl = properties.cache().defaultTtl();
        this.rateLimitedBackoff = List.copyOf(properties.retry().rateLimitedBackoff());
        this.serverErrorRetries = properties.retry().serverErrorRetries();
        this.serverErrorDelay = properties.retry().serverErrorDelay();
    }

    @Override
    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public RegistryResult fetch(String path, Map<String, String> params, Duration cacheTtl) {
        String key = cacheKey(path, params);
        boolean cacheable = isCacheable(path, cacheTtl);

        if (cacheable) {
            var hit = cache.get(key, cacheTtl);
            if (hit.isPresent()) {
                log.debug("Cache hit: {}", key);
                return RegistryResult.found(hit.get());
            }
        }

        RegistryResult result;
        try {
            result = callUpstream(path, params);
        } catch (RuntimeException e) {
            if (!(Exceptions.unwrap(e) instanceof InterruptedException)) throw e;
            Thread.currentThread().interrupt();
            return RegistryResult.unavailable("interrupted while calling " + path);
        }
        if (cacheable && result.isFound()) {
            cache.put(key, result.payload().orElseThrow());
        }
        return result;
    }

    private RegistryResult callUpstream(String path, Map<String, String> params) {
        long started = System.nanoTime();
        return Mono.fromCallable(() -> attempt(path, params))
                .retryWhen(retryPolicy(path))
                .doOnNext(r -> log.debug("Registry GET {} took {} ms", path, (System.nanoTime() - started) / 1_000_000))
                .onErrorResume(RetryableStatus.class, e -> Mono.just(RegistryResult.unavailable(e.getMessage())))
                .onErrorResume(RegistryTransportException.class,
                        e -> Mono.just(RegistryResult.unavailable("network failure: " + e.getMessage())))
                .block();
    }

    /** One permit, one GET. Statuses worth retrying come back as {@link RetryableStatus}. */
    private RegistryResult attempt(String path, Map<String, String> params)
            throws InterruptedException, RegistryTransportException {
        rateLimiter.acquire();

        TransportResponse resp;
        try {
            resp = transport.get(path, params);
        } catch (RegistryTransportException e) {
            log.error("Request failed: {} - {}", path, e.getMessage());
            throw e;
        }

        if (resp.isOk()) {
            JsonNode body = resp.body();
            return body == null ? RegistryResult.unavailable("empty body from " + path) : RegistryResult.found(body);
        }
        if (resp.isNotFound()) {
            return RegistryResult.notFound();
        }
        if (resp.isRateLimited() || resp.isServerError()) {
            throw new RetryableStatus(resp.status());
        }
        log.error("API error {}: {} (not retried)", resp.status(), path);
        return RegistryResult.unavailable("HTTP " + resp.status());
    }

    /**
     * 429 walks the backoff steps; 5xx and network failures share a fixed-delay budget.
     * Anything else ends the call with the failure as is.
     */
    private Retry retryPolicy(String path) {
        AtomicInteger rateLimited = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        return Retry.from(signals -> signals.concatMap(signal -> nextAttempt(path, signal, rateLimited, failed)));
    }

    private Mono<Long> nextAttempt(String path, Retry.RetrySignal signal, AtomicInteger rateLimited,
                                   AtomicInteger failed) {
        Throwable failure = signal.failure();
        if (failure instanceof RetryableStatus && ((RetryableStatus) failure).isRateLimited()) {
            int step = rateLimited.getAndIncrement();
            if (step >= rateLimitedBackoff.size()) {
                return Mono.error(new RetryableStatus(429, "rate limited after " + step + " retries"));
            }
            Duration wait = rateLimitedBackoff.get(step);
            log.warn("429 rate limited on {}, waiting {}s (attempt {})", path, wait.toSeconds(), step + 1);
            return pause(wait);
        }
        if (failure instanceof RetryableStatus) {
            log.error("API error {}: {}", ((RetryableStatus) failure).status, path);
        } else if (!(failure instanceof RegistryTransportException)) {
            return Mono.error(failure);
        }
        if (failed.getAndIncrement() >= serverErrorRetries) {
            return Mono.error(failure);
        }
        return pause(serverErrorDelay);
    }

    private static Mono<Long> pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) return Mono.just(0L);
        return Mono.delay(delay, Schedulers.boundedElastic());
    }

    /** A status that may succeed on a later attempt; its message is the unavailable detail. */
    private static final class RetryableStatus extends RuntimeException {
        private final int status;

        RetryableStatus(int status) {
            this(status, "HTTP " + status);
        }

        RetryableStatus(int status, String message) {
            super(message, null, false, false);
            this.status = status;
        }

        boolean isRateLimited() {
            return status == 429;
        }
    }

    static String cacheKey(String path, Map<String, String> params) {
        if (params == null || params.isEmpty()) return path;
        return path + "?" + new TreeMap<>(params).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    }

    static boolean isCacheable(String path, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) return false;
        return !PROFILE_PATH.matcher(path).matches();
    }
}
