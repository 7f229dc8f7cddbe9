package com.example.corprisk.config;

import com.example.corprisk.http.RegistryCache;
import com.example.corprisk.http.SlidingWindowRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-wide shared state of the registry client: one response cache, one rate window.
 */
@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryCache registryCache(RegistryProperties properties, Clock clock) {
        RegistryProperties.Cache cache = properties.cache();
        return new RegistryCache(cache.maxEntries(), cache.maxAge(), clock);
    }

    @Bean
    public SlidingWindowRateLimiter registryRateLimiter(RegistryProperties properties) {
        RegistryProperties.RateLimit limit = properties.rateLimit();
        return new SlidingWindowRateLimiter(limit.maxRequests(), limit.window());
    }
}
