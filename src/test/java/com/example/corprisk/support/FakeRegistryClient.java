package com.example.corprisk.support;

import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.http.RegistryResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry keyed by path. A {@code category} query parameter is part of the key
 * ({@code /company/X/filing-history?category=address}); other parameters are ignored.
 * Unknown paths answer not found.
 */
public class FakeRegistryClient implements RegistryClient {

    private final Map<String, JsonNode> payloads = new ConcurrentHashMap<>();
    private final Set<String> unavailable = ConcurrentHashMap.newKeySet();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public FakeRegistryClient put(String path, Object payload) {
        payloads.put(path, Fixtures.json(payload));
        return this;
    }

    public FakeRegistryClient unavailable(String path) {
        unavailable.add(path);
        return this;
    }

    /** Makes a fetch of {@code path} throw, to simulate a fault inside an analyzer. */
    public FakeRegistryClient failOn(String path, RuntimeException failure) {
        failures.put(path, failure);
        return this;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callCount(String key) {
        return calls().stream().filter(key::equals).count();
    }

    @Override
    public RegistryResult fetch(String path, Map<String, String> params, Duration cacheTtl) {
        String key = params.containsKey("category") ? path + "?category=" + params.get("category") : path;
        calls.add(key);
        RuntimeException failure = failures.get(key);
        if (failure != null) throw failure;
        if (unavailable.contains(key)) return RegistryResult.unavailable("simulated outage");
        JsonNode payload = payloads.get(key);
        return payload == null ? RegistryResult.notFound() : RegistryResult.found(payload);
    }

    @Override
    public Duration defaultTtl() {
        return Duration.ofHours(24);
    }
}
