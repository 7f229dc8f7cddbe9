package com.example.corprisk.http;

import java.util.Map;

/**
 * Single GET against the registry API. No caching, limiting or retrying happens here;
 * {@link CachingRegistryClient} owns those concerns.
 */
public interface RegistryTransport {

    TransportResponse get(String path, Map<String, String> params) throws RegistryTransportException;
}
