package com.example.corprisk.exception;

/**
 * The registry could not be reached for a request-level lookup, after the client's own
 * retries were spent.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }
}
