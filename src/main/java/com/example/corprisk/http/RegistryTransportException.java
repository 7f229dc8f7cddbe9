package com.example.corprisk.http;

/**
 * Network level failure: connection refused, reset, timeout, unreadable body.
 */
public class RegistryTransportException extends Exception {

    public RegistryTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
