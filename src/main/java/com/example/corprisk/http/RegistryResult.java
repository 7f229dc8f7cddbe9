package com.example.corprisk.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Outcome of one registry lookup. Callers distinguish "the resource does not exist"
 * from "the registry could not be reached"; both carry no payload.
 */
public final class RegistryResult {

    public enum Status { FOUND, NOT_FOUND, UNAVAILABLE }

    private static final RegistryResult NOT_FOUND = new RegistryResult(Status.NOT_FOUND, null, null);

    private final Status status;
    private final JsonNode payload;
    private final String detail;

    private RegistryResult(Status status, JsonNode payload, String detail) {
        this.status = status;
        this.payload = payload;
        this.detail = detail;
    }

    public static RegistryResult found(JsonNode payload) {
        if (payload == null) throw new IllegalArgumentException("payload");
        return new RegistryResult(Status.FOUND, payload, null);
    }

    public static RegistryResult notFound() {
        return NOT_FOUND;
    }

    public static RegistryResult unavailable(String detail) {
        return new RegistryResult(Status.UNAVAILABLE, null, detail);
    }

    public Status status() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isUnavailable() {
        return status == Status.UNAVAILABLE;
    }

    public Optional<JsonNode> payload() {
        return Optional.ofNullable(payload);
    }

    /** Failure reason for {@link Status#UNAVAILABLE}, otherwise null. */
    public String detail() {
        return detail;
    }

    @Override
    public String toString() {
        return detail == null ? status.name() : status + " (" + detail + ")";
    }
}
