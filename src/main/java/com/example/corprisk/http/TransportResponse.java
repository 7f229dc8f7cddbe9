package com.example.corprisk.http;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw upstream answer: HTTP status plus the parsed body (null when the body was empty or not JSON).
 */
public record TransportResponse(int status, JsonNode body) {

    public boolean isOk() {
        return status >= 200 && status < 300;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    public boolean isServerError() {
        return status >= 500;
    }
}
