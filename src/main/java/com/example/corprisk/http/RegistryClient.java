package com.example.corprisk.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every registry call the analyzers make goes through this contract. Endpoint methods
 * return an empty Optional both for "not found" and for "unavailable after retries";
 * use {@link #fetch} or {@link #lookupCompany} when the difference matters.
 */
public interface RegistryClient {

    /**
     * Fetches a resource. A positive {@code cacheTtl} allows a cached response no older than
     * that; zero bypasses the cache entirely.
     */
    RegistryResult fetch(String path, Map<String, String> params, Duration cacheTtl);

    /** TTL used by the endpoint methods below. */
    Duration defaultTtl();

    default RegistryResult fetch(String path, Map<String, String> params) {
        return fetch(path, params, defaultTtl());
    }

    /** Company profile, always fetched fresh since overdue flags change daily. */
    default RegistryResult lookupCompany(String companyNumber) {
        return fetch("/company/" + companyNumber, Map.of(), Duration.ZERO);
    }

    default Optional<JsonNode> getCompany(String companyNumber) {
        return lookupCompany(companyNumber).payload();
    }

    default Optional<JsonNode> getOfficers(String companyNumber) {
        return fetch("/company/" + companyNumber + "/officers", Map.of("items_per_page", "100")).payload();
    }

    default Optional<JsonNode> getAppointments(String officerId) {
        return fetch("/officers/" + officerId + "/appointments", Map.of("items_per_page", "50")).payload();
    }

    default Optional<JsonNode> getDisqualifications(String officerId) {
        return fetch("/disqualified-officers/natural/" + officerId, Map.of()).payload();
    }

    default Optional<JsonNode> getInsolvency(String companyNumber) {
        return fetch("/company/" + companyNumber + "/insolvency", Map.of()).payload();
    }

    default Optional<JsonNode> getPscs(String companyNumber) {
        return fetch("/company/" + companyNumber + "/persons-with-significant-control", Map.of()).payload();
    }

    default Optional<JsonNode> getPscStatements(String companyNumber) {
        return fetch("/company/" + companyNumber + "/persons-with-significant-control-statements", Map.of()).payload();
    }

    default Optional<JsonNode> getFilingHistory(String companyNumber) {
        return getFilingHistory(companyNumber, null);
    }

    default Optional<JsonNode> getFilingHistory(String companyNumber, String category) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("items_per_page", "100");
        if (category != null && !category.isBlank()) params.put("category", category);
        return fetch("/company/" + companyNumber + "/filing-history", params).payload();
    }

    default Optional<JsonNode> getCharges(String companyNumber) {
        return charges(companyNumber).payload();
    }

    /** Charges register; the registry answers 404 for a company that never registered a charge. */
    default RegistryResult charges(String companyNumber) {
        return fetch("/company/" + companyNumber + "/charges", Map.of());
    }

    default Optional<JsonNode> getRegisteredOffice(String companyNumber) {
        return fetch("/company/" + companyNumber + "/registered-office-address", Map.of()).payload();
    }
}
