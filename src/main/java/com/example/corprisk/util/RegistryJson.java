package com.example.corprisk.util;

import com.example.corprisk.model.Appointment;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Null-tolerant readers for registry payloads.
 */
public final class RegistryJson {

    private RegistryJson() {}

    /** The {@code items} array of a list payload; empty when absent. */
    public static List<JsonNode> items(Optional<JsonNode> payload) {
        return payload.map(RegistryJson::items).orElse(List.of());
    }

    public static List<JsonNode> items(JsonNode payload) {
        return array(payload, "items");
    }

    /** True when the payload exists and carries an {@code items} array (possibly empty). */
    public static boolean hasItems(Optional<JsonNode> payload) {
        return payload.map(p -> p.path("items").isArray()).orElse(false);
    }

    public static List<JsonNode> array(JsonNode node, String field) {
        if (node == null) return List.of();
        JsonNode arr = node.path(field);
        if (!arr.isArray()) return List.of();
        List<JsonNode> out = new ArrayList<>(arr.size());
        arr.forEach(out::add);
        return out;
    }

    public static List<String> strings(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : array(node, field)) {
            if (n.isTextual()) out.add(n.asText());
        }
        return out;
    }

    /** Text value or "" when missing/null. */
    public static String text(JsonNode node, String field) {
        if (node == null) return "";
        JsonNode v = node.path(field);
        return v.isValueNode() && !v.isNull() ? v.asText() : "";
    }

    public static String text(JsonNode node, String field, String fallback) {
        String v = text(node, field);
        return v.isEmpty() ? fallback : v;
    }

    public static boolean flag(JsonNode node, String field) {
        return node != null && node.path(field).asBoolean(false);
    }

    /** Parses the leading yyyy-MM-dd of a field; null when missing or malformed. */
    public static LocalDate date(JsonNode node, String field) {
        return parseDate(text(node, field));
    }

    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.length() < 10) return null;
        try {
            return LocalDate.parse(raw.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isCurrentDirector(JsonNode officer) {
        String role = text(officer, "officer_role");
        return ("director".equals(role) || "corporate-director".equals(role))
                && text(officer, "resigned_on").isEmpty();
    }

    public static boolean isResignedDirector(JsonNode officer) {
        String role = text(officer, "officer_role");
        return ("director".equals(role) || "corporate-director".equals(role))
                && !text(officer, "resigned_on").isEmpty();
    }

    public static List<JsonNode> currentDirectors(Optional<JsonNode> officers) {
        return items(officers).stream().filter(RegistryJson::isCurrentDirector).toList();
    }

    public static boolean isCeased(JsonNode psc) {
        return !text(psc, "ceased_on").isEmpty();
    }

    /**
     * Officer id from an officer's links, e.g. {@code /officers/abc123/appointments} gives {@code abc123}.
     */
    public static String officerId(JsonNode officer) {
        JsonNode links = officer == null ? null : officer.path("links");
        if (links == null || links.isMissingNode()) return null;
        String link = text(links.path("officer"), "appointments");
        if (link.isEmpty()) link = text(links, "self");
        String[] parts = link.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if ("officers".equals(parts[i]) && !parts[i + 1].isEmpty()) return parts[i + 1];
        }
        return null;
    }

    public static List<Appointment> appointments(Optional<JsonNode> payload) {
        List<Appointment> out = new ArrayList<>();
        for (JsonNode item : items(payload)) {
            JsonNode to = item.path("appointed_to");
            out.add(new Appointment(
                    text(to, "company_number"),
                    text(to, "company_name", "Unknown"),
                    text(to, "company_status"),
                    date(item, "appointed_on"),
                    date(item, "resigned_on")));
        }
        return out;
    }
}
