package com.example.corprisk.support;

import com.example.corprisk.config.RegistryProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for registry-shaped JSON payloads and fixed test settings.
 */
public final class Fixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** "Today" for every date-window rule in tests. */
    public static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private Fixtures() {}

    public static Clock clock() {
        return Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    public static RegistryProperties properties() {
        return new RegistryProperties(
                "http://localhost",
                "https://registry.example",
                "test-key",
                Duration.ofSeconds(5),
                new RegistryProperties.RateLimit(600, Duration.ofSeconds(300)),
                new RegistryProperties.Cache(Duration.ofHours(24), 10_000, Duration.ofDays(7)),
                new RegistryProperties.Retry(List.of(Duration.ZERO, Duration.ZERO, Duration.ZERO), 2, Duration.ZERO),
                new RegistryProperties.Analysis(3, 20, 3, 5));
    }

    public static JsonNode json(Object value) {
        return value instanceof JsonNode ? (JsonNode) value : MAPPER.valueToTree(value);
    }

    /** Ordered object from alternating key/value pairs. */
    public static Map<String, Object> obj(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put((String) keyValues[i], keyValues[i + 1]);
        }
        return out;
    }

    public static List<Object> arr(Object... values) {
        return Arrays.asList(values);
    }

    public static Map<String, Object> items(Object... values) {
        return obj("items", arr(values));
    }

    public static String daysAgo(long days) {
        return TODAY.minusDays(days).toString();
    }

    public static Map<String, Object> director(String name, String officerId, String appointedOn, String resignedOn) {
        Map<String, Object> o = obj(
                "name", name,
                "officer_role", "director",
                "appointed_on", appointedOn,
                "links", obj("officer", obj("appointments", "/officers/" + officerId + "/appointments")));
        if (resignedOn != null) o.put("resigned_on", resignedOn);
        return o;
    }

    public static Map<String, Object> appointment(String companyNumber, String companyName, String status,
                                                  String appointedOn, String resignedOn) {
        Map<String, Object> a = obj(
                "appointed_to", obj(
                        "company_number", companyNumber,
                        "company_name", companyName,
                        "company_status", status),
                "appointed_on", appointedOn);
        if (resignedOn != null) a.put("resigned_on", resignedOn);
        return a;
    }

    public static Map<String, Object> individualPsc(String name, String notifiedOn, String... natures) {
        return obj(
                "name", name,
                "kind", "individual-person-with-significant-control",
                "nationality", "British",
                "notified_on", notifiedOn,
                "natures_of_control", arr((Object[]) natures));
    }

    public static Map<String, Object> corporatePsc(String name, String registration, String place, String country) {
        return obj(
                "name", name,
                "kind", "corporate-entity-person-with-significant-control",
                "notified_on", "2015-01-01",
                "natures_of_control", arr("ownership-of-shares-75-to-100-percent"),
                "identification", obj(
                        "registration_number", registration,
                        "place_registered", place,
                        "country_registered", country));
    }

    public static Map<String, Object> profile(String number, String name, String created, String... sicCodes) {
        return obj(
                "company_number", number,
                "company_name", name,
                "company_status", "active",
                "type", "ltd",
                "date_of_creation", created,
                "registered_office_address", obj("address_line_1", "1 High Street", "postal_code", "AB1 2CD"),
                "sic_codes", arr((Object[]) sicCodes));
    }
}
