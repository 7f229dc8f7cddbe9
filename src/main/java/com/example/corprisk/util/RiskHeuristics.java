package com.example.corprisk.util;

import com.example.corprisk.model.Appointment;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Derived metrics shared by the analyzers. Pure: results depend on arguments only,
 * "today" included.
 */
public final class RiskHeuristics {

    private RiskHeuristics() {}

    static final double DAYS_PER_YEAR = 365.25;

    /** Churn is not computed over spans shorter than this, in years. */
    static final double MIN_CHURN_SPAN_YEARS = 0.5;

    /** Registered-office fragments of well known company formation agents (normalized). */
    public static final List<String> FORMATION_AGENT_INDICATORS = List.of(
            "71-75 shelton street",
            "20-22 wenlock road",
            "85 great portland street",
            "kemp house",
            "27 old gloucester street",
            "128 city road",
            "suite 4 lincoln house",
            "167-169 great portland street",
            "c/o companies house",
            "lenta business centre",
            "63/66 hatton garden");

    public static final Set<String> INSOLVENCY_STATUSES = Set.of(
            "liquidation",
            "administration",
            "receivership",
            "voluntary-arrangement",
            "insolvency-proceedings");

    public record DissolutionStats(int dissolved, int total, double ratePercent) {}

    public static DissolutionStats dissolutionRate(List<Appointment> appointments) {
        if (appointments == null || appointments.isEmpty()) return new DissolutionStats(0, 0, 0.0);
        int total = appointments.size();
        int dissolved = (int) appointments.stream().filter(Appointment::isAtDissolvedCompany).count();
        return new DissolutionStats(dissolved, total, dissolved * 100.0 / total);
    }

    /**
     * Median appointment length in years; open appointments run to {@code today}.
     * Empty when no appointment has a usable start date.
     */
    public static OptionalDouble medianTenureYears(List<Appointment> appointments, LocalDate today) {
        List<Double> tenures = new ArrayList<>();
        for (Appointment a : appointments) {
            if (a.appointedOn() == null) continue;
            LocalDate end = a.resignedOn() != null ? a.resignedOn() : today;
            long days = ChronoUnit.DAYS.between(a.appointedOn(), end);
            if (days >= 0) tenures.add(days / DAYS_PER_YEAR);
        }
        if (tenures.isEmpty()) return OptionalDouble.empty();
        tenures.sort(null);
        int mid = tenures.size() / 2;
        if (tenures.size() % 2 == 0) {
            return OptionalDouble.of((tenures.get(mid - 1) + tenures.get(mid)) / 2);
        }
        return OptionalDouble.of(tenures.get(mid));
    }

    /**
     * Appointments per year across the span between the earliest and latest start date.
     * Zero with fewer than two dated appointments or a span under six months.
     */
    public static double churnRate(List<Appointment> appointments) {
        if (appointments == null || appointments.isEmpty()) return 0.0;
        List<LocalDate> dates = appointments.stream()
                .map(Appointment::appointedOn)
                .filter(d -> d != null)
                .sorted()
                .toList();
        if (dates.size() < 2) return 0.0;
        double spanYears = ChronoUnit.DAYS.between(dates.get(0), dates.get(dates.size() - 1)) / DAYS_PER_YEAR;
        if (spanYears < MIN_CHURN_SPAN_YEARS) return 0.0;
        return appointments.size() / spanYears;
    }

    /**
     * 1 - levenshtein / max length, after lower-casing, trimming and collapsing whitespace.
     * 1.0 for identical strings, 0.0 when either is empty.
     */
    public static double nameSimilarity(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) return 0.0;
        String s1 = normalizeName(a);
        String s2 = normalizeName(b);
        if (s1.equals(s2)) return 1.0;

        int len1 = s1.length();
        int len2 = s2.length();
        int[] prev = new int[len2 + 1];
        int[] curr = new int[len2 + 1];
        for (int j = 0; j <= len2; j++) prev[j] = j;
        for (int i = 1; i <= len1; i++) {
            curr[0] = i;
            for (int j = 1; j <= len2; j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return 1.0 - (double) prev[len2] / Math.max(len1, len2);
    }

    private static String normalizeName(String s) {
        return s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static boolean codesOverlap(Collection<String> a, Collection<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return false;
        Set<String> shared = new HashSet<>(a);
        shared.retainAll(b);
        return !shared.isEmpty();
    }

    /**
     * Statutory accounts deadline: period end plus 6 months for public companies, 9 otherwise.
     */
    public static LocalDate accountsDeadline(LocalDate madeUpTo, String companyType) {
        if (madeUpTo == null) return null;
        boolean isPublic = "plc".equals(companyType) || "public-limited".equals(companyType);
        return madeUpTo.plusMonths(isPublic ? 6 : 9);
    }

    /** Lower-cased address components with punctuation other than '/' and '-' removed. */
    public static String normalizeAddress(JsonNode address) {
        if (address == null) return "";
        String raw = String.join(" ",
                RegistryJson.text(address, "premises"),
                RegistryJson.text(address, "address_line_1"),
                RegistryJson.text(address, "address_line_2"),
                RegistryJson.text(address, "locality"),
                RegistryJson.text(address, "postal_code"));
        return raw.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9 /\\-]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public static boolean isFormationAgentAddress(JsonNode address) {
        String normalized = normalizeAddress(address);
        if (normalized.isEmpty()) return false;
        return FORMATION_AGENT_INDICATORS.stream().anyMatch(normalized::contains);
    }

    /**
     * Midpoint of the ownership/voting bucket named in a nature-of-control tag, 0 when
     * the tag carries no bucket. Coarse by construction: 75-to-100 counts as 87.5.
     */
    public static double controlBucketMidpoint(String nature) {
        if (nature == null) return 0.0;
        if (nature.contains("75-to-100")) return 87.5;
        if (nature.contains("50-to-75")) return 62.5;
        if (nature.contains("25-to-50")) return 37.5;
        return 0.0;
    }

    public static long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }

    /** Half-up rounding to {@code places} decimals, for report values. */
    public static double round(double value, int places) {
        return BigDecimal.valueOf(value)
                .setScale(places, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
