package com.example.corprisk.service.analyzer;

import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Rating;
import com.example.corprisk.model.Severity;
import com.example.corprisk.model.ownership.HolderKind;
import com.example.corprisk.util.RegistryJson;
import com.example.corprisk.util.RegistryLinks;
import com.example.corprisk.util.RiskHeuristics;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.example.corprisk.model.EvidenceItem.details;

/**
 * What does the decision-making network look like? Combines the board with the
 * individual control-holders: size, concentration of control in directors' hands, late
 * additions, control-holder activity, directors co-serving elsewhere, and directors who
 * also sit on the board of a corporate control-holder.
 */
@Component
public class ControlNetworkAnalyzer implements DimensionAnalyzer {

    static final int LARGE_NETWORK = 10;
    static final long RECENT_DAYS = 90;
    static final long ACTIVITY_WINDOW_DAYS = 730;
    static final int MIN_SHARED_COMPANIES = 2;
    static final int DENSE_NETWORK_PAIRS = 3;

    record OverlapPair(String first, String second, int sharedCompanies) {}

    static final class Facts {
        int directorCount;
        int activePscCount;
        int networkSize;
        final List<String> recentDirectors = new ArrayList<>();
        final List<String> recentPscs = new ArrayList<>();
        int pscChangesLastTwoYears;
        final List<OverlapPair> overlappingPairs = new ArrayList<>();

        boolean largeNetwork() {
            return networkSize > LARGE_NETWORK;
        }

        boolean denseNetwork() {
            return overlappingPairs.size() >= DENSE_NETWORK_PAIRS;
        }
    }

    static final RatingCascade<Facts> CASCADE = RatingCascade.<Facts>builder()
            .rule("recent_director_and_psc", f -> !f.recentDirectors.isEmpty() && !f.recentPscs.isEmpty(),
                    Rating.INVESTIGATE,
                    f -> "Director and PSC both changed in last 90 days",
                    f -> "Recent board and ownership changes (last 90 days)")
            .rule("dense_network", Facts::denseNetwork, Rating.INVESTIGATE,
                    f -> "Dense director network — multiple pairs share other company appointments",
                    f -> "Dense director network — directors share multiple other appointments")
            .rule("recent_psc", f -> !f.recentPscs.isEmpty(), Rating.INVESTIGATE,
                    f -> "PSC change in last 90 days",
                    f -> "Recent PSC change: " + f.recentPscs.get(0))
            .rule("large_network", Facts::largeNetwork, Rating.INVESTIGATE,
                    f -> "Large control network (" + f.networkSize + " individuals)",
                    f -> "Large control network: " + f.networkSize + " individuals")
            .rule("high_psc_activity", f -> f.pscChangesLastTwoYears >= 2, Rating.INVESTIGATE,
                    f -> f.pscChangesLastTwoYears + " PSC changes in last 2 years",
                    f -> "High PSC activity: " + f.pscChangesLastTwoYears + " changes in 2 years")
            .otherwise(
                    f -> "No concerning control network patterns",
                    f -> "Clean control network (" + f.directorCount + " directors, " + f.activePscCount + " PSCs)");

    private final Clock clock;
    private final RegistryLinks links;

    public ControlNetworkAnalyzer(Clock clock, RegistryLinks links) {
        this.clock = clock;
        this.links = links;
    }

    @Override
    public Dimension dimension() {
        return Dimension.CONTROL_NETWORK;
    }

    @Override
    public DimensionResult analyze(RegistryClient registry, String companyNumber) {
        List<JsonNode> directors = RegistryJson.currentDirectors(registry.getOfficers(companyNumber));
        List<JsonNode> allPscs = RegistryJson.items(registry.getPscs(companyNumber));
        List<JsonNode> pscs = allPscs.stream().filter(p -> !RegistryJson.isCeased(p)).toList();
        List<JsonNode> ceasedPscs = allPscs.stream().filter(RegistryJson::isCeased).toList();

        if (directors.isEmpty() && pscs.isEmpty()) {
            return dimension().degraded("Insufficient data to assess control network", List.of());
        }

        LocalDate today = LocalDate.now(clock);
        Facts facts = new Facts();
        facts.directorCount = directors.size();
        facts.activePscCount = pscs.size();
        List<EvidenceItem> evidence = new ArrayList<>();
        boolean anySignal = false;

        List<JsonNode> individualPscs = pscs.stream()
                .filter(p -> HolderKind.fromKind(RegistryJson.text(p, "kind")) == HolderKind.INDIVIDUAL)
                .toList();
        Set<String> directorNames = new HashSet<>();
        directors.forEach(d -> directorNames.add(upperName(d)));

        Set<String> individuals = new HashSet<>(directorNames);
        individualPscs.forEach(p -> individuals.add(upperName(p)));
        facts.networkSize = individuals.size();
        evidence.add(EvidenceItem.verified(Severity.NONE, "network_size")
                .description("Control network includes " + facts.networkSize + " unique individual(s)")
                .details(details(
                        "director_count", directors.size(),
                        "individual_psc_count", individualPscs.size(),
                        "unique_individuals", facts.networkSize))
                .source("officers + PSC endpoints")
                .build());
        if (facts.largeNetwork()) {
            anySignal = true;
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "large_network")
                    .description("Large control network: " + facts.networkSize + " individuals across directors and PSCs")
                    .details(details("network_size", facts.networkSize))
                    .source("officers + PSC endpoints")
                    .build());
        }

        double directorControl = decisionConcentration(individualPscs, directorNames);
        if (directorControl > 0) {
            evidence.add(EvidenceItem.verified(Severity.NONE, "decision_concentration")
                    .description(String.format("Directors hold ~%.0f%% of significant control", directorControl))
                    .details(details("control_by_directors_pct", RiskHeuristics.round(directorControl, 1)))
                    .source("officers + PSC endpoints")
                    .build());
        }

        anySignal |= lateAdditions(directors, pscs, today, facts, evidence);
        anySignal |= pscActivity(pscs, ceasedPscs, today, facts, evidence);
        anySignal |= directorOverlap(registry, companyNumber, directors, facts, evidence);
        anySignal |= directorControlsPsc(registry, directors, pscs, evidence);

        if (!anySignal) {
            evidence.add(EvidenceItem.verified(Severity.NONE, "clean_network")
                    .description("No concerning control network patterns detected")
                    .source("officers + PSC endpoints")
                    .build());
        }

        return dimension().result(CASCADE.evaluate(facts), evidence, followUps(facts));
    }

    /**
     * Sum of control-bucket midpoints over every nature of control held by individual
     * control-holders who also sit on the board. A holder with both 75-100% shares and
     * 75-100% votes contributes 175, so this is an indicator, not a percentage of equity.
     */
    static double decisionConcentration(List<JsonNode> individualPscs, Set<String> directorNames) {
        double total = 0;
        for (JsonNode p : individualPscs) {
            if (!directorNames.contains(upperName(p))) continue;
            for (String nature : RegistryJson.strings(p, "natures_of_control")) {
                total += RiskHeuristics.controlBucketMidpoint(nature);
            }
        }
        return total;
    }

    private static boolean lateAdditions(List<JsonNode> directors, List<JsonNode> pscs, LocalDate today,
                                         Facts facts, List<EvidenceItem> evidence) {
        for (JsonNode d : directors) {
            LocalDate appointed = RegistryJson.date(d, "appointed_on");
            if (appointed == null) continue;
            long gap = RiskHeuristics.daysBetween(appointed, today);
            if (gap < RECENT_DAYS) {
                String name = RegistryJson.text(d, "name", "?");
                facts.recentDirectors.add(name);
                evidence.add(EvidenceItem.verified(Severity.MEDIUM, "recent_director")
                        .description("Director " + name + " appointed " + gap + " days ago (" + appointed + ")")
                        .details(details("director_name", name, "appointed_on", appointed.toString(), "days_ago", gap))
                        .source("officers endpoint")
                        .build());
            }
        }
        for (JsonNode p : pscs) {
            LocalDate notified = RegistryJson.date(p, "notified_on");
            if (notified == null) continue;
            long gap = RiskHeuristics.daysBetween(notified, today);
            if (gap < RECENT_DAYS) {
                String name = RegistryJson.text(p, "name", "?");
                facts.recentPscs.add(name);
                evidence.add(EvidenceItem.verified(Severity.MEDIUM, "recent_psc")
                        .description("PSC " + name + " notified " + gap + " days ago (" + notified + ")")
                        .details(details("psc_name", name, "notified_on", notified.toString(), "days_ago", gap))
                        .source("PSC endpoint")
                        .build());
            }
        }
        return !facts.recentDirectors.isEmpty() || !facts.recentPscs.isEmpty();
    }

    private static boolean pscActivity(List<JsonNode> pscs, List<JsonNode> ceasedPscs, LocalDate today,
                                       Facts facts, List<EvidenceItem> evidence) {
        int changes = 0;
        for (JsonNode p : ceasedPscs) {
            LocalDate ceased = RegistryJson.date(p, "ceased_on");
            if (ceased != null && RiskHeuristics.daysBetween(ceased, today) < ACTIVITY_WINDOW_DAYS) changes++;
        }
        for (JsonNode p : pscs) {
            LocalDate notified = RegistryJson.date(p, "notified_on");
            if (notified != null && RiskHeuristics.daysBetween(notified, today) < ACTIVITY_WINDOW_DAYS) changes++;
        }
        facts.pscChangesLastTwoYears = changes;
        if (changes == 0) return false;

        evidence.add(EvidenceItem.verified(changes >= 2 ? Severity.MEDIUM : Severity.LOW, "psc_activity")
                .description(changes + " PSC change(s) in last 2 years")
                .details(details("psc_changes_2y", changes))
                .source("PSC endpoint")
                .build());
        return changes >= 2;
    }

    private boolean directorOverlap(RegistryClient registry, String companyNumber, List<JsonNode> directors,
                                    Facts facts, List<EvidenceItem> evidence) {
        Map<String, Set<String>> otherBoards = new LinkedHashMap<>();
        for (JsonNode d : directors) {
            String officerId = RegistryJson.officerId(d);
            if (officerId == null) continue;
            Optional<JsonNode> appointments = registry.getAppointments(officerId);
            if (!RegistryJson.hasItems(appointments)) continue;
            Set<String> companies = new HashSet<>();
            for (var appt : RegistryJson.appointments(appointments)) {
                if (!appt.companyNumber().isEmpty() && !appt.companyNumber().equals(companyNumber) && appt.isActive()) {
                    companies.add(appt.companyNumber());
                }
            }
            otherBoards.put(RegistryJson.text(d, "name", "?"), companies);
        }

        List<Map.Entry<String, Set<String>>> entries = new ArrayList<>(otherBoards.entrySet());
        for (int i = 0; i < entries.size(); i++) {
            for (int j = i + 1; j < entries.size(); j++) {
                Set<String> shared = new HashSet<>(entries.get(i).getValue());
                shared.retainAll(entries.get(j).getValue());
                if (shared.size() < MIN_SHARED_COMPANIES) continue;

                String a = entries.get(i).getKey();
                String b = entries.get(j).getKey();
                facts.overlappingPairs.add(new OverlapPair(a, b, shared.size()));
                evidence.add(EvidenceItem.verified(Severity.LOW, "director_network_overlap")
                        .description(a + " and " + b + " are both current directors of " + shared.size() + " other companies")
                        .details(details("directors", List.of(a, b), "shared_company_count", shared.size()))
                        .source("appointments endpoint")
                        .build());
            }
        }

        if (facts.denseNetwork()) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "dense_director_network")
                    .description("Dense director network: " + facts.overlappingPairs.size()
                            + " pairs of directors share multiple company appointments")
                    .details(details("overlapping_pairs", facts.overlappingPairs.size()))
                    .source("appointments endpoint")
                    .build());
        }
        return !facts.overlappingPairs.isEmpty();
    }

    private boolean directorControlsPsc(RegistryClient registry, List<JsonNode> directors, List<JsonNode> pscs,
                                       List<EvidenceItem> evidence) {
        boolean found = false;
        for (JsonNode cp : pscs) {
            if (HolderKind.fromKind(RegistryJson.text(cp, "kind")) != HolderKind.CORPORATE) continue;
            String reg = RegistryJson.text(cp.path("identification"), "registration_number");
            if (reg.isEmpty()) continue;

            Optional<JsonNode> pscOfficers = registry.getOfficers(reg);
            if (!RegistryJson.hasItems(pscOfficers)) continue;
            Set<String> pscBoard = new HashSet<>();
            for (JsonNode o : RegistryJson.items(pscOfficers)) {
                if (RegistryJson.text(o, "resigned_on").isEmpty()) pscBoard.add(upperName(o));
            }

            for (JsonNode d : directors) {
                if (!pscBoard.contains(upperName(d))) continue;
                found = true;
                String pscName = RegistryJson.text(cp, "name", "?");
                evidence.add(EvidenceItem.verified(Severity.LOW, "director_controls_psc")
                        .description(RegistryJson.text(d, "name") + " is director of both target company and its PSC ("
                                + pscName + ")")
                        .details(details(
                                "director", RegistryJson.text(d, "name"),
                                "psc_company", pscName,
                                "psc_company_number", reg))
                        .source("officers + PSC endpoints")
                        .link(links.company(reg))
                        .build());
            }
        }
        return found;
    }

    private static String upperName(JsonNode node) {
        return RegistryJson.text(node, "name").toUpperCase(Locale.ROOT);
    }

    private static List<String> followUps(Facts facts) {
        List<String> asks = new ArrayList<>();
        if (!facts.recentDirectors.isEmpty() && !facts.recentPscs.isEmpty()) {
            asks.add("What prompted the recent changes to both board and ownership?");
        }
        if (!facts.recentDirectors.isEmpty()) {
            asks.add("What is the background of " + facts.recentDirectors.get(0) + "?");
        }
        if (!facts.recentPscs.isEmpty()) asks.add("What prompted the recent ownership change?");
        if (!facts.overlappingPairs.isEmpty()) {
            OverlapPair first = facts.overlappingPairs.get(0);
            asks.add("What is the history of the business relationship between " + first.first()
                    + " and " + first.second() + "?");
        }
        return asks;
    }
}
