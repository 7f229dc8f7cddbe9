package com.example.corprisk.service.analyzer;

import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Rating;
import com.example.corprisk.model.Severity;
import com.example.corprisk.util.RegistryJson;
import com.example.corprisk.util.RiskHeuristics;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.example.corprisk.model.EvidenceItem.details;

/**
 * Is leadership stable or is there concerning churn? All signals are verified: board
 * turnover, new and sole directors, tenure, registered-office quality and churn, and
 * director changes that coincide with accounts filings or control-holder changes.
 */
@Component
public class GovernanceStabilityAnalyzer implements DimensionAnalyzer {

    static final long RECENT_APPOINTMENT_DAYS = 90;
    static final long TURNOVER_WINDOW_DAYS = 730;
    static final long SHORT_TENURE_DAYS = 548;
    static final long TIMING_WINDOW_DAYS = 30;
    static final long ADDRESS_WINDOW_DAYS = 1095;
    static final double MIN_AVERAGE_TENURE_YEARS = 2.0;

    static final class Facts {
        int directorCount;
        boolean hasTenures;
        double averageTenure;
        final List<String> recentAppointees = new ArrayList<>();
        String firstRecentAppointment = "?";
        int changesLastTwoYears;
        boolean timingNearAccounts;
        boolean timingNearPsc;
        boolean formationAgent;
        int addressChanges;

        boolean soleDirector() {
            return directorCount == 1;
        }
    }

    static final RatingCascade<Facts> CASCADE = RatingCascade.<Facts>builder()
            .rule("high_turnover", f -> f.changesLastTwoYears >= 3, Rating.RED_FLAG,
                    f -> f.changesLastTwoYears + " director changes in last 2 years",
                    f -> "High director turnover: " + f.changesLastTwoYears + " changes in 2 years")
            .rule("change_with_psc", f -> f.timingNearPsc && !f.recentAppointees.isEmpty(), Rating.INVESTIGATE,
                    f -> "Director change coincided with PSC change",
                    f -> "Director and ownership change at same time")
            .rule("recent_appointment", f -> !f.recentAppointees.isEmpty(), Rating.INVESTIGATE,
                    f -> "Director appointed in last 3 months",
                    f -> "Recent board change: new director appointed " + f.firstRecentAppointment)
            .rule("sole_director", Facts::soleDirector, Rating.INVESTIGATE,
                    f -> "Sole director — key person dependency",
                    f -> "Single director — key person risk")
            .rule("short_average_tenure", f -> f.hasTenures && f.averageTenure < MIN_AVERAGE_TENURE_YEARS,
                    Rating.INVESTIGATE,
                    f -> String.format("Average director tenure below 2 years (%.1fy)", f.averageTenure),
                    f -> String.format("Short average director tenure (%.1f years)", f.averageTenure))
            .rule("formation_agent", f -> f.formationAgent, Rating.INVESTIGATE,
                    f -> "Registered at formation agent address",
                    f -> "Registered office is a formation agent address")
            .rule("address_churn", f -> f.addressChanges >= 3, Rating.INVESTIGATE,
                    f -> f.addressChanges + " registered office changes in 3 years",
                    f -> "Registered office changed " + f.addressChanges + " times in 3 years")
            .otherwise(
                    f -> String.format("Stable board (%d directors, %.1fyr avg tenure)", f.directorCount, f.averageTenure),
                    f -> String.format("Stable board: %d directors, %.1f year average tenure", f.directorCount, f.averageTenure));

    private final Clock clock;

    public GovernanceStabilityAnalyzer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Dimension dimension() {
        return Dimension.GOVERNANCE_STABILITY;
    }

    @Override
    public DimensionResult analyze(RegistryClient registry, String companyNumber) {
        Optional<JsonNode> officers = registry.getOfficers(companyNumber);
        if (!RegistryJson.hasItems(officers)) {
            return dimension().degraded("Unable to retrieve officer data", List.of());
        }

        LocalDate today = LocalDate.now(clock);
        List<JsonNode> all = RegistryJson.items(officers);
        List<JsonNode> current = all.stream().filter(RegistryJson::isCurrentDirector).toList();
        List<JsonNode> resigned = all.stream().filter(RegistryJson::isResignedDirector).toList();
        if (current.isEmpty()) {
            return dimension().degraded("No current directors found", List.of());
        }

        Facts facts = new Facts();
        List<EvidenceItem> evidence = new ArrayList<>();
        facts.directorCount = current.size();
        evidence.add(EvidenceItem.verified(Severity.NONE, "director_count")
                .description(facts.directorCount + " active director(s)")
                .details(details("count", facts.directorCount))
                .source("officers")
                .build());

        List<LocalDate> directorChanges = new ArrayList<>();
        assessCurrentBoard(current, today, facts, directorChanges, evidence);
        assessResignations(resigned, today, facts, directorChanges, evidence);
        facts.changesLastTwoYears += facts.recentAppointees.size();

        correlateTiming(registry, companyNumber, directorChanges, facts, evidence);
        assessRegisteredOffice(registry, companyNumber, today, facts, evidence);

        return dimension().result(CASCADE.evaluate(facts), evidence, followUps(facts));
    }

    private static void assessCurrentBoard(List<JsonNode> current, LocalDate today, Facts facts,
                                           List<LocalDate> directorChanges, List<EvidenceItem> evidence) {
        List<Double> tenures = new ArrayList<>();
        for (JsonNode d : current) {
            LocalDate appointed = RegistryJson.date(d, "appointed_on");
            if (appointed == null) continue;
            long days = RiskHeuristics.daysBetween(appointed, today);
            tenures.add(days / 365.25);

            if (days >= 0 && days < RECENT_APPOINTMENT_DAYS) {
                String name = RegistryJson.text(d, "name", "?");
                if (facts.recentAppointees.isEmpty()) {
                    facts.firstRecentAppointment = appointed.toString();
                }
                facts.recentAppointees.add(name);
                directorChanges.add(appointed);
                evidence.add(EvidenceItem.verified(Severity.MEDIUM, "recent_appointment")
                        .description("New director " + name + " appointed " + appointed + " (" + days + " days ago)")
                        .details(details("name", name, "appointed_on", appointed.toString(), "days_ago", days))
                        .source("officers")
                        .build());
            }
        }

        if (!tenures.isEmpty()) {
            facts.hasTenures = true;
            facts.averageTenure = tenures.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            evidence.add(EvidenceItem.verified(Severity.NONE, "average_tenure")
                    .description(String.format("Average director tenure: %.1f years", facts.averageTenure))
                    .details(details("average_years", RiskHeuristics.round(facts.averageTenure, 1)))
                    .source("officers")
                    .build());
        }
    }

    private static void assessResignations(List<JsonNode> resigned, LocalDate today, Facts facts,
                                           List<LocalDate> directorChanges, List<EvidenceItem> evidence) {
        int shortTenures = 0;
        for (JsonNode d : resigned) {
            LocalDate resignedOn = RegistryJson.date(d, "resigned_on");
            LocalDate appointedOn = RegistryJson.date(d, "appointed_on");

            if (resignedOn != null && RiskHeuristics.daysBetween(resignedOn, today) < TURNOVER_WINDOW_DAYS) {
                facts.changesLastTwoYears++;
                directorChanges.add(resignedOn);
                evidence.add(EvidenceItem.verified(Severity.LOW, "resignation")
                        .description(RegistryJson.text(d, "name", "?") + " resigned " + resignedOn)
                        .details(details(
                                "name", RegistryJson.text(d, "name"),
                                "resigned_on", resignedOn.toString(),
                                "appointed_on", appointedOn != null ? appointedOn.toString() : null))
                        .source("officers")
                        .build());
            }

            if (appointedOn != null && resignedOn != null) {
                long tenure = RiskHeuristics.daysBetween(appointedOn, resignedOn);
                if (tenure >= 0 && tenure < SHORT_TENURE_DAYS) shortTenures++;
            }
        }

        if (shortTenures >= 3) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "short_tenure_pattern")
                    .description(shortTenures + " former directors served less than 18 months")
                    .details(details("count", shortTenures))
                    .source("officers")
                    .build());
        }
    }

    private static void correlateTiming(RegistryClient registry, String companyNumber, List<LocalDate> directorChanges,
                                        Facts facts, List<EvidenceItem> evidence) {
        List<LocalDate> accountsFilings = new ArrayList<>();
        for (JsonNode f : RegistryJson.items(registry.getFilingHistory(companyNumber))) {
            if (!"accounts".equals(RegistryJson.text(f, "category"))) continue;
            LocalDate filed = RegistryJson.date(f, "date");
            if (filed != null) accountsFilings.add(filed);
        }
        List<LocalDate> recentAccounts = accountsFilings.subList(0, Math.min(5, accountsFilings.size()));

        List<LocalDate> pscChanges = new ArrayList<>();
        for (JsonNode p : RegistryJson.items(registry.getPscs(companyNumber))) {
            LocalDate notified = RegistryJson.date(p, "notified_on");
            LocalDate ceased = RegistryJson.date(p, "ceased_on");
            if (notified != null) pscChanges.add(notified);
            if (ceased != null) pscChanges.add(ceased);
        }

        for (LocalDate change : directorChanges) {
            if (withinWindow(change, recentAccounts)) facts.timingNearAccounts = true;
            if (withinWindow(change, pscChanges)) facts.timingNearPsc = true;
        }

        if (facts.timingNearAccounts) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "timing_near_accounts")
                    .description("Director change within 30 days of accounts filing")
                    .source("officers + filing-history")
                    .build());
        }
        if (facts.timingNearPsc) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "timing_near_psc")
                    .description("Director change within 30 days of PSC change")
                    .source("officers + PSC")
                    .build());
        }
    }

    private static boolean withinWindow(LocalDate date, List<LocalDate> others) {
        return others.stream().anyMatch(o -> Math.abs(RiskHeuristics.daysBetween(date, o)) <= TIMING_WINDOW_DAYS);
    }

    private static void assessRegisteredOffice(RegistryClient registry, String companyNumber, LocalDate today,
                                               Facts facts, List<EvidenceItem> evidence) {
        Optional<JsonNode> office = registry.getRegisteredOffice(companyNumber);
        if (office.isPresent() && RiskHeuristics.isFormationAgentAddress(office.get())) {
            facts.formationAgent = true;
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "formation_agent_address")
                    .description("Registered office is a known formation agent address")
                    .details(details("address", office.get()))
                    .source("registered-office-address")
                    .build());
        }

        for (JsonNode f : RegistryJson.items(registry.getFilingHistory(companyNumber, "address"))) {
            LocalDate filed = RegistryJson.date(f, "date");
            if (filed == null) continue;
            long age = RiskHeuristics.daysBetween(filed, today);
            if (age >= 0 && age < ADDRESS_WINDOW_DAYS) facts.addressChanges++;
        }
        if (facts.addressChanges >= 3) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "address_churn")
                    .description("Registered office changed " + facts.addressChanges + " times in last 3 years")
                    .details(details("count", facts.addressChanges))
                    .source("filing-history")
                    .build());
        }
    }

    private static List<String> followUps(Facts facts) {
        List<String> asks = new ArrayList<>();
        for (String name : facts.recentAppointees) {
            asks.add("What prompted the appointment of " + name + "?");
        }
        if (facts.changesLastTwoYears > 1) asks.add("Why has there been recent board turnover?");
        if (facts.soleDirector()) asks.add("What succession plan exists if the sole director is unavailable?");
        if (facts.formationAgent) {
            asks.add("Why is the registered office at a formation agent rather than the trading address?");
        }
        if (facts.timingNearPsc) asks.add("Why did the director and ownership changes happen at the same time?");
        return asks;
    }
}
