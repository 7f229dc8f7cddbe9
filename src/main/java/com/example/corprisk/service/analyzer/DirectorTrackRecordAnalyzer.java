package com.example.corprisk.service.analyzer;

import com.example.corprisk.config.RegistryProperties;
import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.model.Appointment;
import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Rating;
import com.example.corprisk.model.Severity;
import com.example.corprisk.util.RegistryJson;
import com.example.corprisk.util.RegistryLinks;
import com.example.corprisk.util.RiskHeuristics;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

import static com.example.corprisk.model.EvidenceItem.details;

/**
 * Have these directors been associated with companies that failed?
 * <p>
 * Verified: disqualifications, dissolution rate, appointment churn, insolvency
 * associations and resignations shortly before an insolvency. Inferred: phoenix
 * patterns, where a dissolved company of the same director ceased shortly before the
 * target was incorporated and shares its industry or a similar name.
 */
@Component
public class DirectorTrackRecordAnalyzer implements DimensionAnalyzer {

    static final int MIN_APPOINTMENTS_FOR_DISSOLUTION = 10;
    static final double HIGH_DISSOLUTION_PERCENT = 50.0;
    static final double HIGH_CHURN_PER_YEAR = 3.0;
    static final long PRE_INSOLVENCY_WINDOW_DAYS = 180;
    static final long PHOENIX_WINDOW_DAYS = 365;
    static final double PHOENIX_NAME_SIMILARITY = 0.6;

    private static final Set<String> INSOLVENCY_DATE_TYPES =
            Set.of("wound-up-on", "instrumented-on", "administration-started-on");

    record InsolvencyLink(String director, String companyName) {}

    record PhoenixMatch(String director, String dissolvedCompany, String dissolvedNumber, long gapDays) {}

    static final class Facts {
        String targetName = "";
        int directorCount;
        int disqualified;
        final List<String> highDissolution = new ArrayList<>();
        final List<String> highChurn = new ArrayList<>();
        final List<InsolvencyLink> insolvencies = new ArrayList<>();
        final List<PhoenixMatch> phoenixPatterns = new ArrayList<>();
        int preInsolvencyResignations;
    }

    static final RatingCascade<Facts> CASCADE = RatingCascade.<Facts>builder()
            .rule("disqualified", f -> f.disqualified > 0, Rating.RED_FLAG,
                    f -> f.disqualified + " director(s) formally disqualified",
                    f -> f.disqualified + " director(s) disqualified from acting")
            .rule("high_dissolution", f -> !f.highDissolution.isEmpty(), Rating.RED_FLAG,
                    f -> "Director(s) with >50% dissolution rate: " + String.join(", ", f.highDissolution),
                    f -> "High dissolution rate for " + f.highDissolution.get(0))
            .rule("multiple_insolvencies", f -> f.insolvencies.size() >= 2, Rating.RED_FLAG,
                    f -> "Director(s) associated with " + f.insolvencies.size() + " insolvencies",
                    f -> "Directors linked to " + f.insolvencies.size() + " previous insolvencies")
            .rule("multiple_phoenix", f -> f.phoenixPatterns.size() >= 2, Rating.RED_FLAG,
                    f -> "Multiple phoenix-like patterns detected (" + f.phoenixPatterns.size() + ")",
                    f -> "Multiple phoenix-like patterns detected (inferred)")
            .rule("single_insolvency", f -> f.insolvencies.size() == 1, Rating.INVESTIGATE,
                    f -> "1 insolvency association found",
                    f -> f.insolvencies.get(0).director() + " associated with 1 previous insolvency ("
                            + f.insolvencies.get(0).companyName() + ")")
            .rule("phoenix", f -> !f.phoenixPatterns.isEmpty(), Rating.INVESTIGATE,
                    f -> "Phoenix-like pattern detected (inferred)",
                    f -> "Phoenix-like pattern: " + f.phoenixPatterns.get(0).dissolvedCompany() + " → " + f.targetName)
            .rule("high_churn", f -> !f.highChurn.isEmpty(), Rating.INVESTIGATE,
                    f -> "High appointment churn: " + String.join(", ", f.highChurn),
                    f -> "High appointment churn for " + f.highChurn.get(0))
            .rule("pre_insolvency_resignation", f -> f.preInsolvencyResignations > 0, Rating.INVESTIGATE,
                    f -> "Director resigned within 6 months before insolvency at another company",
                    f -> "Director resigned shortly before another company entered insolvency")
            .otherwise(
                    f -> "No insolvency associations, disqualifications, or concerning patterns found",
                    f -> "All " + f.directorCount + " directors checked — clean track record");

    private final Clock clock;
    private final RegistryLinks links;
    private final int phoenixCandidates;

    public DirectorTrackRecordAnalyzer(Clock clock, RegistryLinks links, RegistryProperties properties) {
        this.clock = clock;
        this.links = links;
        this.phoenixCandidates = properties.analysis().phoenixCandidates();
    }

    @Override
    public Dimension dimension() {
        return Dimension.DIRECTOR_TRACK_RECORD;
    }

    @Override
    public DimensionResult analyze(RegistryClient registry, String companyNumber) {
        Optional<JsonNode> target = registry.getCompany(companyNumber);
        List<String> targetSic = target.map(t -> RegistryJson.strings(t, "sic_codes")).orElse(List.of());
        LocalDate targetIncorporated = target.map(t -> RegistryJson.date(t, "date_of_creation")).orElse(null);

        Optional<JsonNode> officers = registry.getOfficers(companyNumber);
        if (!RegistryJson.hasItems(officers)) {
            return dimension().degraded("Unable to retrieve officer data", List.of());
        }
        List<JsonNode> directors = RegistryJson.currentDirectors(officers);
        if (directors.isEmpty()) {
            return dimension().degraded("No current directors found", List.of());
        }

        Facts facts = new Facts();
        facts.targetName = target.map(t -> RegistryJson.text(t, "company_name")).orElse("");
        facts.directorCount = directors.size();
        LocalDate today = LocalDate.now(clock);
        List<EvidenceItem> evidence = new ArrayList<>();

        for (JsonNode director : directors) {
            String name = RegistryJson.text(director, "name", "Unknown");
            String officerId = RegistryJson.officerId(director);
            if (officerId == null) continue;
            int firstItem = evidence.size();

            checkDisqualifications(registry, officerId, name, facts, evidence);

            Optional<JsonNode> appointmentsPayload = registry.getAppointments(officerId);
            if (!RegistryJson.hasItems(appointmentsPayload)) continue;
            List<Appointment> appointments = RegistryJson.appointments(appointmentsPayload);

            profileDirector(name, officerId, appointments, today, facts, evidence);

            List<Appointment> dissolved = new ArrayList<>();
            for (Appointment appt : appointments) {
                if (companyNumber.equals(appt.companyNumber())) continue;
                if (appt.isAtDissolvedCompany()) {
                    dissolved.add(appt);
                }
                if (RiskHeuristics.INSOLVENCY_STATUSES.contains(appt.companyStatus())) {
                    evidence.add(insolvencyAssociation(registry, name, appt, facts));
                }
            }

            if (targetIncorporated != null && !dissolved.isEmpty()) {
                detectPhoenix(registry, name, dissolved, targetSic, targetIncorporated, facts, evidence);
            }

            boolean hasIssues = evidence.subList(firstItem, evidence.size()).stream()
                    .filter(e -> !"director_profile".equals(e.getType()))
                    .anyMatch(e -> e.getSeverity().atLeast(Severity.MEDIUM));
            if (!hasIssues) {
                evidence.add(EvidenceItem.verified(Severity.NONE, "clean_record")
                        .description(name + " — no insolvencies, disqualifications, or concerning patterns found")
                        .details(details("director_name", name))
                        .source("appointments + disqualified-officers")
                        .build());
            }
        }

        return dimension().result(CASCADE.evaluate(facts), evidence, followUps(facts));
    }

    private void checkDisqualifications(RegistryClient registry, String officerId, String name,
                                        Facts facts, List<EvidenceItem> evidence) {
        List<JsonNode> disqualifications = registry.getDisqualifications(officerId)
                .map(d -> RegistryJson.array(d, "disqualifications"))
                .orElse(List.of());
        if (disqualifications.isEmpty()) return;

        facts.disqualified++;
        for (JsonNode d : disqualifications) {
            String until = RegistryJson.text(d, "disqualified_until", "unknown");
            evidence.add(EvidenceItem.verified(Severity.HIGH, "disqualification")
                    .description(name + " is disqualified until " + until)
                    .details(details(
                            "director_name", name,
                            "reason", RegistryJson.text(d.path("reason"), "description_identifier"),
                            "disqualified_from", RegistryJson.text(d, "disqualified_from"),
                            "disqualified_until", RegistryJson.text(d, "disqualified_until")))
                    .source("disqualified-officers")
                    .build());
        }
    }

    private void profileDirector(String name, String officerId, List<Appointment> appointments, LocalDate today,
                                 Facts facts, List<EvidenceItem> evidence) {
        RiskHeuristics.DissolutionStats stats = RiskHeuristics.dissolutionRate(appointments);
        OptionalDouble medianTenure = RiskHeuristics.medianTenureYears(appointments, today);
        double churn = RiskHeuristics.churnRate(appointments);
        long active = appointments.stream().filter(Appointment::isActive).count();

        evidence.add(EvidenceItem.verified(Severity.NONE, "director_profile")
                .description(String.format("%s: %d lifetime appointments (%d active), %d dissolved (%.0f%%)",
                        name, stats.total(), active, stats.dissolved(), stats.ratePercent()))
                .details(details(
                        "director_name", name,
                        "total_appointments", stats.total(),
                        "active_appointments", active,
                        "dissolved_count", stats.dissolved(),
                        "dissolution_rate", RiskHeuristics.round(stats.ratePercent(), 1),
                        "median_tenure_years", medianTenure.isPresent()
                                ? RiskHeuristics.round(medianTenure.getAsDouble(), 1) : null,
                        "churn_rate", RiskHeuristics.round(churn, 2)))
                .source("appointments")
                .link(links.officer(officerId))
                .build());

        if (stats.total() >= MIN_APPOINTMENTS_FOR_DISSOLUTION && stats.ratePercent() > HIGH_DISSOLUTION_PERCENT) {
            facts.highDissolution.add(name);
            evidence.add(EvidenceItem.verified(Severity.HIGH, "high_dissolution_rate")
                    .description(String.format("%s has %.0f%% dissolution rate across %d companies",
                            name, stats.ratePercent(), stats.total()))
                    .details(details(
                            "director_name", name,
                            "dissolution_rate", RiskHeuristics.round(stats.ratePercent(), 1),
                            "total_companies", stats.total(),
                            "dissolved_companies", stats.dissolved()))
                    .source("appointments")
                    .link(links.officer(officerId))
                    .build());
        }

        if (churn > HIGH_CHURN_PER_YEAR) {
            facts.highChurn.add(name);
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "high_churn")
                    .description(String.format("%s has high appointment churn (%.1f new appointments/year)", name, churn))
                    .details(details("director_name", name, "churn_rate", RiskHeuristics.round(churn, 2)))
                    .source("appointments")
                    .link(links.officer(officerId))
                    .build());
        }
    }

    private EvidenceItem insolvencyAssociation(RegistryClient registry, String name, Appointment appt, Facts facts) {
        String assessment = "Director was present at failure";
        Severity severity = Severity.HIGH;

        if (appt.resignedOn() != null) {
            LocalDate insolvencyDate = firstInsolvencyDate(registry, appt.companyNumber());
            if (insolvencyDate != null) {
                long gap = RiskHeuristics.daysBetween(appt.resignedOn(), insolvencyDate);
                if (gap > 0 && gap < PRE_INSOLVENCY_WINDOW_DAYS) {
                    assessment = "Resigned " + gap + " days before insolvency";
                    facts.preInsolvencyResignations++;
                } else if (gap > 0) {
                    assessment = "Resigned " + gap + " days before insolvency";
                    severity = Severity.MEDIUM;
                }
            }
        }

        facts.insolvencies.add(new InsolvencyLink(name, appt.companyName()));

        String role = "Director from " + (appt.appointedOn() != null ? appt.appointedOn() : "?");
        if (appt.resignedOn() != null) {
            role += " to " + appt.resignedOn();
        }
        return EvidenceItem.verified(severity, "insolvency_association")
                .description(name + " — " + appt.companyName() + " (" + appt.companyNumber() + ") entered "
                        + appt.companyStatus().replace('-', ' '))
                .details(details(
                        "director_name", name,
                        "company_name", appt.companyName(),
                        "company_number", appt.companyNumber(),
                        "director_role", role,
                        "insolvency_type", appt.companyStatus(),
                        "assessment", assessment))
                .source("appointments + insolvency")
                .link(links.company(appt.companyNumber()))
                .build();
    }

    /** Date the first insolvency case started, from its wound-up, instrumented or administration date. */
    private static LocalDate firstInsolvencyDate(RegistryClient registry, String companyNumber) {
        List<JsonNode> cases = registry.getInsolvency(companyNumber)
                .map(p -> RegistryJson.array(p, "cases"))
                .orElse(List.of());
        if (cases.isEmpty()) return null;
        for (JsonNode caseDate : RegistryJson.array(cases.get(0), "dates")) {
            if (INSOLVENCY_DATE_TYPES.contains(RegistryJson.text(caseDate, "type"))) {
                return RegistryJson.date(caseDate, "date");
            }
        }
        return null;
    }

    private void detectPhoenix(RegistryClient registry, String name, List<Appointment> dissolved,
                               List<String> targetSic, LocalDate targetIncorporated,
                               Facts facts, List<EvidenceItem> evidence) {
        for (Appointment dc : dissolved.subList(0, Math.min(phoenixCandidates, dissolved.size()))) {
            Optional<JsonNode> profile = registry.getCompany(dc.companyNumber());
            if (profile.isEmpty()) continue;

            LocalDate ceased = RegistryJson.date(profile.get(), "date_of_cessation");
            if (ceased == null) continue;
            long gap = RiskHeuristics.daysBetween(ceased, targetIncorporated);
            if (gap < 0 || gap > PHOENIX_WINDOW_DAYS) continue;

            boolean sicMatch = RiskHeuristics.codesOverlap(RegistryJson.strings(profile.get(), "sic_codes"), targetSic);
            double similarity = RiskHeuristics.nameSimilarity(dc.companyName(), facts.targetName);
            boolean similarName = similarity > PHOENIX_NAME_SIMILARITY;
            if (!sicMatch && !similarName) continue;

            facts.phoenixPatterns.add(new PhoenixMatch(name, dc.companyName(), dc.companyNumber(), gap));

            List<String> indicators = new ArrayList<>();
            if (sicMatch) indicators.add("same industry (SIC)");
            if (similarName) indicators.add(String.format("similar name (%.0f%%)", similarity * 100));

            evidence.add(EvidenceItem.inferred(facts.phoenixPatterns.size() > 1 ? Severity.HIGH : Severity.MEDIUM,
                            "phoenix_pattern")
                    .description("Phoenix-likelihood: " + dc.companyName() + " dissolved " + ceased + ", "
                            + facts.targetName + " incorporated " + gap + " days later ("
                            + String.join(", ", indicators) + ")")
                    .details(details(
                            "director_name", name,
                            "dissolved_company", dc.companyName(),
                            "dissolved_number", dc.companyNumber(),
                            "dissolved_date", ceased.toString(),
                            "target_incorporated", targetIncorporated.toString(),
                            "gap_days", gap,
                            "sic_match", sicMatch,
                            "name_similarity", RiskHeuristics.round(similarity, 2)))
                    .disclaimer("Cannot verify: asset/staff migration or creditor harm")
                    .source("appointments + company profiles (inferred pattern)")
                    .link(links.company(dc.companyNumber()))
                    .build());
        }
    }

    private static List<String> followUps(Facts facts) {
        List<String> asks = new ArrayList<>();
        for (InsolvencyLink link : facts.insolvencies) {
            asks.add("Ask " + link.director() + " to explain their involvement in " + link.companyName() + "'s insolvency");
        }
        if (!facts.insolvencies.isEmpty()) {
            asks.add("Request the IP's report to check for findings of director misconduct");
            asks.add("Verify whether failures were due to external factors vs. management decisions");
        }
        for (PhoenixMatch match : facts.phoenixPatterns) {
            asks.add("Understand the relationship between " + match.dissolvedCompany() + " and " + facts.targetName);
        }
        return asks;
    }
}
