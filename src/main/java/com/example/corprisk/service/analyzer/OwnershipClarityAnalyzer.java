package com.example.corprisk.service.analyzer;

import com.example.corprisk.config.RegistryProperties;
import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Rating;
import com.example.corprisk.model.Severity;
import com.example.corprisk.model.ownership.HolderKind;
import com.example.corprisk.model.ownership.OwnershipNode;
import com.example.corprisk.model.ownership.OwnershipTrace;
import com.example.corprisk.service.ownership.OwnershipTracer;
import com.example.corprisk.util.RegistryJson;
import com.example.corprisk.util.RegistryLinks;
import com.example.corprisk.util.RiskHeuristics;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.corprisk.model.EvidenceItem.details;

/**
 * Is it clear who controls this company and why? Looks at control statements, the
 * traced ownership chain, each active control-holder, control-holder churn, and the
 * dormant or dissolved clutter among companies one hop away.
 */
@Component
public class OwnershipClarityAnalyzer implements DimensionAnalyzer {

    static final Set<String> PROBLEMATIC_STATEMENTS = Set.of(
            "psc-exists-but-not-identified",
            "psc-details-not-confirmed",
            "steps-to-find-psc-not-yet-completed");

    static final int ORBIT_CLUTTER = 5;
    static final int COMPLEX_LAYERS = 3;
    static final long CHURN_WINDOW_DAYS = 730;

    record Orbit(int total, int sampled, int active, int dormant, int dissolved) {
        int clutter() {
            return dormant + dissolved;
        }
    }

    static final class Facts {
        boolean problematicStatement;
        int orbitClutter;
        final List<String> foreignEntities = new ArrayList<>();
        int trusts;
        int corporateLayers;
        int recentCeased;
        int activePscs;
        final List<String> individualNames = new ArrayList<>();
    }

    static final RatingCascade<Facts> CASCADE = RatingCascade.<Facts>builder()
            .rule("problematic_statement", f -> f.problematicStatement, Rating.RED_FLAG,
                    f -> "PSC statement indicates unidentified controller",
                    f -> "Company has unidentified person(s) with significant control")
            .rule("orbit_clutter", f -> f.orbitClutter >= ORBIT_CLUTTER, Rating.INVESTIGATE,
                    f -> f.orbitClutter + " dormant/dissolved entities in orbit",
                    f -> f.orbitClutter + " dormant/dissolved entities connected to this company")
            .rule("foreign_entity", f -> !f.foreignEntities.isEmpty(), Rating.INVESTIGATE,
                    f -> "Foreign entity in ownership chain: " + String.join(", ",
                            f.foreignEntities.subList(0, Math.min(2, f.foreignEntities.size()))),
                    f -> "Foreign entity in ownership: " + f.foreignEntities.get(0))
            .rule("trust", f -> f.trusts > 0, Rating.INVESTIGATE,
                    f -> "Trust/legal person in ownership chain",
                    f -> "Trust or legal person in ownership structure")
            .rule("complex_structure", f -> f.corporateLayers >= COMPLEX_LAYERS, Rating.INVESTIGATE,
                    f -> f.corporateLayers + "+ corporate layers in ownership",
                    f -> "Complex " + (f.corporateLayers + 1) + "-layer ownership structure")
            .rule("psc_churn", f -> f.recentCeased >= 2, Rating.INVESTIGATE,
                    f -> f.recentCeased + " PSC changes in last 2 years",
                    f -> "Ownership changed " + f.recentCeased + " times in 2 years")
            .otherwise(OwnershipClarityAnalyzer::cleanLogic, OwnershipClarityAnalyzer::cleanSummary);

    private static String cleanLogic(Facts f) {
        if (f.activePscs == 0) return "No PSC data available";
        return f.individualNames.isEmpty() ? "Ownership structure traceable" : "Direct individual ownership";
    }

    private static String cleanSummary(Facts f) {
        if (f.activePscs == 0) return "No PSC information on record";
        if (f.individualNames.isEmpty()) return "Ownership structure is traceable";
        return "Clear ownership: " + String.join(", ", f.individualNames.subList(0, Math.min(2, f.individualNames.size())));
    }

    private final Clock clock;
    private final RegistryLinks links;
    private final OwnershipTracer tracer;
    private final int orbitSampleSize;
    private final int orbitDirectorSample;

    public OwnershipClarityAnalyzer(Clock clock, RegistryLinks links, OwnershipTracer tracer,
                                    RegistryProperties properties) {
        this.clock = clock;
        this.links = links;
        this.tracer = tracer;
        this.orbitSampleSize = properties.analysis().orbitSampleSize();
        this.orbitDirectorSample = properties.analysis().orbitDirectorSample();
    }

    @Override
    public Dimension dimension() {
        return Dimension.OWNERSHIP_CLARITY;
    }

    @Override
    public DimensionResult analyze(RegistryClient registry, String companyNumber) {
        LocalDate today = LocalDate.now(clock);
        List<JsonNode> directors = RegistryJson.currentDirectors(registry.getOfficers(companyNumber));
        List<JsonNode> pscs = RegistryJson.items(registry.getPscs(companyNumber));
        List<JsonNode> statements = RegistryJson.items(registry.getPscStatements(companyNumber));
        List<JsonNode> active = pscs.stream().filter(p -> !RegistryJson.isCeased(p)).toList();

        Facts facts = new Facts();
        facts.activePscs = active.size();
        List<EvidenceItem> evidence = new ArrayList<>();

        for (JsonNode s : statements) {
            if (RegistryJson.isCeased(s)) continue;
            String statement = RegistryJson.text(s, "statement");
            if (!PROBLEMATIC_STATEMENTS.contains(statement)) continue;
            facts.problematicStatement = true;
            evidence.add(EvidenceItem.verified(Severity.HIGH, "psc_statement")
                    .description("PSC statement filed: '" + statement.replace('-', ' ') + "'")
                    .details(details("statement", statement))
                    .source("PSC statements")
                    .build());
        }

        OwnershipTrace trace = tracer.trace(registry, companyNumber);
        facts.corporateLayers = trace.getCorporateLayers();
        facts.trusts = trace.getTrustCount();
        trace.getForeignEntities().forEach(n -> facts.foreignEntities.add(n.getName()));

        Orbit orbit = orbit(registry, companyNumber, pscs, directors);
        facts.orbitClutter = orbit.clutter();
        evidence.add(EvidenceItem.verified(Severity.NONE, "orbit_summary")
                .description("Orbit includes " + orbit.total() + " connected companies (" + orbit.active() + " active, "
                        + orbit.dormant() + " dormant, " + orbit.dissolved() + " dissolved)")
                .details(details(
                        "total", orbit.total(),
                        "sampled", orbit.sampled(),
                        "active", orbit.active(),
                        "dormant", orbit.dormant(),
                        "dissolved", orbit.dissolved()))
                .source("PSC + appointments")
                .build());
        if (orbit.clutter() >= ORBIT_CLUTTER) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "orbit_clutter")
                    .description(orbit.clutter() + " dormant/dissolved entities in orbit — may indicate complexity"
                            + " or legacy cleanup needed")
                    .details(details("dormant", orbit.dormant(), "dissolved", orbit.dissolved()))
                    .source("PSC + appointments")
                    .build());
        }

        for (JsonNode psc : active) {
            describeHolder(psc, facts, evidence);
        }

        if (facts.corporateLayers > 0) {
            evidence.add(EvidenceItem.verified(facts.corporateLayers == 1 ? Severity.LOW : Severity.MEDIUM,
                            "ownership_depth")
                    .description((facts.corporateLayers + 1) + "-layer ownership structure (including target)")
                    .details(details(
                            "corporate_layers", facts.corporateLayers,
                            "foreign_count", trace.getForeignCount(),
                            "trust_count", facts.trusts,
                            "max_depth", trace.getMaxDepth()))
                    .source("recursive PSC tracing")
                    .build());
        }

        for (JsonNode p : pscs) {
            LocalDate ceased = RegistryJson.date(p, "ceased_on");
            if (ceased == null) continue;
            long age = RiskHeuristics.daysBetween(ceased, today);
            if (age >= 0 && age < CHURN_WINDOW_DAYS) facts.recentCeased++;
        }
        if (facts.recentCeased >= 2) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "psc_churn")
                    .description(facts.recentCeased + " PSC changes in last 2 years")
                    .details(details("count", facts.recentCeased))
                    .source("PSC endpoint")
                    .build());
        }

        if (!trace.getLayers().isEmpty()) {
            evidence.add(EvidenceItem.verified(Severity.NONE, "ownership_structure")
                    .description("Ownership traced through " + trace.getVisitedCompanies().size() + " compan"
                            + (trace.getVisitedCompanies().size() == 1 ? "y" : "ies"))
                    .details(details("layers", trace.getLayers(), "visited", trace.getVisitedCompanies()))
                    .source("recursive PSC tracing")
                    .build());
        }

        return dimension().result(CASCADE.evaluate(facts), evidence, followUps(facts));
    }

    private void describeHolder(JsonNode psc, Facts facts, List<EvidenceItem> evidence) {
        String name = RegistryJson.text(psc, "name", "Unknown");
        List<String> natures = RegistryJson.strings(psc, "natures_of_control");
        String control = natures.stream().limit(2).map(n -> n.replace('-', ' ')).collect(Collectors.joining(", "));

        switch (HolderKind.fromKind(RegistryJson.text(psc, "kind"))) {
            case INDIVIDUAL:
                facts.individualNames.add(name);
                evidence.add(EvidenceItem.verified(Severity.NONE, "individual_psc")
                        .description(name + " (" + RegistryJson.text(psc, "nationality", "Unknown nationality") + ") — "
                                + control)
                        .details(details(
                                "name", name,
                                "nationality", RegistryJson.text(psc, "nationality"),
                                "control", natures))
                        .source("PSC endpoint")
                        .build());
                break;
            case CORPORATE:
                JsonNode ident = psc.path("identification");
                String jurisdiction = (RegistryJson.text(ident, "place_registered") + " "
                        + RegistryJson.text(ident, "country_registered")).trim();
                String reg = RegistryJson.text(ident, "registration_number");
                boolean offshore = !jurisdiction.isEmpty() && !jurisdiction.toLowerCase(Locale.ROOT).contains("england");
                evidence.add(EvidenceItem.verified(offshore ? Severity.MEDIUM : Severity.LOW, "corporate_psc")
                        .description(name + " (" + (jurisdiction.isEmpty() ? "UK" : jurisdiction)
                                + (reg.isEmpty() ? "" : ", " + reg) + ") — " + control)
                        .details(details(
                                "name", name,
                                "registration_number", reg,
                                "jurisdiction", jurisdiction,
                                "control", natures))
                        .source("PSC endpoint")
                        .link(!reg.isEmpty() && reg.chars().allMatch(Character::isDigit) ? links.company(reg) : "")
                        .build());
                break;
            case LEGAL_PERSON:
                evidence.add(EvidenceItem.verified(Severity.MEDIUM, "trust_psc")
                        .description(name + " (trust/legal person) — " + control)
                        .details(details("name", name, "control", natures))
                        .source("PSC endpoint")
                        .build());
                break;
            default:
                break;
        }
    }

    /**
     * Companies one hop away through corporate control-holders and the appointments of
     * the first few directors; a bounded sample of them is classified by profile.
     */
    Orbit orbit(RegistryClient registry, String companyNumber, List<JsonNode> pscs, List<JsonNode> directors) {
        Set<String> companies = new LinkedHashSet<>();
        for (JsonNode psc : pscs) {
            if (HolderKind.fromKind(RegistryJson.text(psc, "kind")) != HolderKind.CORPORATE) continue;
            String reg = RegistryJson.text(psc.path("identification"), "registration_number");
            if (!reg.isEmpty()) companies.add(reg);
        }
        for (JsonNode d : directors.subList(0, Math.min(orbitDirectorSample, directors.size()))) {
            String officerId = RegistryJson.officerId(d);
            if (officerId == null) continue;
            for (var appt : RegistryJson.appointments(registry.getAppointments(officerId))) {
                if (!appt.companyNumber().isEmpty() && !appt.companyNumber().equals(companyNumber)) {
                    companies.add(appt.companyNumber());
                }
            }
        }

        int active = 0;
        int dormant = 0;
        int dissolved = 0;
        int sampled = 0;
        for (String cn : companies) {
            if (sampled++ >= orbitSampleSize) break;
            Optional<JsonNode> profile = registry.getCompany(cn);
            if (profile.isEmpty()) continue;
            String status = RegistryJson.text(profile.get(), "company_status");
            if ("dissolved".equals(status)) {
                dissolved++;
            } else if ("active".equals(status) && isDormant(profile.get())) {
                dormant++;
            } else {
                active++;
            }
        }
        return new Orbit(companies.size(), Math.min(companies.size(), orbitSampleSize), active, dormant, dissolved);
    }

    private static boolean isDormant(JsonNode profile) {
        return RegistryJson.flag(profile, "has_been_liquidated")
                || RegistryJson.text(profile, "type").toLowerCase(Locale.ROOT).contains("dormant");
    }

    private static List<String> followUps(Facts facts) {
        List<String> asks = new ArrayList<>();
        for (String name : facts.foreignEntities) {
            asks.add("Who is the ultimate beneficial owner of " + name + "?");
        }
        if (facts.trusts > 0) asks.add("Can we see the trust deed?");
        if (facts.corporateLayers > 0) {
            asks.add("Why is ownership structured through holding companies rather than directly?");
        }
        if (facts.recentCeased >= 2) asks.add("What prompted the recent ownership changes?");
        if (facts.orbitClutter >= ORBIT_CLUTTER) {
            asks.add("Are there plans to clean up dormant/dissolved entities in the group?");
        }
        return asks;
    }
}
