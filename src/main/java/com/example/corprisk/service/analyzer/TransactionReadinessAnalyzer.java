package com.example.corprisk.service.analyzer;

import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.http.RegistryResult;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.corprisk.model.EvidenceItem.details;

/**
 * How much friction should we expect in executing this deal? Reads the charges register:
 * all-assets floating charges need lender consent, fresh charges and several secured
 * creditors add negotiation steps.
 */
@Component
public class TransactionReadinessAnalyzer implements DimensionAnalyzer {

    static final long RECENT_CHARGE_DAYS = 180;

    static final String ALL_ASSETS_FLAG = "All-assets debenture outstanding";
    static final String RECENT_CHARGE_FLAG = "Charge created in last 6 months";

    static final class Facts {
        int charges;
        int outstanding;
        boolean allAssetsDebenture;
        int recentCharges;
        final Set<String> creditors = new LinkedHashSet<>();

        boolean multipleCreditors() {
            return creditors.size() > 1;
        }

        /** Every friction flag that fired, most severe first. */
        List<String> flags() {
            List<String> flags = new ArrayList<>();
            if (allAssetsDebenture) flags.add(ALL_ASSETS_FLAG);
            if (recentCharges > 0) flags.add(RECENT_CHARGE_FLAG);
            if (multipleCreditors()) flags.add("Multiple secured creditors (" + creditors.size() + ")");
            return flags;
        }

        String flagLogic() {
            return String.join("; ", flags());
        }
    }

    static final RatingCascade<Facts> CASCADE = RatingCascade.<Facts>builder()
            .rule("all_assets_debenture", f -> f.allAssetsDebenture, Rating.INVESTIGATE,
                    Facts::flagLogic, f -> f.flags().get(0))
            .rule("recent_charge", f -> f.recentCharges > 0, Rating.INVESTIGATE,
                    Facts::flagLogic, f -> f.flags().get(0))
            .rule("multiple_creditors", Facts::multipleCreditors, Rating.INVESTIGATE,
                    Facts::flagLogic, f -> f.flags().get(0))
            .otherwise(
                    f -> f.outstanding > 0
                            ? f.outstanding + " outstanding charge(s), no concerning patterns"
                            : "No charges, simple structure",
                    f -> f.outstanding > 0
                            ? f.outstanding + " charge(s) on record, no red flags"
                            : "No charges registered — clean transaction path");

    private final Clock clock;

    public TransactionReadinessAnalyzer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Dimension dimension() {
        return Dimension.TRANSACTION_READINESS;
    }

    @Override
    public DimensionResult analyze(RegistryClient registry, String companyNumber) {
        RegistryResult register = registry.charges(companyNumber);
        if (register.isUnavailable()) {
            return dimension().degraded("Unable to retrieve charges register", List.of());
        }

        LocalDate today = LocalDate.now(clock);
        List<JsonNode> charges = register.payload().map(RegistryJson::items).orElse(List.of());
        List<JsonNode> outstanding = charges.stream()
                .filter(c -> "outstanding".equals(RegistryJson.text(c, "status")))
                .toList();

        Facts facts = new Facts();
        facts.charges = charges.size();
        facts.outstanding = outstanding.size();
        List<EvidenceItem> evidence = new ArrayList<>();

        for (JsonNode c : outstanding) {
            String persons = personsEntitled(c);
            String createdOn = RegistryJson.text(c, "created_on", "?");
            if (RegistryJson.flag(c.path("particulars"), "floating_charge_covers_all")) {
                facts.allAssetsDebenture = true;
                evidence.add(EvidenceItem.verified(Severity.HIGH, "all_assets_debenture")
                        .description("Floating charge covers ALL assets — held by " + persons
                                + ". Lender consent required for sale.")
                        .details(details(
                                "charge_id", RegistryJson.text(c, "charge_number"),
                                "created_on", createdOn,
                                "persons_entitled", persons))
                        .source("charges")
                        .build());
            } else {
                evidence.add(EvidenceItem.verified(Severity.MEDIUM, "outstanding_charge")
                        .description("Charge to " + persons + " (created " + createdOn + ") — OUTSTANDING")
                        .details(details(
                                "created_on", createdOn,
                                "persons_entitled", persons,
                                "description", RegistryJson.text(c.path("particulars"), "description")))
                        .source("charges")
                        .build());
            }
            for (JsonNode p : RegistryJson.array(c, "persons_entitled")) {
                facts.creditors.add(RegistryJson.text(p, "name", "Unknown"));
            }
        }

        for (JsonNode c : charges) {
            LocalDate created = RegistryJson.date(c, "created_on");
            if (created == null || RiskHeuristics.daysBetween(created, today) >= RECENT_CHARGE_DAYS) continue;
            facts.recentCharges++;
            String persons = personsEntitled(c);
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "recent_charge")
                    .description("New charge registered " + created + " to " + persons)
                    .details(details("created_on", created.toString(), "persons_entitled", persons))
                    .source("charges")
                    .build());
        }

        if (facts.multipleCreditors()) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "multiple_creditors")
                    .description(facts.creditors.size() + " secured creditors: " + String.join(", ", facts.creditors))
                    .details(details("creditors", List.copyOf(facts.creditors)))
                    .source("charges")
                    .build());
        }

        if (charges.isEmpty()) {
            evidence.add(EvidenceItem.verified(Severity.NONE, "no_charges")
                    .description("No charges registered against this company")
                    .source("charges")
                    .build());
        }

        return dimension().result(CASCADE.evaluate(facts), evidence, followUps(facts));
    }

    private static String personsEntitled(JsonNode charge) {
        return RegistryJson.array(charge, "persons_entitled").stream()
                .map(p -> RegistryJson.text(p, "name", "Unknown"))
                .collect(Collectors.joining(", "));
    }

    private static List<String> followUps(Facts facts) {
        List<String> asks = new ArrayList<>();
        if (facts.allAssetsDebenture) {
            asks.add("Has the lender been informed of the potential sale? What's their typical consent process?");
        }
        if (facts.recentCharges > 0) {
            asks.add("Why was the recent charge taken out? What were the proceeds used for?");
        }
        if (facts.multipleCreditors()) {
            asks.add("Is there an intercreditor agreement? Understand subordination terms.");
        }
        return asks;
    }
}
