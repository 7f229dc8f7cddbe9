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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.example.corprisk.model.EvidenceItem.details;

/**
 * Do they treat statutory obligations seriously? Reads the profile's overdue flags
 * (always fresh) and the accounts section of the filing history.
 */
@Component
public class FilingDisciplineAnalyzer implements DimensionAnalyzer {

    /** Accounts filings inspected for amendments and reference date changes. */
    static final int RECENT_ACCOUNTS = 10;
    /** Accounts filings inspected for timeliness. */
    static final int TIMELINESS_WINDOW = 5;
    static final long LAST_MINUTE_DAYS = 14;

    static final class Facts {
        boolean accountsOverdue;
        boolean confirmationOverdue;
        int late;
        int lastMinute;
        int amendments;
        int ardChanges;
    }

    static final RatingCascade<Facts> CASCADE = RatingCascade.<Facts>builder()
            .rule("overdue", f -> f.accountsOverdue || f.confirmationOverdue, Rating.RED_FLAG,
                    f -> "Accounts or confirmation statement currently overdue",
                    f -> "Currently overdue on statutory filings")
            .rule("repeated_late", f -> f.late >= 2, Rating.RED_FLAG,
                    f -> f.late + " late filings in recent history",
                    f -> f.late + " accounts filed after deadline")
            .rule("last_minute", f -> f.lastMinute >= 3, Rating.INVESTIGATE,
                    f -> "Pattern of last-minute filings (" + f.lastMinute + " of last " + TIMELINESS_WINDOW + ")",
                    f -> "Consistent pattern of last-minute accounts filings")
            .rule("amendments", f -> f.amendments > 0, Rating.INVESTIGATE,
                    f -> f.amendments + " amended/replacement accounts filed",
                    f -> f.amendments + " amended or replacement accounts on record")
            .rule("ard_changes", f -> f.ardChanges >= 2, Rating.INVESTIGATE,
                    f -> "Multiple accounting reference date changes (" + f.ardChanges + ")",
                    f -> "Accounting reference date changed " + f.ardChanges + " times")
            .otherwise(
                    f -> "Consistent on-time filing with no amendments",
                    f -> "All filings on time with no amendments");

    @Override
    public Dimension dimension() {
        return Dimension.FILING_DISCIPLINE;
    }

    @Override
    public DimensionResult analyze(RegistryClient registry, String companyNumber) {
        Optional<JsonNode> profile = registry.getCompany(companyNumber);
        if (profile.isEmpty()) {
            return dimension().degraded("Unable to retrieve company profile", List.of());
        }

        Facts facts = new Facts();
        List<EvidenceItem> evidence = new ArrayList<>();
        JsonNode accounts = profile.get().path("accounts");
        JsonNode confirmation = profile.get().path("confirmation_statement");
        String companyType = RegistryJson.text(profile.get(), "type", "ltd");

        facts.accountsOverdue = RegistryJson.flag(accounts, "overdue");
        facts.confirmationOverdue = RegistryJson.flag(confirmation, "overdue");

        if (facts.accountsOverdue) {
            String dueOn = RegistryJson.text(accounts.path("next_accounts"), "due_on", "unknown");
            evidence.add(EvidenceItem.verified(Severity.HIGH, "accounts_overdue")
                    .description("Accounts currently OVERDUE (due: " + dueOn + ")")
                    .details(details("due_on", dueOn))
                    .source("company profile")
                    .build());
        }
        if (facts.confirmationOverdue) {
            String nextDue = RegistryJson.text(confirmation, "next_due", "unknown");
            evidence.add(EvidenceItem.verified(Severity.HIGH, "confirmation_overdue")
                    .description("Confirmation statement currently OVERDUE (due: " + nextDue + ")")
                    .details(details("next_due", nextDue))
                    .source("company profile")
                    .build());
        }

        Optional<JsonNode> history = registry.getFilingHistory(companyNumber);
        if (!RegistryJson.hasItems(history)) {
            if (facts.accountsOverdue || facts.confirmationOverdue) {
                return dimension().result(CASCADE.evaluate(facts), evidence, followUps(facts));
            }
            return dimension().degraded("Limited filing history available", evidence);
        }

        List<JsonNode> accountsFilings = RegistryJson.items(history).stream()
                .filter(f -> "accounts".equals(RegistryJson.text(f, "category")))
                .toList();

        for (JsonNode filing : accountsFilings.subList(0, Math.min(RECENT_ACCOUNTS, accountsFilings.size()))) {
            checkCorrections(filing, facts, evidence);
        }
        for (JsonNode filing : accountsFilings.subList(0, Math.min(TIMELINESS_WINDOW, accountsFilings.size()))) {
            checkTimeliness(filing, companyType, facts, evidence);
        }

        if (facts.lastMinute >= 3) {
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "last_minute_pattern")
                    .description(facts.lastMinute + " of last " + TIMELINESS_WINDOW
                            + " accounts filed within final " + LAST_MINUTE_DAYS + " days of deadline")
                    .details(details("count", facts.lastMinute))
                    .source("filing-history")
                    .build());
        }

        return dimension().result(CASCADE.evaluate(facts), evidence, followUps(facts));
    }

    private static void checkCorrections(JsonNode filing, Facts facts, List<EvidenceItem> evidence) {
        String type = RegistryJson.text(filing, "type");
        String date = RegistryJson.text(filing, "date", "?");
        String description = RegistryJson.text(filing, "description");
        String upper = (description + " " + type).toUpperCase(Locale.ROOT);

        if (upper.contains("AMENDED") || upper.contains("REPLACEMENT")) {
            facts.amendments++;
            evidence.add(EvidenceItem.verified(Severity.MEDIUM, "amendment")
                    .description("Amended/replacement accounts filed on " + date)
                    .details(details("type", type, "date", date))
                    .source("filing-history")
                    .build());
        }

        if (isReferenceDateChange(type, description)) {
            facts.ardChanges++;
            evidence.add(EvidenceItem.verified(Severity.LOW, "ard_change")
                    .description("Accounting reference date changed on " + date)
                    .details(details("date", date))
                    .source("filing-history")
                    .build());
        }
    }

    /** AA01 is the change-of-accounting-reference-date form; plain AA is ordinary accounts. */
    static boolean isReferenceDateChange(String type, String description) {
        if ("AA01".equals(type)) return true;
        String d = description.toUpperCase(Locale.ROOT);
        return d.contains("CHANGE OF ACCOUNTING REFERENCE") || d.contains("CHANGE-ACCOUNT-REFERENCE-DATE");
    }

    private static void checkTimeliness(JsonNode filing, String companyType, Facts facts, List<EvidenceItem> evidence) {
        LocalDate madeUp = RegistryJson.date(filing.path("description_values"), "made_up_date");
        LocalDate filedOn = RegistryJson.date(filing, "date");
        if (madeUp == null || filedOn == null) return;

        LocalDate deadline = RiskHeuristics.accountsDeadline(madeUp, companyType);
        long slack = RiskHeuristics.daysBetween(filedOn, deadline);
        if (slack < 0) {
            facts.late++;
            evidence.add(EvidenceItem.verified(Severity.HIGH, "late_filing")
                    .description("Accounts for Y/E " + madeUp + " filed " + (-slack) + " days late")
                    .details(details(
                            "period_end", madeUp.toString(),
                            "filed_on", filedOn.toString(),
                            "deadline", deadline.toString(),
                            "days_late", -slack))
                    .source("filing-history")
                    .build());
        } else if (slack < LAST_MINUTE_DAYS) {
            facts.lastMinute++;
        }
    }

    private static List<String> followUps(Facts facts) {
        List<String> asks = new ArrayList<>();
        if (facts.late > 0) asks.add("Why were accounts filed late? Was this a one-off or systemic?");
        if (facts.amendments > 0) asks.add("What was corrected in the amended accounts?");
        if (facts.ardChanges > 0) asks.add("Why was the accounting reference date changed?");
        if (facts.accountsOverdue) asks.add("When will the overdue accounts be filed?");
        return asks;
    }
}
