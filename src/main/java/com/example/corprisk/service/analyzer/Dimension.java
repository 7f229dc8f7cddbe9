package com.example.corprisk.service.analyzer;

import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Interpretation;
import com.example.corprisk.model.Rating;

import java.util.List;
import java.util.Set;

/**
 * The six risk dimensions. Each constant carries the static descriptor of its analyzer:
 * id, title, the question it answers, interpretive notes and the catalog of evidence
 * types it may emit.
 */
public enum Dimension {

    DIRECTOR_TRACK_RECORD(
            "director_track_record",
            "Director Track Record",
            "Have these directors been associated with companies that failed?",
            new Interpretation(
                    List.of("Past insolvencies may indicate governance issues or value extraction patterns",
                            "Serial director metrics reveal professional track record across companies"),
                    List.of("External market factors or industry downturns beyond director control",
                            "Unlucky timing or legitimate business pivots"),
                    List.of("Director appointments, insolvency records, disqualifications, dissolution rates")),
            null,
            Set.of("disqualification", "director_profile", "high_dissolution_rate", "high_churn",
                    "insolvency_association", "phoenix_pattern", "clean_record")),

    FILING_DISCIPLINE(
            "filing_discipline",
            "Filing Discipline",
            "Do they treat statutory obligations seriously?",
            new Interpretation(
                    List.of("Late filings often correlate with weak finance function or cash constraints",
                            "Amendments may indicate error-prone accounting processes"),
                    List.of("One-off adviser failure or staff turnover",
                            "System migration causing timing issues"),
                    List.of("Filing history, deadline calculations, overdue flags")),
            null,
            Set.of("accounts_overdue", "confirmation_overdue", "amendment", "ard_change",
                    "late_filing", "last_minute_pattern")),

    GOVERNANCE_STABILITY(
            "governance_stability",
            "Governance Stability",
            "Is leadership stable or is there concerning churn?",
            new Interpretation(
                    List.of("High turnover can indicate instability or key person disputes",
                            "Timing correlations with filings may suggest governance concerns"),
                    List.of("Growth-phase restructuring or internationalization",
                            "Planned succession executed smoothly"),
                    List.of("Director tenure, resignation patterns, address changes")),
            null,
            Set.of("director_count", "recent_appointment", "average_tenure", "resignation",
                    "short_tenure_pattern", "timing_near_accounts", "timing_near_psc",
                    "formation_agent_address", "address_churn")),

    CONTROL_NETWORK(
            "control_network",
            "Connected Parties",
            "What does the decision-making network look like?",
            new Interpretation(
                    List.of("Concentrated decision-making can indicate related party risk",
                            "Recent changes may signal ownership restructuring ahead of transactions"),
                    List.of("Efficient family business or founder-led structure",
                            "Planned succession or legitimate group reorganization"),
                    List.of("Director overlaps, PSC records, appointment timing")),
            null,
            Set.of("network_size", "large_network", "decision_concentration", "recent_director",
                    "recent_psc", "psc_activity", "director_network_overlap", "dense_director_network",
                    "director_controls_psc", "clean_network")),

    OWNERSHIP_CLARITY(
            "ownership_clarity",
            "Ownership Clarity",
            "Is it clear who controls this company and why?",
            new Interpretation(
                    List.of("Complex structures may exist for tax or liability reasons worth understanding",
                            "Foreign entities require additional verification steps"),
                    List.of("Legitimate holding structure for group operations",
                            "Legacy cleanup in progress"),
                    List.of("PSC records, ownership chain tracing, corporate layers")),
            "Asset location (IP, property, contracts) cannot be determined from the company registry",
            Set.of("psc_statement", "ownership_structure", "orbit_summary", "orbit_clutter",
                    "individual_psc", "corporate_psc", "trust_psc", "ownership_depth", "psc_churn")),

    TRANSACTION_READINESS(
            "transaction_readiness",
            "Closing Friction",
            "How much friction should we expect in executing this deal?",
            new Interpretation(
                    List.of("Outstanding charges require lender consent for asset transfers",
                            "Multiple creditors may create subordination complexity"),
                    List.of("Routine refinancing or growth financing",
                            "Standard banking relationship with no unusual terms"),
                    List.of("Charges register, floating charge coverage, creditor identification")),
            null,
            Set.of("all_assets_debenture", "outstanding_charge", "recent_charge",
                    "multiple_creditors", "no_charges"));

    private final String id;
    private final String title;
    private final String question;
    private final Interpretation interpretation;
    private final String disclaimer;
    private final Set<String> catalog;

    Dimension(String id, String title, String question, Interpretation interpretation,
              String disclaimer, Set<String> catalog) {
        this.id = id;
        this.title = title;
        this.question = question;
        this.interpretation = interpretation;
        this.disclaimer = disclaimer;
        this.catalog = catalog;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String question() {
        return question;
    }

    /** Evidence types this dimension may emit. */
    public Set<String> catalog() {
        return catalog;
    }

    public DimensionResult result(Verdict verdict, List<EvidenceItem> evidence, List<String> whatToAsk) {
        return skeleton()
                .rating(verdict.rating())
                .ratingLogic(verdict.ratingLogic())
                .summary(verdict.summary())
                .evidence(List.copyOf(evidence))
                .whatToAsk(List.copyOf(whatToAsk))
                .build();
    }

    /** Required upstream data was missing: the gap itself is worth a look. */
    public DimensionResult degraded(String summary, List<EvidenceItem> evidence) {
        return skeleton()
                .rating(Rating.INVESTIGATE)
                .ratingLogic("Insufficient registry data: " + summary)
                .summary(summary)
                .evidence(List.copyOf(evidence))
                .build();
    }

    /** Placeholder for an analyzer that faulted; keeps the slot so "unknown" is not read as "clean". */
    public DimensionResult failed(String error) {
        return skeleton()
                .rating(Rating.INVESTIGATE)
                .ratingLogic("Analysis failed")
                .summary("Analysis failed — unable to complete this dimension")
                .error(error)
                .build();
    }

    private DimensionResult.DimensionResultBuilder skeleton() {
        return DimensionResult.builder()
                .dimension(id)
                .title(title)
                .question(question)
                .interpretation(interpretation)
                .disclaimer(disclaimer);
    }
}
