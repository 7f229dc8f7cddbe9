package com.example.corprisk.service.analyzer;

import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Rating;
import com.example.corprisk.model.Severity;
import com.example.corprisk.support.FakeRegistryClient;
import com.example.corprisk.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.corprisk.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TransactionReadinessAnalyzerTest {

    private static final String CN = "00000001";
    private static final String CHARGES = "/company/" + CN + "/charges";

    private final FakeRegistryClient registry = new FakeRegistryClient();
    private final TransactionReadinessAnalyzer analyzer = new TransactionReadinessAnalyzer(Fixtures.clock());

    private static Map<String, Object> charge(String number, String status, String createdOn, boolean allAssets,
                                              String... lenders) {
        Object[] persons = new Object[lenders.length];
        for (int i = 0; i < lenders.length; i++) {
            persons[i] = obj("name", lenders[i]);
        }
        return obj(
                "charge_number", number,
                "status", status,
                "created_on", createdOn,
                "persons_entitled", arr(persons),
                "particulars", obj("floating_charge_covers_all", allAssets, "description", "Fixed and floating charge"));
    }

    @Test
    void cascadeOrder() {
        assertEquals(List.of("all_assets_debenture", "recent_charge", "multiple_creditors"),
                TransactionReadinessAnalyzer.CASCADE.ruleIds());
    }

    @Test
    @DisplayName("A 404 charges register means no charges, not missing data")
    void noChargesRegister() {
        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.CLEAN, result.getRating());
        assertEquals("No charges registered — clean transaction path", result.getSummary());
        assertTrue(result.hasEvidence("no_charges"));
    }

    @Test
    void unavailableRegisterDegrades() {
        registry.unavailable(CHARGES);

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Unable to retrieve charges register", result.getSummary());
    }

    @Test
    @DisplayName("Every friction flag is listed in the logic; the first one is the summary")
    void allFlagsJoined() {
        registry.put(CHARGES, items(
                charge("1", "outstanding", daysAgo(30), true, "BIG BANK PLC"),
                charge("2", "outstanding", "2018-01-01", false, "OTHER LENDER LTD")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("All-assets debenture outstanding; Charge created in last 6 months; Multiple secured creditors (2)",
                result.getRatingLogic());
        assertEquals("All-assets debenture outstanding", result.getSummary());
        assertEquals(Severity.HIGH, result.evidenceOfType("all_assets_debenture").get(0).getSeverity());
        assertEquals(1, result.evidenceOfType("outstanding_charge").size());
        assertEquals(3, result.getWhatToAsk().size());
        for (EvidenceItem e : result.getEvidence()) {
            assertTrue(Dimension.TRANSACTION_READINESS.catalog().contains(e.getType()), e.getType());
        }
    }

    @Test
    void recentSatisfiedChargeStillCounts() {
        registry.put(CHARGES, items(charge("1", "fully-satisfied", daysAgo(60), false, "BIG BANK PLC")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Charge created in last 6 months", result.getSummary());
        assertFalse(result.hasEvidence("outstanding_charge"));
    }

    @Test
    void oldSingleChargeIsClean() {
        registry.put(CHARGES, items(charge("1", "outstanding", "2019-01-01", false, "BIG BANK PLC")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.CLEAN, result.getRating());
        assertEquals("1 outstanding charge(s), no concerning patterns", result.getRatingLogic());
        assertEquals("BIG BANK PLC", result.evidenceOfType("outstanding_charge").get(0).detail("persons_entitled"));
    }
}
