package com.example.corprisk.service.analyzer;

import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Rating;
import com.example.corprisk.support.FakeRegistryClient;
import com.example.corprisk.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.corprisk.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GovernanceStabilityAnalyzerTest {

    private static final String CN = "00000001";
    private static final String OFFICERS = "/company/" + CN + "/officers";

    private final FakeRegistryClient registry = new FakeRegistryClient();
    private final GovernanceStabilityAnalyzer analyzer = new GovernanceStabilityAnalyzer(Fixtures.clock());

    private static void assertCatalogTypes(DimensionResult result) {
        for (EvidenceItem e : result.getEvidence()) {
            assertTrue(Dimension.GOVERNANCE_STABILITY.catalog().contains(e.getType()), e.getType());
        }
    }

    @Test
    void cascadeOrder() {
        assertEquals(List.of(
                "high_turnover",
                "change_with_psc",
                "recent_appointment",
                "sole_director",
                "short_average_tenure",
                "formation_agent",
                "address_churn"), GovernanceStabilityAnalyzer.CASCADE.ruleIds());
    }

    @Test
    void missingOfficersDegrades() {
        DimensionResult result = analyzer.analyze(registry, CN);
        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Unable to retrieve officer data", result.getSummary());
    }

    @Test
    void onlyResignedDirectorsDegrades() {
        registry.put(OFFICERS, items(director("FORMER", "f1", "2010-01-01", "2012-01-01")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("No current directors found", result.getSummary());
    }

    @Test
    @DisplayName("A long-serving sole director with nothing else is a key person dependency")
    void soleDirector() {
        registry.put(OFFICERS, items(director("JANE DOE", "jd1", "2018-01-01", null)));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Sole director — key person dependency", result.getRatingLogic());
        assertEquals("Single director — key person risk", result.getSummary());
        assertTrue(result.getWhatToAsk().contains("What succession plan exists if the sole director is unavailable?"));
        assertCatalogTypes(result);
    }

    @Test
    void stableBoardIsClean() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("JOHN ROE", "jr1", "2015-01-01", null)));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.CLEAN, result.getRating());
        assertEquals("Stable board (2 directors, 9.4yr avg tenure)", result.getRatingLogic());
        assertEquals(2, result.evidenceOfType("director_count").get(0).detail("count"));
    }

    @Test
    @DisplayName("Three director changes inside two years are a red flag")
    void highTurnover() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("JOHN ROE", "jr1", "2015-01-01", null),
                director("A ONE", "a1", "2021-01-01", daysAgo(100)),
                director("B TWO", "b2", "2021-01-01", daysAgo(300)),
                director("C THREE", "c3", "2021-01-01", daysAgo(700))));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.RED_FLAG, result.getRating());
        assertEquals("3 director changes in last 2 years", result.getRatingLogic());
        assertEquals(3, result.evidenceOfType("resignation").size());
        assertTrue(result.getWhatToAsk().contains("Why has there been recent board turnover?"));
    }

    @Test
    void shortTenurePattern() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("JOHN ROE", "jr1", "2015-01-01", null),
                director("A ONE", "a1", "2016-01-01", "2016-06-01"),
                director("B TWO", "b2", "2017-01-01", "2017-09-01"),
                director("C THREE", "c3", "2018-01-01", "2019-01-01")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(3, result.evidenceOfType("short_tenure_pattern").get(0).detail("count"));
        assertFalse(result.hasEvidence("resignation"));
    }

    @Test
    void recentAppointmentInvestigates() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("NEW PERSON", "np1", daysAgo(30), null)));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Recent board change: new director appointed " + daysAgo(30), result.getSummary());
        assertEquals(30L, result.evidenceOfType("recent_appointment").get(0).detail("days_ago"));
        assertTrue(result.getWhatToAsk().contains("What prompted the appointment of NEW PERSON?"));
    }

    @Test
    @DisplayName("A same-day director appointment and PSC notification count as coinciding")
    void changeCoincidingWithPsc() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("NEW PERSON", "np1", daysAgo(20), null)));
        registry.put("/company/" + CN + "/persons-with-significant-control",
                items(individualPsc("NEW PERSON", daysAgo(20), "ownership-of-shares-75-to-100-percent")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Director and ownership change at same time", result.getSummary());
        assertTrue(result.hasEvidence("timing_near_psc"));
    }

    @Test
    void changeNearAccountsFilingIsRecorded() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("JOHN ROE", "jr1", "2015-01-01", null),
                director("LEFT EARLY", "le1", "2016-01-01", daysAgo(400))));
        registry.put("/company/" + CN + "/filing-history",
                items(obj("category", "accounts", "type", "AA", "date", daysAgo(410))));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertTrue(result.hasEvidence("timing_near_accounts"));
        assertEquals(Rating.CLEAN, result.getRating());
    }

    @Test
    void formationAgentAddress() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("JOHN ROE", "jr1", "2015-01-01", null)));
        registry.put("/company/" + CN + "/registered-office-address", obj(
                "address_line_1", "20-22 Wenlock Road",
                "locality", "London",
                "postal_code", "N1 7GU"));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Registered office is a formation agent address", result.getSummary());
        assertCatalogTypes(result);
    }

    @Test
    void addressChurn() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", "2015-01-01", null),
                director("JOHN ROE", "jr1", "2015-01-01", null)));
        registry.put("/company/" + CN + "/filing-history?category=address", items(
                obj("category", "address", "type", "AD01", "date", daysAgo(10)),
                obj("category", "address", "type", "AD01", "date", daysAgo(400)),
                obj("category", "address", "type", "AD01", "date", daysAgo(900)),
                obj("category", "address", "type", "AD01", "date", daysAgo(2000))));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals(3, result.evidenceOfType("address_churn").get(0).detail("count"));
    }

    @Test
    void shortAverageTenure() {
        registry.put(OFFICERS, items(
                director("JANE DOE", "jd1", daysAgo(365), null),
                director("JOHN ROE", "jr1", daysAgo(365), null)));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Short average director tenure (1.0 years)", result.getSummary());
    }
}
