package com.example.corprisk.service.analyzer;

import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.EvidenceItem;
import com.example.corprisk.model.Confidence;
import com.example.corprisk.model.Rating;
import com.example.corprisk.model.Severity;
import com.example.corprisk.support.FakeRegistryClient;
import com.example.corprisk.support.Fixtures;
import com.example.corprisk.util.RegistryLinks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.corprisk.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DirectorTrackRecordAnalyzerTest {

    private static final String CN = "00000001";

    private final FakeRegistryClient registry = new FakeRegistryClient();
    private final DirectorTrackRecordAnalyzer analyzer = new DirectorTrackRecordAnalyzer(
            Fixtures.clock(), new RegistryLinks(Fixtures.properties()), Fixtures.properties());

    private void target(String created, String... sic) {
        registry.put("/company/" + CN, profile(CN, "ACME TRADING LIMITED", created, sic));
    }

    private void soleDirector(String officerId, Object... otherAppointments) {
        registry.put("/company/" + CN + "/officers", items(director("JANE DOE", officerId, "2020-01-01", null)));
        List<Object> appts = new ArrayList<>();
        appts.add(appointment(CN, "ACME TRADING LIMITED", "active", "2020-01-01", null));
        appts.addAll(List.of(otherAppointments));
        registry.put("/officers/" + officerId + "/appointments", items(appts.toArray()));
    }

    private static void assertCatalogTypes(DimensionResult result) {
        for (EvidenceItem e : result.getEvidence()) {
            assertTrue(Dimension.DIRECTOR_TRACK_RECORD.catalog().contains(e.getType()), e.getType());
        }
    }

    @Test
    @DisplayName("Rules are evaluated from the most to the least severe finding")
    void cascadeOrder() {
        assertEquals(List.of(
                "disqualified",
                "high_dissolution",
                "multiple_insolvencies",
                "multiple_phoenix",
                "single_insolvency",
                "phoenix",
                "high_churn",
                "pre_insolvency_resignation"), DirectorTrackRecordAnalyzer.CASCADE.ruleIds());
    }

    @Test
    void missingOfficersDegrades() {
        target("2020-01-01", "62020");

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("Unable to retrieve officer data", result.getSummary());
        assertTrue(result.getRatingLogic().startsWith("Insufficient registry data"));
    }

    @Test
    void noCurrentDirectorsDegrades() {
        target("2020-01-01", "62020");
        registry.put("/company/" + CN + "/officers",
                items(director("GONE AWAY", "x1", "2020-01-01", "2021-01-01")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("No current directors found", result.getSummary());
    }

    @Test
    @DisplayName("A director with no history elsewhere gets a profile and a clean record")
    void cleanRecord() {
        target("2020-01-01", "62020");
        soleDirector("jd1");

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.CLEAN, result.getRating());
        assertEquals("All 1 directors checked — clean track record", result.getSummary());
        assertTrue(result.hasEvidence("director_profile"));
        assertTrue(result.hasEvidence("clean_record"));
        assertEquals("https://registry.example/officers/jd1/appointments",
                result.evidenceOfType("director_profile").get(0).getLink());
        assertTrue(result.getWhatToAsk().isEmpty());
        assertCatalogTypes(result);
    }

    @Test
    void disqualifiedDirectorIsRedFlag() {
        target("2020-01-01", "62020");
        soleDirector("jd1");
        registry.put("/disqualified-officers/natural/jd1", obj("disqualifications", arr(obj(
                "disqualified_from", "2022-01-01",
                "disqualified_until", "2027-01-01",
                "reason", obj("description_identifier", "misconduct")))));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.RED_FLAG, result.getRating());
        EvidenceItem item = result.evidenceOfType("disqualification").get(0);
        assertEquals(Severity.HIGH, item.getSeverity());
        assertEquals("2027-01-01", item.detail("disqualified_until"));
        assertFalse(result.hasEvidence("clean_record"));
    }

    @Test
    @DisplayName("More than half of ten or more appointments dissolved is a red flag")
    void highDissolutionRate() {
        target("2020-01-01", "62020");
        List<Object> others = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            String status = i < 6 ? "dissolved" : "active";
            others.add(appointment("1000000" + i, "OTHER " + i + " LTD", status, "201" + i + "-01-01", null));
        }
        soleDirector("jd1", others.toArray());

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.RED_FLAG, result.getRating());
        assertEquals("High dissolution rate for JANE DOE", result.getSummary());
        EvidenceItem item = result.evidenceOfType("high_dissolution_rate").get(0);
        assertEquals(60.0, item.detail("dissolution_rate"));
        assertEquals(10, item.detail("total_companies"));
        assertCatalogTypes(result);
    }

    @Test
    @DisplayName("Dissolved company in the same industry ceasing 100 days before incorporation is an inferred phoenix pattern")
    void phoenixPattern() {
        target("2020-01-01", "62020");
        soleDirector("jd1",
                appointment("00000099", "OLD WIDGETS LIMITED", "dissolved", "2015-01-01", "2019-09-01"));
        registry.put("/company/00000099", obj(
                "company_number", "00000099",
                "company_name", "OLD WIDGETS LIMITED",
                "company_status", "dissolved",
                "date_of_cessation", "2019-09-23",
                "sic_codes", arr("62020")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertTrue(result.getRating().atLeast(Rating.INVESTIGATE));
        assertEquals("Phoenix-like pattern: OLD WIDGETS LIMITED → ACME TRADING LIMITED", result.getSummary());
        EvidenceItem item = result.evidenceOfType("phoenix_pattern").get(0);
        assertEquals(Confidence.INFERRED, item.getConfidence());
        assertEquals(Severity.MEDIUM, item.getSeverity());
        assertNotNull(item.getDisclaimer());
        assertEquals(100L, item.detail("gap_days"));
        assertEquals(true, item.detail("sic_match"));
        assertTrue(result.getWhatToAsk().stream().anyMatch(q -> q.contains("OLD WIDGETS LIMITED")));
        assertFalse(result.hasEvidence("clean_record"));
        assertCatalogTypes(result);
    }

    @Test
    void dissolvedTooLongBeforeIsNotPhoenix() {
        target("2020-01-01", "62020");
        soleDirector("jd1",
                appointment("00000099", "OLD WIDGETS LIMITED", "dissolved", "2010-01-01", "2015-01-01"));
        registry.put("/company/00000099", obj(
                "company_name", "OLD WIDGETS LIMITED",
                "date_of_cessation", "2016-01-01",
                "sic_codes", arr("62020")));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertFalse(result.hasEvidence("phoenix_pattern"));
        assertEquals(Rating.CLEAN, result.getRating());
    }

    @Test
    @DisplayName("One insolvency association investigates; resigning 60 days before is recorded in the assessment")
    void singleInsolvencyWithLateResignation() {
        target("2020-01-01", "62020");
        soleDirector("jd1",
                appointment("00000077", "SUNK LTD", "liquidation", "2016-01-01", "2022-01-01"));
        registry.put("/company/00000077/insolvency", obj("cases", arr(obj(
                "dates", arr(obj("type", "wound-up-on", "date", "2022-03-02"))))));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.INVESTIGATE, result.getRating());
        assertEquals("1 insolvency association found", result.getRatingLogic());
        EvidenceItem item = result.evidenceOfType("insolvency_association").get(0);
        assertEquals(Severity.HIGH, item.getSeverity());
        assertEquals("Resigned 60 days before insolvency", item.detail("assessment"));
        assertTrue(result.getWhatToAsk().contains("Ask JANE DOE to explain their involvement in SUNK LTD's insolvency"));
    }

    @Test
    void insolvencyLongAfterResignationIsMedium() {
        target("2020-01-01", "62020");
        soleDirector("jd1",
                appointment("00000077", "SUNK LTD", "liquidation", "2016-01-01", "2021-01-01"));
        registry.put("/company/00000077/insolvency", obj("cases", arr(obj(
                "dates", arr(obj("type", "wound-up-on", "date", "2022-06-01"))))));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Severity.MEDIUM, result.evidenceOfType("insolvency_association").get(0).getSeverity());
        assertEquals(Rating.INVESTIGATE, result.getRating());
    }

    @Test
    void twoInsolvenciesAreRedFlag() {
        target("2020-01-01", "62020");
        soleDirector("jd1",
                appointment("00000077", "SUNK LTD", "liquidation", "2016-01-01", null),
                appointment("00000078", "SANK LTD", "administration", "2017-01-01", null));

        DimensionResult result = analyzer.analyze(registry, CN);

        assertEquals(Rating.RED_FLAG, result.getRating());
        assertEquals(2, result.evidenceOfType("insolvency_association").size());
        assertEquals("Director was present at failure",
                result.evidenceOfType("insolvency_association").get(0).detail("assessment"));
    }
}
