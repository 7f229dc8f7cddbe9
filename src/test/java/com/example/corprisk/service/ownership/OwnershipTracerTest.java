package com.example.corprisk.service.ownership;

import com.example.corprisk.model.ownership.HolderKind;
import com.example.corprisk.model.ownership.OwnershipNode;
import com.example.corprisk.model.ownership.OwnershipTrace;
import com.example.corprisk.support.FakeRegistryClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.corprisk.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OwnershipTracerTest {

    private final FakeRegistryClient registry = new FakeRegistryClient();
    private final OwnershipTracer tracer = new OwnershipTracer(3);

    private void owners(String companyNumber, Object... pscs) {
        registry.put("/company/" + companyNumber + "/persons-with-significant-control", items(pscs));
    }

    private static Map<String, Object> ukCorporate(String name, String registration) {
        return corporatePsc(name, registration, "Companies House", "England");
    }

    private long pscFetches(String companyNumber) {
        return registry.callCount("/company/" + companyNumber + "/persons-with-significant-control");
    }

    @Test
    void individualOwnerIsTerminal() {
        owners("00000001", individualPsc("JANE DOE", "2015-01-01", "ownership-of-shares-75-to-100-percent"));

        OwnershipTrace trace = tracer.trace(registry, "00000001");

        assertEquals(1, trace.getLayers().size());
        OwnershipNode jane = trace.getLayers().get(0);
        assertEquals(HolderKind.INDIVIDUAL, jane.getKind());
        assertTrue(jane.isTerminal());
        assertEquals("British", jane.getNationality());
        assertEquals(0, trace.getCorporateLayers());
        assertEquals(List.of("00000001"), trace.getVisitedCompanies());
    }

    @Test
    @DisplayName("A company listed as its own owner is fetched once and marked untraceable")
    void selfReference() {
        owners("00000001", ukCorporate("SELF LTD", "00000001"));

        OwnershipTrace trace = tracer.trace(registry, "00000001");

        OwnershipNode self = trace.getLayers().get(0);
        assertTrue(self.isUntraceable());
        assertTrue(self.getSubLayers().isEmpty());
        assertEquals(1, pscFetches("00000001"));
        assertEquals(List.of("00000001"), trace.getVisitedCompanies());
    }

    @Test
    void ringTerminates() {
        owners("00000001", ukCorporate("B LTD", "00000002"));
        owners("00000002", ukCorporate("A LTD", "00000001"));

        OwnershipTrace trace = tracer.trace(registry, "00000001");

        OwnershipNode b = trace.getLayers().get(0);
        assertFalse(b.isUntraceable());
        assertTrue(b.getSubLayers().get(0).isUntraceable());
        assertEquals(List.of("00000001", "00000002"), trace.getVisitedCompanies());
        assertEquals(1, pscFetches("00000001"));
        assertEquals(1, pscFetches("00000002"));
    }

    @Test
    @DisplayName("Shared parents in a diamond are expanded once and visited lists hold no duplicates")
    void diamondVisitsEachCompanyOnce() {
        owners("00000001", ukCorporate("B LTD", "00000002"), ukCorporate("C LTD", "00000003"));
        owners("00000002", ukCorporate("D LTD", "00000004"));
        owners("00000003", ukCorporate("D LTD", "00000004"));
        owners("00000004", individualPsc("ULTIMATE OWNER", "2010-01-01", "ownership-of-shares-75-to-100-percent"));

        OwnershipTrace trace = tracer.trace(registry, "00000001");

        assertEquals(List.of("00000001", "00000002", "00000004", "00000003"), trace.getVisitedCompanies());
        assertEquals(1, pscFetches("00000004"));
        OwnershipNode viaC = trace.getLayers().get(1).getSubLayers().get(0);
        assertTrue(viaC.isUntraceable());
    }

    @Test
    @DisplayName("Expansion stops below the configured depth")
    void depthBound() {
        OwnershipTracer shallow = new OwnershipTracer(2);
        owners("00000001", ukCorporate("L1 LTD", "00000002"));
        owners("00000002", ukCorporate("L2 LTD", "00000003"));
        owners("00000003", ukCorporate("L3 LTD", "00000004"));
        owners("00000004", ukCorporate("L4 LTD", "00000005"));

        OwnershipTrace trace = shallow.trace(registry, "00000001");

        assertEquals(List.of("00000001", "00000002", "00000003"), trace.getVisitedCompanies());
        assertEquals(0, pscFetches("00000004"));
        OwnershipNode deepest = trace.getLayers().get(0).getSubLayers().get(0).getSubLayers().get(0);
        assertEquals("L3 LTD", deepest.getName());
        assertTrue(deepest.isUntraceable());
        assertEquals(2, deepest.getDepth());
    }

    @Test
    @DisplayName("A corporate holder without a registration number is a foreign leaf")
    void foreignTrustAndUnregisteredAreLeaves() {
        owners("00000001",
                corporatePsc("GMBH HOLDING", "HRB 12345", "Handelsregister", "Germany"),
                obj("name", "FAMILY TRUST", "kind", "legal-person-person-with-significant-control",
                        "natures_of_control", arr("ownership-of-shares-25-to-50-percent")),
                corporatePsc("MYSTERY CO", "", "", ""));

        OwnershipTrace trace = tracer.trace(registry, "00000001");

        OwnershipNode foreign = trace.getLayers().get(0);
        assertTrue(foreign.isForeign());
        assertTrue(foreign.isTerminal());
        assertEquals("Handelsregister Germany", foreign.getJurisdiction());

        OwnershipNode trust = trace.getLayers().get(1);
        assertEquals(HolderKind.LEGAL_PERSON, trust.getKind());
        assertTrue(trust.isTrust());

        OwnershipNode unregistered = trace.getLayers().get(2);
        assertTrue(unregistered.isForeign());
        assertTrue(unregistered.isTerminal());
        assertFalse(unregistered.isUntraceable());
        assertNull(unregistered.getRegistrationNumber());

        assertEquals(2, trace.getForeignCount());
        assertEquals(1, trace.getTrustCount());
        assertEquals(0, trace.getCorporateLayers());
        assertEquals(List.of("00000001"), trace.getVisitedCompanies());
    }

    @Test
    void ceasedHoldersAreSkipped() {
        Map<String, Object> ceased = ukCorporate("OLD PARENT LTD", "00000009");
        ceased.put("ceased_on", "2020-01-01");
        owners("00000001", ceased, individualPsc("JANE DOE", "2020-01-01", "ownership-of-shares-75-to-100-percent"));

        OwnershipTrace trace = tracer.trace(registry, "00000001");

        assertEquals(1, trace.getLayers().size());
        assertEquals(0, pscFetches("00000009"));
    }

    @Test
    void domesticDetection() {
        assertTrue(OwnershipTracer.isDomestic("", "Companies House", ""));
        assertTrue(OwnershipTracer.isDomestic("", "Register of Companies", "United Kingdom"));
        assertTrue(OwnershipTracer.isDomestic("01234567", "", ""));
        assertFalse(OwnershipTracer.isDomestic("HRB 12345", "Handelsregister", "Germany"));
    }
}
