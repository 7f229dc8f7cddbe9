package com.example.corprisk.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CompanyNumbersTest {

    @Test
    void padsShortNumericNumbers() {
        assertEquals(Optional.of("00445790"), CompanyNumbers.normalize("445790"));
        assertEquals(Optional.of("00445790"), CompanyNumbers.normalize(" 0044 5790 "));
    }

    @Test
    void prefixedNumbersPassThroughUpperCased() {
        assertEquals(Optional.of("SC123456"), CompanyNumbers.normalize("sc123456"));
        assertEquals(Optional.of("OC301234"), CompanyNumbers.normalize("OC301234"));
    }

    @Test
    void rejectsMalformedInput() {
        assertTrue(CompanyNumbers.normalize(null).isEmpty());
        assertTrue(CompanyNumbers.normalize("").isEmpty());
        assertTrue(CompanyNumbers.normalize("A").isEmpty());
        assertTrue(CompanyNumbers.normalize("123456789").isEmpty());
        assertTrue(CompanyNumbers.normalize("12-34").isEmpty());
        assertTrue(CompanyNumbers.normalize("SC1234567").isEmpty());
    }

    @Test
    void domesticShape() {
        assertTrue(CompanyNumbers.isDomesticShape("01234567"));
        assertFalse(CompanyNumbers.isDomesticShape("SC123456"));
        assertFalse(CompanyNumbers.isDomesticShape("HRB 1234"));
        assertFalse(CompanyNumbers.isDomesticShape(null));
    }
}
