package com.example.corprisk.util;

import java.util.Locale;
import java.util.Optional;

public final class CompanyNumbers {

    private CompanyNumbers() {}

    /**
     * Upper-cases and strips whitespace; all-digit numbers are zero-padded to 8 characters
     * (e.g. {@code 445790} becomes {@code 00445790}). Prefixed numbers such as {@code SC123456}
     * pass through. Empty when the result is not 2..8 characters.
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) return Optional.empty();
        String cn = raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (!cn.matches("[A-Z0-9]*")) return Optional.empty();
        if (!cn.isEmpty() && cn.chars().allMatch(Character::isDigit) && cn.length() < 8) {
            cn = "0".repeat(8 - cn.length()) + cn;
        }
        if (cn.length() < 2 || cn.length() > 8) return Optional.empty();
        return Optional.of(cn);
    }

    /** Eight digits: the shape of an England and Wales registration number. */
    public static boolean isDomesticShape(String registrationNumber) {
        return registrationNumber != null && registrationNumber.matches("\\d{8}");
    }
}
