package com.example.corprisk.model;

import java.time.LocalDate;

/**
 * One officer appointment as listed in the officer appointment history.
 * Dates are null when the registry omits or garbles them.
 */
public record Appointment(
        String companyNumber,
        String companyName,
        String companyStatus,
        LocalDate appointedOn,
        LocalDate resignedOn
) {
    public boolean isActive() {
        return resignedOn == null;
    }

    public boolean isAtDissolvedCompany() {
        return "dissolved".equals(companyStatus);
    }
}
