package de.schliweb.idverify.mrz;

import java.time.LocalDate;

/**
 * Identity data parsed from a TD1 zone. Dates are null when the zone holds no valid date.
 */
public record IdentityFields(String documentType,
                             String issuingCountry,
                             String documentNumber,
                             LocalDate birthDate,
                             String sex,
                             LocalDate expiryDate,
                             String nationality,
                             String nationalId,
                             String surname,
                             String givenNames) {

    /**
     * @return true if the expiry date is known and lies before {@code today}
     */
    public boolean isExpired(LocalDate today) {
        return expiryDate != null && expiryDate.isBefore(today);
    }
}
