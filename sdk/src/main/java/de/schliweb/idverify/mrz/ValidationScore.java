package de.schliweb.idverify.mrz;

import de.schliweb.idverify.result.ValidationError;

import java.util.ArrayList;
import java.util.List;

/**
 * Check digit results of one TD1 zone.
 *
 * @param documentNumberValid document number check digit matches
 * @param birthDateValid      birth date check digit matches
 * @param expiryDateValid     expiry date check digit matches
 * @param compositeValid      composite check digit matches
 * @param pointsPerCheck      points contributed by each matching check
 * @param lines               the validated (padded) rows
 */
public record ValidationScore(boolean documentNumberValid,
                              boolean birthDateValid,
                              boolean expiryDateValid,
                              boolean compositeValid,
                              int pointsPerCheck,
                              MrzLines lines) {

    public int validCount() {
        int n = 0;
        if (documentNumberValid) n++;
        if (birthDateValid) n++;
        if (expiryDateValid) n++;
        if (compositeValid) n++;
        return n;
    }

    public int total() {
        return validCount() * pointsPerCheck;
    }

    public int maxTotal() {
        return 4 * pointsPerCheck;
    }

    public boolean allValid() {
        return validCount() == 4;
    }

    public List<ValidationError> errors() {
        List<ValidationError> errors = new ArrayList<>(4);
        if (!documentNumberValid) errors.add(ValidationError.MRZ_CHECKSUM_DOCUMENT_NUMBER);
        if (!birthDateValid) errors.add(ValidationError.MRZ_CHECKSUM_BIRTH_DATE);
        if (!expiryDateValid) errors.add(ValidationError.MRZ_CHECKSUM_EXPIRY_DATE);
        if (!compositeValid) errors.add(ValidationError.MRZ_CHECKSUM_COMPOSITE);
        return errors;
    }
}
