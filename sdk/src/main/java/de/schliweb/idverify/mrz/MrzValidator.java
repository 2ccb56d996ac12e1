package de.schliweb.idverify.mrz;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Verifies the four TD1 check digits: document number, birth date, expiry date and composite.
 * <p>
 * Each matching check earns {@value #POINTS_PER_CHECK} points, so a fully valid zone scores
 * {@value #MAX_POINTS}.
 */
public class MrzValidator {
    private static final Logger log = LoggerFactory.getLogger(MrzValidator.class);

    public static final int POINTS_PER_CHECK = 15;
    public static final int MAX_POINTS = 4 * POINTS_PER_CHECK;

    /**
     * Validates up to three rows. Rows are padded or truncated to 30 characters first; missing rows
     * count as empty, so short or empty input yields a zero score instead of an error.
     */
    public ValidationScore validate(List<String> rows) {
        return validate(MrzLines.of(rows));
    }

    public ValidationScore validate(MrzLines lines) {
        String row1 = lines.row1();
        String row2 = lines.row2();

        boolean documentNumber = MrzChecksum.isValid(
                row1.substring(Td1Layout.DOCUMENT_NUMBER_START, Td1Layout.DOCUMENT_NUMBER_END),
                row1.charAt(Td1Layout.DOCUMENT_NUMBER_CHECK));
        boolean birthDate = MrzChecksum.isValid(
                row2.substring(Td1Layout.BIRTH_DATE_START, Td1Layout.BIRTH_DATE_END),
                row2.charAt(Td1Layout.BIRTH_DATE_CHECK));
        boolean expiryDate = MrzChecksum.isValid(
                row2.substring(Td1Layout.EXPIRY_DATE_START, Td1Layout.EXPIRY_DATE_END),
                row2.charAt(Td1Layout.EXPIRY_DATE_CHECK));
        boolean composite = MrzChecksum.isValid(
                Td1Layout.compositeData(row1, row2),
                row2.charAt(Td1Layout.COMPOSITE_CHECK));

        ValidationScore score = new ValidationScore(documentNumber, birthDate, expiryDate, composite,
                POINTS_PER_CHECK, lines);
        log.debug("MRZ checks doc={} birth={} expiry={} composite={}", documentNumber, birthDate, expiryDate, composite);
        return score;
    }
}
