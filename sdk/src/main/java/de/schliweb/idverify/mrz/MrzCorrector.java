package de.schliweb.idverify.mrz;

import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.nationalid.NationalIdValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Best-effort repair of OCR'd TD1 rows.
 * <p>
 * Five passes, in order:
 * <ol>
 *     <li>map every character onto the MRZ alphabet ({@link MrzAlphabet#canonicalize(String)});</li>
 *     <li>overwrite the positions whose content is fixed for this document: type marker, issuing
 *     country, nationality and the sex marker's allowed values;</li>
 *     <li>apply the letter-to-digit confusion table at every position that can only hold a digit
 *     (dates, national id, check digits);</li>
 *     <li>overwrite the document number and national id with trusted values from a companion read,
 *     when supplied;</li>
 *     <li>pad or truncate every row to 30 characters.</li>
 * </ol>
 * The row 1 optional span is reset to filler only when the composite check fails with it, so a
 * zone carrying optional data in row 1 keeps it.
 * The corrector never invents content: characters without a known confusion are left as read, and
 * check digits are never recomputed. A valid zone passes through unchanged.
 */
public class MrzCorrector {
    private static final Logger log = LoggerFactory.getLogger(MrzCorrector.class);

    private static final int[][] ROW2_NUMERIC = {
            {Td1Layout.BIRTH_DATE_START, Td1Layout.BIRTH_DATE_CHECK + 1},
            {Td1Layout.EXPIRY_DATE_START, Td1Layout.EXPIRY_DATE_CHECK + 1},
            {Td1Layout.NATIONAL_ID_START, Td1Layout.COMPOSITE_CHECK + 1}
    };

    private final String documentType;
    private final String issuingCountry;

    public MrzCorrector(ScannerConfig config) {
        this(config.getDocumentType(), config.getIssuingCountry());
    }

    public MrzCorrector(String documentType, String issuingCountry) {
        this.documentType = MrzAlphabet.fit(documentType.toUpperCase(Locale.ROOT), 2);
        this.issuingCountry = MrzAlphabet.fit(issuingCountry.toUpperCase(Locale.ROOT), 3);
    }

    /**
     * Corrects the rows without companion values.
     */
    public MrzLines correct(List<String> rows) {
        return correct(rows, null, null);
    }

    /**
     * Corrects up to three OCR'd rows.
     * <p>
     * Two rows are taken as rows 2 and 3 (row 1 not read) and a row 1 holding only the constant
     * fields is synthesized. A single row is taken as row 2.
     *
     * @param rows                the rows as read, top to bottom
     * @param knownNationalId     national id from the front side, used only if it passes its own algorithm
     * @param knownDocumentNumber document number from the front side, 1 to 9 alphanumeric characters
     * @return the corrected rows, each exactly 30 characters
     */
    public MrzLines correct(List<String> rows, String knownNationalId, String knownDocumentNumber) {
        String[] raw = arrange(rows);

        StringBuilder[] out = new StringBuilder[Td1Layout.ROWS];
        for (int r = 0; r < Td1Layout.ROWS; r++) {
            // pass 1, padded so the fixed positions exist
            String canonical = MrzAlphabet.canonicalize(raw[r]);
            out[r] = new StringBuilder(MrzAlphabet.fit(canonical, Math.max(canonical.length(), Td1Layout.ROW_LENGTH)));
            raw[r] = raw[r].trim();
        }

        forceConstants(out[0], out[1]);
        forceDigits(out[0], raw[0], Td1Layout.DOCUMENT_NUMBER_CHECK, Td1Layout.DOCUMENT_NUMBER_CHECK + 1);
        for (int[] span : ROW2_NUMERIC) {
            forceDigits(out[1], raw[1], span[0], span[1]);
        }
        injectKnownValues(out[0], out[1], knownNationalId, knownDocumentNumber);
        clearRow1OptionalUnlessConsistent(out[0], out[1]);

        MrzLines corrected = new MrzLines(out[0].toString(), out[1].toString(), out[2].toString());
        log.debug("MRZ corrected:\n{}", corrected);
        return corrected;
    }

    private String[] arrange(List<String> rows) {
        List<String> present = new ArrayList<>();
        if (rows != null) {
            for (String row : rows) {
                if (row != null && !row.trim().isEmpty()) present.add(row);
            }
        }
        String synthesized = documentType + issuingCountry;
        switch (present.size()) {
            case 0:
                return new String[]{synthesized, "", ""};
            case 1:
                return new String[]{synthesized, present.get(0), ""};
            case 2:
                return new String[]{synthesized, present.get(0), present.get(1)};
            default:
                return new String[]{present.get(0), present.get(1), present.get(2)};
        }
    }

    private void forceConstants(StringBuilder row1, StringBuilder row2) {
        row1.replace(Td1Layout.DOCUMENT_TYPE_START, Td1Layout.DOCUMENT_TYPE_END, documentType);
        row1.replace(Td1Layout.ISSUER_START, Td1Layout.ISSUER_END, issuingCountry);
        row2.replace(Td1Layout.NATIONALITY_START, Td1Layout.NATIONALITY_END, issuingCountry);
        char sex = row2.charAt(Td1Layout.SEX);
        if (sex != 'M' && sex != 'F') {
            row2.setCharAt(Td1Layout.SEX, MrzAlphabet.FILLER);
        }
    }

    private static void clearRow1OptionalUnlessConsistent(StringBuilder row1, StringBuilder row2) {
        String r1 = MrzAlphabet.fit(row1.toString(), Td1Layout.ROW_LENGTH);
        if (r1.substring(Td1Layout.ROW1_OPTIONAL_START).chars().allMatch(c -> c == MrzAlphabet.FILLER)) return;
        String r2 = MrzAlphabet.fit(row2.toString(), Td1Layout.ROW_LENGTH);
        if (MrzChecksum.isValid(Td1Layout.compositeData(r1, r2), r2.charAt(Td1Layout.COMPOSITE_CHECK))) return;
        for (int i = Td1Layout.ROW1_OPTIONAL_START; i < Td1Layout.ROW_LENGTH; i++) {
            row1.setCharAt(i, MrzAlphabet.FILLER);
        }
    }

    private static void forceDigits(StringBuilder row, String raw, int start, int end) {
        for (int i = start; i < end; i++) {
            char read = i < raw.length() ? raw.charAt(i) : 0;
            row.setCharAt(i, MrzAlphabet.forceDigit(read, row.charAt(i)));
        }
    }

    private static void injectKnownValues(StringBuilder row1, StringBuilder row2,
                                          String knownNationalId, String knownDocumentNumber) {
        if (knownNationalId != null && NationalIdValidator.isValid(knownNationalId)) {
            String id = NationalIdValidator.normalize(knownNationalId);
            row2.replace(Td1Layout.NATIONAL_ID_START, Td1Layout.NATIONAL_ID_END, id);
        }
        if (knownDocumentNumber != null) {
            String number = knownDocumentNumber.trim().toUpperCase(Locale.ROOT);
            if (number.matches("[A-Z0-9]{1,9}")) {
                int width = Td1Layout.DOCUMENT_NUMBER_END - Td1Layout.DOCUMENT_NUMBER_START;
                row1.replace(Td1Layout.DOCUMENT_NUMBER_START, Td1Layout.DOCUMENT_NUMBER_END, MrzAlphabet.fit(number, width));
            }
        }
    }
}
