package de.schliweb.idverify.mrz;

/**
 * Field positions of the 3 x 30 TD1 machine-readable zone (ICAO 9303 part 5).
 * Ranges are half-open {@code [start, end)}, row indices are 0-based.
 */
public final class Td1Layout {

    public static final int ROWS = 3;
    public static final int ROW_LENGTH = 30;

    // Row 1
    public static final int DOCUMENT_TYPE_START = 0;
    public static final int DOCUMENT_TYPE_END = 2;
    public static final int ISSUER_START = 2;
    public static final int ISSUER_END = 5;
    public static final int DOCUMENT_NUMBER_START = 5;
    public static final int DOCUMENT_NUMBER_END = 14;
    public static final int DOCUMENT_NUMBER_CHECK = 14;
    public static final int ROW1_OPTIONAL_START = 15;

    // Row 2
    public static final int BIRTH_DATE_START = 0;
    public static final int BIRTH_DATE_END = 6;
    public static final int BIRTH_DATE_CHECK = 6;
    public static final int SEX = 7;
    public static final int EXPIRY_DATE_START = 8;
    public static final int EXPIRY_DATE_END = 14;
    public static final int EXPIRY_DATE_CHECK = 14;
    public static final int NATIONALITY_START = 15;
    public static final int NATIONALITY_END = 18;
    public static final int NATIONAL_ID_START = 18;
    public static final int NATIONAL_ID_END = 29;
    public static final int COMPOSITE_CHECK = 29;

    private Td1Layout() {
    }

    /**
     * The data covered by the composite check digit: row 1 from the document number to the end,
     * birth date and expiry date with their check digits, and the optional (national id) span.
     */
    public static String compositeData(String row1, String row2) {
        return row1.substring(DOCUMENT_NUMBER_START, ROW_LENGTH)
                + row2.substring(BIRTH_DATE_START, BIRTH_DATE_CHECK + 1)
                + row2.substring(EXPIRY_DATE_START, EXPIRY_DATE_CHECK + 1)
                + row2.substring(NATIONAL_ID_START, NATIONAL_ID_END);
    }
}
