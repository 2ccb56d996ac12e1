package de.schliweb.idverify.ocr;

import de.schliweb.idverify.geometry.CardRegion;

/**
 * Character whitelists per card region, used to restrict the recognizer's alphabet and reduce
 * confusions on fields with a known character class.
 * <p>
 * This class is not intended to be instantiated.
 */
public final class RegionWhitelist {

    public static final String DIGITS = "0123456789";

    // Turkish uppercase alphabet
    public static final String TR_UPPER = "ABCÇDEFGĞHIİJKLMNOÖPRSŞTUÜVYZ";

    public static final String LATIN_UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    public static final String MRZ = LATIN_UPPER + DIGITS + "<";

    public static final String NAME = TR_UPPER + "QWX -";

    public static final String DATE = DIGITS + "./";

    public static final String SERIAL = LATIN_UPPER + DIGITS;

    private RegionWhitelist() {
    }

    /**
     * Returns the whitelist of allowed characters for a card region.
     *
     * @param region The region to be read. When null (a whole card) or a region without text, no
     *               restriction applies.
     * @return the allowed characters, or null if the recognizer should read unrestricted
     */
    public static String forRegion(CardRegion region) {
        if (region == null) return null;
        switch (region) {
            case DOCUMENT_NUMBER:
                return DIGITS;
            case SURNAME:
            case GIVEN_NAME:
                return NAME;
            case BIRTH_DATE:
                return DATE;
            case SERIAL:
                return SERIAL;
            case MRZ:
            case MRZ_LINE_1:
            case MRZ_LINE_2:
            case MRZ_LINE_3:
                return MRZ;
            default:
                return null;
        }
    }
}
