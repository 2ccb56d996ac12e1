package de.schliweb.idverify.geometry;

/**
 * Named printed fields of the card, each mapped to a fixed sub-rectangle of the canonical image by
 * {@link RegionTable}.
 */
public enum CardRegion {
    // Front
    DOCUMENT_NUMBER,
    SURNAME,
    GIVEN_NAME,
    BIRTH_DATE,
    SERIAL,
    PHOTO,
    HOLOGRAM,

    // Back
    MRZ,
    MRZ_LINE_1,
    MRZ_LINE_2,
    MRZ_LINE_3,
    CHIP,
    BARCODE;

    public boolean isMrz() {
        return this == MRZ || this == MRZ_LINE_1 || this == MRZ_LINE_2 || this == MRZ_LINE_3;
    }
}
