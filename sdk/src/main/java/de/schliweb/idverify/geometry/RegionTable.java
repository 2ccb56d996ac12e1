package de.schliweb.idverify.geometry;

import de.schliweb.idverify.DocumentSide;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed layout of the Turkish ID-1 card: where each printed field sits on the canonical image.
 * <p>
 * This class cannot be instantiated.
 */
public final class RegionTable {

    private static final Map<CardRegion, RegionSpec> FRONT;
    private static final Map<CardRegion, RegionSpec> BACK;

    static {
        Map<CardRegion, RegionSpec> front = new EnumMap<>(CardRegion.class);
        front.put(CardRegion.DOCUMENT_NUMBER, RegionSpec.field(0.03, 0.20, 0.28, 0.12, false, 15, 8));
        front.put(CardRegion.SURNAME, RegionSpec.field(0.03, 0.38, 0.55, 0.10, false, 21, 5));
        front.put(CardRegion.GIVEN_NAME, RegionSpec.field(0.03, 0.48, 0.55, 0.10, false, 21, 5));
        front.put(CardRegion.BIRTH_DATE, RegionSpec.field(0.03, 0.58, 0.40, 0.10, false, 17, 6));
        front.put(CardRegion.SERIAL, RegionSpec.field(0.03, 0.68, 0.35, 0.10, false, 15, 7));
        front.put(CardRegion.PHOTO, RegionSpec.raw(0.68, 0.18, 0.28, 0.45));
        front.put(CardRegion.HOLOGRAM, RegionSpec.field(0.65, 0.70, 0.32, 0.25, false, 0, 0));
        FRONT = Collections.unmodifiableMap(front);

        Map<CardRegion, RegionSpec> back = new EnumMap<>(CardRegion.class);
        back.put(CardRegion.MRZ, RegionSpec.mrz(0.0, 0.72, 1.0, 0.28));
        back.put(CardRegion.MRZ_LINE_1, RegionSpec.mrz(0.02, 0.73, 0.96, 0.08));
        back.put(CardRegion.MRZ_LINE_2, RegionSpec.mrz(0.02, 0.81, 0.96, 0.08));
        back.put(CardRegion.MRZ_LINE_3, RegionSpec.mrz(0.02, 0.89, 0.96, 0.08));
        back.put(CardRegion.CHIP, RegionSpec.field(0.02, 0.05, 0.20, 0.25, false, 0, 0));
        back.put(CardRegion.BARCODE, RegionSpec.field(0.88, 0.05, 0.10, 0.60, false, 0, 0));
        BACK = Collections.unmodifiableMap(back);
    }

    private RegionTable() {
        // Utility class, no instances allowed
    }

    /**
     * @return the layout entry for the region on the given side, or null if the side has no such field
     */
    public static RegionSpec lookup(CardRegion region, DocumentSide side) {
        return regions(side).get(region);
    }

    /**
     * @return all regions of one side in declaration order
     */
    public static Map<CardRegion, RegionSpec> regions(DocumentSide side) {
        return side == DocumentSide.BACK ? BACK : FRONT;
    }
}
