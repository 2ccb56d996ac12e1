package de.schliweb.idverify.mrz;

import java.util.List;

/**
 * The three rows of a TD1 zone, each exactly {@value Td1Layout#ROW_LENGTH} characters.
 * Rows are padded with the filler or truncated on construction, never stored unpadded.
 */
public final class MrzLines {

    private final String row1;
    private final String row2;
    private final String row3;

    public MrzLines(String row1, String row2, String row3) {
        this.row1 = MrzAlphabet.fit(row1, Td1Layout.ROW_LENGTH);
        this.row2 = MrzAlphabet.fit(row2, Td1Layout.ROW_LENGTH);
        this.row3 = MrzAlphabet.fit(row3, Td1Layout.ROW_LENGTH);
    }

    /**
     * Builds the zone from up to three rows. Missing rows become all-filler rows, extra rows are ignored.
     */
    public static MrzLines of(List<String> rows) {
        if (rows == null) rows = List.of();
        String r1 = rows.size() > 0 ? rows.get(0) : "";
        String r2 = rows.size() > 1 ? rows.get(1) : "";
        String r3 = rows.size() > 2 ? rows.get(2) : "";
        return new MrzLines(r1, r2, r3);
    }

    public String row1() {
        return row1;
    }

    public String row2() {
        return row2;
    }

    public String row3() {
        return row3;
    }

    public List<String> rows() {
        return List.of(row1, row2, row3);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MrzLines)) return false;
        MrzLines other = (MrzLines) o;
        return row1.equals(other.row1) && row2.equals(other.row2) && row3.equals(other.row3);
    }

    @Override
    public int hashCode() {
        return (row1.hashCode() * 31 + row2.hashCode()) * 31 + row3.hashCode();
    }

    @Override
    public String toString() {
        return row1 + "\n" + row2 + "\n" + row3;
    }
}
