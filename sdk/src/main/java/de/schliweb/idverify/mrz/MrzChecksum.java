package de.schliweb.idverify.mrz;

/**
 * ICAO 9303 check digit: weighted sum with the repeating weights 7, 3, 1, modulo 10.
 * <p>
 * This class cannot be instantiated.
 */
public final class MrzChecksum {

    private static final int[] WEIGHTS = {7, 3, 1};

    private MrzChecksum() {
        // Utility class, no instances allowed
    }

    /**
     * Numeric value of an MRZ character: digits map to their value, letters to 10..35, the filler
     * and any other character to 0.
     */
    public static int charValue(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'A' && c <= 'Z') return c - 'A' + 10;
        return 0;
    }

    /**
     * Computes the check digit of {@code data}.
     *
     * @param data the checked field, may be empty
     * @return the check digit in [0,9]
     */
    public static int checksum(CharSequence data) {
        int sum = 0;
        for (int i = 0; i < data.length(); i++) {
            sum += charValue(data.charAt(i)) * WEIGHTS[i % 3];
        }
        return sum % 10;
    }

    /**
     * Verifies a declared check digit. The declared character must be a digit; a filler or letter
     * in a check position never validates.
     */
    public static boolean isValid(CharSequence data, char declared) {
        if (!MrzAlphabet.isDigit(declared)) return false;
        return checksum(data) == declared - '0';
    }
}
