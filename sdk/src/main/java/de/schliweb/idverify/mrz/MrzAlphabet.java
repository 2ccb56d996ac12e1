package de.schliweb.idverify.mrz;

import java.util.HashMap;
import java.util.Map;

/**
 * Character handling for the machine-readable zone: the {@code A-Z 0-9 <} alphabet, the mapping of
 * OCR output onto it and the letter-to-digit confusion table for positions that can only hold digits.
 * <p>
 * This class cannot be instantiated.
 */
public final class MrzAlphabet {

    public static final char FILLER = '<';

    // Optical confusions that can be mapped to a letter without guessing
    private static final Map<Character, Character> LETTER_FIXES = new HashMap<>();
    // Letter -> digit for positions known to be numeric; keys are case sensitive
    private static final Map<Character, Character> DIGIT_FIXES = new HashMap<>();

    static {
        LETTER_FIXES.put('|', 'I');
        LETTER_FIXES.put('!', 'I');
        LETTER_FIXES.put('İ', 'I');
        LETTER_FIXES.put('ı', 'I');
        LETTER_FIXES.put('Ş', 'S');
        LETTER_FIXES.put('ş', 'S');
        LETTER_FIXES.put('Ğ', 'G');
        LETTER_FIXES.put('ğ', 'G');
        LETTER_FIXES.put('Ü', 'U');
        LETTER_FIXES.put('ü', 'U');
        LETTER_FIXES.put('Ö', 'O');
        LETTER_FIXES.put('ö', 'O');
        LETTER_FIXES.put('Ç', 'C');
        LETTER_FIXES.put('ç', 'C');

        DIGIT_FIXES.put('O', '0');
        DIGIT_FIXES.put('Q', '0');
        DIGIT_FIXES.put('I', '1');
        DIGIT_FIXES.put('L', '1');
        DIGIT_FIXES.put('|', '1');
        DIGIT_FIXES.put('Z', '2');
        DIGIT_FIXES.put('E', '3');
        DIGIT_FIXES.put('A', '4');
        DIGIT_FIXES.put('S', '5');
        DIGIT_FIXES.put('G', '6');
        DIGIT_FIXES.put('b', '6');
        DIGIT_FIXES.put('T', '7');
        DIGIT_FIXES.put('B', '8');
        DIGIT_FIXES.put('g', '9');
        DIGIT_FIXES.put('q', '9');
    }

    private MrzAlphabet() {
        // Utility class, no instances allowed
    }

    public static boolean isMrzChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == FILLER;
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Maps a single OCR character onto the MRZ alphabet.
     * Lower case letters are upper-cased, obvious optical confusions are fixed and anything else,
     * including separators such as space, dash, underscore or period, becomes the filler.
     */
    public static char canonical(char c) {
        if (isMrzChar(c)) return c;
        Character fixed = LETTER_FIXES.get(c);
        if (fixed != null) return fixed;
        if (c >= 'a' && c <= 'z') return Character.toUpperCase(c);
        return FILLER;
    }

    /**
     * Maps every character of a trimmed OCR line onto the MRZ alphabet. The result has the same
     * length as the trimmed input, so positions stay aligned with the raw read.
     *
     * @param raw an OCR line, may be null
     * @return the canonical line, empty for null input
     */
    public static String canonicalize(String raw) {
        if (raw == null) return "";
        String trimmed = raw.trim();
        StringBuilder sb = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            sb.append(canonical(trimmed.charAt(i)));
        }
        return sb.toString();
    }

    /**
     * Resolves a character at a position that can only hold a digit.
     * The raw read is consulted first so that lower case confusions ({@code g}, {@code q}, {@code b})
     * are still recognized after canonicalization. Characters without a known confusion are kept.
     *
     * @param raw       the character as read by OCR, or 0 if unknown
     * @param canonical the canonicalized character at the same position
     * @return a digit when the confusion is known, otherwise {@code canonical}
     */
    public static char forceDigit(char raw, char canonical) {
        if (isDigit(canonical) || canonical == FILLER) {
            return canonical;
        }
        Character fromRaw = DIGIT_FIXES.get(raw);
        if (fromRaw != null) return fromRaw;
        Character fromCanonical = DIGIT_FIXES.get(canonical);
        return fromCanonical != null ? fromCanonical : canonical;
    }

    /**
     * Pads with the filler or truncates to exactly {@code length} characters.
     */
    public static String fit(String s, int length) {
        String v = s == null ? "" : s;
        if (v.length() >= length) return v.substring(0, length);
        StringBuilder sb = new StringBuilder(length).append(v);
        while (sb.length() < length) sb.append(FILLER);
        return sb.toString();
    }
}
