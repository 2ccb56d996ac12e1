package de.schliweb.idverify.mrz;

import de.schliweb.idverify.result.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Picks the MRZ rows out of raw OCR lines and scores how well they match the TD1 structure.
 * <p>
 * Score (0..20): row count 8 for three rows, 6 for two, 3 for one; row length 6 when every row is
 * exactly 30 characters, 3 when at least one is; character set 3 when every row uses only
 * {@code A-Z 0-9 <}; filler ratio 3 when the share of {@code <} lies between 15% and 40%.
 */
public class MrzStructureAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(MrzStructureAnalyzer.class);

    public static final int MAX_SCORE = 20;

    private static final int MIN_LINE_LENGTH = 15;
    private static final double MIN_VALID_RATIO = 0.6;
    private static final double MIN_UPPER_RATIO = 0.7;
    private static final double MIN_FILLER_RATIO = 0.15;
    private static final double MAX_FILLER_RATIO = 0.40;
    private static final int FALLBACK_CAP = 10;

    /**
     * Selects up to three MRZ rows and scores their structure.
     *
     * @param ocrLines recognized lines in reading order, may be null or contain blanks
     * @return the structure, with {@link ValidationError#MRZ_NOT_FOUND} when no row was found
     */
    public MrzStructure analyze(List<String> ocrLines) {
        List<String> candidates = new ArrayList<>();
        List<String> fallback = new ArrayList<>();
        if (ocrLines != null) {
            for (String line : ocrLines) {
                if (line == null) continue;
                String trimmed = line.trim();
                if (trimmed.length() < MIN_LINE_LENGTH) continue;
                if (looksLikeMrz(trimmed)) {
                    candidates.add(trimmed);
                } else if (upperRatio(trimmed) > MIN_UPPER_RATIO) {
                    fallback.add(trimmed);
                }
            }
        }

        boolean usedFallback = candidates.isEmpty() && !fallback.isEmpty();
        List<String> rows = lastThree(usedFallback ? fallback : candidates);
        if (rows.isEmpty()) {
            return new MrzStructure(rows, 0, List.of(ValidationError.MRZ_NOT_FOUND), false);
        }

        List<ValidationError> errors = new ArrayList<>();
        int score = 0;

        if (rows.size() == Td1Layout.ROWS) {
            score += 8;
        } else {
            score += rows.size() == 2 ? 6 : 3;
            errors.add(ValidationError.MRZ_ROW_COUNT);
        }

        int exact = 0;
        int fillers = 0;
        int chars = 0;
        boolean charsetOk = true;
        for (String row : rows) {
            String upper = row.toUpperCase(Locale.ROOT);
            if (upper.length() == Td1Layout.ROW_LENGTH) exact++;
            for (int i = 0; i < upper.length(); i++) {
                char c = upper.charAt(i);
                if (!MrzAlphabet.isMrzChar(c)) charsetOk = false;
                // only a literal filler counts, stray punctuation is a charset error
                if (c == MrzAlphabet.FILLER) fillers++;
                chars++;
            }
        }

        if (exact == rows.size()) {
            score += 6;
        } else {
            score += exact > 0 ? 3 : 0;
            errors.add(ValidationError.MRZ_ROW_LENGTH);
        }

        if (charsetOk) {
            score += 3;
        } else {
            errors.add(ValidationError.MRZ_CHARSET);
        }

        double fillerRatio = chars == 0 ? 0 : fillers / (double) chars;
        if (fillerRatio >= MIN_FILLER_RATIO && fillerRatio <= MAX_FILLER_RATIO) {
            score += 3;
        } else {
            errors.add(ValidationError.MRZ_FILLER_RATIO);
        }

        if (usedFallback) {
            score = Math.min(score, FALLBACK_CAP);
        }
        score = Math.min(score, MAX_SCORE);
        log.debug("MRZ structure: rows={} score={} fallback={} errors={}", rows.size(), score, usedFallback, errors);
        return new MrzStructure(rows, score, errors, usedFallback);
    }

    /**
     * Heuristic for a single OCR line: at least 15 characters, at least 60% of them in the MRZ
     * alphabet, some upper-case letter and either a filler or a digit.
     */
    static boolean looksLikeMrz(String line) {
        if (line.length() < MIN_LINE_LENGTH) return false;
        int valid = 0;
        boolean hasUpper = false;
        boolean hasFillerOrDigit = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (MrzAlphabet.isMrzChar(c)) valid++;
            if (c >= 'A' && c <= 'Z') hasUpper = true;
            if (c == MrzAlphabet.FILLER || MrzAlphabet.isDigit(c)) hasFillerOrDigit = true;
        }
        return hasUpper && hasFillerOrDigit && valid / (double) line.length() >= MIN_VALID_RATIO;
    }

    private static double upperRatio(String line) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) upper++;
            }
        }
        return letters == 0 ? 0 : upper / (double) letters;
    }

    private static List<String> lastThree(List<String> lines) {
        int from = Math.max(0, lines.size() - Td1Layout.ROWS);
        return new ArrayList<>(lines.subList(from, lines.size()));
    }
}
