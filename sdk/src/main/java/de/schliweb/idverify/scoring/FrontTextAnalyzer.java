package de.schliweb.idverify.scoring;

import de.schliweb.idverify.nationalid.NationalIdValidator;
import de.schliweb.idverify.result.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plausibility of the text read from the front of the card.
 * <p>
 * Score (0..20): readable text of at least 10 characters 4, locale marker 5, a national id passing
 * its algorithm 6, upper-case ratio above 50% 2, a name-like line 2, a date 1.
 * The national id points are a hard gate: a number that fails either check digit earns nothing.
 */
public class FrontTextAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(FrontTextAnalyzer.class);

    public static final int MAX_SCORE = 20;

    private static final int MIN_TEXT_LENGTH = 10;
    private static final String[] LOCALE_MARKERS = {
            "TURKIYE", "TORKIYE", "TURKEY", "CUMHURIYET", "REPUBLIC", "KIMLIK", "NUFUS", "T.C."
    };
    private static final Pattern DATE = Pattern.compile("\\b\\d{2}[./]\\d{2}[./]\\d{4}\\b");
    private static final Pattern SERIAL = Pattern.compile("\\b[A-Z]\\d{2}[A-Z]\\d{5}\\b");
    private static final Pattern NAME_LINE = Pattern.compile("[A-Z]{3,}(?: [A-Z]{2,})*");

    /**
     * @param lines the OCR lines of the front side, may be null
     * @return the findings and score
     */
    public FrontTextResult analyze(List<String> lines) {
        List<String> folded = new ArrayList<>();
        StringBuilder all = new StringBuilder();
        StringBuilder raw = new StringBuilder();
        if (lines != null) {
            for (String line : lines) {
                if (line == null || line.isBlank()) continue;
                String f = fold(line.trim());
                folded.add(f);
                all.append(f).append('\n');
                raw.append(line.trim()).append('\n');
            }
        }
        String text = all.toString();
        List<ValidationError> errors = new ArrayList<>();
        int score = 0;

        if (text.replaceAll("\\s", "").length() >= MIN_TEXT_LENGTH) {
            score += 4;
        }

        boolean marker = containsMarker(text);
        if (marker) {
            score += 5;
        } else {
            errors.add(ValidationError.LOCALE_MARKER_NOT_FOUND);
        }

        List<String> valid = NationalIdValidator.extractCandidates(text);
        String nationalId = valid.isEmpty() ? null : valid.get(0);
        if (nationalId != null) {
            score += 6;
        } else if (NationalIdValidator.findCandidates(text).isEmpty()) {
            errors.add(ValidationError.NATIONAL_ID_NOT_FOUND);
        } else {
            errors.add(ValidationError.NATIONAL_ID_ALGORITHM_FAILED);
        }

        double upperRatio = uppercaseRatio(raw.toString());
        if (upperRatio > 0.5) {
            score += 2;
        }

        boolean name = false;
        for (String line : folded) {
            if (NAME_LINE.matcher(line).matches() && !containsMarker(line)) {
                name = true;
                break;
            }
        }
        if (name) {
            score += 2;
        } else {
            errors.add(ValidationError.NAME_PATTERN_NOT_FOUND);
        }

        boolean date = DATE.matcher(text).find();
        if (date) {
            score += 1;
        } else {
            errors.add(ValidationError.DATE_PATTERN_NOT_FOUND);
        }

        Matcher serial = SERIAL.matcher(text);
        String documentNumber = serial.find() ? serial.group() : null;

        score = Math.min(score, MAX_SCORE);
        log.debug("Front text: score={} marker={} id={} name={} date={}",
                score, marker, nationalId != null, name, date);
        return new FrontTextResult(score, marker, nationalId, documentNumber, upperRatio, name, date, errors);
    }

    /**
     * Upper-cases with Turkish rules and folds the Turkish letters to their ASCII base letter.
     */
    static String fold(String s) {
        String upper = s.toUpperCase(Locale.forLanguageTag("tr"));
        StringBuilder sb = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            switch (c) {
                case 'İ':
                case 'I':
                    sb.append('I');
                    break;
                case 'Ş':
                    sb.append('S');
                    break;
                case 'Ğ':
                    sb.append('G');
                    break;
                case 'Ü':
                    sb.append('U');
                    break;
                case 'Ö':
                    sb.append('O');
                    break;
                case 'Ç':
                    sb.append('C');
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean containsMarker(String foldedText) {
        for (String marker : LOCALE_MARKERS) {
            if (foldedText.contains(marker)) return true;
        }
        return false;
    }

    private static double uppercaseRatio(String text) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) upper++;
            }
        }
        return letters == 0 ? 0 : upper / (double) letters;
    }
}
