package de.schliweb.idverify.nationalid;

import de.schliweb.idverify.result.Outcome;
import de.schliweb.idverify.result.ValidationError;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates the 11-digit Turkish national identity number (T.C. Kimlik No).
 * <p>
 * The number must not start with 0. The 10th digit is
 * {@code ((d1 + d3 + d5 + d7 + d9) * 7 - (d2 + d4 + d6 + d8)) mod 10}, the 11th digit is the sum of
 * the first ten digits mod 10.
 * <p>
 * This class cannot be instantiated.
 */
public final class NationalIdValidator {

    public static final int LENGTH = 11;

    private static final Pattern ELEVEN_DIGITS = Pattern.compile("(?<!\\d)\\d{11}(?!\\d)");
    private static final Pattern GROUP_SEPARATOR = Pattern.compile("[\\s.,\\-/]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private NationalIdValidator() {
        // Utility class, no instances allowed
    }

    /**
     * Strips everything but ASCII digits.
     */
    public static String normalize(String input) {
        if (input == null) return "";
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    /**
     * @return true if the input normalizes to 11 digits that pass both check digits
     */
    public static boolean isValid(String input) {
        String id = normalize(input);
        if (id.length() != LENGTH || id.charAt(0) == '0') return false;
        int[] d = new int[LENGTH];
        for (int i = 0; i < LENGTH; i++) d[i] = id.charAt(i) - '0';
        int[] check = checkDigits(d);
        return d[9] == check[0] && d[10] == check[1];
    }

    /**
     * Validates and returns the normalized number.
     *
     * @return the 11 digits, or {@link ValidationError#NATIONAL_ID_NOT_FOUND} when the input does not
     * normalize to 11 digits, or {@link ValidationError#NATIONAL_ID_ALGORITHM_FAILED} when a check fails
     */
    public static Outcome<String> validate(String input) {
        String id = normalize(input);
        if (id.length() != LENGTH) {
            return Outcome.failure(ValidationError.NATIONAL_ID_NOT_FOUND);
        }
        return isValid(id) ? Outcome.success(id) : Outcome.failure(ValidationError.NATIONAL_ID_ALGORITHM_FAILED);
    }

    /**
     * Completes the first nine digits into a full number with both check digits.
     *
     * @param firstNine nine digits, the first one non-zero
     * @return the 11-digit number
     * @throws IllegalArgumentException if the input is not nine digits starting with 1-9
     */
    public static String complete(String firstNine) {
        if (firstNine == null || !firstNine.matches("[1-9]\\d{8}")) {
            throw new IllegalArgumentException("Nine digits with a non-zero first digit are required");
        }
        int[] d = new int[LENGTH];
        for (int i = 0; i < 9; i++) d[i] = firstNine.charAt(i) - '0';
        int[] check = checkDigits(d);
        return firstNine + check[0] + check[1];
    }

    private static int[] checkDigits(int[] d) {
        int odd = d[0] + d[2] + d[4] + d[6] + d[8];
        int even = d[1] + d[3] + d[5] + d[7];
        int tenth = ((odd * 7 - even) % 10 + 10) % 10;
        int sum = 0;
        for (int i = 0; i < 9; i++) sum += d[i];
        int eleventh = (sum + tenth) % 10;
        return new int[]{tenth, eleventh};
    }

    /**
     * Finds 11-digit candidates in free text without validating them: contiguous runs of exactly
     * eleven digits, and digit groups separated by whitespace or punctuation that join to exactly
     * eleven digits.
     *
     * @param text OCR text, may be null
     * @return distinct candidates in reading order
     */
    public static List<String> findCandidates(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return new ArrayList<>(found);

        Matcher m = ELEVEN_DIGITS.matcher(text);
        while (m.find()) found.add(m.group());

        for (String line : text.split("\\R")) {
            List<String> run = new ArrayList<>();
            for (String token : GROUP_SEPARATOR.split(line.trim())) {
                if (DIGITS.matcher(token).matches()) {
                    run.add(token);
                } else {
                    joinGroups(run, found);
                    run.clear();
                }
            }
            joinGroups(run, found);
        }
        return new ArrayList<>(found);
    }

    private static void joinGroups(List<String> run, Set<String> out) {
        if (run.size() < 2) return;
        for (int start = 0; start < run.size(); start++) {
            StringBuilder sb = new StringBuilder();
            for (int end = start; end < run.size() && sb.length() < LENGTH; end++) {
                sb.append(run.get(end));
                if (sb.length() == LENGTH && end > start) out.add(sb.toString());
            }
        }
    }

    /**
     * Finds the national id candidates in free text that pass the full algorithm.
     * Candidates failing either check digit are dropped, there is no partial credit.
     *
     * @param text OCR text, may be null
     * @return distinct valid numbers in reading order
     */
    public static List<String> extractCandidates(String text) {
        List<String> valid = new ArrayList<>();
        for (String candidate : findCandidates(text)) {
            if (isValid(candidate)) valid.add(candidate);
        }
        return valid;
    }
}
