package de.schliweb.idverify.mrz;

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * Splits corrected TD1 rows into identity fields.
 * <p>
 * Two-digit years are resolved relative to {@code today}: a birth year that would lie in the future
 * belongs to the previous century, expiry years are always in the 2000s.
 */
public class MrzParser {

    private static final String NAME_SEPARATOR = "<<";

    public IdentityFields parse(MrzLines lines) {
        return parse(lines, LocalDate.now());
    }

    public IdentityFields parse(MrzLines lines, LocalDate today) {
        String row1 = lines.row1();
        String row2 = lines.row2();
        String row3 = lines.row3();

        String sex = String.valueOf(row2.charAt(Td1Layout.SEX));
        if (!"M".equals(sex) && !"F".equals(sex)) sex = null;

        String surname;
        String givenNames;
        int sep = row3.indexOf(NAME_SEPARATOR);
        if (sep >= 0) {
            surname = name(row3.substring(0, sep));
            givenNames = name(row3.substring(sep + NAME_SEPARATOR.length()));
        } else {
            surname = name(row3);
            givenNames = "";
        }

        return new IdentityFields(
                strip(row1.substring(Td1Layout.DOCUMENT_TYPE_START, Td1Layout.DOCUMENT_TYPE_END)),
                strip(row1.substring(Td1Layout.ISSUER_START, Td1Layout.ISSUER_END)),
                strip(row1.substring(Td1Layout.DOCUMENT_NUMBER_START, Td1Layout.DOCUMENT_NUMBER_END)),
                birthDate(row2.substring(Td1Layout.BIRTH_DATE_START, Td1Layout.BIRTH_DATE_END), today),
                sex,
                expiryDate(row2.substring(Td1Layout.EXPIRY_DATE_START, Td1Layout.EXPIRY_DATE_END)),
                strip(row2.substring(Td1Layout.NATIONALITY_START, Td1Layout.NATIONALITY_END)),
                strip(row2.substring(Td1Layout.NATIONAL_ID_START, Td1Layout.NATIONAL_ID_END)),
                surname,
                givenNames);
    }

    static LocalDate birthDate(String yymmdd, LocalDate today) {
        LocalDate date = toDate(yymmdd, 2000);
        if (date != null && date.isAfter(today)) {
            date = date.minusYears(100);
        }
        return date;
    }

    static LocalDate expiryDate(String yymmdd) {
        return toDate(yymmdd, 2000);
    }

    private static LocalDate toDate(String yymmdd, int century) {
        if (yymmdd == null || !yymmdd.matches("\\d{6}")) return null;
        int yy = Integer.parseInt(yymmdd.substring(0, 2));
        int mm = Integer.parseInt(yymmdd.substring(2, 4));
        int dd = Integer.parseInt(yymmdd.substring(4, 6));
        try {
            return LocalDate.of(century + yy, mm, dd);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static String strip(String field) {
        int end = field.length();
        while (end > 0 && field.charAt(end - 1) == MrzAlphabet.FILLER) end--;
        return field.substring(0, end).replace(MrzAlphabet.FILLER, ' ').trim();
    }

    private static String name(String field) {
        return field.replace(MrzAlphabet.FILLER, ' ').trim().replaceAll(" +", " ");
    }
}
