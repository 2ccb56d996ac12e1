package de.schliweb.idverify.mrz;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static de.schliweb.idverify.mrz.MrzValidatorTest.ROW1;
import static de.schliweb.idverify.mrz.MrzValidatorTest.ROW2;
import static de.schliweb.idverify.mrz.MrzValidatorTest.ROW3;
import static org.junit.Assert.*;

public class MrzCorrectorTest {

    private final MrzCorrector corrector = new MrzCorrector("I<", "TUR");
    private final MrzValidator validator = new MrzValidator();

    @Test
    public void validZoneIsUnchanged() {
        MrzLines lines = corrector.correct(Arrays.asList(ROW1, ROW2, ROW3));
        assertEquals(new MrzLines(ROW1, ROW2, ROW3), lines);
        assertEquals(lines, corrector.correct(lines.rows()));
    }

    @Test
    public void lettersInDatePositionsBecomeDigits() {
        String row2 = "97O6O40M320101STUR33O586006560";
        MrzLines lines = corrector.correct(Arrays.asList(ROW1, row2, ROW3));
        assertEquals(ROW2, lines.row2());
        assertTrue(validator.validate(lines).allValid());
    }

    @Test
    public void lowerCaseConfusionsUseTheRawRead() {
        // g -> 9, b -> 6
        String row2 = "g70b040M3201015TUR330586006560";
        MrzLines lines = corrector.correct(Arrays.asList(ROW1, row2, ROW3));
        assertEquals(ROW2, lines.row2());
    }

    @Test
    public void lettersOutsideNumericPositionsAreKept() {
        // the O in the document number is not a numeric-only position
        String row1 = "I<TURAO2B345675<<<<<<<<<<<<<<<";
        MrzLines lines = corrector.correct(Arrays.asList(row1, ROW2, ROW3));
        assertEquals(row1, lines.row1());
    }

    @Test
    public void constantPositionsAreForced() {
        String row1 = "1-7UPA12B345675<<<<<Q7<<<<<<<<";
        String row2 = "9706040X3201015T0R330586006560";
        MrzLines lines = corrector.correct(Arrays.asList(row1, row2, ROW3));
        assertEquals(ROW1, lines.row1());
        assertEquals('<', lines.row2().charAt(Td1Layout.SEX));
        assertEquals("TUR", lines.row2().substring(Td1Layout.NATIONALITY_START, Td1Layout.NATIONALITY_END));
    }

    @Test
    public void optionalDataInFirstRowIsKeptWhenCompositeHolds() {
        String row1 = "I<TURA12B345675XY12<<<<<<<<<<<";
        String row2 = "9706040M3201015TUR330586006566";
        MrzLines lines = corrector.correct(Arrays.asList(row1, row2, ROW3));
        assertEquals(new MrzLines(row1, row2, ROW3), lines);
        assertTrue(validator.validate(lines).allValid());
    }

    @Test
    public void separatorsAndLowerCaseAreCanonicalized() {
        MrzLines lines = corrector.correct(Arrays.asList("i<tura12b345675 ---", ROW2, "yilmaz  ahmet can"));
        assertEquals(ROW1, lines.row1());
        assertEquals("YILMAZ<<AHMET<CAN<<<<<<<<<<<<<", lines.row3());
    }

    @Test
    public void missingFirstRowIsSynthesized() {
        MrzLines lines = corrector.correct(Arrays.asList(ROW2, ROW3));
        assertEquals("I<TUR<<<<<<<<<<<<<<<<<<<<<<<<<", lines.row1());
        assertEquals(ROW2, lines.row2());
        assertEquals(ROW3, lines.row3());

        ValidationScore score = validator.validate(lines);
        assertFalse(score.documentNumberValid());
        assertTrue(score.birthDateValid());
        assertTrue(score.expiryDateValid());
    }

    @Test
    public void knownValuesOverwriteTheRead() {
        String row2 = "9706040M3201015TUR330586000000";
        MrzLines lines = corrector.correct(Arrays.asList("I<TUR????????<5", row2, ROW3),
                "33058600656", "A12B34567");
        assertEquals("A12B34567", lines.row1().substring(Td1Layout.DOCUMENT_NUMBER_START, Td1Layout.DOCUMENT_NUMBER_END));
        assertEquals("33058600656", lines.row2().substring(Td1Layout.NATIONAL_ID_START, Td1Layout.NATIONAL_ID_END));
    }

    @Test
    public void invalidKnownNationalIdIsIgnored() {
        String row2 = "9706040M3201015TUR330586000000";
        MrzLines lines = corrector.correct(Arrays.asList(ROW1, row2, ROW3), "12345678901", null);
        assertEquals("33058600000", lines.row2().substring(Td1Layout.NATIONAL_ID_START, Td1Layout.NATIONAL_ID_END));
    }

    @Test
    public void checkDigitsAreNeverRecomputed() {
        String row1 = "I<TURA12B345679<<<<<<<<<<<<<<<";
        MrzLines lines = corrector.correct(Arrays.asList(row1, ROW2, ROW3));
        assertEquals('9', lines.row1().charAt(Td1Layout.DOCUMENT_NUMBER_CHECK));
        assertFalse(validator.validate(lines).documentNumberValid());
    }

    @Test
    public void emptyInputYieldsConstantOnlyRows() {
        MrzLines lines = corrector.correct(Collections.emptyList());
        assertEquals("I<TUR<<<<<<<<<<<<<<<<<<<<<<<<<", lines.row1());
        assertEquals("<<<<<<<<<<<<<<<TUR<<<<<<<<<<<<", lines.row2());
        assertEquals("<<<<<<<<<<<<<<<<<<<<<<<<<<<<<<", lines.row3());
        assertEquals(0, validator.validate(lines).total());
    }

    @Test
    public void everyRowHasThirtyCharacters() {
        List<String> rows = Arrays.asList(ROW1 + "EXTRA", "970", ROW3.substring(0, 10));
        for (String row : corrector.correct(rows).rows()) {
            assertEquals(30, row.length());
        }
    }
}
