package de.schliweb.idverify.mrz;

import de.schliweb.idverify.result.ValidationError;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class MrzValidatorTest {

    static final String ROW1 = "I<TURA12B345675<<<<<<<<<<<<<<<";
    static final String ROW2 = "9706040M3201015TUR330586006560";
    static final String ROW3 = "YILMAZ<<AHMET<CAN<<<<<<<<<<<<<";

    private final MrzValidator validator = new MrzValidator();

    @Test
    public void validZoneScoresFullPoints() {
        ValidationScore score = validator.validate(Arrays.asList(ROW1, ROW2, ROW3));
        assertTrue(score.allValid());
        assertEquals(4, score.validCount());
        assertEquals(MrzValidator.MAX_POINTS, score.total());
        assertEquals(60, score.maxTotal());
        assertTrue(score.errors().isEmpty());
    }

    @Test
    public void brokenBirthDateCheckIsReported() {
        String row2 = "9706041M3201015TUR330586006560";
        ValidationScore score = validator.validate(Arrays.asList(ROW1, row2, ROW3));
        assertFalse(score.birthDateValid());
        assertTrue(score.documentNumberValid());
        assertTrue(score.expiryDateValid());
        // the birth date check digit is part of the composite data
        assertFalse(score.compositeValid());
        assertEquals(30, score.total());
        assertEquals(Arrays.asList(ValidationError.MRZ_CHECKSUM_BIRTH_DATE, ValidationError.MRZ_CHECKSUM_COMPOSITE),
                score.errors());
    }

    @Test
    public void emptyInputScoresZero() {
        ValidationScore score = validator.validate(Collections.emptyList());
        assertEquals(0, score.total());
        assertEquals(4, score.errors().size());
    }

    @Test
    public void nullInputScoresZero() {
        assertEquals(0, validator.validate((java.util.List<String>) null).total());
    }

    @Test
    public void shortRowsArePadded() {
        ValidationScore score = validator.validate(Arrays.asList("I<TURA12B345675", ROW2));
        assertTrue(score.documentNumberValid());
        assertTrue(score.birthDateValid());
        assertEquals(30, score.lines().row1().length());
        assertEquals(30, score.lines().row3().length());
    }
}
