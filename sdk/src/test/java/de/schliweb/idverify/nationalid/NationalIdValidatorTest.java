package de.schliweb.idverify.nationalid;

import de.schliweb.idverify.result.Outcome;
import de.schliweb.idverify.result.ValidationError;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class NationalIdValidatorTest {

    @Test
    public void literalFixturePasses() {
        assertTrue(NationalIdValidator.isValid("33058600656"));
        Outcome<String> outcome = NationalIdValidator.validate("330 586 006 56");
        assertTrue(outcome.isSuccess());
        assertEquals("33058600656", outcome.get());
    }

    @Test
    public void completeBuildsBothCheckDigits() {
        assertEquals("33058600656", NationalIdValidator.complete("330586006"));
        assertEquals("10000000146", NationalIdValidator.complete("100000001"));
        assertEquals("12345678950", NationalIdValidator.complete("123456789"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void completeRejectsLeadingZero() {
        NationalIdValidator.complete("012345678");
    }

    @Test
    public void leadingZeroAndWrongLengthAreRejected() {
        assertFalse(NationalIdValidator.isValid("03058600656"));
        assertFalse(NationalIdValidator.isValid("3305860065"));
        assertFalse(NationalIdValidator.isValid("330586006560"));
        assertFalse(NationalIdValidator.isValid(null));
        assertFalse(NationalIdValidator.isValid(""));
    }

    @Test
    public void validateTagsTheFailure() {
        assertEquals(Collections.singletonList(ValidationError.NATIONAL_ID_NOT_FOUND),
                NationalIdValidator.validate("12345").errors());
        assertEquals(Collections.singletonList(ValidationError.NATIONAL_ID_ALGORITHM_FAILED),
                NationalIdValidator.validate("33058600657").errors());
    }

    @Test
    public void constructedNumbersAlwaysPassAndMutationsFail() {
        Random random = new Random(7);
        for (int n = 0; n < 200; n++) {
            StringBuilder prefix = new StringBuilder().append(1 + random.nextInt(9));
            for (int i = 0; i < 8; i++) prefix.append(random.nextInt(10));
            String id = NationalIdValidator.complete(prefix.toString());
            assertTrue(id, NationalIdValidator.isValid(id));

            for (int pos = 0; pos < 11; pos++) {
                for (char d = '0'; d <= '9'; d++) {
                    if (d == id.charAt(pos)) continue;
                    String mutated = id.substring(0, pos) + d + id.substring(pos + 1);
                    // a single changed digit always breaks the digit sum
                    assertFalse(mutated, NationalIdValidator.isValid(mutated));
                }
            }
        }
    }

    @Test
    public void extractsContiguousAndGroupedCandidates() {
        List<String> contiguous = NationalIdValidator.extractCandidates("T.C. KIMLIK NO 33058600656\nSOYADI YILMAZ");
        assertEquals(Collections.singletonList("33058600656"), contiguous);

        List<String> grouped = NationalIdValidator.extractCandidates("Kimlik No: 330 5860 0656");
        assertEquals(Collections.singletonList("33058600656"), grouped);

        List<String> dotted = NationalIdValidator.extractCandidates("330.586.006.56");
        assertEquals(Collections.singletonList("33058600656"), dotted);
    }

    @Test
    public void invalidCandidatesAreFoundButNotExtracted() {
        String text = "TCKN 33058600657";
        assertEquals(Collections.singletonList("33058600657"), NationalIdValidator.findCandidates(text));
        assertTrue(NationalIdValidator.extractCandidates(text).isEmpty());
    }

    @Test
    public void longerDigitRunsAreNotCandidates() {
        assertTrue(NationalIdValidator.findCandidates("1233058600656").isEmpty());
        assertTrue(NationalIdValidator.findCandidates(null).isEmpty());
    }
}
