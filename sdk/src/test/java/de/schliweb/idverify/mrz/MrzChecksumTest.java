package de.schliweb.idverify.mrz;

import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

public class MrzChecksumTest {

    @Test
    public void birthDateFixtureValidates() {
        // 9*7 + 7*3 + 0*1 + 6*7 + 0*3 + 4*1 = 130
        assertEquals(0, MrzChecksum.checksum("970604"));
        assertTrue(MrzChecksum.isValid("970604", '0'));
        assertFalse(MrzChecksum.isValid("970604", '1'));
    }

    @Test
    public void charValues() {
        assertEquals(0, MrzChecksum.charValue('0'));
        assertEquals(9, MrzChecksum.charValue('9'));
        assertEquals(10, MrzChecksum.charValue('A'));
        assertEquals(35, MrzChecksum.charValue('Z'));
        assertEquals(0, MrzChecksum.charValue('<'));
    }

    @Test
    public void knownDocumentNumber() {
        // ICAO 9303 specimen
        assertEquals(7, MrzChecksum.checksum("D23145890"));
        assertEquals(5, MrzChecksum.checksum("A12B34567"));
    }

    @Test
    public void fillerOrLetterNeverValidatesAsCheckDigit() {
        assertFalse(MrzChecksum.isValid("<<<<<<", '<'));
        assertFalse(MrzChecksum.isValid("970604", 'O'));
    }

    @Test
    public void emptyDataHasZeroChecksum() {
        assertEquals(0, MrzChecksum.checksum(""));
    }

    @Test
    public void checksumIsDeterministicAndInRange() {
        String alphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789<";
        Random random = new Random(42);
        for (int n = 0; n < 500; n++) {
            StringBuilder sb = new StringBuilder();
            int len = random.nextInt(40);
            for (int i = 0; i < len; i++) sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
            String s = sb.toString();
            int first = MrzChecksum.checksum(s);
            assertTrue(first >= 0 && first <= 9);
            assertEquals(first, MrzChecksum.checksum(s));
        }
    }
}
