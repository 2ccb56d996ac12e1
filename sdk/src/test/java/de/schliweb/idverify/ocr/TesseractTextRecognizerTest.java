package de.schliweb.idverify.ocr;

import de.schliweb.idverify.geometry.CardRegion;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TesseractTextRecognizerTest {

    @Test
    public void pageSegmentationFollowsRegion() {
        assertEquals(TesseractTextRecognizer.PSM_SPARSE_TEXT, TesseractTextRecognizer.pageSegMode(null));
        assertEquals(TesseractTextRecognizer.PSM_SINGLE_BLOCK, TesseractTextRecognizer.pageSegMode(CardRegion.MRZ));
        assertEquals(TesseractTextRecognizer.PSM_SINGLE_LINE,
                TesseractTextRecognizer.pageSegMode(CardRegion.SURNAME));
    }

    @Test
    public void linesAreTrimmedAndBlankLinesDropped() {
        List<String> lines = TesseractTextRecognizer.lines("  I<TUR \r\n\n9706040M\n   \nYILMAZ<<\n");
        assertEquals(List.of("I<TUR", "9706040M", "YILMAZ<<"), lines);
        assertTrue(TesseractTextRecognizer.lines(null).isEmpty());
        assertTrue(TesseractTextRecognizer.lines("").isEmpty());
    }
}
