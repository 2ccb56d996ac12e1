package de.schliweb.idverify.ocr;

import de.schliweb.idverify.geometry.CardRegion;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Text recognition collaborator. Implementations return the recognized lines top to bottom with no
 * correctness guarantee; every consumer treats the result as untrusted.
 */
public interface TextRecognizer {

    /**
     * Recognizes the text of one image.
     *
     * @param image  a gray, binary or BGR image; not released by the recognizer
     * @param region the card region the image shows, or null for a whole card
     * @return the recognized non-blank lines, possibly empty
     * @throws OcrUnavailableException if the engine cannot run at all
     */
    List<String> recognize(Mat image, CardRegion region) throws OcrUnavailableException;
}
