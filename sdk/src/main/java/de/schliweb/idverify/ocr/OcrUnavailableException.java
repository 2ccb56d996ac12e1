package de.schliweb.idverify.ocr;

/**
 * The text recognition engine could not run: missing native library, missing language data or an
 * engine failure. Not recoverable by collecting more frames.
 */
public class OcrUnavailableException extends Exception {

    public OcrUnavailableException(String message) {
        super(message);
    }

    public OcrUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
