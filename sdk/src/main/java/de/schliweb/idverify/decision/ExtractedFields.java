package de.schliweb.idverify.decision;

import de.schliweb.idverify.mrz.MrzLines;

import java.util.List;

/**
 * Text and values recognized on one frame.
 *
 * @param textLines      OCR lines of the front side, empty for the back
 * @param nationalId     validated national id, or null
 * @param documentNumber document number candidate read on the front, or null
 * @param mrzRows        MRZ rows as selected from the OCR output, empty for the front
 * @param correctedMrz   the MRZ rows after correction, or null for the front
 */
public record ExtractedFields(List<String> textLines,
                              String nationalId,
                              String documentNumber,
                              List<String> mrzRows,
                              MrzLines correctedMrz) {

    public static final ExtractedFields EMPTY = new ExtractedFields(List.of(), null, null, List.of(), null);

    public ExtractedFields {
        textLines = textLines == null ? List.of() : List.copyOf(textLines);
        mrzRows = mrzRows == null ? List.of() : List.copyOf(mrzRows);
    }
}
