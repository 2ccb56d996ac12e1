package de.schliweb.idverify.mrz;

import de.schliweb.idverify.result.ValidationError;

import java.util.List;

/**
 * Structural plausibility of the MRZ rows found in OCR output.
 *
 * @param rows     the selected rows as read (trimmed, not canonicalized), top to bottom, at most three
 * @param score    structure score in [0, {@value MrzStructureAnalyzer#MAX_SCORE}]
 * @param errors   structural problems found
 * @param fallback true when no line looked like an MRZ row and upper-case lines were used instead
 */
public record MrzStructure(List<String> rows, int score, List<ValidationError> errors, boolean fallback) {

    public MrzStructure {
        rows = List.copyOf(rows);
        errors = List.copyOf(errors);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
