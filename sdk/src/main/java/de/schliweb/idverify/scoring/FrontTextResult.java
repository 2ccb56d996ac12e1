package de.schliweb.idverify.scoring;

import de.schliweb.idverify.result.ValidationError;

import java.util.List;

/**
 * Findings of the front-side text heuristics.
 *
 * @param score              front text score in [0, {@value FrontTextAnalyzer#MAX_SCORE}]
 * @param localeMarkerFound  a "Türkiye Cumhuriyeti" style marker was read
 * @param nationalId         the first national id that passed its algorithm, or null
 * @param documentNumber     the card serial (document number) if one was read, or null
 * @param uppercaseRatio     share of upper-case letters among all letters
 * @param namePatternFound   a name-like line was read
 * @param datePatternFound   a dd.MM.yyyy date was read
 * @param errors             informational tags for the missing elements
 */
public record FrontTextResult(int score,
                              boolean localeMarkerFound,
                              String nationalId,
                              String documentNumber,
                              double uppercaseRatio,
                              boolean namePatternFound,
                              boolean datePatternFound,
                              List<ValidationError> errors) {

    public FrontTextResult {
        errors = List.copyOf(errors);
    }

    public boolean hasValidNationalId() {
        return nationalId != null;
    }
}
