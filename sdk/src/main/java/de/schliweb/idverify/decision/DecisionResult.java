package de.schliweb.idverify.decision;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.result.ValidationError;
import de.schliweb.idverify.scoring.Decision;
import de.schliweb.idverify.scoring.ScoreBreakdown;

import java.util.List;

/**
 * Decision for one side, or for the whole session when {@code side} is null.
 *
 * @param side       the decided side, null for a combined result
 * @param decision   the verdict
 * @param totalScore score in [0,100] the verdict was taken on
 * @param breakdown  category points
 * @param errors     validation tags behind the score
 * @param fields     recognized values of the decisive frame
 */
public record DecisionResult(DocumentSide side,
                             Decision decision,
                             int totalScore,
                             ScoreBreakdown breakdown,
                             List<ValidationError> errors,
                             ExtractedFields fields) {

    public DecisionResult {
        if (decision == null) throw new IllegalArgumentException("decision is null");
        if (breakdown == null) breakdown = ScoreBreakdown.EMPTY;
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (fields == null) fields = ExtractedFields.EMPTY;
    }

    public boolean isValid() {
        return decision == Decision.VALID;
    }
}
