package de.schliweb.idverify.decision;

import de.schliweb.idverify.result.ValidationError;
import de.schliweb.idverify.scoring.ScoreBreakdown;

import java.util.List;

/**
 * Scored result of one processed frame, the unit kept in a {@link FrameBuffer}.
 *
 * @param score           side score in [0,100]
 * @param breakdown       category points behind the score
 * @param timestampMillis capture time of the frame
 * @param qualityPassed   whether the frame passed the quality gate
 * @param errors          validation tags raised while scoring the frame
 * @param fields          recognized values
 */
public record FrameEvidence(int score,
                            ScoreBreakdown breakdown,
                            long timestampMillis,
                            boolean qualityPassed,
                            List<ValidationError> errors,
                            ExtractedFields fields) {

    public FrameEvidence {
        if (score < 0 || score > ScoreBreakdown.MAX_TOTAL) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        if (breakdown == null) breakdown = ScoreBreakdown.EMPTY;
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (fields == null) fields = ExtractedFields.EMPTY;
    }

    /**
     * Evidence carrying only a score, for callers that track nothing else.
     */
    public static FrameEvidence ofScore(int score, long timestampMillis) {
        return new FrameEvidence(score, ScoreBreakdown.EMPTY, timestampMillis, true, List.of(), ExtractedFields.EMPTY);
    }
}
