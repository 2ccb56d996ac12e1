package de.schliweb.idverify.session;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.decision.FrameEvidence;
import de.schliweb.idverify.geometry.CardGeometry;
import de.schliweb.idverify.quality.QualityMetrics;
import de.schliweb.idverify.result.ValidationError;

import java.util.List;

/**
 * Everything learned from one frame.
 *
 * @param state           feedback state
 * @param side            the side the frame was processed as
 * @param quality         quality metrics of the frame
 * @param geometry        detected card boundary
 * @param stability       similarity to the previous usable frame of the same side, 1 for the first one
 * @param evidence        scored evidence, or null if the frame was not read
 * @param errors          tags explaining the state
 * @param timestampMillis capture time of the frame
 */
public record FrameReport(CaptureState state,
                          DocumentSide side,
                          QualityMetrics quality,
                          CardGeometry geometry,
                          double stability,
                          FrameEvidence evidence,
                          List<ValidationError> errors,
                          long timestampMillis) {

    public FrameReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasEvidence() {
        return evidence != null;
    }

    FrameReport withState(CaptureState newState) {
        return new FrameReport(newState, side, quality, geometry, stability, evidence, errors, timestampMillis);
    }
}
