package de.schliweb.idverify.session;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.decision.DecisionResult;
import de.schliweb.idverify.decision.SessionResult;
import de.schliweb.idverify.result.ValidationError;

import java.util.List;

/**
 * Receives the events of a {@link CaptureSession}.
 * <p>
 * All callbacks run on the session's worker thread, one frame at a time and in submission order.
 * Implementations must hand off to their own thread before touching UI state.
 */
public interface SessionListener {

    default void onPhaseChanged(ScanPhase previous, ScanPhase current) {
    }

    default void onFrameProcessed(FrameReport report) {
    }

    default void onSideCaptured(DecisionResult result) {
    }

    default void onManualCaptureRejected(DocumentSide side, List<ValidationError> reasons) {
    }

    default void onSessionCompleted(SessionResult result) {
    }

    default void onError(ValidationError error, Throwable cause) {
    }

    /**
     * A frame was dropped because processing threw. The session stays in its phase and accepts the
     * next frame.
     *
     * @param side  the side being scanned when the frame failed, null if scanning had already stopped
     * @param cause the exception raised while processing the frame
     */
    default void onFrameFailed(DocumentSide side, RuntimeException cause) {
    }
}
