package de.schliweb.idverify.session;

/**
 * Feedback state of one processed frame.
 */
public enum CaptureState {
    /** No card found in the frame. */
    SEARCHING,
    /** A card was found but the frame is not usable yet: blurred, badly lit, glare or moving. */
    ALIGNING,
    /** The frame was read and scored. */
    VERIFYING,
    /** The frame completed the capture of a side. */
    CAPTURED,
    /** Text recognition is unavailable. */
    ERROR
}
