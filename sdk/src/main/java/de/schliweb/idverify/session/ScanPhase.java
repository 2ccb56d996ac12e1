package de.schliweb.idverify.session;

/**
 * Progress of a two-sided capture session.
 */
public enum ScanPhase {
    IDLE,
    SCANNING_FRONT,
    FRONT_CAPTURED,
    SCANNING_BACK,
    BACK_CAPTURED,
    COMPLETED,
    ERROR;

    public boolean isScanning() {
        return this == SCANNING_FRONT || this == SCANNING_BACK;
    }
}
