package de.schliweb.idverify.scoring;

/**
 * Verdict for a side or a whole session, ordered from best to worst.
 */
public enum Decision {
    /** Score of at least 80: accepted. */
    VALID,
    /** Score between 50 and 79: keep collecting frames. */
    RETRY,
    /** Score below 50: rejected. */
    INVALID;

    /**
     * @return true if this decision is strictly better than {@code other}
     */
    public boolean isBetterThan(Decision other) {
        return ordinal() < other.ordinal();
    }
}
