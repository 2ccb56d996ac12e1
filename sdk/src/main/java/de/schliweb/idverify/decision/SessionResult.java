package de.schliweb.idverify.decision;

import de.schliweb.idverify.mrz.IdentityFields;

/**
 * Final result of a two-sided capture.
 *
 * @param combined decision over both sides; its score is the floored mean of the side scores
 * @param front    the committed front side
 * @param back     the committed back side
 * @param identity identity data parsed from the corrected back-side MRZ
 */
public record SessionResult(DecisionResult combined,
                            DecisionResult front,
                            DecisionResult back,
                            IdentityFields identity) {

    public boolean isValid() {
        return combined.isValid();
    }
}
