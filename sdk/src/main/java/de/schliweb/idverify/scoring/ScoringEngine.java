package de.schliweb.idverify.scoring;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.mrz.MrzStructure;
import de.schliweb.idverify.mrz.ValidationScore;

/**
 * Turns per-frame findings into category points, side scores and decisions.
 * <p>
 * A front frame can earn aspect ratio, front text and national id points (50 at most), a back frame
 * aspect ratio, MRZ structure and MRZ checksum points (100 at most). The side score scales the
 * category total against what the side can attain, so both sides are judged on the same 0..100
 * range and the same thresholds: 80 and above is VALID, 50 and above RETRY, anything lower INVALID.
 */
public class ScoringEngine {

    private final ScannerConfig config;

    public ScoringEngine(ScannerConfig config) {
        this.config = config;
    }

    public ScoreBreakdown scoreFront(double aspectRatio, FrontTextResult front) {
        int nationalId = front.hasValidNationalId() ? ScoreBreakdown.MAX_NATIONAL_ID : 0;
        return new ScoreBreakdown(AspectRatioScorer.score(aspectRatio), front.score(), 0, 0, nationalId);
    }

    public ScoreBreakdown scoreBack(double aspectRatio, MrzStructure structure, ValidationScore checks) {
        return new ScoreBreakdown(AspectRatioScorer.score(aspectRatio), 0, structure.score(), checks.total(), 0);
    }

    /**
     * Highest category total a frame of the given side can reach.
     */
    public static int attainable(DocumentSide side) {
        if (side == DocumentSide.FRONT) {
            return ScoreBreakdown.MAX_ASPECT_RATIO + ScoreBreakdown.MAX_FRONT_TEXT + ScoreBreakdown.MAX_NATIONAL_ID;
        }
        return ScoreBreakdown.MAX_ASPECT_RATIO + ScoreBreakdown.MAX_MRZ_STRUCTURE + ScoreBreakdown.MAX_MRZ_CHECKSUM;
    }

    /**
     * The category total scaled to 0..100 against what the side can attain.
     */
    public int sideScore(ScoreBreakdown breakdown, DocumentSide side) {
        long scaled = Math.round(breakdown.total() * 100.0 / attainable(side));
        return (int) Math.min(ScoreBreakdown.MAX_TOTAL, scaled);
    }

    public Decision decide(int score) {
        if (score >= config.getValidThreshold()) return Decision.VALID;
        if (score >= config.getRetryThreshold()) return Decision.RETRY;
        return Decision.INVALID;
    }

    /**
     * Relaxed acceptance for an explicit capture of a single frame.
     * <p>
     * Front: aspect ratio + front text + national id must reach 18 when the aspect ratio earned at
     * least 10 points, 20 otherwise. Back: MRZ structure + checksum must reach 20.
     */
    public boolean passesManualCapture(ScoreBreakdown breakdown, DocumentSide side) {
        if (side == DocumentSide.FRONT) {
            int sum = breakdown.aspectRatio() + breakdown.frontText() + breakdown.nationalId();
            int threshold = breakdown.aspectRatio() >= 10
                    ? config.getManualFrontThresholdWithAspect()
                    : config.getManualFrontThreshold();
            return sum >= threshold;
        }
        return breakdown.mrzStructure() + breakdown.mrzChecksum() >= config.getManualBackThreshold();
    }
}
