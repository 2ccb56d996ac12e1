package de.schliweb.idverify.scoring;

import de.schliweb.idverify.mrz.MrzStructureAnalyzer;
import de.schliweb.idverify.mrz.MrzValidator;

/**
 * Per-category points of one frame. Each value is clamped into its category range on construction.
 *
 * @param aspectRatio  aspect-ratio fit, 0..20
 * @param frontText    front-side text plausibility, 0..20
 * @param mrzStructure MRZ structural plausibility, 0..20
 * @param mrzChecksum  MRZ check digits, 0..60
 * @param nationalId   national id algorithm, 0 or 10
 */
public record ScoreBreakdown(int aspectRatio, int frontText, int mrzStructure, int mrzChecksum, int nationalId) {

    public static final int MAX_ASPECT_RATIO = AspectRatioScorer.MAX_SCORE;
    public static final int MAX_FRONT_TEXT = FrontTextAnalyzer.MAX_SCORE;
    public static final int MAX_MRZ_STRUCTURE = MrzStructureAnalyzer.MAX_SCORE;
    public static final int MAX_MRZ_CHECKSUM = MrzValidator.MAX_POINTS;
    public static final int MAX_NATIONAL_ID = 10;
    public static final int MAX_TOTAL = 100;

    public static final ScoreBreakdown EMPTY = new ScoreBreakdown(0, 0, 0, 0, 0);

    public ScoreBreakdown {
        aspectRatio = clamp(aspectRatio, MAX_ASPECT_RATIO);
        frontText = clamp(frontText, MAX_FRONT_TEXT);
        mrzStructure = clamp(mrzStructure, MAX_MRZ_STRUCTURE);
        mrzChecksum = clamp(mrzChecksum, MAX_MRZ_CHECKSUM);
        nationalId = clamp(nationalId, MAX_NATIONAL_ID);
    }

    /**
     * Sum of all categories, clipped to 100.
     */
    public int total() {
        return Math.min(MAX_TOTAL, aspectRatio + frontText + mrzStructure + mrzChecksum + nationalId);
    }

    private static int clamp(int v, int max) {
        return Math.max(0, Math.min(max, v));
    }
}
