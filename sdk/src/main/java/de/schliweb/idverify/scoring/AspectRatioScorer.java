package de.schliweb.idverify.scoring;

/**
 * Scores how close a measured card ratio is to the ID-1 ratio (85.60 / 53.98 = 1.5858).
 * <p>
 * Inside the tolerance window 1.50..1.65: 20 points within 1% of the ideal, 18 within 2%, 15 within
 * 3%, 12 within 4% and 10 otherwise. Outside the window the score is 0.
 */
public final class AspectRatioScorer {

    public static final double IDEAL_RATIO = 85.60 / 53.98;
    public static final double MIN_RATIO = 1.50;
    public static final double MAX_RATIO = 1.65;
    public static final int MAX_SCORE = 20;

    private AspectRatioScorer() {
    }

    /**
     * @param ratio long side over short side of the detected card
     * @return the aspect-ratio score in [0,20]
     */
    public static int score(double ratio) {
        if (!isWithinTolerance(ratio)) return 0;
        double deviation = Math.abs(ratio - IDEAL_RATIO) / IDEAL_RATIO;
        if (deviation <= 0.01) return 20;
        if (deviation <= 0.02) return 18;
        if (deviation <= 0.03) return 15;
        if (deviation <= 0.04) return 12;
        return 10;
    }

    public static boolean isWithinTolerance(double ratio) {
        return ratio >= MIN_RATIO && ratio <= MAX_RATIO;
    }
}
