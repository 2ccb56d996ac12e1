package de.schliweb.idverify.scoring;

import org.junit.Test;

import static org.junit.Assert.*;

public class AspectRatioScorerTest {

    private static final double IDEAL = AspectRatioScorer.IDEAL_RATIO;

    @Test
    public void idealRatioScoresFull() {
        assertEquals(1.5858, IDEAL, 1e-4);
        assertEquals(20, AspectRatioScorer.score(IDEAL));
        assertEquals(20, AspectRatioScorer.score(IDEAL * 1.009));
    }

    @Test
    public void deviationBands() {
        assertEquals(18, AspectRatioScorer.score(IDEAL * 1.015));
        assertEquals(18, AspectRatioScorer.score(IDEAL * 0.985));
        assertEquals(15, AspectRatioScorer.score(IDEAL * 1.025));
        assertEquals(12, AspectRatioScorer.score(IDEAL * 1.035));
        assertEquals(10, AspectRatioScorer.score(1.50));
        assertEquals(10, AspectRatioScorer.score(1.65));
    }

    @Test
    public void outsideToleranceScoresZero() {
        assertEquals(0, AspectRatioScorer.score(1.49));
        assertEquals(0, AspectRatioScorer.score(1.66));
        assertEquals(0, AspectRatioScorer.score(1.0));
        assertEquals(0, AspectRatioScorer.score(Double.NaN));
        assertFalse(AspectRatioScorer.isWithinTolerance(0.63));
    }

    @Test
    public void scoreNeverIncreasesWithDeviation() {
        int previous = AspectRatioScorer.MAX_SCORE;
        for (double r = IDEAL; r <= 1.70; r += 0.001) {
            int s = AspectRatioScorer.score(r);
            assertTrue(s <= previous);
            previous = s;
        }
    }
}
