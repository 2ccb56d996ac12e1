package de.schliweb.idverify.scoring;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.mrz.MrzLines;
import de.schliweb.idverify.mrz.MrzStructure;
import de.schliweb.idverify.mrz.ValidationScore;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ScoringEngineTest {

    private ScoringEngine engine;

    @Before
    public void setUp() {
        engine = new ScoringEngine(ScannerConfig.defaults());
    }

    @Test
    public void decisionThresholds() {
        assertEquals(Decision.VALID, engine.decide(100));
        assertEquals(Decision.VALID, engine.decide(80));
        assertEquals(Decision.RETRY, engine.decide(79));
        assertEquals(Decision.RETRY, engine.decide(50));
        assertEquals(Decision.INVALID, engine.decide(49));
        assertEquals(Decision.INVALID, engine.decide(0));
    }

    @Test
    public void breakdownClampsEveryCategory() {
        ScoreBreakdown b = new ScoreBreakdown(25, -1, 30, 70, 11);
        assertEquals(20, b.aspectRatio());
        assertEquals(0, b.frontText());
        assertEquals(20, b.mrzStructure());
        assertEquals(60, b.mrzChecksum());
        assertEquals(10, b.nationalId());
        assertEquals(100, b.total());
    }

    @Test
    public void frontScoring() {
        FrontTextResult text = new FrontTextResult(20, true, "33058600656", "A12B34567", 0.9, true, true, List.of());
        ScoreBreakdown b = engine.scoreFront(AspectRatioScorer.IDEAL_RATIO, text);
        assertEquals(new ScoreBreakdown(20, 20, 0, 0, 10), b);
        assertEquals(100, engine.sideScore(b, DocumentSide.FRONT));

        FrontTextResult noId = new FrontTextResult(14, true, null, null, 0.9, true, true, List.of());
        ScoreBreakdown partial = engine.scoreFront(AspectRatioScorer.IDEAL_RATIO * 1.015, noId);
        assertEquals(0, partial.nationalId());
        // (18 + 14) * 100 / 50
        assertEquals(64, engine.sideScore(partial, DocumentSide.FRONT));
    }

    @Test
    public void backScoring() {
        MrzLines lines = new MrzLines("", "", "");
        MrzStructure structure = new MrzStructure(List.of("A", "B", "C"), 20, List.of(), false);
        ScoreBreakdown full = engine.scoreBack(AspectRatioScorer.IDEAL_RATIO, structure,
                new ValidationScore(true, true, true, true, 15, lines));
        assertEquals(100, full.total());
        assertEquals(100, engine.sideScore(full, DocumentSide.BACK));

        ScoreBreakdown twoChecks = engine.scoreBack(1.0, structure,
                new ValidationScore(true, false, true, false, 15, lines));
        assertEquals(0, twoChecks.aspectRatio());
        assertEquals(50, engine.sideScore(twoChecks, DocumentSide.BACK));
    }

    @Test
    public void attainablePointsPerSide() {
        assertEquals(50, ScoringEngine.attainable(DocumentSide.FRONT));
        assertEquals(100, ScoringEngine.attainable(DocumentSide.BACK));
    }

    @Test
    public void manualCaptureThresholds() {
        assertTrue(engine.passesManualCapture(new ScoreBreakdown(10, 8, 0, 0, 0), DocumentSide.FRONT));
        assertFalse(engine.passesManualCapture(new ScoreBreakdown(10, 7, 0, 0, 0), DocumentSide.FRONT));
        assertFalse(engine.passesManualCapture(new ScoreBreakdown(0, 14, 0, 0, 0), DocumentSide.FRONT));
        assertTrue(engine.passesManualCapture(new ScoreBreakdown(0, 10, 0, 0, 10), DocumentSide.FRONT));

        assertTrue(engine.passesManualCapture(new ScoreBreakdown(0, 0, 6, 15, 0), DocumentSide.BACK));
        assertFalse(engine.passesManualCapture(new ScoreBreakdown(20, 0, 18, 0, 0), DocumentSide.BACK));
    }

    @Test
    public void raisingAnyCategoryNeverLowersScoreOrDecision() {
        int[] ar = {0, 10, 12, 15, 18, 20};
        int[] steps = {0, 5, 10, 15, 20};
        int[] checks = {0, 15, 30, 45, 60};
        int[] id = {0, 10};
        for (int a : ar) {
            for (int f : steps) {
                for (int s : steps) {
                    for (int c : checks) {
                        for (int n : id) {
                            ScoreBreakdown base = new ScoreBreakdown(a, f, s, c, n);
                            assertMonotone(base, new ScoreBreakdown(a + 2, f, s, c, n));
                            assertMonotone(base, new ScoreBreakdown(a, f + 5, s, c, n));
                            assertMonotone(base, new ScoreBreakdown(a, f, s + 5, c, n));
                            assertMonotone(base, new ScoreBreakdown(a, f, s, c + 15, n));
                            assertMonotone(base, new ScoreBreakdown(a, f, s, c, n + 10));
                        }
                    }
                }
            }
        }
    }

    private void assertMonotone(ScoreBreakdown lower, ScoreBreakdown higher) {
        assertTrue(higher.total() >= lower.total());
        assertFalse(engine.decide(lower.total()).isBetterThan(engine.decide(higher.total())));
        for (DocumentSide side : DocumentSide.values()) {
            assertTrue(engine.sideScore(higher, side) >= engine.sideScore(lower, side));
        }
    }
}
