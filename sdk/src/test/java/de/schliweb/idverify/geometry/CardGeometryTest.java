package de.schliweb.idverify.geometry;

import org.junit.Test;
import org.opencv.core.Point;

import static org.junit.Assert.*;

public class CardGeometryTest {

    private static Point[] portraitCorners() {
        return new Point[]{new Point(0, 0), new Point(540, 0), new Point(540, 856), new Point(0, 856)};
    }

    @Test
    public void notDetectedHasNoCorners() {
        CardGeometry g = CardGeometry.notDetected();
        assertFalse(g.detected());
        assertNull(g.corners());
        assertNull(g.orderedCorners());
        assertEquals(0, g.aspectRatio(), 0.0);
        assertEquals(0, g.normalizedAspectRatio(), 0.0);
    }

    @Test
    public void normalizedRatioIgnoresOrientation() {
        CardGeometry g = new CardGeometry(portraitCorners(), 540 * 856, 1, true);
        assertTrue(g.aspectRatio() < 1);
        assertEquals(856 / 540.0, g.normalizedAspectRatio(), 1e-9);
    }

    @Test
    public void cornersAreCopied() {
        Point[] corners = portraitCorners();
        CardGeometry g = new CardGeometry(corners, 1, 1, true);
        corners[0].x = 99;
        g.corners()[0].x = 77;
        assertEquals(0, g.corners()[0].x, 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void detectedNeedsCorners() {
        new CardGeometry(null, 0, 0, true);
    }
}
