package de.schliweb.idverify.geometry;

import org.opencv.core.Point;

/**
 * The card boundary found in one frame.
 *
 * @param corners    the four detected corners in detection order, or {@code null} when not detected
 * @param area       pixel area of the detected contour
 * @param confidence detection confidence in [0,1]
 * @param detected   whether a card quadrilateral was found
 */
public record CardGeometry(Point[] corners, double area, double confidence, boolean detected) {

    private static final CardGeometry NOT_DETECTED = new CardGeometry(null, 0, 0, false);

    public CardGeometry {
        if (detected && (corners == null || corners.length != 4)) {
            throw new IllegalArgumentException("A detected geometry needs four corners");
        }
        corners = corners != null ? copy(corners) : null;
    }

    public static CardGeometry notDetected() {
        return NOT_DETECTED;
    }

    /**
     * Returns a copy of the corners in detection order.
     */
    @Override
    public Point[] corners() {
        return corners != null ? copy(corners) : null;
    }

    /**
     * Corners in TL, TR, BR, BL order, recomputed on every call.
     */
    public Point[] orderedCorners() {
        if (!detected) return null;
        return CornerOrder.order(corners);
    }

    /**
     * Measured width/height of the ordered quadrilateral, 0 when not detected.
     */
    public double aspectRatio() {
        if (!detected) return 0;
        return CornerOrder.aspectRatio(orderedCorners());
    }

    /**
     * Long side over short side, independent of whether the card is held in portrait or landscape.
     */
    public double normalizedAspectRatio() {
        double ratio = aspectRatio();
        if (ratio <= 0) return 0;
        return ratio >= 1 ? ratio : 1.0 / ratio;
    }

    private static Point[] copy(Point[] src) {
        Point[] out = new Point[src.length];
        for (int i = 0; i < src.length; i++) {
            out[i] = new Point(src[i].x, src[i].y);
        }
        return out;
    }
}
