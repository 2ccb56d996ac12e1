package de.schliweb.idverify.geometry;

import org.opencv.core.Point;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Canonical ordering and measurements of a card quadrilateral.
 * <p>
 * The ordering is always recomputed from the four points and never stored on its own.
 * This class cannot be instantiated.
 */
public final class CornerOrder {

    public static final int TOP_LEFT = 0;
    public static final int TOP_RIGHT = 1;
    public static final int BOTTOM_RIGHT = 2;
    public static final int BOTTOM_LEFT = 3;

    private CornerOrder() {
        // Utility class, no instances allowed
    }

    /**
     * Orders four points as top-left, top-right, bottom-right, bottom-left.
     * The points are split into a top and a bottom pair by their y coordinate, then each pair is
     * sorted by x.
     *
     * @param points exactly four points in any order
     * @return a new array in TL, TR, BR, BL order
     * @throws IllegalArgumentException if {@code points} is null or does not hold four points
     */
    public static Point[] order(Point[] points) {
        if (points == null || points.length != 4) {
            throw new IllegalArgumentException("Exactly four corner points are required");
        }
        Point[] byY = Arrays.copyOf(points, 4);
        Arrays.sort(byY, Comparator.comparingDouble((Point p) -> p.y).thenComparingDouble(p -> p.x));

        Point[] top = {byY[0], byY[1]};
        Point[] bottom = {byY[2], byY[3]};
        Arrays.sort(top, Comparator.comparingDouble(p -> p.x));
        Arrays.sort(bottom, Comparator.comparingDouble(p -> p.x));

        return new Point[]{
                new Point(top[0].x, top[0].y),
                new Point(top[1].x, top[1].y),
                new Point(bottom[1].x, bottom[1].y),
                new Point(bottom[0].x, bottom[0].y)
        };
    }

    /**
     * Area of a quadrilateral (shoelace formula). The result is always non-negative.
     */
    public static double area(Point[] q) {
        double area = 0;
        for (int i = 0; i < 4; i++) {
            Point a = q[i], b = q[(i + 1) % 4];
            area += (a.x * b.y - b.x * a.y);
        }
        return Math.abs(area) / 2.0;
    }

    /**
     * Average width divided by average height of an ordered quadrilateral.
     *
     * @param ordered corners in TL, TR, BR, BL order
     * @return width/height, or 0 for a degenerate quadrilateral
     */
    public static double aspectRatio(Point[] ordered) {
        double avgWidth = (distance(ordered[TOP_LEFT], ordered[TOP_RIGHT])
                + distance(ordered[BOTTOM_LEFT], ordered[BOTTOM_RIGHT])) / 2.0;
        double avgHeight = (distance(ordered[TOP_LEFT], ordered[BOTTOM_LEFT])
                + distance(ordered[TOP_RIGHT], ordered[BOTTOM_RIGHT])) / 2.0;
        if (avgHeight <= 0) return 0;
        return avgWidth / avgHeight;
    }

    static double distance(Point a, Point b) {
        return Math.hypot(a.x - b.x, a.y - b.y);
    }
}
