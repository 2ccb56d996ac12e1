package de.schliweb.idverify.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.RotatedRect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Synthetic camera frames with a light card on a dark, slightly noisy background.
 * <p>
 * The noise is seeded so two renders of the same card are pixel-identical.
 */
public final class SyntheticCards {

    public static final int FRAME_WIDTH = 640;
    public static final int FRAME_HEIGHT = 480;

    // 428x270 is the ID-1 ratio at 5 px per mm
    public static final int CARD_WIDTH = 428;
    public static final int CARD_HEIGHT = 270;

    private static final Scalar BACKGROUND = new Scalar(40, 40, 40);
    private static final Scalar CARD = new Scalar(200, 200, 200);
    private static final Scalar MARKER = new Scalar(30, 30, 30);
    private static final int MARKER_SIZE = 60;
    private static final int MARKER_OFFSET = 20;

    private SyntheticCards() {
    }

    /** Axis-aligned landscape card centered in the frame. */
    public static Point[] landscape() {
        double x = (FRAME_WIDTH - CARD_WIDTH) / 2.0;
        double y = (FRAME_HEIGHT - CARD_HEIGHT) / 2.0;
        return rect(x, y, CARD_WIDTH, CARD_HEIGHT);
    }

    /** The same card held upright. */
    public static Point[] portrait() {
        double x = (FRAME_WIDTH - CARD_HEIGHT) / 2.0;
        double y = (FRAME_HEIGHT - CARD_WIDTH * 0.85) / 2.0;
        return rect(x, y, CARD_HEIGHT * 0.85, CARD_WIDTH * 0.85);
    }

    /** Landscape card rotated around the frame center. */
    public static Point[] rotated(double angle) {
        RotatedRect box = new RotatedRect(new Point(FRAME_WIDTH / 2.0, FRAME_HEIGHT / 2.0),
                new Size(CARD_WIDTH, CARD_HEIGHT), angle);
        Point[] pts = new Point[4];
        box.points(pts);
        return pts;
    }

    /**
     * Renders a frame with a card at the given corners.
     *
     * @param corners    card corners in drawing order
     * @param withMarker whether to draw a dark square near the top-left corner of an axis-aligned card
     * @return a new BGR Mat, owned by the caller
     */
    public static Mat render(Point[] corners, boolean withMarker) {
        Mat img = new Mat(FRAME_HEIGHT, FRAME_WIDTH, CvType.CV_8UC3, BACKGROUND);
        MatOfPoint poly = new MatOfPoint(corners);
        Mat noise = new Mat(FRAME_HEIGHT, FRAME_WIDTH, CvType.CV_8UC3);
        try {
            Imgproc.fillConvexPoly(img, poly, CARD);
            if (withMarker) {
                Point tl = corners[0];
                Imgproc.rectangle(img,
                        new Point(tl.x + MARKER_OFFSET, tl.y + MARKER_OFFSET),
                        new Point(tl.x + MARKER_OFFSET + MARKER_SIZE, tl.y + MARKER_OFFSET + MARKER_SIZE),
                        MARKER, -1);
            }
            Core.setRNGSeed(42);
            Core.randu(noise, 0, 24);
            Core.add(img, noise, img);
            return img;
        } finally {
            poly.release();
            noise.release();
        }
    }

    /** Uniform gray frame without any texture. */
    public static Mat uniform(int value) {
        return new Mat(FRAME_HEIGHT, FRAME_WIDTH, CvType.CV_8UC3, new Scalar(value, value, value));
    }

    /** Uniform noise in {@code [low, high)}. */
    public static Mat noise(double low, double high) {
        Mat img = new Mat(FRAME_HEIGHT, FRAME_WIDTH, CvType.CV_8UC3);
        Core.setRNGSeed(7);
        Core.randu(img, low, high);
        return img;
    }

    public static Frame toFrame(Mat mat, long timestampMillis) {
        return MatUtils.toFrame(mat, timestampMillis);
    }

    private static Point[] rect(double x, double y, double w, double h) {
        return new Point[]{
                new Point(x, y),
                new Point(x + w, y),
                new Point(x + w, y + h),
                new Point(x, y + h)
        };
    }
}
