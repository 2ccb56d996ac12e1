package de.schliweb.idverify.geometry;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.image.MatUtils;
import de.schliweb.idverify.image.OpenCvRuntime;
import de.schliweb.idverify.result.Outcome;
import de.schliweb.idverify.result.ValidationError;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the card in a raw frame and turns it into OCR-ready images.
 * <p>
 * The pipeline is classical computer vision: edge based quadrilateral detection, a homography to the
 * canonical ID-1 size, local-contrast adaptive binarization and fixed-layout region crops. It also
 * provides the image metrics used for live feedback (glare, blur, frame-to-frame stability).
 * <p>
 * Every method returns new Mats owned by the caller and never retains its inputs.
 */
public class GeometryNormalizer {
    private static final Logger log = LoggerFactory.getLogger(GeometryNormalizer.class);

    private static final double FIELD_CLAHE_CLIP = 3.0;
    private static final int FIELD_CLAHE_TILE = 4;
    private static final double MIN_QUAD_AREA = 1.0;
    // mean gray difference between the two long-edge bands that marks the MRZ side
    private static final double MRZ_BAND_CONTRAST = 20.0;

    private final ScannerConfig config;

    public GeometryNormalizer(OpenCvRuntime runtime, ScannerConfig config) {
        runtime.requireLoaded();
        this.config = config;
    }

    /**
     * Detects the card boundary in a frame.
     * <p>
     * Grayscale, 5x5 Gaussian blur, Canny edges, dilation to close gaps, then every closed contour
     * is approximated to a polygon. Convex quadrilaterals covering at least the configured share of
     * the frame and whose width/height ratio lies in the wide admission window are
     * candidates; the largest one wins.
     *
     * @param frame a BGR or gray frame
     * @return the detected geometry, or {@link CardGeometry#notDetected()}
     */
    public CardGeometry detectGeometry(Mat frame) {
        if (frame == null || frame.empty()) return CardGeometry.notDetected();

        Mat gray = MatUtils.toGray(frame);
        Mat edges = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();

        try {
            Imgproc.GaussianBlur(gray, gray, new Size(5, 5), 0);
            Imgproc.Canny(gray, edges, config.getCannyLow(), config.getCannyHigh());
            Imgproc.dilate(edges, edges, kernel, new Point(-1, -1), config.getDilateIterations());
            Imgproc.findContours(edges, contours, hierarchy, Imgproc.RETR_LIST, Imgproc.CHAIN_APPROX_SIMPLE);

            double frameArea = (double) frame.cols() * frame.rows();
            double minArea = frameArea * config.getMinAreaRatio();
            double bestArea = 0;
            Point[] bestQuad = null;

            for (MatOfPoint contour : contours) {
                double area = Imgproc.contourArea(contour);
                if (area < minArea) continue;

                Point[] quad = approximateQuad(contour);
                if (quad == null) continue;

                double aspect = CornerOrder.aspectRatio(CornerOrder.order(quad));
                if (aspect < config.getAdmitAspectMin() || aspect > config.getAdmitAspectMax()) continue;

                if (area > bestArea) {
                    bestArea = area;
                    bestQuad = quad;
                }
            }

            if (bestQuad == null) {
                log.debug("No card quadrilateral among {} contours", contours.size());
                return CardGeometry.notDetected();
            }

            double confidence = Math.min(1.0, bestArea / (0.5 * frameArea));
            log.debug("Card quadrilateral found: area={} confidence={}", bestArea, confidence);
            return new CardGeometry(bestQuad, bestArea, confidence, true);
        } finally {
            MatUtils.release(gray, edges, kernel, hierarchy);
            MatUtils.releaseAll(contours);
        }
    }

    private Point[] approximateQuad(MatOfPoint contour) {
        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        MatOfPoint approxAsPoints = null;
        try {
            double epsilon = Imgproc.arcLength(curve, true) * config.getApproxEpsilon();
            Imgproc.approxPolyDP(curve, approx, epsilon, true);
            if (approx.total() != 4) return null;
            approxAsPoints = new MatOfPoint(approx.toArray());
            if (!Imgproc.isContourConvex(approxAsPoints)) return null;
            return approx.toArray();
        } finally {
            MatUtils.release(curve, approx, approxAsPoints);
        }
    }

    /**
     * Warps the detected card to the canonical size.
     * <p>
     * The output is landscape (for example 856x540) unless the measured card is taller than wide, in
     * which case the transposed preset is used. Degenerate corner sets (zero area, collinear points)
     * fail with {@link ValidationError#RECTIFICATION_FAILED}.
     *
     * @param frame    the frame the geometry was detected in
     * @param geometry the detected card boundary
     * @return the rectified color image, or a failure tag
     */
    public Outcome<Mat> rectify(Mat frame, CardGeometry geometry) {
        if (geometry == null || !geometry.detected()) {
            return Outcome.failure(ValidationError.GEOMETRY_NOT_FOUND);
        }
        if (frame == null || frame.empty()) {
            return Outcome.failure(ValidationError.RECTIFICATION_FAILED);
        }
        Point[] src = geometry.orderedCorners();
        if (isDegenerate(src)) {
            log.warn("Rectification skipped, degenerate corners");
            return Outcome.failure(ValidationError.RECTIFICATION_FAILED);
        }

        double widthTop = CornerOrder.distance(src[CornerOrder.TOP_LEFT], src[CornerOrder.TOP_RIGHT]);
        double widthBottom = CornerOrder.distance(src[CornerOrder.BOTTOM_LEFT], src[CornerOrder.BOTTOM_RIGHT]);
        double heightLeft = CornerOrder.distance(src[CornerOrder.TOP_LEFT], src[CornerOrder.BOTTOM_LEFT]);
        double heightRight = CornerOrder.distance(src[CornerOrder.TOP_RIGHT], src[CornerOrder.BOTTOM_RIGHT]);
        double maxWidth = Math.max(widthTop, widthBottom);
        double maxHeight = Math.max(heightLeft, heightRight);

        Size target = maxHeight > maxWidth
                ? new Size(config.getCanonicalHeight(), config.getCanonicalWidth())
                : new Size(config.getCanonicalWidth(), config.getCanonicalHeight());

        Mat srcMat = new Mat(4, 1, CvType.CV_32FC2);
        Mat dstMat = new Mat(4, 1, CvType.CV_32FC2);
        Mat transform = null;
        Mat output = new Mat();
        try {
            Point[] dst = new Point[]{
                    new Point(0, 0),
                    new Point(target.width - 1, 0),
                    new Point(target.width - 1, target.height - 1),
                    new Point(0, target.height - 1)
            };
            for (int i = 0; i < 4; i++) {
                srcMat.put(i, 0, src[i].x, src[i].y);
                dstMat.put(i, 0, dst[i].x, dst[i].y);
            }
            transform = Imgproc.getPerspectiveTransform(srcMat, dstMat);
            Imgproc.warpPerspective(frame, output, transform, target, Imgproc.INTER_CUBIC);
            if (output.empty()) {
                output.release();
                return Outcome.failure(ValidationError.RECTIFICATION_FAILED);
            }
            return Outcome.success(output);
        } catch (CvException e) {
            log.warn("warpPerspective failed: {}", e.getMessage());
            output.release();
            return Outcome.failure(ValidationError.RECTIFICATION_FAILED);
        } finally {
            MatUtils.release(srcMat, dstMat, transform);
        }
    }

    private static boolean isDegenerate(Point[] ordered) {
        if (CornerOrder.area(ordered) < MIN_QUAD_AREA) return true;
        // any three corners on one line
        for (int i = 0; i < 4; i++) {
            Point a = ordered[i], b = ordered[(i + 1) % 4], c = ordered[(i + 2) % 4];
            double cross = (b.x - a.x) * (c.y - a.y) - (b.y - a.y) * (c.x - a.x);
            if (Math.abs(cross) < MIN_QUAD_AREA) return true;
        }
        return false;
    }

    /**
     * Binarizes a card image for OCR.
     * <p>
     * Grayscale, CLAHE (tile based contrast enhancement), a 3x3 Gaussian blur as the only denoise
     * step so thin strokes such as the MRZ filler survive, Gaussian adaptive thresholding and a 2x2
     * closing that removes isolated dark speckle.
     *
     * @param image a BGR or gray image
     * @return a new binary image, text black on white
     */
    public Mat binarize(Mat image) {
        Mat gray = MatUtils.toGray(image);
        Mat enhanced = new Mat();
        Mat binary = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(2, 2));
        try {
            int tile = config.getClaheTileSize();
            CLAHE clahe = Imgproc.createCLAHE(config.getClaheClipLimit(), new Size(tile, tile));
            clahe.apply(gray, enhanced);
            Imgproc.GaussianBlur(enhanced, enhanced, new Size(3, 3), 0);
            Imgproc.adaptiveThreshold(enhanced, binary, 255, Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                    Imgproc.THRESH_BINARY, config.getBinarizeBlockSize(), config.getBinarizeConstant());
            Imgproc.morphologyEx(binary, binary, Imgproc.MORPH_CLOSE, kernel);
            return binary;
        } finally {
            MatUtils.release(gray, enhanced, kernel);
        }
    }

    /**
     * Crops one region out of a canonical card image and prepares it for OCR.
     * <p>
     * {@link CardRegion#PHOTO} is returned unbinarized. MRZ regions use a light 3x3 blur and a
     * single adaptive threshold, every other field goes through the per-field binarizer configured
     * in {@link RegionTable}.
     *
     * @param normalized the canonical (landscape) card image
     * @param region     the field to crop
     * @param backSide   whether the image shows the back of the card
     * @return the prepared crop
     * @throws IllegalArgumentException if the region does not exist on the given side
     */
    public Mat extractRegion(Mat normalized, CardRegion region, boolean backSide) {
        DocumentSide side = backSide ? DocumentSide.BACK : DocumentSide.FRONT;
        RegionSpec spec = RegionTable.lookup(region, side);
        if (spec == null) {
            throw new IllegalArgumentException(region + " is not a " + side + " region");
        }
        Rect rect = spec.toRect(normalized.cols(), normalized.rows());
        Mat view = normalized.submat(rect);
        try {
            switch (spec.pipeline()) {
                case RAW:
                    return view.clone();
                case MRZ:
                    return binarizeMrz(view);
                case FIELD:
                default:
                    return binarizeField(view, spec);
            }
        } finally {
            view.release();
        }
    }

    private Mat binarizeMrz(Mat crop) {
        Mat gray = MatUtils.toGray(crop);
        Mat binary = new Mat();
        try {
            Imgproc.GaussianBlur(gray, gray, new Size(3, 3), 0);
            Imgproc.adaptiveThreshold(gray, binary, 255, Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                    Imgproc.THRESH_BINARY, config.getMrzBlockSize(), config.getMrzConstant());
            return binary;
        } finally {
            MatUtils.release(gray);
        }
    }

    private Mat binarizeField(Mat crop, RegionSpec spec) {
        Mat gray = MatUtils.toGray(crop);
        Mat enhanced = new Mat();
        Mat binary = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(2, 2));
        try {
            CLAHE clahe = Imgproc.createCLAHE(FIELD_CLAHE_CLIP, new Size(FIELD_CLAHE_TILE, FIELD_CLAHE_TILE));
            clahe.apply(gray, enhanced);
            if (spec.invert()) {
                Core.bitwise_not(enhanced, enhanced);
            }
            int block = spec.blockSize();
            if (block >= 3) {
                if (block % 2 == 0) block++;
                Imgproc.adaptiveThreshold(enhanced, binary, 255, Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                        Imgproc.THRESH_BINARY, block, spec.constant());
            } else {
                Imgproc.threshold(enhanced, binary, 0, 255, Imgproc.THRESH_BINARY + Imgproc.THRESH_OTSU);
            }
            Imgproc.morphologyEx(binary, binary, Imgproc.MORPH_CLOSE, kernel);
            return binary;
        } finally {
            MatUtils.release(gray, enhanced, kernel);
        }
    }

    /**
     * Rectifies the card and builds every OCR input for one side.
     * <p>
     * A card held in portrait is rotated a quarter turn clockwise after rectification so the
     * returned canonical image is always landscape and the region table applies. That assumes the
     * card's top edge faces left in the frame. For the back side the MRZ band settles the question:
     * when the band opposite the MRZ region holds clearly more ink, the card was turned the other
     * way and the image is turned a further half turn. The front has no such anchor and keeps the
     * clockwise assumption.
     *
     * @param frame    the raw frame
     * @param geometry the card boundary detected in {@code frame}
     * @param side     which side of the card is expected
     * @return the normalized card, or the rectification failure tags
     */
    public Outcome<NormalizedCard> normalize(Mat frame, CardGeometry geometry, DocumentSide side) {
        Outcome<Mat> rectified = rectify(frame, geometry);
        if (!rectified.isSuccess()) {
            ValidationError first = rectified.errors().get(0);
            return Outcome.failure(first);
        }
        Mat canonical = rectified.get();
        if (canonical.rows() > canonical.cols()) {
            Mat rotated = new Mat();
            Core.rotate(canonical, rotated, Core.ROTATE_90_CLOCKWISE);
            canonical.release();
            canonical = rotated;
            if (side == DocumentSide.BACK && mrzBandIsOnTop(canonical)) {
                log.debug("Portrait back side held top to the right, turning half a turn");
                Mat flipped = new Mat();
                Core.rotate(canonical, flipped, Core.ROTATE_180);
                canonical.release();
                canonical = flipped;
            }
        }

        Map<CardRegion, Mat> crops = new EnumMap<>(CardRegion.class);
        for (CardRegion region : RegionTable.regions(side).keySet()) {
            crops.put(region, extractRegion(canonical, region, side == DocumentSide.BACK));
        }
        Mat binarized = binarize(canonical);
        return Outcome.success(new NormalizedCard(side, canonical, binarized, crops));
    }

    private static boolean mrzBandIsOnTop(Mat canonical) {
        Rect bottom = RegionTable.lookup(CardRegion.MRZ, DocumentSide.BACK).toRect(canonical.cols(), canonical.rows());
        Rect top = new Rect(bottom.x, canonical.rows() - bottom.y - bottom.height, bottom.width, bottom.height);
        return meanGray(canonical, bottom) - meanGray(canonical, top) > MRZ_BAND_CONTRAST;
    }

    private static double meanGray(Mat image, Rect rect) {
        Mat view = image.submat(rect);
        Mat gray = MatUtils.toGray(view);
        try {
            return Core.mean(gray).val[0];
        } finally {
            MatUtils.release(view, gray);
        }
    }

    /**
     * Fraction of pixels at or above the glare pixel cutoff (250 by default), the same measure the
     * quality gate applies. Lower is better.
     *
     * @param image a BGR or gray image
     * @return glare ratio in [0,1], 1 for an empty image
     */
    public double glareScore(Mat image) {
        if (image == null || image.empty()) return 1.0;
        Mat gray = MatUtils.toGray(image);
        Mat bright = new Mat();
        try {
            Imgproc.threshold(gray, bright, config.getGlarePixelCutoff() - 1, 255, Imgproc.THRESH_BINARY);
            return Core.countNonZero(bright) / (double) gray.total();
        } finally {
            MatUtils.release(gray, bright);
        }
    }

    /**
     * Sharpness as the variance of the Laplacian, scaled and clamped to [0,100]. Higher is sharper.
     *
     * @param image a BGR or gray image
     * @return the sharpness score, 0 for an empty image
     */
    public double blurScore(Mat image) {
        if (image == null || image.empty()) return 0;
        double variance = laplacianVariance(image);
        return Math.min(100.0, variance * config.getBlurScale());
    }

    /**
     * Variance of the discrete Laplacian of the gray image.
     */
    public static double laplacianVariance(Mat image) {
        Mat gray = MatUtils.toGray(image);
        Mat laplacian = new Mat();
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stddev = new MatOfDouble();
        try {
            Imgproc.Laplacian(gray, laplacian, CvType.CV_64F);
            Core.meanStdDev(laplacian, mean, stddev);
            double sd = stddev.toArray()[0];
            return sd * sd;
        } finally {
            MatUtils.release(gray, laplacian, mean, stddev);
        }
    }

    /**
     * Downsampled gray copy of a normalized card, the only derivative kept between frames.
     */
    public Mat thumbnail(Mat normalized) {
        Mat gray = MatUtils.toGray(normalized);
        Mat small = new Mat();
        try {
            Imgproc.resize(gray, small, new Size(config.getStabilityWidth(), config.getStabilityHeight()),
                    0, 0, Imgproc.INTER_AREA);
            return small;
        } finally {
            gray.release();
        }
    }

    /**
     * Frame-to-frame similarity of two normalized images: 1 minus the mean absolute pixel difference
     * of their thumbnails divided by 255.
     *
     * @return stability in [0,1], 1 for identical images, 0 if either image is missing
     */
    public double stability(Mat current, Mat previous) {
        if (current == null || current.empty() || previous == null || previous.empty()) return 0;
        Mat a = thumbnail(current);
        Mat b = thumbnail(previous);
        Mat diff = new Mat();
        try {
            Core.absdiff(a, b, diff);
            Scalar mean = Core.mean(diff);
            return Math.max(0.0, Math.min(1.0, 1.0 - mean.val[0] / 255.0));
        } finally {
            MatUtils.release(a, b, diff);
        }
    }
}
