package de.schliweb.idverify.image;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.List;

/**
 * Conversions between {@link Frame}, OpenCV {@link Mat} and AWT images, plus release helpers.
 * <p>
 * This class cannot be instantiated.
 */
public final class MatUtils {

    private MatUtils() {
        // Utility class, no instances allowed
    }

    /**
     * Copies a frame into a new BGR (or gray) {@link Mat}. The caller owns the returned Mat.
     *
     * @param frame the raw frame
     * @return a CV_8UC3 BGR Mat for color frames, CV_8UC1 for gray frames
     */
    public static Mat toMat(Frame frame) {
        Mat raw = new Mat(frame.height(), frame.width(), frame.format().cvType);
        raw.put(0, 0, frame.pixels());
        switch (frame.format()) {
            case GRAY:
            case BGR:
                return raw;
            case BGRA: {
                Mat bgr = new Mat();
                Imgproc.cvtColor(raw, bgr, Imgproc.COLOR_BGRA2BGR);
                raw.release();
                return bgr;
            }
            case RGBA: {
                Mat bgr = new Mat();
                Imgproc.cvtColor(raw, bgr, Imgproc.COLOR_RGBA2BGR);
                raw.release();
                return bgr;
            }
            default:
                raw.release();
                throw new IllegalArgumentException("Unsupported pixel format " + frame.format());
        }
    }

    /**
     * Creates a frame from a Mat. Used by callers that already hold OpenCV images.
     *
     * @param mat             a CV_8UC1 or CV_8UC3 (BGR) Mat
     * @param timestampMillis capture time to attach
     * @return a frame with its own copy of the pixels
     */
    public static Frame toFrame(Mat mat, long timestampMillis) {
        PixelFormat format;
        if (mat.type() == CvType.CV_8UC1) {
            format = PixelFormat.GRAY;
        } else if (mat.type() == CvType.CV_8UC3) {
            format = PixelFormat.BGR;
        } else if (mat.type() == CvType.CV_8UC4) {
            format = PixelFormat.BGRA;
        } else {
            throw new IllegalArgumentException("Unsupported Mat type " + CvType.typeToString(mat.type()));
        }
        Mat src = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] data = new byte[(int) (src.total() * src.channels())];
            src.get(0, 0, data);
            return new Frame(data, src.cols(), src.rows(), format, timestampMillis);
        } finally {
            if (src != mat) src.release();
        }
    }

    /**
     * Returns a new single-channel copy of the input.
     */
    public static Mat toGray(Mat src) {
        Mat gray = new Mat();
        if (src.channels() == 3) {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (src.channels() == 4) {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            src.copyTo(gray);
        }
        return gray;
    }

    /**
     * Downscales the input so its width does not exceed {@code maxWidth}. Returns a new Mat in all cases.
     */
    public static Mat limitWidth(Mat src, int maxWidth) {
        Mat out = new Mat();
        if (maxWidth <= 0 || src.cols() <= maxWidth) {
            src.copyTo(out);
            return out;
        }
        double scale = maxWidth / (double) src.cols();
        Imgproc.resize(src, out, new Size(maxWidth, Math.max(1, Math.round(src.rows() * scale))), 0, 0, Imgproc.INTER_AREA);
        return out;
    }

    /**
     * Converts an 8-bit gray or BGR Mat into a {@link BufferedImage} for AWT based consumers such as Tess4J.
     */
    public static BufferedImage toBufferedImage(Mat mat) {
        int type;
        if (mat.channels() == 1) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        } else if (mat.channels() == 3) {
            type = BufferedImage.TYPE_3BYTE_BGR;
        } else {
            throw new IllegalArgumentException("Unsupported channel count " + mat.channels());
        }
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), type);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        Mat src = mat.isContinuous() ? mat : mat.clone();
        try {
            src.get(0, 0, target);
        } finally {
            if (src != mat) src.release();
        }
        return image;
    }

    /**
     * Releases the provided OpenCV Mat objects to free up native memory.
     * Null values are ignored.
     *
     * @param mats the Mats to release
     */
    public static void release(Mat... mats) {
        if (mats == null) return;
        for (Mat m : mats) {
            if (m != null) m.release();
        }
    }

    /**
     * Releases all Mats in the list and clears it.
     *
     * @param mats the Mats to release, may be null
     */
    public static void releaseAll(List<? extends Mat> mats) {
        if (mats == null) return;
        for (Mat m : mats) {
            if (m != null) m.release();
        }
        mats.clear();
    }
}
