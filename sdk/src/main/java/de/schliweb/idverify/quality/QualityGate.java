package de.schliweb.idverify.quality;

import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.geometry.GeometryNormalizer;
import de.schliweb.idverify.image.MatUtils;
import de.schliweb.idverify.image.OpenCvRuntime;
import de.schliweb.idverify.result.ValidationError;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-OCR image quality check.
 * <p>
 * A frame that fails the gate must not be sent to the text recognizer. The gate passes only when the
 * blur, brightness and glare scores each reach the configured floor (0.5 by default).
 */
public class QualityGate {
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    private final ScannerConfig config;

    public QualityGate(OpenCvRuntime runtime, ScannerConfig config) {
        runtime.requireLoaded();
        this.config = config;
    }

    /**
     * Scores sharpness, brightness and glare of a frame.
     *
     * @param frame a BGR or gray image; an empty image fails every check
     * @return the quality metrics
     */
    public QualityMetrics assess(Mat frame) {
        if (frame == null || frame.empty()) {
            return new QualityMetrics(0, 0, 0, false,
                    List.of(ValidationError.QUALITY_BLUR, ValidationError.QUALITY_BRIGHTNESS, ValidationError.QUALITY_GLARE),
                    0, 0, 1);
        }

        Mat scaled = MatUtils.limitWidth(frame, config.getQualityMaxWidth());
        Mat gray = MatUtils.toGray(scaled);
        Mat bright = new Mat();
        try {
            double variance = GeometryNormalizer.laplacianVariance(gray);
            double luminance = Core.mean(gray).val[0];
            Imgproc.threshold(gray, bright, config.getGlarePixelCutoff() - 1, 255, Imgproc.THRESH_BINARY);
            double glareRatio = Core.countNonZero(bright) / (double) gray.total();

            double blurScore = blurScore(variance);
            double brightnessScore = brightnessScore(luminance);
            double glareScore = glareScore(glareRatio);

            double floor = config.getQualityFloor();
            List<ValidationError> failures = new ArrayList<>(3);
            if (blurScore < floor) failures.add(ValidationError.QUALITY_BLUR);
            if (brightnessScore < floor) failures.add(ValidationError.QUALITY_BRIGHTNESS);
            if (glareScore < floor) failures.add(ValidationError.QUALITY_GLARE);

            QualityMetrics metrics = new QualityMetrics(blurScore, glareScore, brightnessScore, failures.isEmpty(),
                    failures, variance, luminance, glareRatio);
            log.debug("Quality: variance={} luminance={} glare={} passed={}",
                    variance, luminance, glareRatio, metrics.passed());
            return metrics;
        } finally {
            MatUtils.release(scaled, gray, bright);
        }
    }

    double blurScore(double laplacianVariance) {
        if (laplacianVariance <= 0) return 0;
        return Math.min(1.0, laplacianVariance / config.getLaplacianReference());
    }

    double brightnessScore(double luminance) {
        if (luminance < config.getMinLuminance()) {
            return Math.max(0, luminance / config.getMinLuminance());
        }
        if (luminance > config.getMaxLuminance()) {
            return Math.max(0, (255.0 - luminance) / (255.0 - config.getMaxLuminance()));
        }
        return 1.0;
    }

    double glareScore(double glareRatio) {
        double ceiling = config.getGlareCeiling();
        double zeroAt = config.getGlareZeroAt();
        if (glareRatio <= ceiling) return 1.0;
        if (glareRatio >= zeroAt) return 0.0;
        return 1.0 - (glareRatio - ceiling) / (zeroAt - ceiling);
    }
}
