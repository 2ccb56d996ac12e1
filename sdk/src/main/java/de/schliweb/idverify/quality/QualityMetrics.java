package de.schliweb.idverify.quality;

import de.schliweb.idverify.result.ValidationError;

import java.util.List;

/**
 * Image quality of one frame. All scores are normalized to [0,1] where 1 is best.
 *
 * @param blurScore         sharpness score
 * @param glareScore        absence of near-saturated highlights
 * @param brightnessScore   how well the mean luminance sits inside the accepted band
 * @param passed            whether every sub-score clears the quality floor
 * @param failures          reasons the gate rejected the frame, empty when passed
 * @param laplacianVariance raw Laplacian variance
 * @param meanLuminance     raw luminance-weighted mean in [0,255]
 * @param glareRatio        raw share of near-saturated pixels in [0,1]
 */
public record QualityMetrics(double blurScore,
                             double glareScore,
                             double brightnessScore,
                             boolean passed,
                             List<ValidationError> failures,
                             double laplacianVariance,
                             double meanLuminance,
                             double glareRatio) {

    public QualityMetrics {
        failures = List.copyOf(failures);
    }

    /**
     * Mean of the three sub-scores. Diagnostic only, the gate never decides on it.
     */
    public double overallScore() {
        return (blurScore + glareScore + brightnessScore) / 3.0;
    }
}
