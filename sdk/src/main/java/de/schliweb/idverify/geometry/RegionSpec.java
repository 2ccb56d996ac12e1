package de.schliweb.idverify.geometry;

import org.opencv.core.Rect;

/**
 * Position of a {@link CardRegion} as fractions of the canonical card size, plus how the crop is
 * prepared for recognition.
 *
 * @param x         left edge, fraction of the card width
 * @param y         top edge, fraction of the card height
 * @param width     width, fraction of the card width
 * @param height    height, fraction of the card height
 * @param pipeline  how the crop is post-processed
 * @param invert    invert the crop before thresholding (light text on dark background)
 * @param blockSize adaptive threshold block size, 0 selects Otsu's global threshold
 * @param constant  adaptive threshold constant
 */
public record RegionSpec(double x, double y, double width, double height,
                         Pipeline pipeline, boolean invert, int blockSize, double constant) {

    /**
     * Post-processing applied to a region crop.
     */
    public enum Pipeline {
        /** Returned as cropped, no binarization. */
        RAW,
        /** Generic field binarizer: local contrast enhancement, adaptive or Otsu threshold, closing. */
        FIELD,
        /** Lighter pipeline for the fixed-pitch MRZ font: light blur and a single adaptive threshold. */
        MRZ
    }

    static RegionSpec raw(double x, double y, double w, double h) {
        return new RegionSpec(x, y, w, h, Pipeline.RAW, false, 0, 0);
    }

    static RegionSpec field(double x, double y, double w, double h, boolean invert, int blockSize, double constant) {
        return new RegionSpec(x, y, w, h, Pipeline.FIELD, invert, blockSize, constant);
    }

    static RegionSpec mrz(double x, double y, double w, double h) {
        return new RegionSpec(x, y, w, h, Pipeline.MRZ, false, 0, 0);
    }

    /**
     * Converts the fractions into a pixel rectangle clamped to an image of the given size.
     * The rectangle is always at least one pixel wide and high.
     */
    public Rect toRect(int imageWidth, int imageHeight) {
        int px = clamp((int) Math.round(x * imageWidth), 0, imageWidth - 1);
        int py = clamp((int) Math.round(y * imageHeight), 0, imageHeight - 1);
        int pw = clamp((int) Math.round(width * imageWidth), 1, imageWidth - px);
        int ph = clamp((int) Math.round(height * imageHeight), 1, imageHeight - py);
        return new Rect(px, py, pw, ph);
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
