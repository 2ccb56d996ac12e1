package de.schliweb.idverify.image;

import java.util.Arrays;

/**
 * A raw camera frame: tightly packed pixel rows plus dimensions and capture time.
 * <p>
 * Frames are transient. A component that needs a frame beyond the current processing cycle keeps a
 * derived image (for example a downsampled thumbnail), never the frame itself.
 *
 * @param pixels          packed pixel data, {@code width * height * format.channels} bytes
 * @param width           frame width in pixels
 * @param height          frame height in pixels
 * @param format          interleaved pixel layout
 * @param timestampMillis capture timestamp in milliseconds
 */
public record Frame(byte[] pixels, int width, int height, PixelFormat format, long timestampMillis) {

    public Frame {
        if (pixels == null) throw new IllegalArgumentException("pixels must not be null");
        if (format == null) throw new IllegalArgumentException("format must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid frame size " + width + "x" + height);
        }
        long expected = (long) width * height * format.channels;
        if (pixels.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " bytes but got " + pixels.length);
        }
    }

    /**
     * Returns a frame with its own copy of the pixel data.
     */
    public Frame copy() {
        return new Frame(Arrays.copyOf(pixels, pixels.length), width, height, format, timestampMillis);
    }
}
