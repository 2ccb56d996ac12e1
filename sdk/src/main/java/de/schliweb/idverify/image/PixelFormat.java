package de.schliweb.idverify.image;

import org.opencv.core.CvType;

/**
 * Interleaved 8-bit pixel layouts accepted by {@link Frame}.
 */
public enum PixelFormat {
    GRAY(1, CvType.CV_8UC1),
    BGR(3, CvType.CV_8UC3),
    BGRA(4, CvType.CV_8UC4),
    RGBA(4, CvType.CV_8UC4);

    public final int channels;
    public final int cvType;

    PixelFormat(int channels, int cvType) {
        this.channels = channels;
        this.cvType = cvType;
    }
}
