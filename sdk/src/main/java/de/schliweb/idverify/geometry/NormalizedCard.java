package de.schliweb.idverify.geometry;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.image.MatUtils;
import lombok.Getter;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The rectified card of one frame: the canonical color image, its binarized variant and the region
 * crops of one side.
 * <p>
 * The card owns all of its Mats; {@link #close()} releases them. It is produced and consumed within
 * a single processing cycle.
 */
@Getter
public final class NormalizedCard implements AutoCloseable {

    private final DocumentSide side;
    private final Mat normalized;
    private final Mat binarized;
    private final Map<CardRegion, Mat> regions;

    NormalizedCard(DocumentSide side, Mat normalized, Mat binarized, Map<CardRegion, Mat> regions) {
        this.side = side;
        this.normalized = normalized;
        this.binarized = binarized;
        this.regions = Collections.unmodifiableMap(new EnumMap<>(regions));
    }

    /**
     * @return the crop for the region, or null if this side has no such region
     */
    public Mat region(CardRegion region) {
        return regions.get(region);
    }

    public int width() {
        return normalized.cols();
    }

    public int height() {
        return normalized.rows();
    }

    @Override
    public void close() {
        MatUtils.release(normalized, binarized);
        for (Mat m : regions.values()) {
            MatUtils.release(m);
        }
    }
}
