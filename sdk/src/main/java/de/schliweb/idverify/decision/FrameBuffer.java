package de.schliweb.idverify.decision;

import de.schliweb.idverify.DocumentSide;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of the most recent {@link FrameEvidence} of one document side.
 * <p>
 * When full, adding a frame evicts the oldest one. Decisions are taken over the buffered frames,
 * never over a single frame.
 * <p>
 * Not thread-safe: only the processing worker mutates a buffer, other threads read a
 * {@link BufferSnapshot}.
 */
public class FrameBuffer {

    static final double REFERENCE_VARIANCE = 400.0;

    private final int capacity;
    private final int requiredFrames;
    private final int consistentFrames;
    private final Deque<FrameEvidence> frames;

    public FrameBuffer(int capacity, int requiredFrames) {
        this(capacity, requiredFrames, requiredFrames);
    }

    /**
     * @param capacity         maximum number of frames kept
     * @param requiredFrames   frames needed before a side can be decided
     * @param consistentFrames length of the recent window checked by {@link #hasConsistentQuality(int)}
     */
    public FrameBuffer(int capacity, int requiredFrames, int consistentFrames) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive");
        if (requiredFrames < 1 || requiredFrames > capacity) {
            throw new IllegalArgumentException("requiredFrames must be in [1, capacity]");
        }
        if (consistentFrames < 1 || consistentFrames > capacity) {
            throw new IllegalArgumentException("consistentFrames must be in [1, capacity]");
        }
        this.capacity = capacity;
        this.requiredFrames = requiredFrames;
        this.consistentFrames = consistentFrames;
        this.frames = new ArrayDeque<>(capacity);
    }

    public void add(FrameEvidence evidence) {
        if (evidence == null) throw new IllegalArgumentException("evidence is null");
        frames.addLast(evidence);
        while (frames.size() > capacity) {
            frames.removeFirst();
        }
    }

    public int size() {
        return frames.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public boolean hasEnoughFrames() {
        return frames.size() >= requiredFrames;
    }

    /**
     * @return the highest-scoring buffered frame (the earliest one on ties), or null if empty
     */
    public FrameEvidence getBestResult() {
        FrameEvidence best = null;
        for (FrameEvidence e : frames) {
            if (best == null || e.score() > best.score()) best = e;
        }
        return best;
    }

    public double getAverageScore() {
        if (frames.isEmpty()) return 0;
        double sum = 0;
        for (FrameEvidence e : frames) sum += e.score();
        return sum / frames.size();
    }

    /**
     * Score stability: 1 minus the population variance of the buffered scores over 400, clamped to
     * [0,1]. A spread of about 20 points therefore reads as 0. Fewer than two frames give 0.
     */
    public double getStability() {
        if (frames.size() < 2) return 0;
        double mean = getAverageScore();
        double variance = 0;
        for (FrameEvidence e : frames) {
            double d = e.score() - mean;
            variance += d * d;
        }
        variance /= frames.size();
        return Math.max(0.0, Math.min(1.0, 1.0 - variance / REFERENCE_VARIANCE));
    }

    /**
     * @return the last {@code count} frames, oldest first
     */
    public List<FrameEvidence> getRecentFrames(int count) {
        List<FrameEvidence> all = new ArrayList<>(frames);
        int from = Math.max(0, all.size() - Math.max(0, count));
        return Collections.unmodifiableList(new ArrayList<>(all.subList(from, all.size())));
    }

    /**
     * @return true if the last K frames all passed the quality gate and scored at least {@code minScore}
     */
    public boolean hasConsistentQuality(int minScore) {
        List<FrameEvidence> recent = getRecentFrames(consistentFrames);
        if (recent.size() < consistentFrames) return false;
        for (FrameEvidence e : recent) {
            if (!e.qualityPassed() || e.score() < minScore) return false;
        }
        return true;
    }

    public void clear() {
        frames.clear();
    }

    public BufferSnapshot snapshot(DocumentSide side, boolean captured) {
        FrameEvidence best = getBestResult();
        return new BufferSnapshot(side, frames.size(), getAverageScore(), getStability(),
                best == null ? 0 : best.score(), captured);
    }
}
