package de.schliweb.idverify.decision;

import de.schliweb.idverify.DocumentSide;

/**
 * Immutable view of one side's buffer, safe to hand to any thread.
 *
 * @param side         the document side
 * @param frameCount   buffered frames
 * @param averageScore mean buffered score, 0 when empty
 * @param stability    score stability in [0,1]
 * @param bestScore    best buffered score, 0 when empty
 * @param captured     whether the side has been committed
 */
public record BufferSnapshot(DocumentSide side,
                             int frameCount,
                             double averageScore,
                             double stability,
                             int bestScore,
                             boolean captured) {

    public static BufferSnapshot empty(DocumentSide side) {
        return new BufferSnapshot(side, 0, 0, 0, 0, false);
    }
}
