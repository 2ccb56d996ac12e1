package de.schliweb.idverify.decision;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.mrz.IdentityFields;
import de.schliweb.idverify.mrz.MrzCorrector;
import de.schliweb.idverify.mrz.MrzLines;
import de.schliweb.idverify.mrz.MrzParser;
import de.schliweb.idverify.result.Outcome;
import de.schliweb.idverify.result.ValidationError;
import de.schliweb.idverify.scoring.Decision;
import de.schliweb.idverify.scoring.ScoreBreakdown;
import de.schliweb.idverify.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-frame decisions for both sides of a card.
 * <p>
 * Each side has its own {@link FrameBuffer}. A side is committed once its buffer holds the
 * required number of frames and the best buffered score clears the RETRY threshold, or when the
 * caller forces a manual capture that passes the relaxed per-side thresholds. With both sides
 * committed, {@link #completeSession(LocalDate)} combines them.
 * <p>
 * Single writer: {@link #addEvidence}, {@link #evaluateSide}, {@link #captureManually},
 * {@link #completeSession} and {@link #reset} must be called from one thread, the processing
 * worker. {@link #snapshot(DocumentSide)}, {@link #isCaptured(DocumentSide)} and
 * {@link #committed(DocumentSide)} may be called from any thread.
 */
public class DecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final ScannerConfig config;
    private final ScoringEngine scoring;
    private final MrzCorrector corrector;
    private final MrzParser parser = new MrzParser();

    private final Map<DocumentSide, FrameBuffer> buffers = new EnumMap<>(DocumentSide.class);
    private final Map<DocumentSide, FrameEvidence> lastEvidence = new EnumMap<>(DocumentSide.class);

    private volatile DecisionResult frontResult;
    private volatile DecisionResult backResult;
    private volatile BufferSnapshot frontSnapshot = BufferSnapshot.empty(DocumentSide.FRONT);
    private volatile BufferSnapshot backSnapshot = BufferSnapshot.empty(DocumentSide.BACK);

    public DecisionEngine(ScannerConfig config) {
        this(config, new ScoringEngine(config));
    }

    public DecisionEngine(ScannerConfig config, ScoringEngine scoring) {
        this.config = config;
        this.scoring = scoring;
        this.corrector = new MrzCorrector(config);
        for (DocumentSide side : DocumentSide.values()) {
            buffers.put(side, new FrameBuffer(config.getBufferCapacity(), config.getRequiredFrames(),
                    config.getConsistentFrames()));
        }
    }

    /**
     * Buffers the evidence of one processed frame and remembers it for a manual capture.
     * Evidence for an already committed side is ignored.
     */
    public void addEvidence(DocumentSide side, FrameEvidence evidence) {
        if (isCaptured(side)) {
            log.debug("Ignoring evidence for committed {} side", side);
            return;
        }
        buffers.get(side).add(evidence);
        lastEvidence.put(side, evidence);
        publish(side);
    }

    /**
     * Decides a side over its buffered frames and commits it when the decision is final.
     *
     * @return the committed result, or empty while more frames are needed
     */
    public Optional<DecisionResult> evaluateSide(DocumentSide side) {
        DecisionResult committed = committed(side);
        if (committed != null) return Optional.of(committed);

        FrameBuffer buffer = buffers.get(side);
        if (!buffer.hasEnoughFrames()) return Optional.empty();
        FrameEvidence best = buffer.getBestResult();
        if (best == null || best.score() < config.getRetryThreshold()) {
            return Optional.empty();
        }
        DecisionResult result = toResult(side, best);
        commit(side, result);
        log.info("{} side committed: decision={} score={} frames={}",
                side, result.decision(), result.totalScore(), buffer.size());
        return Optional.of(result);
    }

    /**
     * Forces a decision on the most recently processed frame of a side, bypassing the buffering
     * requirement but applying the relaxed manual thresholds of {@link ScoringEngine}.
     *
     * @return the committed result, or the reasons the frame was not accepted
     */
    public Outcome<DecisionResult> captureManually(DocumentSide side) {
        FrameEvidence last = lastEvidence.get(side);
        if (last == null) {
            return Outcome.failure(ValidationError.INSUFFICIENT_CONSISTENT_FRAMES);
        }
        if (!scoring.passesManualCapture(last.breakdown(), side)) {
            log.debug("Manual {} capture rejected: {}", side, last.breakdown());
            return last.errors().isEmpty()
                    ? Outcome.failure(ValidationError.INSUFFICIENT_CONSISTENT_FRAMES)
                    : Outcome.failure(last.errors());
        }
        DecisionResult result = toResult(side, last);
        commit(side, result);
        log.info("{} side captured manually: decision={} score={}", side, result.decision(), result.totalScore());
        return Outcome.success(result);
    }

    /**
     * Combines both committed sides.
     * <p>
     * The session score is the floored mean of the two side scores. Identity fields come from the
     * back-side MRZ rows, corrected again with the national id and document number read on the
     * front.
     *
     * @param today reference date for century resolution and the expiry check
     * @return the session result, or {@link ValidationError#INSUFFICIENT_CONSISTENT_FRAMES} if a
     * side is not committed yet
     */
    public Outcome<SessionResult> completeSession(LocalDate today) {
        DecisionResult front = frontResult;
        DecisionResult back = backResult;
        if (front == null || back == null) {
            return Outcome.failure(ValidationError.INSUFFICIENT_CONSISTENT_FRAMES);
        }
        int score = (front.totalScore() + back.totalScore()) / 2;
        Decision decision = scoring.decide(score);

        Set<ValidationError> errors = new LinkedHashSet<>(front.errors());
        errors.addAll(back.errors());

        ExtractedFields frontFields = front.fields();
        ExtractedFields backFields = back.fields();
        List<String> rows = !backFields.mrzRows().isEmpty()
                ? backFields.mrzRows()
                : backFields.correctedMrz() != null ? backFields.correctedMrz().rows() : List.of();

        IdentityFields identity = null;
        MrzLines corrected = null;
        if (rows.isEmpty()) {
            errors.add(ValidationError.MRZ_NOT_FOUND);
        } else {
            corrected = corrector.correct(rows, frontFields.nationalId(), frontFields.documentNumber());
            identity = parser.parse(corrected, today);
            if (identity.isExpired(today)) {
                errors.add(ValidationError.DOCUMENT_EXPIRED);
            }
        }

        ScoreBreakdown fb = front.breakdown();
        ScoreBreakdown bb = back.breakdown();
        ScoreBreakdown combinedBreakdown = new ScoreBreakdown(
                Math.max(fb.aspectRatio(), bb.aspectRatio()),
                fb.frontText(),
                bb.mrzStructure(),
                bb.mrzChecksum(),
                fb.nationalId());
        ExtractedFields fields = new ExtractedFields(
                frontFields.textLines(),
                frontFields.nationalId() != null ? frontFields.nationalId() : backFields.nationalId(),
                frontFields.documentNumber() != null ? frontFields.documentNumber() : backFields.documentNumber(),
                rows,
                corrected);

        DecisionResult combined = new DecisionResult(null, decision, score, combinedBreakdown,
                new ArrayList<>(errors), fields);
        log.info("Session completed: decision={} score={} (front={}, back={})",
                decision, score, front.totalScore(), back.totalScore());
        return Outcome.success(new SessionResult(combined, front, back, identity));
    }

    public boolean isCaptured(DocumentSide side) {
        return committed(side) != null;
    }

    /**
     * @return the committed result of a side, or null
     */
    public DecisionResult committed(DocumentSide side) {
        return side == DocumentSide.FRONT ? frontResult : backResult;
    }

    public BufferSnapshot snapshot(DocumentSide side) {
        return side == DocumentSide.FRONT ? frontSnapshot : backSnapshot;
    }

    /**
     * Drops all buffered frames and committed results.
     */
    public void reset() {
        for (FrameBuffer buffer : buffers.values()) buffer.clear();
        lastEvidence.clear();
        frontResult = null;
        backResult = null;
        frontSnapshot = BufferSnapshot.empty(DocumentSide.FRONT);
        backSnapshot = BufferSnapshot.empty(DocumentSide.BACK);
    }

    private DecisionResult toResult(DocumentSide side, FrameEvidence evidence) {
        return new DecisionResult(side, scoring.decide(evidence.score()), evidence.score(),
                evidence.breakdown(), evidence.errors(), evidence.fields());
    }

    private void commit(DocumentSide side, DecisionResult result) {
        if (side == DocumentSide.FRONT) {
            frontResult = result;
        } else {
            backResult = result;
        }
        publish(side);
    }

    private void publish(DocumentSide side) {
        BufferSnapshot snapshot = buffers.get(side).snapshot(side, isCaptured(side));
        if (side == DocumentSide.FRONT) {
            frontSnapshot = snapshot;
        } else {
            backSnapshot = snapshot;
        }
    }
}
