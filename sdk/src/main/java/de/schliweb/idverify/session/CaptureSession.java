package de.schliweb.idverify.session;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.decision.BufferSnapshot;
import de.schliweb.idverify.decision.DecisionEngine;
import de.schliweb.idverify.decision.DecisionResult;
import de.schliweb.idverify.decision.SessionResult;
import de.schliweb.idverify.image.Frame;
import de.schliweb.idverify.image.OpenCvRuntime;
import de.schliweb.idverify.ocr.TextRecognizer;
import de.schliweb.idverify.result.Outcome;
import de.schliweb.idverify.result.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A two-sided capture session: front first, then back.
 * <p>
 * Frames are processed asynchronously on a dedicated single-threaded worker. While a frame is in
 * flight, newly submitted frames are dropped, so the producer never blocks and only the most recent
 * frame is ever worked on. All state of the session is mutated on the worker; listener callbacks
 * are delivered there too, in submission order.
 * <p>
 * Phases: {@code IDLE -> SCANNING_FRONT -> FRONT_CAPTURED -> SCANNING_BACK -> BACK_CAPTURED ->
 * COMPLETED}. A side is captured automatically once its frame buffer yields a decision, or
 * explicitly with {@link #captureManually()}. The caller moves on to the back with
 * {@link #switchToBackSide()}.
 */
public class CaptureSession {
    private static final Logger log = LoggerFactory.getLogger(CaptureSession.class);

    private final ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "idverify-capture");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean busy = new AtomicBoolean(false);

    private final FrameProcessor processor;
    private final DecisionEngine decisions;
    private final SessionListener listener;
    private final Clock clock;

    private volatile ScanPhase phase = ScanPhase.IDLE;
    private volatile boolean shutdown = false;

    public CaptureSession(ScannerConfig config, OpenCvRuntime runtime, TextRecognizer recognizer,
                          SessionListener listener) {
        this(new FrameProcessor(runtime, config, recognizer), new DecisionEngine(config), listener,
                Clock.systemDefaultZone());
    }

    public CaptureSession(FrameProcessor processor, DecisionEngine decisions, SessionListener listener, Clock clock) {
        this.processor = processor;
        this.decisions = decisions;
        this.listener = listener != null ? listener : new SessionListener() {
        };
        this.clock = clock;
    }

    /**
     * Starts scanning the front side.
     *
     * @throws IllegalStateException if the session is shut down or not idle
     */
    public void start() {
        ensureOpen();
        runOnWorker(() -> {
            if (phase != ScanPhase.IDLE) {
                log.warn("start() ignored in phase {}", phase);
                return;
            }
            setPhase(ScanPhase.SCANNING_FRONT);
        });
    }

    /**
     * Hands a frame to the worker unless one is already in flight.
     *
     * @param frame the camera frame; it is copied, the caller keeps ownership
     * @return true if the frame was accepted, false if it was dropped
     */
    public boolean submitFrame(Frame frame) {
        if (frame == null || shutdown || !phase.isScanning()) return false;
        if (busy.getAndSet(true)) return false;

        final Frame frameRef = frame.copy();
        try {
            exec.execute(() -> {
                try {
                    handleFrame(frameRef);
                } catch (RuntimeException e) {
                    log.warn("Frame processing failed: {}", e.getMessage(), e);
                    DocumentSide side = scanningSide();
                    notifyListener(() -> listener.onFrameFailed(side, e));
                } finally {
                    busy.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            busy.set(false);
            log.debug("Frame rejected, session is shutting down");
            return false;
        }
    }

    /**
     * Moves from a captured front side to scanning the back.
     *
     * @throws IllegalStateException if the session is shut down
     */
    public void switchToBackSide() {
        ensureOpen();
        runOnWorker(() -> {
            if (phase != ScanPhase.FRONT_CAPTURED) {
                log.warn("switchToBackSide() ignored in phase {}", phase);
                return;
            }
            setPhase(ScanPhase.SCANNING_BACK);
        });
    }

    /**
     * Captures the side being scanned from its most recently processed frame, using the relaxed
     * manual thresholds.
     *
     * @return the side result, or the reasons the capture was rejected
     * @throws IllegalStateException if the session is shut down
     */
    public Future<Outcome<DecisionResult>> captureManually() {
        ensureOpen();
        return CompletableFuture.supplyAsync(() -> {
            DocumentSide side = scanningSide();
            if (side == null) {
                return Outcome.<DecisionResult>failure(ValidationError.INSUFFICIENT_CONSISTENT_FRAMES);
            }
            Outcome<DecisionResult> outcome = decisions.captureManually(side);
            if (outcome.isSuccess()) {
                sideCaptured(outcome.get());
            } else {
                notifyListener(() -> listener.onManualCaptureRejected(side, outcome.errors()));
            }
            return outcome;
        }, exec);
    }

    /**
     * Clears both sides and returns to {@link ScanPhase#IDLE}.
     *
     * @throws IllegalStateException if the session is shut down
     */
    public Future<?> reset() {
        ensureOpen();
        return exec.submit(() -> {
            decisions.reset();
            processor.reset();
            setPhase(ScanPhase.IDLE);
        });
    }

    /**
     * Stops the worker and discards in-flight work. The session cannot be restarted.
     */
    public void shutdown() {
        shutdown = true;
        exec.shutdownNow();
        try {
            if (exec.awaitTermination(1, TimeUnit.SECONDS)) {
                processor.reset();
            } else {
                log.warn("Capture worker did not stop within 1s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public ScanPhase getPhase() {
        return phase;
    }

    public BufferSnapshot snapshot(DocumentSide side) {
        return decisions.snapshot(side);
    }

    private void handleFrame(Frame frame) {
        DocumentSide side = scanningSide();
        if (side == null) return;

        FrameReport report;
        if (side == DocumentSide.BACK) {
            DecisionResult front = decisions.committed(DocumentSide.FRONT);
            String knownId = front != null ? front.fields().nationalId() : null;
            String knownNumber = front != null ? front.fields().documentNumber() : null;
            report = processor.process(frame, side, knownId, knownNumber);
        } else {
            report = processor.process(frame, side);
        }

        if (report.state() == CaptureState.ERROR) {
            FrameReport errorReport = report;
            notifyListener(() -> listener.onFrameProcessed(errorReport));
            notifyListener(() -> listener.onError(ValidationError.OCR_UNAVAILABLE, null));
            setPhase(ScanPhase.ERROR);
            return;
        }
        if (!report.hasEvidence()) {
            FrameReport plain = report;
            notifyListener(() -> listener.onFrameProcessed(plain));
            return;
        }

        decisions.addEvidence(side, report.evidence());
        Optional<DecisionResult> result = decisions.evaluateSide(side);
        FrameReport finalReport = result.isPresent() ? report.withState(CaptureState.CAPTURED) : report;
        notifyListener(() -> listener.onFrameProcessed(finalReport));
        result.ifPresent(this::sideCaptured);
    }

    private void sideCaptured(DecisionResult result) {
        notifyListener(() -> listener.onSideCaptured(result));
        if (result.side() == DocumentSide.FRONT) {
            setPhase(ScanPhase.FRONT_CAPTURED);
            return;
        }
        setPhase(ScanPhase.BACK_CAPTURED);
        Outcome<SessionResult> session = decisions.completeSession(LocalDate.now(clock));
        if (!session.isSuccess()) {
            log.warn("Back side captured before front side: {}", session.errors());
            return;
        }
        SessionResult sessionResult = session.get();
        notifyListener(() -> listener.onSessionCompleted(sessionResult));
        setPhase(sessionResult.isValid() ? ScanPhase.COMPLETED : ScanPhase.ERROR);
    }

    private DocumentSide scanningSide() {
        switch (phase) {
            case SCANNING_FRONT:
                return DocumentSide.FRONT;
            case SCANNING_BACK:
                return DocumentSide.BACK;
            default:
                return null;
        }
    }

    private void setPhase(ScanPhase next) {
        ScanPhase previous = phase;
        if (previous == next) return;
        phase = next;
        log.info("Scan phase {} -> {}", previous, next);
        notifyListener(() -> listener.onPhaseChanged(previous, next));
    }

    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Session listener failed: {}", e.getMessage(), e);
        }
    }

    private void runOnWorker(Runnable task) {
        try {
            exec.execute(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Capture session is shut down", e);
        }
    }

    private void ensureOpen() {
        if (shutdown) throw new IllegalStateException("Capture session is shut down");
    }
}
