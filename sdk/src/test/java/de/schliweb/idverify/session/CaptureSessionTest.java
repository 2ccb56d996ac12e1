package de.schliweb.idverify.session;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.decision.DecisionEngine;
import de.schliweb.idverify.decision.DecisionResult;
import de.schliweb.idverify.decision.SessionResult;
import de.schliweb.idverify.image.Frame;
import de.schliweb.idverify.image.OpenCvRuntime;
import de.schliweb.idverify.image.SyntheticCards;
import de.schliweb.idverify.result.Outcome;
import de.schliweb.idverify.result.ValidationError;
import de.schliweb.idverify.scoring.Decision;
import org.junit.After;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;
import org.opencv.core.Mat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

/**
 * End-to-end capture flow on synthetic frames with scripted text recognition.
 * <p>
 * Session calls are asynchronous, so every step waits for the listener event it causes.
 */
public class CaptureSessionTest {

    private static final OpenCvRuntime RUNTIME = new OpenCvRuntime();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC);
    private static final long TIMEOUT_SECONDS = 10;

    private final BlockingQueue<ScanPhase> phases = new LinkedBlockingQueue<>();
    private final BlockingQueue<FrameReport> reports = new LinkedBlockingQueue<>();
    private final BlockingQueue<DecisionResult> captured = new LinkedBlockingQueue<>();
    private final AtomicReference<SessionResult> completed = new AtomicReference<>();
    private final AtomicReference<ValidationError> error = new AtomicReference<>();
    private final AtomicReference<List<ValidationError>> rejected = new AtomicReference<>();
    private final BlockingQueue<RuntimeException> failures = new LinkedBlockingQueue<>();
    private final AtomicReference<DocumentSide> failedSide = new AtomicReference<>();

    private ScriptedRecognizer recognizer;
    private CaptureSession session;
    private Frame card;

    @Before
    public void setUp() {
        Assume.assumeTrue("OpenCV not available", RUNTIME.load());
        ScannerConfig config = ScannerConfig.defaults();
        recognizer = new ScriptedRecognizer();
        SessionListener listener = new SessionListener() {
            @Override
            public void onPhaseChanged(ScanPhase previous, ScanPhase current) {
                phases.add(current);
            }

            @Override
            public void onFrameProcessed(FrameReport report) {
                reports.add(report);
            }

            @Override
            public void onSideCaptured(DecisionResult result) {
                captured.add(result);
            }

            @Override
            public void onManualCaptureRejected(DocumentSide side, List<ValidationError> reasons) {
                rejected.set(reasons);
            }

            @Override
            public void onSessionCompleted(SessionResult result) {
                completed.set(result);
            }

            @Override
            public void onError(ValidationError e, Throwable cause) {
                error.set(e);
            }

            @Override
            public void onFrameFailed(DocumentSide side, RuntimeException cause) {
                failedSide.set(side);
                failures.add(cause);
            }
        };
        session = new CaptureSession(new FrameProcessor(RUNTIME, config, recognizer), new DecisionEngine(config),
                listener, CLOCK);
        Mat mat = SyntheticCards.render(SyntheticCards.landscape(), true);
        try {
            card = SyntheticCards.toFrame(mat, 0L);
        } finally {
            mat.release();
        }
    }

    @After
    public void tearDown() {
        if (session != null) session.shutdown();
    }

    @Test
    public void framesAreIgnoredBeforeStart() {
        assertEquals(ScanPhase.IDLE, session.getPhase());
        assertFalse(session.submitFrame(card));
    }

    @Test
    public void fullSessionCompletesWithValidResult() throws Exception {
        session.start();
        awaitPhase(ScanPhase.SCANNING_FRONT);

        for (int i = 0; i < 3; i++) {
            FrameReport report = submitAndAwait(card);
            assertTrue(report.hasEvidence());
        }
        awaitPhase(ScanPhase.FRONT_CAPTURED);
        DecisionResult front = captured.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(DocumentSide.FRONT, front.side());
        assertEquals(Decision.VALID, front.decision());
        assertFalse(session.submitFrame(card));

        session.switchToBackSide();
        awaitPhase(ScanPhase.SCANNING_BACK);
        for (int i = 0; i < 3; i++) {
            submitAndAwait(card);
        }
        awaitPhase(ScanPhase.BACK_CAPTURED);
        awaitPhase(ScanPhase.COMPLETED);

        SessionResult result = completed.get();
        assertNotNull(result);
        assertTrue(result.isValid());
        assertEquals(Decision.VALID, result.combined().decision());
        assertEquals("YILMAZ", result.identity().surname());
        assertEquals("33058600656", result.identity().nationalId());
        assertFalse(result.combined().errors().contains(ValidationError.DOCUMENT_EXPIRED));
        assertEquals(3, session.snapshot(DocumentSide.BACK).frameCount());
        assertTrue(session.snapshot(DocumentSide.BACK).captured());
    }

    @Test
    public void manualCaptureWithoutFramesIsRejected() throws Exception {
        session.start();
        awaitPhase(ScanPhase.SCANNING_FRONT);
        Outcome<DecisionResult> outcome = session.captureManually().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertFalse(outcome.isSuccess());
        assertEquals(List.of(ValidationError.INSUFFICIENT_CONSISTENT_FRAMES), outcome.errors());
        assertEquals(List.of(ValidationError.INSUFFICIENT_CONSISTENT_FRAMES), rejected.get());
        assertEquals(ScanPhase.SCANNING_FRONT, session.getPhase());
    }

    @Test
    public void manualCaptureAfterOneFrame() throws Exception {
        session.start();
        awaitPhase(ScanPhase.SCANNING_FRONT);
        submitAndAwait(card);
        Outcome<DecisionResult> outcome = session.captureManually().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertTrue(outcome.isSuccess());
        assertEquals(DocumentSide.FRONT, outcome.get().side());
        awaitPhase(ScanPhase.FRONT_CAPTURED);
    }

    @Test
    public void missingEngineEndsInError() throws Exception {
        recognizer.unavailable = true;
        session.start();
        awaitPhase(ScanPhase.SCANNING_FRONT);
        FrameReport report = submitAndAwait(card);
        assertEquals(CaptureState.ERROR, report.state());
        awaitPhase(ScanPhase.ERROR);
        assertEquals(ValidationError.OCR_UNAVAILABLE, error.get());
    }

    @Test
    public void failingFrameIsReportedAndScanningContinues() throws Exception {
        IllegalStateException boom = new IllegalStateException("recognizer crashed");
        recognizer.failure = boom;
        session.start();
        awaitPhase(ScanPhase.SCANNING_FRONT);
        assertTrue(session.submitFrame(card));
        assertSame(boom, failures.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertEquals(DocumentSide.FRONT, failedSide.get());
        assertTrue(reports.isEmpty());
        assertEquals(ScanPhase.SCANNING_FRONT, session.getPhase());

        recognizer.failure = null;
        FrameReport report = submitAndAwait(card);
        assertTrue(report.hasEvidence());
        assertTrue(failures.isEmpty());
    }

    @Test
    public void switchToBackIsIgnoredWhileScanningFront() throws Exception {
        session.start();
        awaitPhase(ScanPhase.SCANNING_FRONT);
        session.switchToBackSide();
        session.reset().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(ScanPhase.IDLE, session.getPhase());
        assertEquals(ScanPhase.IDLE, phases.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertTrue(phases.isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void shutDownSessionCannotStart() {
        session.shutdown();
        session.start();
    }

    private FrameReport submitAndAwait(Frame frame) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (!session.submitFrame(frame)) {
            if (System.nanoTime() > deadline) fail("frame never accepted");
            Thread.sleep(5);
        }
        FrameReport report = reports.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertNotNull("no frame report", report);
        return report;
    }

    private void awaitPhase(ScanPhase expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (System.nanoTime() < deadline) {
            ScanPhase next = phases.poll(50, TimeUnit.MILLISECONDS);
            if (next == expected) return;
        }
        fail("phase " + expected + " not reached, now " + session.getPhase());
    }
}
