package de.schliweb.idverify.session;

import de.schliweb.idverify.DocumentSide;
import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.decision.ExtractedFields;
import de.schliweb.idverify.decision.FrameEvidence;
import de.schliweb.idverify.geometry.CardGeometry;
import de.schliweb.idverify.geometry.CardRegion;
import de.schliweb.idverify.geometry.GeometryNormalizer;
import de.schliweb.idverify.geometry.NormalizedCard;
import de.schliweb.idverify.image.Frame;
import de.schliweb.idverify.image.MatUtils;
import de.schliweb.idverify.image.OpenCvRuntime;
import de.schliweb.idverify.mrz.MrzCorrector;
import de.schliweb.idverify.mrz.MrzLines;
import de.schliweb.idverify.mrz.MrzStructure;
import de.schliweb.idverify.mrz.MrzStructureAnalyzer;
import de.schliweb.idverify.mrz.MrzValidator;
import de.schliweb.idverify.mrz.Td1Layout;
import de.schliweb.idverify.mrz.ValidationScore;
import de.schliweb.idverify.nationalid.NationalIdValidator;
import de.schliweb.idverify.ocr.OcrUnavailableException;
import de.schliweb.idverify.ocr.TextRecognizer;
import de.schliweb.idverify.quality.QualityGate;
import de.schliweb.idverify.quality.QualityMetrics;
import de.schliweb.idverify.result.Outcome;
import de.schliweb.idverify.result.ValidationError;
import de.schliweb.idverify.scoring.AspectRatioScorer;
import de.schliweb.idverify.scoring.FrontTextAnalyzer;
import de.schliweb.idverify.scoring.FrontTextResult;
import de.schliweb.idverify.scoring.ScoreBreakdown;
import de.schliweb.idverify.scoring.ScoringEngine;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one frame through the whole pipeline and returns what was learned from it.
 * <p>
 * Order: quality gate and card detection, rectification, frame-to-frame stability, text
 * recognition, analysis and scoring. Text recognition only runs on frames that passed the quality
 * gate, contain a card and are steady.
 * <p>
 * The processor keeps one downsampled thumbnail per side between calls and nothing else. It is
 * meant to be driven by a single worker thread.
 */
public class FrameProcessor {
    private static final Logger log = LoggerFactory.getLogger(FrameProcessor.class);

    private final ScannerConfig config;
    private final TextRecognizer recognizer;
    private final GeometryNormalizer normalizer;
    private final QualityGate qualityGate;
    private final ScoringEngine scoring;
    private final FrontTextAnalyzer frontAnalyzer = new FrontTextAnalyzer();
    private final MrzStructureAnalyzer mrzAnalyzer = new MrzStructureAnalyzer();
    private final MrzValidator mrzValidator = new MrzValidator();
    private final MrzCorrector corrector;

    private final Map<DocumentSide, Mat> previousThumbnails = new EnumMap<>(DocumentSide.class);

    public FrameProcessor(OpenCvRuntime runtime, ScannerConfig config, TextRecognizer recognizer) {
        this.config = config;
        this.recognizer = recognizer;
        this.normalizer = new GeometryNormalizer(runtime, config);
        this.qualityGate = new QualityGate(runtime, config);
        this.scoring = new ScoringEngine(config);
        this.corrector = new MrzCorrector(config);
    }

    public FrameReport process(Frame frame, DocumentSide side) {
        return process(frame, side, null, null);
    }

    /**
     * Processes one frame as the given side.
     *
     * @param frame               the camera frame, not retained
     * @param side                the side expected in the frame
     * @param knownNationalId     national id already read on the front, used to repair the back MRZ
     * @param knownDocumentNumber document number already read on the front
     * @return the frame report
     */
    public FrameReport process(Frame frame, DocumentSide side, String knownNationalId, String knownDocumentNumber) {
        long ts = frame.timestampMillis();
        Mat mat = MatUtils.toMat(frame);
        try {
            QualityMetrics quality = qualityGate.assess(mat);
            CardGeometry geometry = normalizer.detectGeometry(mat);
            if (!geometry.detected()) {
                return new FrameReport(CaptureState.SEARCHING, side, quality, geometry, 0, null,
                        List.of(ValidationError.GEOMETRY_NOT_FOUND), ts);
            }
            if (!quality.passed()) {
                return new FrameReport(CaptureState.ALIGNING, side, quality, geometry, 0, null, quality.failures(), ts);
            }

            Outcome<NormalizedCard> normalized = normalizer.normalize(mat, geometry, side);
            if (!normalized.isSuccess()) {
                log.warn("Rectification failed: {}", normalized.errors());
                return new FrameReport(CaptureState.ALIGNING, side, quality, geometry, 0, null, normalized.errors(), ts);
            }

            try (NormalizedCard card = normalized.get()) {
                double stability = updateStability(side, card.getNormalized());
                if (stability < config.getMinStability()) {
                    log.debug("Card moving: stability={}", stability);
                    return new FrameReport(CaptureState.ALIGNING, side, quality, geometry, stability, null, List.of(), ts);
                }

                FrameEvidence evidence;
                try {
                    evidence = side == DocumentSide.FRONT
                            ? readFront(card, geometry, ts)
                            : readBack(card, geometry, ts, knownNationalId, knownDocumentNumber);
                } catch (OcrUnavailableException e) {
                    log.error("Text recognition unavailable", e);
                    return new FrameReport(CaptureState.ERROR, side, quality, geometry, stability, null,
                            List.of(ValidationError.OCR_UNAVAILABLE), ts);
                }
                log.debug("{} frame scored {} {}", side, evidence.score(), evidence.breakdown());
                return new FrameReport(CaptureState.VERIFYING, side, quality, geometry, stability, evidence,
                        evidence.errors(), ts);
            }
        } finally {
            mat.release();
        }
    }

    /**
     * Forgets the stability thumbnails of both sides.
     */
    public void reset() {
        for (Mat m : previousThumbnails.values()) {
            MatUtils.release(m);
        }
        previousThumbnails.clear();
    }

    private double updateStability(DocumentSide side, Mat normalized) {
        Mat thumbnail = normalizer.thumbnail(normalized);
        Mat previous = previousThumbnails.put(side, thumbnail);
        if (previous == null) return 1.0;
        try {
            return normalizer.stability(thumbnail, previous);
        } finally {
            previous.release();
        }
    }

    private FrameEvidence readFront(NormalizedCard card, CardGeometry geometry, long ts) throws OcrUnavailableException {
        List<String> lines = new ArrayList<>(recognizer.recognize(card.getBinarized(), null));
        Mat numberRegion = card.region(CardRegion.DOCUMENT_NUMBER);
        if (numberRegion != null) {
            lines.addAll(recognizer.recognize(numberRegion, CardRegion.DOCUMENT_NUMBER));
        }
        if (lines.isEmpty()) {
            log.warn("No text recognized on front side");
        }

        double ratio = geometry.normalizedAspectRatio();
        FrontTextResult text = frontAnalyzer.analyze(lines);
        ScoreBreakdown breakdown = scoring.scoreFront(ratio, text);

        List<ValidationError> errors = new ArrayList<>(text.errors());
        if (!AspectRatioScorer.isWithinTolerance(ratio)) {
            errors.add(ValidationError.ASPECT_RATIO_OUT_OF_TOLERANCE);
        }
        ExtractedFields fields = new ExtractedFields(lines, text.nationalId(), text.documentNumber(), List.of(), null);
        return new FrameEvidence(scoring.sideScore(breakdown, DocumentSide.FRONT), breakdown, ts, true, errors, fields);
    }

    private FrameEvidence readBack(NormalizedCard card, CardGeometry geometry, long ts,
                                   String knownNationalId, String knownDocumentNumber) throws OcrUnavailableException {
        List<String> lines = recognizer.recognize(card.region(CardRegion.MRZ), CardRegion.MRZ);
        if (lines.isEmpty()) {
            log.warn("No text recognized in MRZ region");
        }

        double ratio = geometry.normalizedAspectRatio();
        MrzStructure structure = mrzAnalyzer.analyze(lines);
        List<ValidationError> errors = new ArrayList<>(structure.errors());
        if (!AspectRatioScorer.isWithinTolerance(ratio)) {
            errors.add(ValidationError.ASPECT_RATIO_OUT_OF_TOLERANCE);
        }

        if (structure.isEmpty()) {
            ScoreBreakdown breakdown = new ScoreBreakdown(AspectRatioScorer.score(ratio), 0, 0, 0, 0);
            return new FrameEvidence(scoring.sideScore(breakdown, DocumentSide.BACK), breakdown, ts, true, errors,
                    ExtractedFields.EMPTY);
        }

        MrzLines corrected = corrector.correct(structure.rows(), knownNationalId, knownDocumentNumber);
        ValidationScore checks = mrzValidator.validate(corrected);
        errors.addAll(checks.errors());
        log.debug("MRZ rows {}", corrected);

        ScoreBreakdown breakdown = scoring.scoreBack(ratio, structure, checks);
        ExtractedFields fields = new ExtractedFields(List.of(), nationalId(corrected), documentNumber(corrected, checks),
                structure.rows(), corrected);
        return new FrameEvidence(scoring.sideScore(breakdown, DocumentSide.BACK), breakdown, ts, true, errors, fields);
    }

    private static String nationalId(MrzLines lines) {
        String id = lines.row2().substring(Td1Layout.NATIONAL_ID_START, Td1Layout.NATIONAL_ID_END);
        return NationalIdValidator.isValid(id) ? id : null;
    }

    private static String documentNumber(MrzLines lines, ValidationScore checks) {
        if (!checks.documentNumberValid()) return null;
        String number = lines.row1().substring(Td1Layout.DOCUMENT_NUMBER_START, Td1Layout.DOCUMENT_NUMBER_END);
        return number.replace("<", "");
    }
}
