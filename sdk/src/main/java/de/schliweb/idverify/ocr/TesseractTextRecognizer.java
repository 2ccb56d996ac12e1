package de.schliweb.idverify.ocr;

import de.schliweb.idverify.config.ScannerConfig;
import de.schliweb.idverify.geometry.CardRegion;
import de.schliweb.idverify.image.MatUtils;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link TextRecognizer} backed by Tesseract through Tess4J.
 * <p>
 * The page segmentation mode follows the region: a uniform block for the MRZ, a single line for
 * one field, sparse text for a whole card. Calls are serialized because the engine instance is
 * reconfigured per region.
 */
public class TesseractTextRecognizer implements TextRecognizer {
    private static final Logger log = LoggerFactory.getLogger(TesseractTextRecognizer.class);

    static final int PSM_SINGLE_BLOCK = 6;
    static final int PSM_SINGLE_LINE = 7;
    static final int PSM_SPARSE_TEXT = 11;

    private static final String WHITELIST_VARIABLE = "tessedit_char_whitelist";

    private final Tesseract tesseract;

    public TesseractTextRecognizer(ScannerConfig config) {
        this(config.getOcrDatapath(), config.getOcrLanguages());
    }

    /**
     * @param datapath  directory holding the tessdata files, or null for the engine default
     * @param languages language spec such as {@code tur+eng}
     */
    public TesseractTextRecognizer(String datapath, String languages) {
        this.tesseract = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            log.info("Configuring Tesseract data path: {}", datapath);
            tesseract.setDatapath(datapath);
        }
        tesseract.setLanguage(languages == null || languages.isBlank() ? "eng" : languages);
    }

    @Override
    public synchronized List<String> recognize(Mat image, CardRegion region) throws OcrUnavailableException {
        if (image == null || image.empty()) return List.of();
        BufferedImage buffered = MatUtils.toBufferedImage(image);
        String whitelist = RegionWhitelist.forRegion(region);
        try {
            tesseract.setPageSegMode(pageSegMode(region));
            tesseract.setVariable(WHITELIST_VARIABLE, whitelist == null ? "" : whitelist);
            String raw = tesseract.doOCR(buffered);
            return lines(raw);
        } catch (TesseractException ex) {
            String message = String.format(Locale.ROOT, "Failed to run OCR on %s: %s",
                    region == null ? "card" : region, ex.getMessage());
            log.error(message, ex);
            throw new OcrUnavailableException(message, ex);
        } catch (LinkageError err) {
            log.error("Tesseract native library not available", err);
            throw new OcrUnavailableException("Tesseract native library not available", err);
        }
    }

    static int pageSegMode(CardRegion region) {
        if (region == null) return PSM_SPARSE_TEXT;
        if (region == CardRegion.MRZ) return PSM_SINGLE_BLOCK;
        return PSM_SINGLE_LINE;
    }

    static List<String> lines(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String line : raw.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
        return out;
    }
}
