package de.schliweb.idverify.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import lombok.Getter;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Tunable settings of one capture session.
 * <p>
 * Every value has a built-in default. The bundled {@value #DEFAULTS_RESOURCE} resource mirrors those
 * defaults and can be overridden by a partial JSON document passed to {@link #fromJson(Reader)}:
 * only the keys present in the override replace the defaults.
 * <p>
 * Instances are immutable once loaded and can be shared between the components of a session.
 */
@Getter
public final class ScannerConfig {

    public static final String DEFAULTS_RESOURCE = "/idverify-defaults.json";

    private static final Gson GSON = new GsonBuilder().create();

    // Card detection
    private double cannyLow = 30;
    private double cannyHigh = 100;
    private int dilateIterations = 2;
    private double minAreaRatio = 0.05;
    private double approxEpsilon = 0.02;
    private double admitAspectMin = 0.2;
    private double admitAspectMax = 5.0;

    // Canonical card size (ID-1, landscape)
    private int canonicalWidth = 856;
    private int canonicalHeight = 540;

    // Binarization
    private double claheClipLimit = 2.0;
    private int claheTileSize = 8;
    private int binarizeBlockSize = 15;
    private double binarizeConstant = 10;
    private int mrzBlockSize = 13;
    private double mrzConstant = 10;

    // Image metrics
    private double blurScale = 20.0;
    private int stabilityWidth = 200;
    private int stabilityHeight = 126;

    // Quality gate
    private double laplacianReference = 100.0;
    private double minLuminance = 30.0;
    private double maxLuminance = 240.0;
    private int glarePixelCutoff = 250;
    private double glareCeiling = 0.05;
    private double glareZeroAt = 0.15;
    private double qualityFloor = 0.5;
    private int qualityMaxWidth = 720;

    // Frame buffer and decisions
    private int bufferCapacity = 10;
    private int requiredFrames = 3;
    private int consistentFrames = 3;
    private int validThreshold = 80;
    private int retryThreshold = 50;
    private int manualFrontThreshold = 20;
    private int manualFrontThresholdWithAspect = 18;
    private int manualBackThreshold = 20;
    private double minStability = 0.85;

    // Document constants
    private String documentType = "I<";
    private String issuingCountry = "TUR";

    // OCR
    private String ocrLanguages = "tur+eng";
    private String ocrDatapath = null;

    /**
     * Loads the bundled defaults.
     *
     * @return the default configuration
     * @throws IllegalStateException if the bundled resource is missing or malformed
     */
    public static ScannerConfig defaults() {
        try (InputStream in = ScannerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
            }
            return parse(JsonParser.parseReader(new InputStreamReader(in, StandardCharsets.UTF_8)), new JsonObject());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Loads the bundled defaults and applies the given JSON override on top of them.
     *
     * @param override a JSON object holding a subset of the configuration keys
     * @return the merged and validated configuration
     * @throws IllegalArgumentException if the override is not a JSON object or yields invalid values
     */
    public static ScannerConfig fromJson(Reader override) {
        JsonElement element;
        try {
            element = JsonParser.parseReader(override);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed configuration JSON", e);
        }
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("Configuration override must be a JSON object");
        }
        try (InputStream in = ScannerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            JsonElement base = in != null
                    ? JsonParser.parseReader(new InputStreamReader(in, StandardCharsets.UTF_8))
                    : new JsonObject();
            return parse(base, element.getAsJsonObject());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    private static ScannerConfig parse(JsonElement base, JsonObject override) {
        JsonObject merged = base.isJsonObject() ? base.getAsJsonObject().deepCopy() : new JsonObject();
        for (Map.Entry<String, JsonElement> e : override.entrySet()) {
            merged.add(e.getKey(), e.getValue());
        }
        ScannerConfig cfg;
        try {
            cfg = GSON.fromJson(merged, ScannerConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration value", e);
        }
        if (cfg == null) cfg = new ScannerConfig();
        cfg.validate();
        return cfg;
    }

    /**
     * Checks the cross-field constraints of this configuration.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public void validate() {
        require(cannyLow > 0 && cannyHigh > cannyLow, "cannyHigh must exceed cannyLow > 0");
        require(minAreaRatio > 0 && minAreaRatio < 1, "minAreaRatio must be in (0,1)");
        require(admitAspectMin > 0 && admitAspectMax > admitAspectMin, "invalid aspect admission window");
        require(canonicalWidth > canonicalHeight && canonicalHeight > 0, "canonical size must be landscape");
        require(binarizeBlockSize >= 3 && binarizeBlockSize % 2 == 1, "binarizeBlockSize must be odd and >= 3");
        require(mrzBlockSize >= 3 && mrzBlockSize % 2 == 1, "mrzBlockSize must be odd and >= 3");
        require(minLuminance < maxLuminance, "minLuminance must be below maxLuminance");
        require(glareCeiling < glareZeroAt, "glareCeiling must be below glareZeroAt");
        require(bufferCapacity >= requiredFrames && requiredFrames >= 1, "bufferCapacity must hold requiredFrames");
        require(consistentFrames >= 1 && consistentFrames <= bufferCapacity, "consistentFrames out of range");
        require(validThreshold > retryThreshold && retryThreshold > 0 && validThreshold <= 100,
                "decision thresholds must satisfy 0 < retry < valid <= 100");
        require(issuingCountry != null && issuingCountry.length() == 3, "issuingCountry must have 3 letters");
        require(documentType != null && documentType.length() == 2, "documentType must have 2 characters");
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException(message);
    }
}
