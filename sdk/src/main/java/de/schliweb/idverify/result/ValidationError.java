package de.schliweb.idverify.result;

/**
 * Error tags produced by the verification pipeline.
 * <p>
 * Tags are values, not exceptions: every stage degrades to a zero or partial score and reports
 * what went wrong through one or more of these tags. All tags are recoverable at the session level
 * (keep collecting frames) except {@link #OCR_UNAVAILABLE}.
 */
public enum ValidationError {

    GEOMETRY_NOT_FOUND("geometry-not-found"),
    RECTIFICATION_FAILED("rectification-failed"),

    QUALITY_BLUR("quality-gate-reject/blur"),
    QUALITY_GLARE("quality-gate-reject/glare"),
    QUALITY_BRIGHTNESS("quality-gate-reject/brightness"),

    MRZ_NOT_FOUND("mrz-not-found"),
    MRZ_ROW_COUNT("mrz-structure-invalid/row-count"),
    MRZ_ROW_LENGTH("mrz-structure-invalid/row-length"),
    MRZ_CHARSET("mrz-structure-invalid/charset"),
    MRZ_FILLER_RATIO("mrz-structure-invalid/filler-ratio"),

    MRZ_CHECKSUM_DOCUMENT_NUMBER("mrz-checksum-failed/document-number"),
    MRZ_CHECKSUM_BIRTH_DATE("mrz-checksum-failed/birth-date"),
    MRZ_CHECKSUM_EXPIRY_DATE("mrz-checksum-failed/expiry-date"),
    MRZ_CHECKSUM_COMPOSITE("mrz-checksum-failed/composite"),

    NATIONAL_ID_NOT_FOUND("national-id-not-found"),
    NATIONAL_ID_ALGORITHM_FAILED("national-id-algorithm-failed"),

    LOCALE_MARKER_NOT_FOUND("locale-marker-not-found"),
    NAME_PATTERN_NOT_FOUND("name-pattern-not-found"),
    DATE_PATTERN_NOT_FOUND("date-pattern-not-found"),

    ASPECT_RATIO_OUT_OF_TOLERANCE("aspect-ratio-out-of-tolerance"),
    INSUFFICIENT_CONSISTENT_FRAMES("insufficient-consistent-frames"),
    DOCUMENT_EXPIRED("document-expired"),

    OCR_UNAVAILABLE("ocr-unavailable");

    private final String code;

    ValidationError(String code) {
        this.code = code;
    }

    /**
     * Stable, human readable tag such as {@code mrz-checksum-failed/composite}.
     */
    public String code() {
        return code;
    }

    /**
     * Whether the session can recover from this error by collecting more frames.
     */
    public boolean isRecoverable() {
        return this != OCR_UNAVAILABLE;
    }

    /**
     * Looks up a tag by its code.
     *
     * @param code the tag code, for example {@code geometry-not-found}
     * @param def  value returned when the code is null or unknown
     * @return the matching tag or {@code def}
     */
    public static ValidationError fromCode(String code, ValidationError def) {
        if (code == null) return def;
        for (ValidationError e : values()) {
            if (e.code.equals(code)) return e;
        }
        return def;
    }

    @Override
    public String toString() {
        return code;
    }
}
