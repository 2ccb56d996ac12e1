package de.schliweb.idverify;

/**
 * The two faces of an identity card. The front carries the printed personal data and the national id,
 * the back carries the machine-readable zone.
 */
public enum DocumentSide {
    FRONT,
    BACK
}
