package de.schliweb.idverify.image;

import nu.pattern.OpenCV;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library for one capture session.
 * <p>
 * The runtime is created by the session and handed to every component that touches OpenCV,
 * instead of relying on a process-wide "initialized" flag. Loading is attempted at most once per
 * instance; a failed attempt is remembered so the caller gets a consistent answer.
 */
public final class OpenCvRuntime {
    private static final Logger log = LoggerFactory.getLogger(OpenCvRuntime.class);

    private boolean attempted;
    private boolean loaded;

    /**
     * Loads the native library bundled with the OpenCV artifact.
     *
     * @return true if OpenCV is usable, false otherwise
     */
    public synchronized boolean load() {
        if (attempted) return loaded;
        attempted = true;
        try {
            OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV native library loaded");
        } catch (Throwable t) {
            log.error("OpenCV native library could not be loaded", t);
        }
        return loaded;
    }

    /**
     * @throws IllegalStateException if the native library is not available
     */
    public void requireLoaded() {
        if (!load()) {
            throw new IllegalStateException("OpenCV native library is not available");
        }
    }
}
