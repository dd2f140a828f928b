package com.assoverlay;

/**
 * Thrown when a request names a subtitle document that is not loaded.
 */
public class SubtitleNotFoundException extends RuntimeException {

    public SubtitleNotFoundException(String id) {
        super("Subtitle document not found: " + id);
    }
}
