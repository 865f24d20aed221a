package com.kmg.classifier.payload;

/**
 * The image bytes for a work item could not be read. {@code permanent} failures (missing file, bad
 * reference) will not get better on retry; the others are I/O hiccups worth another claim.
 */
public class PayloadUnavailableException extends RuntimeException {
    private final boolean permanent;

    public PayloadUnavailableException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public PayloadUnavailableException(String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
