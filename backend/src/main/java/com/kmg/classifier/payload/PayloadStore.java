package com.kmg.classifier.payload;

/**
 * Resolves a work item's {@code payloadRef} to image bytes.
 */
public interface PayloadStore {
    byte[] load(String payloadRef);
}
