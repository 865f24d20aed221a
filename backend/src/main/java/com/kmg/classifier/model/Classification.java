package com.kmg.classifier.model;

import java.util.Map;

/**
 * Raw answer of an {@link com.kmg.classifier.classify.ImageClassifier}. Not validated; the recorder
 * checks ranges before anything is committed.
 */
public record Classification(
        String label,
        double confidence,
        Map<String, Double> scores,
        String modelVersion
) {
    public Classification {
        scores = scores == null ? Map.of() : Map.copyOf(scores);
    }
}
