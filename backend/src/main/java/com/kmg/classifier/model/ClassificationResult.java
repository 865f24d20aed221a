package com.kmg.classifier.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ClassificationResult(
        String label,
        double confidence,
        Map<String, Double> scoreDistribution,
        String modelVersion,
        long processingTimeMs
) {
    public ClassificationResult {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Result label is required.");
        }
        if (!isScore(confidence)) {
            throw new IllegalArgumentException("Confidence out of range [0,1]: " + confidence);
        }
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must not be negative.");
        }
        Map<String, Double> copy = new LinkedHashMap<>();
        if (scoreDistribution != null) {
            for (Map.Entry<String, Double> entry : scoreDistribution.entrySet()) {
                Double score = entry.getValue();
                if (score == null || !isScore(score)) {
                    throw new IllegalArgumentException("Score for '" + entry.getKey() + "' out of range [0,1]: " + score);
                }
                copy.put(entry.getKey(), score);
            }
        }
        scoreDistribution = Collections.unmodifiableMap(copy);
    }

    private static boolean isScore(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }
}
