package com.kmg.classifier.model;

public record LabelStats(
        String label,
        long count,
        double avgConfidence
) {
}
