package com.kmg.classifier.dto;

import com.kmg.classifier.model.ClassificationResult;

import java.util.Map;

public record ResultView(
        String label,
        double confidence,
        Map<String, Double> scoreDistribution,
        String modelVersion,
        long processingTimeMs
) {
    public static ResultView of(ClassificationResult result) {
        if (result == null) {
            return null;
        }
        return new ResultView(
                result.label(),
                result.confidence(),
                result.scoreDistribution(),
                result.modelVersion(),
                result.processingTimeMs()
        );
    }
}
