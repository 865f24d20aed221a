package com.kmg.classifier.dto;

import com.kmg.classifier.model.LabelStats;
import com.kmg.classifier.model.WorkItemState;

import java.util.List;
import java.util.Map;

public record StatsView(
        long totalItems,
        Map<WorkItemState, Long> byState,
        List<LabelStats> byLabel,
        double averageConfidence,
        double averageProcessingTimeMs
) {
}
