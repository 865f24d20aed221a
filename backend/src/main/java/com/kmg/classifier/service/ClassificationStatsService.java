package com.kmg.classifier.service;

import com.kmg.classifier.dto.StatsView;
import com.kmg.classifier.model.WorkItemState;
import com.kmg.classifier.repo.WorkItemRepository;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class ClassificationStatsService {
    private final WorkItemRepository workItemRepository;

    public ClassificationStatsService(WorkItemRepository workItemRepository) {
        this.workItemRepository = workItemRepository;
    }

    public StatsView getStats() {
        Map<WorkItemState, Long> byState = workItemRepository.countByState();
        long total = byState.values().stream().mapToLong(Long::longValue).sum();
        WorkItemRepository.DoneAverages averages = workItemRepository.findDoneAverages();
        return new StatsView(
                total,
                byState,
                workItemRepository.findLabelStats(),
                averages.avgConfidence(),
                averages.avgProcessingMs()
        );
    }
}
