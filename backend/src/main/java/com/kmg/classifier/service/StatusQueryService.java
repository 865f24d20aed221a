package com.kmg.classifier.service;

import com.kmg.classifier.config.ClassifierProperties;
import com.kmg.classifier.dto.ResultView;
import com.kmg.classifier.dto.WorkItemStatus;
import com.kmg.classifier.dto.WorkItemView;
import com.kmg.classifier.model.WorkItem;
import com.kmg.classifier.repo.WorkItemRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side for polling clients. Always goes to the store; nothing here is cached.
 */
@Service
public class StatusQueryService {
    static final int MAX_LIST_LIMIT = 100;

    private final WorkItemRepository workItemRepository;
    private final ClassifierProperties properties;

    public StatusQueryService(WorkItemRepository workItemRepository, ClassifierProperties properties) {
        this.workItemRepository = workItemRepository;
        this.properties = properties;
    }

    public WorkItemStatus getStatus(String id) {
        WorkItem item = workItemRepository.get(id);
        Long pollAfter = item.state().isTerminal()
                ? null
                : properties.getClient().getRecommendedPollInterval().toMillis();
        return new WorkItemStatus(
                item.id(),
                item.state(),
                ResultView.of(item.result()),
                item.failureReason() == null ? null : item.failureReason().kind(),
                item.failureReason() == null ? null : item.failureReason().detail(),
                item.updatedAt().toString(),
                pollAfter
        );
    }

    public WorkItemView getItem(String id) {
        return toView(workItemRepository.get(id));
    }

    public List<WorkItemView> listRecent(String ownerRef, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return workItemRepository.findRecentByOwner(ownerRef, bounded).stream()
                .map(this::toView)
                .toList();
    }

    private WorkItemView toView(WorkItem item) {
        return new WorkItemView(
                item.id(),
                item.ownerRef(),
                item.payloadRef(),
                item.state(),
                ResultView.of(item.result()),
                item.failureReason() == null ? null : item.failureReason().kind(),
                item.failureReason() == null ? null : item.failureReason().detail(),
                item.createdAt().toString(),
                item.updatedAt().toString()
        );
    }
}
