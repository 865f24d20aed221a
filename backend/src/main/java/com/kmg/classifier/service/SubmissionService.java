package com.kmg.classifier.service;

import com.kmg.classifier.dto.CreateWorkItemRequest;
import com.kmg.classifier.model.WorkItem;
import com.kmg.classifier.repo.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final WorkItemRepository workItemRepository;
    private final TimeService timeService;

    public SubmissionService(WorkItemRepository workItemRepository, TimeService timeService) {
        this.workItemRepository = workItemRepository;
        this.timeService = timeService;
    }

    public String submit(CreateWorkItemRequest request) {
        String id = request.id() == null || request.id().isBlank()
                ? UUID.randomUUID().toString()
                : request.id();
        WorkItem item = WorkItem.pending(id, request.ownerRef(), request.payloadRef(), timeService.now());
        workItemRepository.create(item);
        log.info("Queued {} for {} ({})", id, request.ownerRef(), request.payloadRef());
        return id;
    }
}
