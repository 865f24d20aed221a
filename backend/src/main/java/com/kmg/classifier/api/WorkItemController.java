package com.kmg.classifier.api;

import com.kmg.classifier.dto.CreateWorkItemRequest;
import com.kmg.classifier.dto.CreateWorkItemResponse;
import com.kmg.classifier.dto.WorkItemStatus;
import com.kmg.classifier.dto.WorkItemView;
import com.kmg.classifier.service.StatusQueryService;
import com.kmg.classifier.service.SubmissionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/items")
public class WorkItemController {
    private final SubmissionService submissionService;
    private final StatusQueryService statusQueryService;

    public WorkItemController(SubmissionService submissionService, StatusQueryService statusQueryService) {
        this.submissionService = submissionService;
        this.statusQueryService = statusQueryService;
    }

    @PostMapping
    public ResponseEntity<CreateWorkItemResponse> submit(@Valid @RequestBody CreateWorkItemRequest request) {
        String id = submissionService.submit(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .location(URI.create("/api/items/" + id + "/status"))
                .body(new CreateWorkItemResponse(id));
    }

    @GetMapping
    public List<WorkItemView> listRecent(
            @RequestParam String ownerRef,
            @RequestParam(defaultValue = "20") int limit
    ) {
        return statusQueryService.listRecent(ownerRef, limit);
    }

    @GetMapping("/{id}")
    public WorkItemView getItem(@PathVariable String id) {
        return statusQueryService.getItem(id);
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<WorkItemStatus> getStatus(@PathVariable String id) {
        WorkItemStatus status = statusQueryService.getStatus(id);
        ResponseEntity.BodyBuilder response = ResponseEntity.ok();
        if (status.pollAfterMillis() != null) {
            long seconds = Math.max(1, (status.pollAfterMillis() + 999) / 1000);
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }
        return response.body(status);
    }
}
