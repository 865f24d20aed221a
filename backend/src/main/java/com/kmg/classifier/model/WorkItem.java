package com.kmg.classifier.model;

import java.time.Instant;
import java.util.Objects;

public record WorkItem(
        String id,
        String ownerRef,
        String payloadRef,
        WorkItemState state,
        ClassificationResult result,
        FailureReason failureReason,
        Instant createdAt,
        Instant updatedAt,
        String claimToken,
        int attempts
) {
    public WorkItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if ((result != null) != (state == WorkItemState.DONE)) {
            throw new IllegalStateException("Item " + id + ": result must be present exactly when state is DONE");
        }
        if ((failureReason != null) != (state == WorkItemState.FAILED)) {
            throw new IllegalStateException("Item " + id + ": failure reason must be present exactly when state is FAILED");
        }
        if ((claimToken != null) != (state == WorkItemState.PROCESSING)) {
            throw new IllegalStateException("Item " + id + ": claim token must be present exactly when state is PROCESSING");
        }
    }

    public static WorkItem pending(String id, String ownerRef, String payloadRef, Instant now) {
        return new WorkItem(id, ownerRef, payloadRef, WorkItemState.PENDING, null, null, now, now, null, 0);
    }
}
