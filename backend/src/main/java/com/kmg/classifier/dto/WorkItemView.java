package com.kmg.classifier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kmg.classifier.model.FailureKind;
import com.kmg.classifier.model.WorkItemState;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkItemView(
        String id,
        String ownerRef,
        String payloadRef,
        WorkItemState state,
        ResultView result,
        FailureKind failureKind,
        String failureReason,
        String createdAt,
        String updatedAt
) {
}
