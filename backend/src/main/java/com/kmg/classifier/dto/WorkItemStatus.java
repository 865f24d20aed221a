package com.kmg.classifier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kmg.classifier.model.FailureKind;
import com.kmg.classifier.model.WorkItemState;

/**
 * What a polling client sees. {@code pollAfterMillis} is only present while the item is still moving.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkItemStatus(
        String id,
        WorkItemState state,
        ResultView result,
        FailureKind failureKind,
        String failureReason,
        String updatedAt,
        Long pollAfterMillis
) {
    public boolean terminal() {
        return state.isTerminal();
    }
}
