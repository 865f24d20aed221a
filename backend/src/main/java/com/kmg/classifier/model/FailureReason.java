package com.kmg.classifier.model;

import java.util.Objects;

public record FailureReason(
        FailureKind kind,
        String detail
) {
    public static final int MAX_DETAIL_LENGTH = 1000;

    public FailureReason {
        Objects.requireNonNull(kind, "kind");
        if (detail == null || detail.isBlank()) {
            detail = kind.label();
        } else if (detail.length() > MAX_DETAIL_LENGTH) {
            int end = MAX_DETAIL_LENGTH;
            if (Character.isHighSurrogate(detail.charAt(end - 1))) {
                end--;
            }
            detail = detail.substring(0, end);
        }
    }
}
