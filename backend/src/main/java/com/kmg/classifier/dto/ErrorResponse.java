package com.kmg.classifier.dto;

public record ErrorResponse(
        String error,
        String detail
) {
}
