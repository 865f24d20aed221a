package com.kmg.classifier.dto;

public record CreateWorkItemResponse(String id) {
}
