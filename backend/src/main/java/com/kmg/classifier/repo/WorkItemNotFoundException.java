package com.kmg.classifier.repo;

public class WorkItemNotFoundException extends RuntimeException {
    public WorkItemNotFoundException(String itemId) {
        super("Work item not found: " + itemId);
    }
}
