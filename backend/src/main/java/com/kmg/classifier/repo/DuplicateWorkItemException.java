package com.kmg.classifier.repo;

public class DuplicateWorkItemException extends RuntimeException {
    private final String itemId;

    public DuplicateWorkItemException(String itemId) {
        super("Work item already exists: " + itemId);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
