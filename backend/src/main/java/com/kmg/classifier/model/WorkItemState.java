package com.kmg.classifier.model;

public enum WorkItemState {
    PENDING,
    PROCESSING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
