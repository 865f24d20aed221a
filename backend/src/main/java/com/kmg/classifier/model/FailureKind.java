package com.kmg.classifier.model;

public enum FailureKind {
    PAYLOAD_UNAVAILABLE("Image could not be loaded"),
    ADAPTER_ERROR("Image could not be classified"),
    TIMEOUT("Classification timed out");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
