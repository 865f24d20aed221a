package com.kmg.classifier.model;

public enum CommitOutcome {
    COMMITTED,
    STALE_CLAIM
}
