package com.kmg.classifier.model;

/**
 * A won claim: the item as read back right after the claim (so {@code attempts} counts it), and the token
 * that now guards it.
 */
public record Claim(
        WorkItem item,
        String token
) {
    public String itemId() {
        return item.id();
    }
}
