package com.kmg.classifier.classify;

import com.kmg.classifier.model.Classification;

/**
 * Boundary to the classification model. Implementations do not retry; a failed call throws
 * {@link ClassificationException} and the worker decides what happens to the item.
 */
public interface ImageClassifier {
    Classification classify(byte[] image);
}
