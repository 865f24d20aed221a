package com.kmg.classifier.service;

import com.kmg.classifier.model.*;
import com.kmg.classifier.repo.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes a worker's outcome together with the state transition. A {@link CommitOutcome#STALE_CLAIM}
 * means the claim was lost (reclaimed or re-claimed) and the outcome has been dropped.
 */
@Service
public class ResultRecorder {
    private static final Logger log = LoggerFactory.getLogger(ResultRecorder.class);

    private final WorkItemRepository workItemRepository;
    private final TimeService timeService;

    public ResultRecorder(WorkItemRepository workItemRepository, TimeService timeService) {
        this.workItemRepository = workItemRepository;
        this.timeService = timeService;
    }

    public CommitOutcome recordSuccess(Claim claim, Classification classification, long processingTimeMs) {
        ClassificationResult result;
        try {
            result = new ClassificationResult(
                    classification.label(),
                    classification.confidence(),
                    classification.scores(),
                    classification.modelVersion(),
                    processingTimeMs
            );
        } catch (IllegalArgumentException e) {
            log.warn("Classifier returned an invalid answer for {}: {}", claim.itemId(), e.getMessage());
            return recordFailure(claim, FailureKind.ADAPTER_ERROR, "Invalid classifier output: " + e.getMessage());
        }

        boolean committed = workItemRepository.commitResult(claim.itemId(), claim.token(), result, timeService.now());
        if (!committed) {
            return stale(claim, "result");
        }
        log.info("Classified {} as '{}' (confidence {}, {} ms)",
                claim.itemId(), result.label(), String.format("%.2f", result.confidence()), processingTimeMs);
        return CommitOutcome.COMMITTED;
    }

    public CommitOutcome recordFailure(Claim claim, FailureKind kind, String detail) {
        FailureReason reason = new FailureReason(kind, detail);
        boolean committed = workItemRepository.commitFailure(claim.itemId(), claim.token(), reason, timeService.now());
        if (!committed) {
            return stale(claim, "failure");
        }
        log.info("Marked {} as FAILED ({}): {}", claim.itemId(), kind, reason.detail());
        return CommitOutcome.COMMITTED;
    }

    public CommitOutcome release(Claim claim) {
        boolean released = workItemRepository.releaseClaim(claim.itemId(), claim.token(), timeService.now());
        if (!released) {
            return stale(claim, "release");
        }
        log.warn("Released {} back to PENDING after attempt {}", claim.itemId(), claim.item().attempts());
        return CommitOutcome.COMMITTED;
    }

    private CommitOutcome stale(Claim claim, String what) {
        log.info("Discarding {} for {}: claim {} is no longer current", what, claim.itemId(), claim.token());
        return CommitOutcome.STALE_CLAIM;
    }
}
