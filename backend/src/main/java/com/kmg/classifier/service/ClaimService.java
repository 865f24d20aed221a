package com.kmg.classifier.service;

import com.kmg.classifier.config.ClassifierProperties;
import com.kmg.classifier.model.Claim;
import com.kmg.classifier.model.WorkItem;
import com.kmg.classifier.repo.WorkItemNotFoundException;
import com.kmg.classifier.repo.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Hands out exclusive claims on pending items and recovers claims whose holders went quiet.
 * Losing a race is normal: the caller just moves on to the next candidate.
 */
@Service
public class ClaimService {
    private static final Logger log = LoggerFactory.getLogger(ClaimService.class);

    private final WorkItemRepository workItemRepository;
    private final TimeService timeService;
    private final ClassifierProperties properties;

    public ClaimService(
            WorkItemRepository workItemRepository,
            TimeService timeService,
            ClassifierProperties properties
    ) {
        this.workItemRepository = workItemRepository;
        this.timeService = timeService;
        this.properties = properties;
    }

    public List<WorkItem> pendingCandidates(int batchSize) {
        return workItemRepository.listPending(batchSize);
    }

    public Optional<Claim> tryClaim(String workerId, WorkItem candidate) {
        String token = newClaimToken(workerId);
        boolean won;
        try {
            won = workItemRepository.tryClaim(candidate.id(), token, timeService.now());
        } catch (WorkItemNotFoundException e) {
            log.debug("Candidate {} disappeared before claim", candidate.id());
            return Optional.empty();
        }
        if (!won) {
            log.debug("Worker {} lost claim race for {}", workerId, candidate.id());
            return Optional.empty();
        }

        WorkItem claimed = workItemRepository.get(candidate.id());
        if (!token.equals(claimed.claimToken())) {
            // Reclaimed between the UPDATE and the read.
            log.debug("Claim on {} by {} was reclaimed immediately", candidate.id(), workerId);
            return Optional.empty();
        }
        log.info("Worker {} claimed {} (attempt {})", workerId, claimed.id(), claimed.attempts());
        return Optional.of(new Claim(claimed, token));
    }

    @Scheduled(
            fixedDelayString = "${classifier.recovery.sweep-interval:PT1M}",
            initialDelayString = "${classifier.recovery.sweep-interval:PT1M}"
    )
    public int reclaimStale() {
        Instant now = timeService.now();
        int reclaimed = workItemRepository.reclaimStale(properties.getRecovery().getStaleAfter(), now);
        if (reclaimed > 0) {
            log.warn("Reset {} stale PROCESSING item(s) to PENDING (idle longer than {})",
                    reclaimed, properties.getRecovery().getStaleAfter());
        }
        return reclaimed;
    }

    static String newClaimToken(String workerId) {
        return workerId + ":" + UUID.randomUUID();
    }
}
