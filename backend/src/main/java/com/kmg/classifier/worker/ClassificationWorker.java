package com.kmg.classifier.worker;

import com.kmg.classifier.classify.ClassificationException;
import com.kmg.classifier.classify.ImageClassifier;
import com.kmg.classifier.config.ClassifierProperties;
import com.kmg.classifier.model.Claim;
import com.kmg.classifier.model.Classification;
import com.kmg.classifier.model.FailureKind;
import com.kmg.classifier.model.WorkItem;
import com.kmg.classifier.payload.PayloadStore;
import com.kmg.classifier.payload.PayloadUnavailableException;
import com.kmg.classifier.service.ClaimService;
import com.kmg.classifier.service.ResultRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * One polling loop: claim the oldest pending items one at a time, classify, record. Owns nothing
 * shared except its id; everything else goes through the store.
 *
 * <p>Payload loading and classification run on {@code callExecutor} so both can be bounded by a
 * timeout. A timeout in either stage fails the item with {@link FailureKind#TIMEOUT}.
 *
 * <p>If the worker thread is interrupted while waiting on either stage, nothing is committed: the
 * item stays PROCESSING until the stale-claim sweep puts it back.
 */
public class ClassificationWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ClassificationWorker.class);

    private final String workerId;
    private final ClaimService claimService;
    private final ResultRecorder resultRecorder;
    private final PayloadStore payloadStore;
    private final ImageClassifier classifier;
    private final ExecutorService callExecutor;
    private final ClassifierProperties.Worker settings;
    private volatile boolean running = true;

    public ClassificationWorker(
            String workerId,
            ClaimService claimService,
            ResultRecorder resultRecorder,
            PayloadStore payloadStore,
            ImageClassifier classifier,
            ExecutorService callExecutor,
            ClassifierProperties.Worker settings
    ) {
        this.workerId = workerId;
        this.claimService = claimService;
        this.resultRecorder = resultRecorder;
        this.payloadStore = payloadStore;
        this.classifier = classifier;
        this.callExecutor = callExecutor;
        this.settings = settings;
    }

    @Override
    public void run() {
        log.info("Worker {} started (batch {}, idle {})", workerId, settings.getBatchSize(), settings.getIdleInterval());
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                int processed = runCycle();
                if (processed == 0) {
                    Thread.sleep(settings.getIdleInterval().toMillis());
                }
            } catch (InterruptedException | WorkerInterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Error in worker {} cycle: {}", workerId, e.getMessage(), e);
                try {
                    Thread.sleep(settings.getIdleInterval().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Worker {} stopped", workerId);
    }

    public void stop() {
        running = false;
    }

    /**
     * Runs one poll cycle.
     *
     * @return number of items this worker claimed and processed
     */
    public int runCycle() {
        List<WorkItem> candidates = claimService.pendingCandidates(settings.getBatchSize());
        int processed = 0;
        for (WorkItem candidate : candidates) {
            if (!running || Thread.currentThread().isInterrupted()) {
                break;
            }
            Optional<Claim> claim = claimService.tryClaim(workerId, candidate);
            if (claim.isEmpty()) {
                continue;
            }
            process(claim.get());
            processed++;
        }
        return processed;
    }

    void process(Claim claim) {
        long started = System.nanoTime();

        byte[] payload;
        try {
            payload = callWithTimeout(() -> payloadStore.load(claim.item().payloadRef()), settings.getPayloadTimeout());
        } catch (PayloadUnavailableException e) {
            handlePayloadFailure(claim, e);
            return;
        } catch (TimeoutException e) {
            resultRecorder.recordFailure(claim, FailureKind.TIMEOUT,
                    "Loading image timed out after " + settings.getPayloadTimeout().toMillis() + " ms");
            return;
        } catch (WorkerInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            handlePayloadFailure(claim, new PayloadUnavailableException(
                    "Failed to load image: " + e.getMessage(), false, e));
            return;
        }

        Classification classification;
        try {
            classification = callWithTimeout(() -> classifier.classify(payload), settings.getClassifyTimeout());
        } catch (ClassificationException e) {
            resultRecorder.recordFailure(claim, FailureKind.ADAPTER_ERROR, e.getMessage());
            return;
        } catch (TimeoutException e) {
            resultRecorder.recordFailure(claim, FailureKind.TIMEOUT,
                    "Classification timed out after " + settings.getClassifyTimeout().toMillis() + " ms");
            return;
        } catch (WorkerInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Classifier failed unexpectedly on {}: {}", claim.itemId(), e.getMessage(), e);
            resultRecorder.recordFailure(claim, FailureKind.ADAPTER_ERROR, e.getMessage());
            return;
        }

        if (classification == null) {
            resultRecorder.recordFailure(claim, FailureKind.ADAPTER_ERROR, "Classifier returned no result");
            return;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        resultRecorder.recordSuccess(claim, classification, elapsedMs);
    }

    private void handlePayloadFailure(Claim claim, PayloadUnavailableException e) {
        int attempts = claim.item().attempts();
        if (!e.isPermanent() && attempts < settings.getMaxPayloadAttempts()) {
            log.warn("Transient payload error on {} (attempt {}/{}): {}",
                    claim.itemId(), attempts, settings.getMaxPayloadAttempts(), e.getMessage());
            resultRecorder.release(claim);
            return;
        }
        resultRecorder.recordFailure(claim, FailureKind.PAYLOAD_UNAVAILABLE, e.getMessage());
    }

    private <T> T callWithTimeout(Callable<T> call, Duration timeout) throws TimeoutException {
        Future<T> future;
        try {
            future = callExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            // Pool is shutting down.
            throw new WorkerInterruptedException();
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new WorkerInterruptedException();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static class WorkerInterruptedException extends RuntimeException {
    }
}
