package com.kmg.classifier.worker;

import com.kmg.classifier.classify.ImageClassifier;
import com.kmg.classifier.config.ClassifierProperties;
import com.kmg.classifier.payload.PayloadStore;
import com.kmg.classifier.service.ClaimService;
import com.kmg.classifier.service.ResultRecorder;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@code classifier.worker.pool-size} independent {@link ClassificationWorker} loops. Workers do
 * not talk to each other; the store is the only thing they share.
 */
@Component
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long JOIN_TIMEOUT_MS = 5000;
    // Room for calls that outlive their timeout; past that, new calls queue and time out instead.
    static final int CALL_THREADS_PER_WORKER = 2;

    private final ClaimService claimService;
    private final ResultRecorder resultRecorder;
    private final PayloadStore payloadStore;
    private final ImageClassifier classifier;
    private final ClassifierProperties properties;

    private final List<ClassificationWorker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private ExecutorService callExecutor;

    public WorkerPool(
            ClaimService claimService,
            ResultRecorder resultRecorder,
            PayloadStore payloadStore,
            ImageClassifier classifier,
            ClassifierProperties properties
    ) {
        this.claimService = claimService;
        this.resultRecorder = resultRecorder;
        this.payloadStore = payloadStore;
        this.classifier = classifier;
        this.properties = properties;
    }

    public synchronized void start() {
        if (!threads.isEmpty()) {
            return;
        }
        ClassifierProperties.Worker settings = properties.getWorker();
        callExecutor = Executors.newFixedThreadPool(
                settings.getPoolSize() * CALL_THREADS_PER_WORKER, namedThreads("classifier-call-"));
        String prefix = "w" + UUID.randomUUID().toString().substring(0, 8);

        for (int i = 0; i < settings.getPoolSize(); i++) {
            ClassificationWorker worker = new ClassificationWorker(
                    prefix + "-" + i,
                    claimService,
                    resultRecorder,
                    payloadStore,
                    classifier,
                    callExecutor,
                    settings
            );
            Thread thread = new Thread(worker, "classifier-worker-" + i);
            workers.add(worker);
            threads.add(thread);
            thread.start();
        }
        log.info("Started {} classification worker(s)", settings.getPoolSize());
    }

    @PreDestroy
    public synchronized void stop() {
        if (threads.isEmpty()) {
            return;
        }
        workers.forEach(ClassificationWorker::stop);
        threads.forEach(Thread::interrupt);
        for (Thread thread : threads) {
            try {
                thread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        callExecutor.shutdownNow();
        try {
            if (!callExecutor.awaitTermination(JOIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Classifier calls still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopped {} classification worker(s)", workers.size());
        workers.clear();
        threads.clear();
    }

    public synchronized boolean isRunning() {
        return threads.stream().anyMatch(Thread::isAlive);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
