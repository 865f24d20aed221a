package com.kmg.classifier.config;

import com.kmg.classifier.repo.WorkItemSchema;
import com.kmg.classifier.service.ClaimService;
import com.kmg.classifier.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final ClassifierProperties properties;
    private final WorkItemSchema schema;
    private final ClaimService claimService;
    private final WorkerPool workerPool;

    public StartupInitializer(
            ClassifierProperties properties,
            WorkItemSchema schema,
            ClaimService claimService,
            WorkerPool workerPool
    ) {
        this.properties = properties;
        this.schema = schema;
        this.claimService = claimService;
        this.workerPool = workerPool;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        schema.initialize();
        // Items left PROCESSING by a previous run are only recovered once they are stale.
        claimService.reclaimStale();
        if (properties.getWorker().isEnabled()) {
            workerPool.start();
        } else {
            log.info("Classification workers disabled (classifier.worker.enabled=false)");
        }
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(properties.baseDirPath());
        Files.createDirectories(Path.of(properties.getPayload().getRootDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }
}
