package com.kmg.classifier.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "classifier")
public class ClassifierProperties {
    @NotBlank
    private String baseDir;
    @Valid
    @NotNull
    private State state = new State();
    @Valid
    @NotNull
    private Payload payload = new Payload();
    @Valid
    @NotNull
    private Worker worker = new Worker();
    @Valid
    @NotNull
    private Recovery recovery = new Recovery();
    @Valid
    @NotNull
    private Client client = new Client();
    @Valid
    @NotNull
    private Vision vision = new Vision();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Payload getPayload() {
        return payload;
    }

    public void setPayload(Payload payload) {
        this.payload = payload;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Client getClient() {
        return client;
    }

    public void setClient(Client client) {
        this.client = client;
    }

    public Vision getVision() {
        return vision;
    }

    public void setVision(Vision vision) {
        this.vision = vision;
    }

    public Path baseDirPath() {
        return Path.of(baseDir);
    }

    @AssertTrue(message = "recovery.stale-after must exceed worker.payload-timeout + worker.classify-timeout")
    public boolean isStaleAfterBeyondCallTimeouts() {
        if (worker == null || recovery == null || recovery.getStaleAfter() == null
                || worker.getPayloadTimeout() == null || worker.getClassifyTimeout() == null) {
            return true;
        }
        Duration longestCall = worker.getPayloadTimeout().plus(worker.getClassifyTimeout());
        return recovery.getStaleAfter().compareTo(longestCall) > 0;
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Payload {
        @NotBlank
        private String rootDir;

        public String getRootDir() {
            return rootDir;
        }

        public void setRootDir(String rootDir) {
            this.rootDir = rootDir;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        @Min(1)
        @Max(16)
        private int poolSize = 2;
        @Min(1)
        private int batchSize = 10;
        @NotNull
        private Duration idleInterval = Duration.ofSeconds(5);
        @NotNull
        private Duration payloadTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration classifyTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int maxPayloadAttempts = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getIdleInterval() {
            return idleInterval;
        }

        public void setIdleInterval(Duration idleInterval) {
            this.idleInterval = idleInterval;
        }

        public Duration getPayloadTimeout() {
            return payloadTimeout;
        }

        public void setPayloadTimeout(Duration payloadTimeout) {
            this.payloadTimeout = payloadTimeout;
        }

        public Duration getClassifyTimeout() {
            return classifyTimeout;
        }

        public void setClassifyTimeout(Duration classifyTimeout) {
            this.classifyTimeout = classifyTimeout;
        }

        public int getMaxPayloadAttempts() {
            return maxPayloadAttempts;
        }

        public void setMaxPayloadAttempts(int maxPayloadAttempts) {
            this.maxPayloadAttempts = maxPayloadAttempts;
        }
    }

    public static class Recovery {
        // Must exceed payload-timeout + classify-timeout, or live claims get reclaimed. Checked on bind.
        @NotNull
        private Duration staleAfter = Duration.ofMinutes(5);
        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(1);

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Client {
        @NotNull
        private Duration recommendedPollInterval = Duration.ofSeconds(2);

        public Duration getRecommendedPollInterval() {
            return recommendedPollInterval;
        }

        public void setRecommendedPollInterval(Duration recommendedPollInterval) {
            this.recommendedPollInterval = recommendedPollInterval;
        }
    }

    public static class Vision {
        private String credentialPath;
        @Min(1)
        private int maxResults = 10;
        private List<String> labels = new ArrayList<>();
        @NotBlank
        private String modelVersion = "vision-label-v1";

        public String getCredentialPath() {
            return credentialPath;
        }

        public void setCredentialPath(String credentialPath) {
            this.credentialPath = credentialPath;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public List<String> getLabels() {
            return labels;
        }

        public void setLabels(List<String> labels) {
            this.labels = labels;
        }

        public String getModelVersion() {
            return modelVersion;
        }

        public void setModelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
        }
    }
}
