package com.kmg.classifier.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.classifier.SqliteTestDatabase;
import com.kmg.classifier.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class WorkItemRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-01-10T10:00:00Z");

    @TempDir
    Path tempDir;

    WorkItemRepository repository;

    @BeforeEach
    void setUp() {
        repository = new WorkItemRepository(SqliteTestDatabase.create(tempDir), new ObjectMapper());
    }

    @Test
    @DisplayName("create stores a PENDING item that get returns field for field")
    void createAndGet() {
        repository.create(WorkItem.pending("img1", "user-1", "photos/cat.jpg", T0));

        WorkItem item = repository.get("img1");

        assertThat(item.id()).isEqualTo("img1");
        assertThat(item.ownerRef()).isEqualTo("user-1");
        assertThat(item.payloadRef()).isEqualTo("photos/cat.jpg");
        assertThat(item.state()).isEqualTo(WorkItemState.PENDING);
        assertThat(item.result()).isNull();
        assertThat(item.failureReason()).isNull();
        assertThat(item.claimToken()).isNull();
        assertThat(item.attempts()).isZero();
        assertThat(item.createdAt()).isEqualTo(T0);
        assertThat(item.updatedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("create with an existing id fails with DuplicateWorkItemException and keeps the original")
    void createDuplicate() {
        repository.create(WorkItem.pending("img1", "user-1", "a.jpg", T0));

        assertThatThrownBy(() -> repository.create(WorkItem.pending("img1", "user-2", "b.jpg", T0.plusSeconds(1))))
                .isInstanceOf(DuplicateWorkItemException.class);
        assertThat(repository.get("img1").payloadRef()).isEqualTo("a.jpg");
    }

    @Test
    @DisplayName("get on an unknown id fails with WorkItemNotFoundException")
    void getUnknown() {
        assertThatThrownBy(() -> repository.get("missing"))
                .isInstanceOf(WorkItemNotFoundException.class);
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    @DisplayName("tryClaim moves PENDING to PROCESSING with the token and bumps updatedAt")
    void tryClaimPending() {
        repository.create(WorkItem.pending("img1", "user-1", "a.jpg", T0));

        boolean claimed = repository.tryClaim("img1", "w1:token", T0.plusSeconds(5));

        WorkItem item = repository.get("img1");
        assertThat(claimed).isTrue();
        assertThat(item.state()).isEqualTo(WorkItemState.PROCESSING);
        assertThat(item.claimToken()).isEqualTo("w1:token");
        assertThat(item.attempts()).isEqualTo(1);
        assertThat(item.updatedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(item.createdAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("a second tryClaim returns false and leaves the first claim in place")
    void tryClaimAlreadyClaimed() {
        repository.create(WorkItem.pending("img1", "user-1", "a.jpg", T0));
        repository.tryClaim("img1", "w1:token", T0.plusSeconds(5));

        boolean second = repository.tryClaim("img1", "w2:token", T0.plusSeconds(6));

        WorkItem item = repository.get("img1");
        assertThat(second).isFalse();
        assertThat(item.claimToken()).isEqualTo("w1:token");
        assertThat(item.updatedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(item.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("tryClaim on an unknown id fails with WorkItemNotFoundException")
    void tryClaimUnknown() {
        assertThatThrownBy(() -> repository.tryClaim("missing", "w1:token", T0))
                .isInstanceOf(WorkItemNotFoundException.class);
    }

    @Test
    @DisplayName("concurrent tryClaim calls on one item produce exactly one winner")
    void concurrentClaimsHaveOneWinner() throws Exception {
        repository.create(WorkItem.pending("img2", "user-1", "b.jpg", T0));
        int contenders = 8;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String token = "w" + i + ":token";
                results.add(executor.submit(() -> {
                    start.await();
                    return repository.tryClaim("img2", token, T0.plusSeconds(1));
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        WorkItem item = repository.get("img2");
        assertThat(item.state()).isEqualTo(WorkItemState.PROCESSING);
        assertThat(item.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("commitResult with the current token stores the result, clears the token and marks DONE")
    void commitResult() {
        repository.create(WorkItem.pending("img1", "user-1", "a.jpg", T0));
        repository.tryClaim("img1", "w1:token", T0.plusSeconds(1));
        ClassificationResult result = new ClassificationResult(
                "Cat", 0.95, Map.of("Cat", 0.95, "Dog", 0.04), "v1", 120);

        boolean committed = repository.commitResult("img1", "w1:token", result, T0.plusSeconds(2));

        WorkItem item = repository.get("img1");
        assertThat(committed).isTrue();
        assertThat(item.state()).isEqualTo(WorkItemState.DONE);
        assertThat(item.claimToken()).isNull();
        assertThat(item.result().label()).isEqualTo("Cat");
        assertThat(item.result().confidence()).isEqualTo(0.95);
        assertThat(item.result().scoreDistribution()).containsEntry("Cat", 0.95).containsEntry("Dog", 0.04);
        assertThat(item.result().modelVersion()).isEqualTo("v1");
        assertThat(item.result().processingTimeMs()).isEqualTo(120);
        assertThat(item.updatedAt()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    @DisplayName("commitResult with a foreign token returns false and leaves the item unchanged")
    void commitResultStaleToken() {
        repository.create(WorkItem.pending("img1", "user-1", "a.jpg", T0));
        repository.tryClaim("img1", "w1:token", T0.plusSeconds(1));
        WorkItem before = repository.get("img1");

        boolean committed = repository.commitResult(
                "img1", "w2:token", new ClassificationResult("Cat", 0.9, Map.of(), "v1", 5), T0.plusSeconds(2));

        assertThat(committed).isFalse();
        assertThat(repository.get("img1")).isEqualTo(before);
    }

    @Test
    @DisplayName("commitFailure records the classified reason and marks FAILED")
    void commitFailure() {
        repository.create(WorkItem.pending("img4", "user-1", "d.jpg", T0));
        repository.tryClaim("img4", "w1:token", T0.plusSeconds(1));

        boolean committed = repository.commitFailure(
                "img4", "w1:token", new FailureReason(FailureKind.ADAPTER_ERROR, "corrupt image"), T0.plusSeconds(2));

        WorkItem item = repository.get("img4");
        assertThat(committed).isTrue();
        assertThat(item.state()).isEqualTo(WorkItemState.FAILED);
        assertThat(item.failureReason()).isEqualTo(new FailureReason(FailureKind.ADAPTER_ERROR, "corrupt image"));
        assertThat(item.result()).isNull();
        assertThat(item.claimToken()).isNull();
    }

    @Test
    @DisplayName("terminal items accept no further transition")
    void terminalIsFinal() {
        repository.create(WorkItem.pending("img1", "user-1", "a.jpg", T0));
        repository.tryClaim("img1", "w1:token", T0.plusSeconds(1));
        repository.commitFailure("img1", "w1:token", new FailureReason(FailureKind.TIMEOUT, null), T0.plusSeconds(2));
        WorkItem failed = repository.get("img1");

        assertThat(repository.tryClaim("img1", "w2:token", T0.plusSeconds(3))).isFalse();
        assertThat(repository.commitResult("img1", "w1:token",
                new ClassificationResult("Cat", 0.9, Map.of(), "v1", 1), T0.plusSeconds(3))).isFalse();
        assertThat(repository.releaseClaim("img1", "w1:token", T0.plusSeconds(3))).isFalse();
        assertThat(repository.reclaimStale(Duration.ofSeconds(1), T0.plusSeconds(3600))).isZero();
        assertThat(repository.get("img1")).isEqualTo(failed);
        assertThat(failed.failureReason().detail()).isEqualTo(FailureKind.TIMEOUT.label());
    }

    @Test
    @DisplayName("listPending returns only PENDING items, oldest first, up to the limit")
    void listPendingOrderAndLimit() {
        repository.create(WorkItem.pending("c", "user-1", "c.jpg", T0.plusSeconds(30)));
        repository.create(WorkItem.pending("a", "user-1", "a.jpg", T0.plusSeconds(10)));
        repository.create(WorkItem.pending("b", "user-1", "b.jpg", T0.plusSeconds(20)));
        repository.create(WorkItem.pending("d", "user-1", "d.jpg", T0));
        repository.tryClaim("d", "w1:token", T0.plusSeconds(40));

        assertThat(repository.listPending(10)).extracting(WorkItem::id).containsExactly("a", "b", "c");
        assertThat(repository.listPending(2)).extracting(WorkItem::id).containsExactly("a", "b");
    }

    @Test
    @DisplayName("reclaimStale resets an item claimed 10 minutes ago when the threshold is 5 minutes")
    void reclaimStaleResetsOldClaims() {
        repository.create(WorkItem.pending("old", "user-1", "a.jpg", T0));
        repository.create(WorkItem.pending("fresh", "user-1", "b.jpg", T0));
        repository.tryClaim("old", "w1:token", T0);
        repository.tryClaim("fresh", "w2:token", T0.plusSeconds(8 * 60));
        Instant now = T0.plusSeconds(10 * 60);

        int reclaimed = repository.reclaimStale(Duration.ofMinutes(5), now);

        assertThat(reclaimed).isEqualTo(1);
        WorkItem old = repository.get("old");
        assertThat(old.state()).isEqualTo(WorkItemState.PENDING);
        assertThat(old.claimToken()).isNull();
        assertThat(old.updatedAt()).isEqualTo(now);
        assertThat(repository.get("fresh").claimToken()).isEqualTo("w2:token");
    }

    @Test
    @DisplayName("a reclaimed claim can no longer commit, and the next claim wins")
    void reclaimedClaimIsStale() {
        repository.create(WorkItem.pending("img3", "user-1", "c.jpg", T0));
        repository.tryClaim("img3", "w1:token", T0);
        repository.reclaimStale(Duration.ofMinutes(1), T0.plusSeconds(120));

        assertThat(repository.commitResult("img3", "w1:token",
                new ClassificationResult("Cat", 0.9, Map.of(), "v1", 1), T0.plusSeconds(121))).isFalse();
        assertThat(repository.tryClaim("img3", "w2:token", T0.plusSeconds(122))).isTrue();
        assertThat(repository.get("img3").attempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("releaseClaim hands the item back to PENDING for the claim holder only")
    void releaseClaim() {
        repository.create(WorkItem.pending("img1", "user-1", "a.jpg", T0));
        repository.tryClaim("img1", "w1:token", T0);

        assertThat(repository.releaseClaim("img1", "other:token", T0.plusSeconds(1))).isFalse();
        assertThat(repository.releaseClaim("img1", "w1:token", T0.plusSeconds(1))).isTrue();
        WorkItem item = repository.get("img1");
        assertThat(item.state()).isEqualTo(WorkItemState.PENDING);
        assertThat(item.claimToken()).isNull();
        assertThat(item.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("findRecentByOwner returns the owner's items newest first")
    void findRecentByOwner() {
        repository.create(WorkItem.pending("a", "user-1", "a.jpg", T0));
        repository.create(WorkItem.pending("b", "user-2", "b.jpg", T0.plusSeconds(1)));
        repository.create(WorkItem.pending("c", "user-1", "c.jpg", T0.plusSeconds(2)));

        assertThat(repository.findRecentByOwner("user-1", 10)).extracting(WorkItem::id).containsExactly("c", "a");
        assertThat(repository.findRecentByOwner("user-1", 1)).extracting(WorkItem::id).containsExactly("c");
    }

    @Test
    @DisplayName("statistics count states and aggregate DONE items per label")
    void statistics() {
        done("a", "Bird", 0.9, 100);
        done("b", "Bird", 0.7, 300);
        done("c", "Fish", 0.5, 200);
        repository.create(WorkItem.pending("d", "user-1", "d.jpg", T0));

        Map<WorkItemState, Long> counts = repository.countByState();
        assertThat(counts).containsEntry(WorkItemState.DONE, 3L)
                .containsEntry(WorkItemState.PENDING, 1L)
                .containsEntry(WorkItemState.PROCESSING, 0L)
                .containsEntry(WorkItemState.FAILED, 0L);

        List<LabelStats> labels = repository.findLabelStats();
        assertThat(labels).extracting(LabelStats::label).containsExactly("Bird", "Fish");
        assertThat(labels.get(0).count()).isEqualTo(2);
        assertThat(labels.get(0).avgConfidence()).isCloseTo(0.8, offset(1e-9));

        WorkItemRepository.DoneAverages averages = repository.findDoneAverages();
        assertThat(averages.avgConfidence()).isCloseTo(0.7, offset(1e-9));
        assertThat(averages.avgProcessingMs()).isCloseTo(200.0, offset(1e-9));
    }

    @Test
    @DisplayName("statistics on an empty store are zero")
    void statisticsEmpty() {
        assertThat(repository.findLabelStats()).isEmpty();
        assertThat(repository.findDoneAverages().avgConfidence()).isZero();
        assertThat(repository.countByState().values()).containsOnly(0L);
    }

    private void done(String id, String label, double confidence, long processingMs) {
        repository.create(WorkItem.pending(id, "user-1", id + ".jpg", T0));
        repository.tryClaim(id, "w1:" + id, T0);
        repository.commitResult(id, "w1:" + id,
                new ClassificationResult(label, confidence, Map.of(label, confidence), "v1", processingMs),
                T0.plusSeconds(1));
    }
}
