package pretium.reporting.services;

import io.quarkus.test.InjectMock;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pretium.reporting.api.types.GenerateReportPayloadType;
import pretium.reporting.api.types.GeneratedReportType;
import pretium.reporting.data.models.Job;
import pretium.reporting.data.models.Job.JobStatus;
import pretium.reporting.testing.H2TestResource;
import pretium.reporting.testing.JobFixtures;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link JobDrainService} over a real store, including two loops draining the same queue.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class JobDrainServiceTest {

    @Inject
    JobDrainService drainService;

    @Inject
    JobStore jobStore;

    @InjectMock
    ReportGenerationService reportGenerationService;

    @BeforeEach
    void setUp() {
        JobFixtures.deleteAllJobs();
        when(reportGenerationService.generate(any(UUID.class), any(GenerateReportPayloadType.class)))
                .thenReturn(new GeneratedReportType("report-1", "done", List.of(),
                        new GeneratedReportType.MetadataType("observation", 1, 1, true)));
    }

    @Test
    void testDrainAll_EmptyQueue() {
        DrainResult result = drainService.drainAll();

        assertEquals(0, result.processedCount());
        assertTrue(result.errors().isEmpty());
    }

    /**
     * Failing jobs are counted and reported; the loop keeps going.
     */
    @Test
    void testDrainAll_CountsEveryJobAndCollectsFailures() {
        Job ok1 = jobStore.create("generate_report", JobFixtures.reportPayload(1));
        Job unknown = jobStore.create("mystery_type", Map.of());
        Job ok2 = jobStore.create("generate_report", JobFixtures.reportPayload(2));
        Job export = jobStore.create("export_document", Map.of());
        Instant base = Instant.parse("2025-02-01T00:00:00Z");
        JobFixtures.setCreatedAt(ok1.id, base);
        JobFixtures.setCreatedAt(unknown.id, base.plusSeconds(1));
        JobFixtures.setCreatedAt(ok2.id, base.plusSeconds(2));
        JobFixtures.setCreatedAt(export.id, base.plusSeconds(3));

        DrainResult result = drainService.drainAll();

        assertEquals(4, result.processedCount());
        assertEquals(2, result.errors().size());
        assertTrue(result.errors().get(0).contains(unknown.id.toString()));
        assertTrue(result.errors().get(0).contains("Unknown job type: mystery_type"));
        assertTrue(result.errors().get(1).contains(export.id.toString()));

        assertEquals(JobStatus.COMPLETED, JobFixtures.reload(ok1.id).status);
        assertEquals(JobStatus.FAILED, JobFixtures.reload(unknown.id).status);
        assertEquals(JobStatus.COMPLETED, JobFixtures.reload(ok2.id).status);
        assertEquals(JobStatus.FAILED, JobFixtures.reload(export.id).status);
        assertEquals(0, jobStore.countByStatus(JobStatus.QUEUED));
    }

    /**
     * Two loops started together over three jobs: every job ends terminal and each handler runs once.
     */
    @Test
    void testDrainAll_ConcurrentLoopsProcessEachJobOnce() throws Exception {
        Job a = jobStore.create("generate_report", JobFixtures.reportPayload(1));
        Job b = jobStore.create("generate_report", JobFixtures.reportPayload(1));
        Job c = jobStore.create("generate_report", JobFixtures.reportPayload(1));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            CompletableFuture<DrainResult> first = CompletableFuture.supplyAsync(() -> awaitAndDrain(start),
                    executor);
            CompletableFuture<DrainResult> second = CompletableFuture.supplyAsync(() -> awaitAndDrain(start),
                    executor);
            start.countDown();

            DrainResult r1 = first.get(60, TimeUnit.SECONDS);
            DrainResult r2 = second.get(60, TimeUnit.SECONDS);

            assertEquals(3, r1.processedCount() + r2.processedCount());
            assertTrue(r1.errors().isEmpty());
            assertTrue(r2.errors().isEmpty());
        } finally {
            executor.shutdownNow();
        }

        for (Job job : List.of(a, b, c)) {
            assertEquals(JobStatus.COMPLETED, JobFixtures.reload(job.id).status);
            verify(reportGenerationService, times(1)).generate(eq(job.id), any(GenerateReportPayloadType.class));
        }
    }

    private DrainResult awaitAndDrain(CountDownLatch start) {
        try {
            start.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return drainService.drainAll();
    }
}
