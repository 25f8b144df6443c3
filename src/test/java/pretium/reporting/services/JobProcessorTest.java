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
import pretium.reporting.exceptions.JobExecutionException;
import pretium.reporting.exceptions.ReportGenerationException;
import pretium.reporting.testing.H2TestResource;
import pretium.reporting.testing.JobFixtures;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the {@link JobProcessor} state machine. Report generation is mocked; the store is real.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class JobProcessorTest {

    @Inject
    JobProcessor jobProcessor;

    @Inject
    JobStore jobStore;

    @InjectMock
    ReportGenerationService reportGenerationService;

    @BeforeEach
    void setUp() {
        JobFixtures.deleteAllJobs();
    }

    @Test
    void testProcess_GenerateReportCompletesWithHandlerOutput() {
        when(reportGenerationService.generate(any(UUID.class), any(GenerateReportPayloadType.class)))
                .thenReturn(report("1. Roofing\n1.1 Seams lapped [IMAGE:1:Roofing]"));
        Job job = jobStore.create("generate_report", JobFixtures.reportPayload(1));

        ProcessOutcome outcome = jobProcessor.process(job);

        assertEquals(ProcessOutcome.COMPLETED, outcome);
        Job stored = JobFixtures.reload(job.id);
        assertEquals(JobStatus.COMPLETED, stored.status);
        assertEquals("1. Roofing\n1.1 Seams lapped [IMAGE:1:Roofing]", stored.result.get("content"));
        assertNull(stored.error);
        assertNotNull(stored.startedAt);
        assertNotNull(stored.finishedAt);
    }

    @Test
    void testProcess_AlreadyClaimedJobIsSkipped() {
        Job job = jobStore.create("generate_report", JobFixtures.reportPayload(1));
        jobStore.transitionToProcessing(job.id);

        ProcessOutcome outcome = jobProcessor.process(job);

        assertEquals(ProcessOutcome.SKIPPED, outcome);
        assertEquals(JobStatus.PROCESSING, JobFixtures.reload(job.id).status);
        verify(reportGenerationService, never()).generate(any(), any());
    }

    @Test
    void testProcess_UnknownTypeFailsJob() {
        Job job = jobStore.create("mystery_type", Map.of());

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> jobProcessor.process(job));

        assertEquals(job.id, e.getJobId());
        Job stored = JobFixtures.reload(job.id);
        assertEquals(JobStatus.FAILED, stored.status);
        assertTrue(stored.error.contains("mystery_type"));
        assertNull(stored.result);
    }

    @Test
    void testProcess_NotImplementedTypesFail() {
        Job images = jobStore.create("process_images", Map.of());
        Job export = jobStore.create("export_document", Map.of());

        assertThrows(JobExecutionException.class, () -> jobProcessor.process(images));
        assertThrows(JobExecutionException.class, () -> jobProcessor.process(export));

        assertEquals("Image processing job type not yet implemented", JobFixtures.reload(images.id).error);
        assertEquals("Document export job type not yet implemented", JobFixtures.reload(export.id).error);
        assertEquals(JobStatus.FAILED, JobFixtures.reload(export.id).status);
    }

    @Test
    void testProcess_HandlerFailureRecordedAndRethrown() {
        when(reportGenerationService.generate(any(UUID.class), any(GenerateReportPayloadType.class)))
                .thenThrow(new ReportGenerationException("Error processing batch 1: model timeout"));
        Job job = jobStore.create("generate_report", JobFixtures.reportPayload(3));

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> jobProcessor.process(job));

        assertInstanceOf(ReportGenerationException.class, e.getCause());
        Job stored = JobFixtures.reload(job.id);
        assertEquals(JobStatus.FAILED, stored.status);
        assertEquals("Error processing batch 1: model timeout", stored.error);
    }

    @Test
    void testProcess_LongHandlerErrorStillFailsJob() {
        String message = "Error processing batch 1: " + "x".repeat(5000);
        when(reportGenerationService.generate(any(UUID.class), any(GenerateReportPayloadType.class)))
                .thenThrow(new ReportGenerationException(message));
        Job job = jobStore.create("generate_report", JobFixtures.reportPayload(1));

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> jobProcessor.process(job));

        assertEquals(message, e.getMessage());
        Job stored = JobFixtures.reload(job.id);
        assertEquals(JobStatus.FAILED, stored.status);
        assertEquals(message, stored.error);
        assertNull(stored.result);
    }

    @Test
    void testProcessClaimed_RunsWithoutSecondClaim() {
        when(reportGenerationService.generate(any(UUID.class), any(GenerateReportPayloadType.class)))
                .thenReturn(report("done"));
        Job job = jobStore.create("generate_report", JobFixtures.reportPayload(1));
        ClaimedJob claimed = jobStore.claimNext().orElseThrow();

        assertEquals(ProcessOutcome.COMPLETED, jobProcessor.process(claimed));
        assertEquals(JobStatus.COMPLETED, JobFixtures.reload(job.id).status);
    }

    private static GeneratedReportType report(String content) {
        return new GeneratedReportType("report-1", content, List.of(),
                new GeneratedReportType.MetadataType("observation", 1, 1, true));
    }
}
