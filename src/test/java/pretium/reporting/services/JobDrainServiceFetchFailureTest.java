package pretium.reporting.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import pretium.reporting.exceptions.JobExecutionException;
import pretium.reporting.exceptions.StoreUnavailableException;
import pretium.reporting.observability.JobMetrics;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link JobDrainService} loop control with the queue and processor mocked.
 */
class JobDrainServiceFetchFailureTest {

    @Mock
    QueueClient queueClient;

    @Mock
    JobProcessor jobProcessor;

    @Mock
    JobMetrics metrics;

    @InjectMocks
    JobDrainService drainService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testDrainAll_StoreErrorWhileFetchingStopsLoop() {
        // Arrange
        ClaimedJob first = claimed();
        when(queueClient.getNext()).thenReturn(Optional.of(first))
                .thenThrow(new StoreUnavailableException("connection refused"));

        // Act
        DrainResult result = drainService.drainAll();

        // Assert
        assertEquals(1, result.processedCount());
        assertEquals(1, result.errors().size());
        assertEquals("Error getting next job: connection refused", result.errors().get(0));
        verify(queueClient, times(2)).getNext();
        verify(jobProcessor, times(1)).process(first);
    }

    @Test
    void testDrainAll_StoreErrorOnFirstFetch() {
        when(queueClient.getNext()).thenThrow(new StoreUnavailableException("down"));

        DrainResult result = drainService.drainAll();

        assertEquals(0, result.processedCount());
        assertEquals("Error getting next job: down", result.errors().get(0));
        verify(jobProcessor, never()).process(any(ClaimedJob.class));
    }

    @Test
    void testDrainAll_ProcessorFailureDoesNotStopLoop() {
        ClaimedJob failing = claimed();
        ClaimedJob passing = claimed();
        when(queueClient.getNext()).thenReturn(Optional.of(failing), Optional.of(passing), Optional.empty());
        when(jobProcessor.process(failing)).thenThrow(new JobExecutionException(failing.id(), "boom"));
        when(jobProcessor.process(passing)).thenReturn(ProcessOutcome.COMPLETED);

        DrainResult result = drainService.drainAll();

        assertEquals(2, result.processedCount());
        assertEquals(1, result.errors().size());
        assertEquals("Job " + failing.id() + ": boom", result.errors().get(0));
        verify(metrics).recordDrained(2);
    }

    private static ClaimedJob claimed() {
        return new ClaimedJob(UUID.randomUUID(), "generate_report", Map.of(), Instant.now(), Instant.now(),
                "test-worker");
    }
}
