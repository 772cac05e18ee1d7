package org.example.modelgen.service.worker;

import org.example.modelgen.entity.JobType;
import org.example.modelgen.model.GenerationRequestResult.Outcome;
import org.example.modelgen.service.ModelGenerationService;
import org.example.modelgen.service.gateway.GenerationGatewayException;
import org.example.modelgen.service.job.GenerationJob;
import org.example.modelgen.service.job.JobArgs;
import org.example.modelgen.service.job.JobResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationSubmitWorkerTest {

    @Mock
    private ModelGenerationService modelGenerationService;

    @Test
    void perform_submitsProduct() {
        GenerationSubmitWorker worker = new GenerationSubmitWorker(modelGenerationService);
        when(modelGenerationService.checkGate()).thenReturn(Optional.empty());
        when(modelGenerationService.processGeneration("product-1")).thenReturn("task-1");

        assertInstanceOf(JobResult.Ok.class, worker.perform(job()));
    }

    @Test
    void perform_gatedAfterQueueing_discards() {
        GenerationSubmitWorker worker = new GenerationSubmitWorker(modelGenerationService);
        when(modelGenerationService.checkGate()).thenReturn(Optional.of(Outcome.SERVICE_DISABLED));

        assertInstanceOf(JobResult.Discard.class, worker.perform(job()));
        verify(modelGenerationService).recordGateOutcome("product-1", Outcome.SERVICE_DISABLED);
        verify(modelGenerationService, never()).processGeneration(anyString());
    }

    @Test
    void perform_submitFailure_propagatesForRetry() {
        GenerationSubmitWorker worker = new GenerationSubmitWorker(modelGenerationService);
        when(modelGenerationService.checkGate()).thenReturn(Optional.empty());
        when(modelGenerationService.processGeneration("product-1"))
                .thenThrow(new GenerationGatewayException("HTTP 500"));

        assertThrows(GenerationGatewayException.class, () -> worker.perform(job()));
        verify(modelGenerationService, never()).abandonGeneration(anyString(), anyString());
    }

    @Test
    void perform_lastAttemptFailure_abandonsGeneration() {
        GenerationSubmitWorker worker = new GenerationSubmitWorker(modelGenerationService);
        when(modelGenerationService.checkGate()).thenReturn(Optional.empty());
        when(modelGenerationService.processGeneration("product-1"))
                .thenThrow(new IllegalStateException("database locked"));

        GenerationJob last = new GenerationJob("job-1", JobType.SUBMIT, JobArgs.forProduct("product-1"), 3, 3);

        assertThrows(IllegalStateException.class, () -> worker.perform(last));
        verify(modelGenerationService).abandonGeneration("product-1", "database locked");
    }

    @Test
    void backoff_isQuadraticInMinutes() {
        GenerationSubmitWorker worker = new GenerationSubmitWorker(modelGenerationService);

        assertEquals(Duration.ofMinutes(1), worker.backoff(1));
        assertEquals(Duration.ofMinutes(4), worker.backoff(2));
        assertEquals(Duration.ofMinutes(9), worker.backoff(3));
        assertEquals(3, worker.maxAttempts());
        assertEquals(Duration.ofMinutes(2), worker.timeout());
    }

    private static GenerationJob job() {
        return new GenerationJob("job-1", JobType.SUBMIT, JobArgs.forProduct("product-1"), 1, 3);
    }
}
