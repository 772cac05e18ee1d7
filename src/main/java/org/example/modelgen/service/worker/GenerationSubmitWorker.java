package org.example.modelgen.service.worker;

import org.example.modelgen.entity.JobType;
import org.example.modelgen.model.GenerationRequestResult.Outcome;
import org.example.modelgen.service.ModelGenerationService;
import org.example.modelgen.service.job.GenerationJob;
import org.example.modelgen.service.job.JobResult;
import org.example.modelgen.service.job.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Component
public class GenerationSubmitWorker implements JobWorker {

    private static final Logger log = LoggerFactory.getLogger(GenerationSubmitWorker.class);

    private static final Duration EXECUTION_TIMEOUT = Duration.ofMinutes(2);

    private final ModelGenerationService modelGenerationService;

    @Value("${generation.submit.max-attempts:3}")
    private int maxAttempts = 3;

    public GenerationSubmitWorker(ModelGenerationService modelGenerationService) {
        this.modelGenerationService = modelGenerationService;
    }

    @Override
    public JobType type() {
        return JobType.SUBMIT;
    }

    @Override
    public int maxAttempts() {
        return Math.max(1, maxAttempts);
    }

    @Override
    public Duration timeout() {
        return EXECUTION_TIMEOUT;
    }

    // attempt^2 minutes
    @Override
    public Duration backoff(int attempt) {
        long n = Math.max(1, attempt);
        return Duration.ofSeconds(n * n * 60L);
    }

    @Override
    public JobResult perform(GenerationJob job) {
        String productId = job.args().productId();
        Optional<Outcome> gate = modelGenerationService.checkGate();
        if (gate.isPresent()) {
            log.info("Dropping generation job for product {}: {}", productId, gate.get());
            modelGenerationService.recordGateOutcome(productId, gate.get());
            return JobResult.discard("Generation gated: " + gate.get());
        }

        try {
            String taskId = modelGenerationService.processGeneration(productId);
            log.info("Generation job for product {} submitted task {}", productId, taskId);
            return JobResult.ok();
        } catch (RuntimeException e) {
            if (job.attempt() >= job.maxAttempts()) {
                log.error("Generation job for product {} failed on its last attempt: {}", productId, e.getMessage());
                modelGenerationService.abandonGeneration(productId,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            throw e;
        }
    }
}
