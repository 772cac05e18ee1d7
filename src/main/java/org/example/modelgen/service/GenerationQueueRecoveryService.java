package org.example.modelgen.service;

import org.example.modelgen.service.job.GenerationJobService;
import org.example.modelgen.service.job.GenerationJobService.RecoveredJobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class GenerationQueueRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(GenerationQueueRecoveryService.class);

    private final GenerationJobService generationJobService;
    private final boolean recoveryEnabled;

    public GenerationQueueRecoveryService(
            GenerationJobService generationJobService,
            @Value("${generation.queue.recovery.enabled:true}") boolean recoveryEnabled) {
        this.generationJobService = generationJobService;
        this.recoveryEnabled = recoveryEnabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        recoverPendingGenerationWork();
    }

    RecoverySummary recoverPendingGenerationWork() {
        if (!recoveryEnabled) {
            log.info("Generation queue recovery is disabled");
            return new RecoverySummary(0, 0);
        }

        RecoveredJobs recovered = generationJobService.recoverPendingJobs();
        RecoverySummary summary = new RecoverySummary(recovered.dispatched(), recovered.orphanedReset());
        if (summary.jobsRequeued() == 0) {
            log.info("No pending generation jobs to recover");
        } else {
            log.info("Recovered generation queue: requeued={}, orphanedRunning={}",
                    summary.jobsRequeued(), summary.orphanedRunningReset());
        }
        return summary;
    }

    record RecoverySummary(int jobsRequeued, int orphanedRunningReset) {
    }
}
