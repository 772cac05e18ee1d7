package org.example.modelgen.service.job;

import org.example.modelgen.entity.JobType;

import java.time.Duration;

/**
 * One kind of pipeline step executed by the job scheduler.
 */
public interface JobWorker {

    JobType type();

    /**
     * Execute the step. Thrown exceptions count as {@link JobResult.Error}.
     */
    JobResult perform(GenerationJob job);

    int maxAttempts();

    /**
     * Upper bound for a single execution; exceeding it counts as a failure.
     */
    Duration timeout();

    /**
     * Delay before re-running after the given failed attempt.
     */
    Duration backoff(int attempt);
}
