package org.example.modelgen.service.job;

import org.example.modelgen.entity.JobType;

/**
 * Read-only view of one job execution handed to a worker.
 *
 * @param attempt failure-attempt counter, starting at 1; deferred retries do not advance it
 */
public record GenerationJob(
        String id,
        JobType type,
        JobArgs args,
        int attempt,
        int maxAttempts
) {
}
