package org.example.modelgen.service.job;

import org.example.modelgen.entity.JobType;

/**
 * Durable, at-least-once execution of pipeline steps.
 */
public interface JobScheduler {

    /**
     * Persist a job and run it as soon as the surrounding transaction (if any) commits.
     *
     * @return the id of the stored job
     */
    String enqueue(JobType type, JobArgs args);
}
