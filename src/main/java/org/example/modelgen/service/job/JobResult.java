package org.example.modelgen.service.job;

import java.time.Duration;

/**
 * Outcome of one job execution.
 */
public sealed interface JobResult permits JobResult.Ok, JobResult.Snooze, JobResult.Error, JobResult.Discard {

    /** Work finished; the job completes. */
    record Ok() implements JobResult {}

    /** Run the same job again after {@code delay} without consuming an attempt. */
    record Snooze(Duration delay) implements JobResult {}

    /** Counted failure; retried with backoff until attempts run out. */
    record Error(String message) implements JobResult {}

    /** Terminal outcome already recorded by the worker; never retried. */
    record Discard(String reason) implements JobResult {}

    static JobResult ok() {
        return new Ok();
    }

    static JobResult snooze(Duration delay) {
        return new Snooze(delay);
    }

    static JobResult error(String message) {
        return new Error(message);
    }

    static JobResult discard(String reason) {
        return new Discard(reason);
    }
}
