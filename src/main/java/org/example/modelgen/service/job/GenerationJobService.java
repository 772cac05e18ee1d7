package org.example.modelgen.service.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.example.modelgen.entity.GenerationJobEntity;
import org.example.modelgen.entity.JobState;
import org.example.modelgen.entity.JobType;
import org.example.modelgen.repository.GenerationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job scheduler backed by the {@code generation_jobs} table and an in-process executor.
 * <p>
 * Rows are the source of truth: a job is claimed (SCHEDULED to RUNNING) before it runs and its
 * outcome is written back afterwards. Snoozed jobs keep their attempt counter; failed jobs advance
 * it and are retried with the worker's backoff until {@code maxAttempts} is reached.
 */
@Service
public class GenerationJobService implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(GenerationJobService.class);

    private static final Duration DUE_TOLERANCE = Duration.ofMillis(250);

    private final GenerationJobRepository jobRepository;
    private final List<JobWorker> workers;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService dispatcher;
    private final ExecutorService executionPool;
    private final LocalDateTime startedAt = LocalDateTime.now();
    private volatile boolean running = true;
    private volatile Map<JobType, JobWorker> workersByType;

    public GenerationJobService(
            GenerationJobRepository jobRepository,
            @Lazy List<JobWorker> workers,
            ObjectMapper objectMapper,
            @Value("${generation.jobs.worker-threads:4}") int workerThreads) {
        this.jobRepository = jobRepository;
        this.workers = workers;
        this.objectMapper = objectMapper;
        this.dispatcher = Executors.newScheduledThreadPool(
                Math.max(1, workerThreads),
                new JobThreadFactory("generation-job-dispatch-"));
        this.executionPool = Executors.newCachedThreadPool(new JobThreadFactory("generation-job-exec-"));
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        dispatcher.shutdownNow();
        executionPool.shutdownNow();
        log.info("Generation job scheduler shutting down");
    }

    @Override
    @Transactional
    public String enqueue(JobType type, JobArgs args) {
        JobWorker worker = workerFor(type);
        GenerationJobEntity job = new GenerationJobEntity(
                type,
                args.productId(),
                args.taskId(),
                writeArgs(args),
                Math.max(1, worker.maxAttempts())
        );
        String jobId = jobRepository.save(job).getId();
        log.info("Enqueued {} job {} for product {}", type, jobId, args.productId());
        runAfterCommit(() -> dispatch(jobId, Duration.ZERO));
        return jobId;
    }

    /**
     * Re-dispatch work left behind by a previous process: SCHEDULED rows this instance has not
     * touched, and RUNNING rows whose execution died with the old process.
     */
    @Transactional
    public RecoveredJobs recoverPendingJobs() {
        LocalDateTime now = LocalDateTime.now();
        List<GenerationJobEntity> pending = new ArrayList<>(
                jobRepository.findByStateAndUpdatedAtBefore(JobState.SCHEDULED, startedAt));

        List<GenerationJobEntity> orphaned = jobRepository.findByStateAndUpdatedAtBefore(JobState.RUNNING, startedAt);
        for (GenerationJobEntity job : orphaned) {
            log.warn("Resetting orphaned {} job {} (attempt {})", job.getJobType(), job.getId(), job.getAttempt());
            job.setState(JobState.SCHEDULED);
            job.setScheduledAt(now);
            jobRepository.save(job);
            pending.add(job);
        }

        for (GenerationJobEntity job : pending) {
            Duration delay = job.getScheduledAt() != null && job.getScheduledAt().isAfter(now)
                    ? Duration.between(now, job.getScheduledAt())
                    : Duration.ZERO;
            String jobId = job.getId();
            runAfterCommit(() -> dispatch(jobId, delay));
        }

        log.info("Re-dispatched {} pending generation jobs ({} orphaned RUNNING reset)", pending.size(), orphaned.size());
        return new RecoveredJobs(pending.size(), orphaned.size());
    }

    protected void dispatch(String jobId, Duration delay) {
        if (!running) {
            log.debug("Not dispatching job {}: scheduler stopped", jobId);
            return;
        }
        try {
            dispatcher.schedule(() -> {
                try {
                    execute(jobId);
                } catch (RuntimeException e) {
                    log.error("Error executing generation job {}", jobId, e);
                }
            }, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Job {} not dispatched: scheduler is shutting down", jobId);
        }
    }

    void execute(String jobId) {
        GenerationJobEntity job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Generation job not found: {}", jobId);
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        if (job.getState() != JobState.SCHEDULED) {
            log.debug("Skipping job {}: already {}", jobId, job.getState());
            return;
        }
        if (job.getScheduledAt() != null && job.getScheduledAt().isAfter(now.plus(DUE_TOLERANCE))) {
            log.debug("Skipping job {}: not due until {}", jobId, job.getScheduledAt());
            return;
        }
        if (jobRepository.claimForExecution(jobId, now, JobState.SCHEDULED, JobState.RUNNING) == 0) {
            log.debug("Job {} was claimed by another executor", jobId);
            return;
        }
        job.setState(JobState.RUNNING);

        JobWorker worker = workerFor(job.getJobType());
        GenerationJob execution = new GenerationJob(
                job.getId(),
                job.getJobType(),
                readArgs(job.getArgsJson()),
                job.getAttempt(),
                job.getMaxAttempts()
        );
        log.debug("Running {} job {} (attempt {}/{})",
                execution.type(), execution.id(), execution.attempt(), execution.maxAttempts());

        JobResult result = runWithTimeout(worker, execution);
        applyResult(job, worker, result);
    }

    JobResult runWithTimeout(JobWorker worker, GenerationJob execution) {
        Future<JobResult> future = executionPool.submit(() -> worker.perform(execution));
        long timeoutMs = Math.max(1L, worker.timeout().toMillis());
        try {
            JobResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : JobResult.error("Worker returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("{} job {} timed out after {}ms", execution.type(), execution.id(), timeoutMs);
            return JobResult.error("Execution timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} job {} raised on attempt {}", execution.type(), execution.id(), execution.attempt(), cause);
            return JobResult.error(safeErrorMessage(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return JobResult.error("Execution interrupted");
        }
    }

    void applyResult(GenerationJobEntity job, JobWorker worker, JobResult result) {
        LocalDateTime now = LocalDateTime.now();

        if (result instanceof JobResult.Snooze snooze) {
            Duration delay = nonNegative(snooze.delay());
            job.setState(JobState.SCHEDULED);
            job.setScheduledAt(now.plus(delay));
            jobRepository.save(job);
            log.debug("{} job {} snoozed for {}s (attempt {} unchanged)",
                    job.getJobType(), job.getId(), delay.toSeconds(), job.getAttempt());
            dispatch(job.getId(), delay);
            return;
        }

        if (result instanceof JobResult.Error error) {
            job.setLastError(truncate(error.message()));
            if (job.getAttempt() < job.getMaxAttempts()) {
                Duration delay = nonNegative(worker.backoff(job.getAttempt()));
                job.setAttempt(job.getAttempt() + 1);
                job.setState(JobState.SCHEDULED);
                job.setScheduledAt(now.plus(delay));
                jobRepository.save(job);
                log.warn("Retrying {} job {} in {}s (attempt {}/{}): {}",
                        job.getJobType(), job.getId(), delay.toSeconds(),
                        job.getAttempt(), job.getMaxAttempts(), error.message());
                dispatch(job.getId(), delay);
                return;
            }
            job.setState(JobState.FAILED);
            jobRepository.save(job);
            log.error("{} job {} failed after {} attempts: {}",
                    job.getJobType(), job.getId(), job.getAttempt(), error.message());
            return;
        }

        if (result instanceof JobResult.Discard discard) {
            job.setState(JobState.DISCARDED);
            job.setLastError(truncate(discard.reason()));
            jobRepository.save(job);
            log.info("{} job {} discarded: {}", job.getJobType(), job.getId(), discard.reason());
            return;
        }

        job.setState(JobState.COMPLETED);
        jobRepository.save(job);
        log.debug("{} job {} completed", job.getJobType(), job.getId());
    }

    private JobWorker workerFor(JobType type) {
        Map<JobType, JobWorker> registry = workersByType;
        if (registry == null) {
            registry = new EnumMap<>(JobType.class);
            for (JobWorker worker : workers) {
                JobWorker previous = registry.put(worker.type(), worker);
                if (previous != null) {
                    throw new IllegalStateException("Multiple workers registered for " + worker.type());
                }
            }
            workersByType = registry;
        }
        JobWorker worker = registry.get(type);
        if (worker == null) {
            throw new IllegalStateException("No worker registered for job type " + type);
        }
        return worker;
    }

    private void runAfterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }

    private String writeArgs(JobArgs args) {
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize job arguments", e);
        }
    }

    private JobArgs readArgs(String json) {
        try {
            return objectMapper.readValue(json, JobArgs.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read job arguments: " + json, e);
        }
    }

    private static Duration nonNegative(Duration delay) {
        return delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    private static String safeErrorMessage(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 1000) {
            return value;
        }
        return value.substring(0, 1000);
    }

    public record RecoveredJobs(int dispatched, int orphanedReset) {
    }

    private static final class JobThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger(1);
        private final String prefix;

        private JobThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + sequence.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        }
    }
}
