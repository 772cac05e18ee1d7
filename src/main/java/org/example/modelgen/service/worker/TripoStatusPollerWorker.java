package org.example.modelgen.service.worker;

import org.example.modelgen.entity.JobType;
import org.example.modelgen.entity.ModelGenerationStatus;
import org.example.modelgen.model.TaskStatus;
import org.example.modelgen.model.TaskStatusReport;
import org.example.modelgen.service.GenerationLogService;
import org.example.modelgen.service.ProductGenerationStateService;
import org.example.modelgen.service.ProductNotificationService;
import org.example.modelgen.service.gateway.GenerationGateway;
import org.example.modelgen.service.gateway.GenerationGatewayException;
import org.example.modelgen.service.job.GenerationJob;
import org.example.modelgen.service.job.JobArgs;
import org.example.modelgen.service.job.JobResult;
import org.example.modelgen.service.job.JobScheduler;
import org.example.modelgen.service.job.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Polls the generation service for one task until it reaches a terminal state.
 * <p>
 * Non-terminal statuses snooze without consuming an attempt. Gateway failures count as attempts and
 * turn into a timeout once the attempt ceiling is reached.
 */
@Component
public class TripoStatusPollerWorker implements JobWorker {

    private static final Logger log = LoggerFactory.getLogger(TripoStatusPollerWorker.class);

    static final String TIMEOUT_MESSAGE = "Task timed out after maximum polling attempts";
    static final String TIMEOUT_ERROR = "timeout";

    // Headroom over the gateway's own receive timeout so gateway failures reach the worker
    private static final Duration EXECUTION_HEADROOM = Duration.ofSeconds(5);

    private final GenerationGateway generationGateway;
    private final GenerationLogService generationLogService;
    private final ProductGenerationStateService productGenerationStateService;
    private final ProductNotificationService productNotificationService;
    private final JobScheduler jobScheduler;

    @Value("${generation.poller.interval-seconds:10}")
    private int intervalSeconds = 10;

    @Value("${generation.poller.max-attempts:60}")
    private int maxAttempts = 60;

    @Value("${tripo.status-timeout-seconds:30}")
    private int statusTimeoutSeconds = 30;

    public TripoStatusPollerWorker(
            GenerationGateway generationGateway,
            GenerationLogService generationLogService,
            ProductGenerationStateService productGenerationStateService,
            ProductNotificationService productNotificationService,
            JobScheduler jobScheduler) {
        this.generationGateway = generationGateway;
        this.generationLogService = generationLogService;
        this.productGenerationStateService = productGenerationStateService;
        this.productNotificationService = productNotificationService;
        this.jobScheduler = jobScheduler;
    }

    @Override
    public JobType type() {
        return JobType.POLL_STATUS;
    }

    @Override
    public int maxAttempts() {
        return Math.max(1, maxAttempts);
    }

    @Override
    public Duration timeout() {
        return Duration.ofSeconds(Math.max(1, statusTimeoutSeconds)).plus(EXECUTION_HEADROOM);
    }

    @Override
    public Duration backoff(int attempt) {
        return pollInterval();
    }

    @Override
    public JobResult perform(GenerationJob job) {
        try {
            return poll(job);
        } catch (RuntimeException e) {
            if (job.attempt() < maxAttempts()) {
                throw e;
            }
            log.error("Giving up on task {} after {} attempts: {}", job.args().taskId(), job.attempt(), e.getMessage());
            return handleTimeout(job.args().productId(), job.args().taskId());
        }
    }

    private JobResult poll(GenerationJob job) {
        String productId = job.args().productId();
        String taskId = job.args().taskId();

        String recorded = generationLogService.getLogByTaskId(taskId)
                .map(entry -> entry.getStatus())
                .orElse(null);
        if (TaskStatus.isTerminalValue(recorded) && TaskStatus.parse(recorded) != TaskStatus.SUCCESS) {
            log.info("Task {} already finished as {}, dropping poll", taskId, recorded);
            return JobResult.discard("Task already " + recorded);
        }

        TaskStatusReport report;
        try {
            report = generationGateway.getTaskStatus(taskId);
        } catch (GenerationGatewayException e) {
            if (job.attempt() >= maxAttempts()) {
                throw e;
            }
            log.warn("Status check failed for task {} (attempt {}/{}): {}",
                    taskId, job.attempt(), maxAttempts(), e.getMessage());
            return JobResult.error(e.getMessage());
        }

        String missingResult = missingResult(report);
        if (missingResult != null) {
            log.error("Task {} for product {} reported success {}", taskId, productId, missingResult);
            report = report.asFailure("Task succeeded " + missingResult);
        }

        generationLogService.updateLogStatus(taskId, report);
        if (!TaskStatus.isRecognized(report.rawStatus())) {
            log.warn("Unknown status '{}' for task {}, treating as processing", report.rawStatus(), taskId);
        }

        switch (report.status()) {
            case SUCCESS:
                return handleSuccess(productId, taskId, report);
            case FAILED:
            case CANCELLED:
                return handleFailure(productId, taskId, report);
            case TIMEOUT:
                generationLogService.recordError(taskId, TIMEOUT_MESSAGE);
                return handleTimeout(productId, taskId);
            default:
                log.debug("Task {} still {} ({}%), checking again in {}s",
                        taskId, report.rawStatus(), report.progress(), pollInterval().toSeconds());
                return JobResult.snooze(pollInterval());
        }
    }

    // A success without both result URLs cannot be downloaded and is recorded as a failure
    private static String missingResult(TaskStatusReport report) {
        if (report.status() != TaskStatus.SUCCESS) {
            return null;
        }
        if (isBlank(report.modelUrl())) {
            return "without a model URL";
        }
        if (isBlank(report.renderedImageUrl())) {
            return "without a preview URL";
        }
        return null;
    }

    private JobResult handleSuccess(String productId, String taskId, TaskStatusReport report) {
        log.info("Task {} completed, scheduling model download for product {}", taskId, productId);
        productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.DOWNLOADING);
        jobScheduler.enqueue(JobType.DOWNLOAD_MODEL,
                JobArgs.forDownload(productId, taskId, report.modelUrl(), report.renderedImageUrl()));
        return JobResult.ok();
    }

    private JobResult handleFailure(String productId, String taskId, TaskStatusReport report) {
        String error = !isBlank(report.error()) ? report.error() : report.rawStatus();
        log.error("Task {} for product {} ended as {}: {}", taskId, productId, report.rawStatus(), error);
        generationLogService.recordError(taskId, error);
        productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.FAILED);
        productNotificationService.modelFailed(productId, error);
        return JobResult.discard("Task " + report.rawStatus() + ": " + error);
    }

    private JobResult handleTimeout(String productId, String taskId) {
        generationLogService.markTimedOut(taskId, TIMEOUT_MESSAGE);
        productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.TIMEOUT);
        productNotificationService.modelFailed(productId, TIMEOUT_ERROR);
        return JobResult.discard(TIMEOUT_MESSAGE);
    }

    private Duration pollInterval() {
        return Duration.ofSeconds(Math.max(1, intervalSeconds));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
