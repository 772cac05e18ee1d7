package org.example.modelgen.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.modelgen.entity.GenerationLogEntity;
import org.example.modelgen.entity.ProductEntity;
import org.example.modelgen.model.TaskStatus;
import org.example.modelgen.model.TaskStatusReport;
import org.example.modelgen.repository.GenerationLogRepository;
import org.example.modelgen.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Durable audit trail of generation attempts. Pure persistence: callers decide what to record.
 */
@Service
public class GenerationLogService {

    private static final Logger log = LoggerFactory.getLogger(GenerationLogService.class);

    static final List<String> ACTIVE_STATUSES = List.of(
            TaskStatus.QUEUED.value(),
            TaskStatus.PROCESSING.value()
    );

    private final GenerationLogRepository generationLogRepository;
    private final ProductRepository productRepository;

    public GenerationLogService(
            GenerationLogRepository generationLogRepository,
            ProductRepository productRepository) {
        this.generationLogRepository = generationLogRepository;
        this.productRepository = productRepository;
    }

    @Transactional
    public GenerationLogEntity createLog(String productId, String taskId, JsonNode requestPayload) {
        ProductEntity product = productRepository.findById(productId)
                .orElseThrow(() -> new GenerationStateException("Product not found: " + productId));
        GenerationLogEntity entry = new GenerationLogEntity(product, taskId);
        if (requestPayload != null) {
            entry.setRequestPayload(requestPayload.toString());
        }
        GenerationLogEntity saved = generationLogRepository.save(entry);
        log.debug("Created generation log for task {} (product {})", taskId, productId);
        return saved;
    }

    /**
     * Record the latest status response. Rows that already reached a terminal status are left untouched.
     */
    @Transactional
    public Optional<GenerationLogEntity> updateLogStatus(String taskId, TaskStatusReport report) {
        GenerationLogEntity entry = generationLogRepository.findByTaskId(taskId).orElse(null);
        if (entry == null) {
            log.warn("Cannot update status: generation log not found for task {}", taskId);
            return Optional.empty();
        }
        if (TaskStatus.isTerminalValue(entry.getStatus())) {
            log.warn("Ignoring status '{}' for task {}: already {}", report.rawStatus(), taskId, entry.getStatus());
            return Optional.of(entry);
        }

        if (report.rawStatus() != null && !report.rawStatus().isBlank()) {
            entry.setStatus(report.rawStatus());
        }
        if (report.progress() != null) {
            entry.setProgress(clampProgress(report.progress()));
        }
        if (report.payload() != null) {
            entry.setResponseData(report.payload().toString());
        }
        if (report.modelUrl() != null) {
            entry.setPbrModelUrl(report.modelUrl());
        }
        if (report.renderedImageUrl() != null) {
            entry.setRenderedImageUrl(report.renderedImageUrl());
        }
        if (report.generatedImageUrl() != null) {
            entry.setGeneratedImageUrl(report.generatedImageUrl());
        }
        if (report.error() != null && entry.getErrorMessage() == null) {
            entry.setErrorMessage(truncate(report.error()));
        }
        return Optional.of(generationLogRepository.save(entry));
    }

    @Transactional
    public Optional<GenerationLogEntity> updateLogWithLocalPath(String taskId, String localPath) {
        GenerationLogEntity entry = generationLogRepository.findByTaskId(taskId).orElse(null);
        if (entry == null) {
            log.warn("Cannot record local path: generation log not found for task {}", taskId);
            return Optional.empty();
        }
        if (entry.getLocalModelPath() != null && !entry.getLocalModelPath().equals(localPath)) {
            log.warn("Replacing local model path for task {}: {} -> {}", taskId, entry.getLocalModelPath(), localPath);
        }
        entry.setLocalModelPath(localPath);
        return Optional.of(generationLogRepository.save(entry));
    }

    /**
     * Record the error message of a terminal failure. The first message wins.
     */
    @Transactional
    public void recordError(String taskId, String errorMessage) {
        generationLogRepository.findByTaskId(taskId).ifPresentOrElse(entry -> {
            if (entry.getErrorMessage() == null) {
                entry.setErrorMessage(truncate(errorMessage));
                generationLogRepository.save(entry);
            }
        }, () -> log.warn("Cannot record error: generation log not found for task {}", taskId));
    }

    @Transactional
    public void markTimedOut(String taskId, String errorMessage) {
        markTerminal(taskId, TaskStatus.TIMEOUT, errorMessage);
    }

    /**
     * Close a task that was abandoned locally while the service still reported it as running.
     */
    @Transactional
    public void markFailed(String taskId, String errorMessage) {
        markTerminal(taskId, TaskStatus.FAILED, errorMessage);
    }

    private void markTerminal(String taskId, TaskStatus status, String errorMessage) {
        GenerationLogEntity entry = generationLogRepository.findByTaskId(taskId).orElse(null);
        if (entry == null) {
            log.warn("Cannot mark task {} as {}: generation log not found", taskId, status.value());
            return;
        }
        if (TaskStatus.isTerminalValue(entry.getStatus())) {
            log.warn("Not marking task {} as {}: already {}", taskId, status.value(), entry.getStatus());
            return;
        }
        entry.setStatus(status.value());
        if (entry.getErrorMessage() == null) {
            entry.setErrorMessage(truncate(errorMessage));
        }
        generationLogRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public Optional<GenerationLogEntity> getLogByTaskId(String taskId) {
        return generationLogRepository.findByTaskId(taskId);
    }

    @Transactional(readOnly = true)
    public List<GenerationLogEntity> getLogsByProductId(String productId) {
        return generationLogRepository.findByProductIdOrderByCreatedAtDesc(productId);
    }

    /**
     * Get the newest generation for a product that is still queued or processing.
     */
    @Transactional(readOnly = true)
    public Optional<GenerationLogEntity> getActiveGeneration(String productId) {
        return generationLogRepository.findFirstByProductIdAndStatusInOrderByCreatedAtDesc(productId, ACTIVE_STATUSES);
    }

    static int clampProgress(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    private String truncate(String value) {
        if (value == null || value.length() <= 1000) {
            return value;
        }
        return value.substring(0, 1000);
    }
}
