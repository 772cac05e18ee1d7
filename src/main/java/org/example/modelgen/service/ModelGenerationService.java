package org.example.modelgen.service;

import org.example.modelgen.entity.GenerationLogEntity;
import org.example.modelgen.entity.JobType;
import org.example.modelgen.entity.ModelGenerationStatus;
import org.example.modelgen.entity.ProductEntity;
import org.example.modelgen.model.GenerationRequestResult;
import org.example.modelgen.model.GenerationRequestResult.Outcome;
import org.example.modelgen.model.SubmittedTask;
import org.example.modelgen.repository.ProductRepository;
import org.example.modelgen.service.gateway.GenerationGateway;
import org.example.modelgen.service.job.JobArgs;
import org.example.modelgen.service.job.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point of the pipeline: gates and queues generation requests, and submits queued products
 * to the generation service.
 */
@Service
public class ModelGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ModelGenerationService.class);

    static final String NO_IMAGES_AVAILABLE = "no_images_available";
    private static final String DEFAULT_FILE_TYPE = "jpg";

    private final ProductRepository productRepository;
    private final GenerationGateway generationGateway;
    private final GenerationLogService generationLogService;
    private final ProductGenerationStateService productGenerationStateService;
    private final ProductNotificationService productNotificationService;
    private final JobScheduler jobScheduler;

    @Value("${generation.production.enabled:true}")
    private boolean productionEnabled = true;

    @Value("${generation.debug.skip:false}")
    private boolean debugSkip;

    @Value("${tripo.enabled:true}")
    private boolean tripoEnabled = true;

    public ModelGenerationService(
            ProductRepository productRepository,
            GenerationGateway generationGateway,
            GenerationLogService generationLogService,
            ProductGenerationStateService productGenerationStateService,
            ProductNotificationService productNotificationService,
            JobScheduler jobScheduler) {
        this.productRepository = productRepository;
        this.generationGateway = generationGateway;
        this.generationLogService = generationLogService;
        this.productGenerationStateService = productGenerationStateService;
        this.productNotificationService = productNotificationService;
        this.jobScheduler = jobScheduler;
    }

    /**
     * Request a model for a product. Gated requests record the reason on the product and queue nothing.
     */
    public GenerationRequestResult requestGeneration(String productId) {
        log.info("Starting 3D model generation for product {}", productId);
        ProductEntity product = productRepository.findById(productId).orElse(null);
        if (product == null) {
            log.warn("Cannot generate model: product not found {}", productId);
            return new GenerationRequestResult(productId, Outcome.PRODUCT_NOT_FOUND, null, "Product not found");
        }

        Optional<Outcome> gate = checkGate();
        if (gate.isPresent()) {
            Outcome outcome = gate.get();
            recordGateOutcome(productId, outcome);
            log.info("3D model generation for product {} not started: {}", productId, outcome);
            return new GenerationRequestResult(productId, outcome, null, describe(outcome));
        }

        ModelGenerationStatus current = product.getModelGenerationStatus();
        Optional<GenerationLogEntity> active = generationLogService.getActiveGeneration(productId);
        if (active.isPresent()
                || current == ModelGenerationStatus.QUEUED
                || current == ModelGenerationStatus.DOWNLOADING) {
            String taskId = active.map(GenerationLogEntity::getTaskId).orElse(product.getTripoTaskId());
            log.info("Generation already in progress for product {} (task {})", productId, taskId);
            return new GenerationRequestResult(productId, Outcome.ALREADY_IN_PROGRESS, null,
                    "Generation already in progress" + (taskId != null ? " for task " + taskId : ""));
        }

        productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.QUEUED);
        try {
            String jobId = jobScheduler.enqueue(JobType.SUBMIT, JobArgs.forProduct(productId));
            log.info("Queued 3D model generation job {} for product {}", jobId, productId);
            return new GenerationRequestResult(productId, Outcome.QUEUED, jobId, "queued");
        } catch (RuntimeException e) {
            log.error("Failed to queue 3D model generation for product {}", productId, e);
            productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.QUEUE_FAILED);
            return new GenerationRequestResult(productId, Outcome.QUEUE_FAILED, null, e.getMessage());
        }
    }

    /**
     * Submit the product's image to the generation service and start polling the new task.
     * <p>
     * A task that was already submitted for the product and is still queued or processing is polled
     * instead of being submitted again.
     *
     * @return the task id assigned by the service
     */
    public String processGeneration(String productId) {
        productNotificationService.generationStarted(productId);
        try {
            ProductEntity product = productRepository.findById(productId)
                    .orElseThrow(() -> new GenerationStateException("Product not found: " + productId));
            Optional<GenerationLogEntity> submitted = generationLogService.getActiveGeneration(productId);
            if (submitted.isPresent()) {
                String taskId = submitted.get().getTaskId();
                log.info("Product {} already has task {} in flight, resuming status polling", productId, taskId);
                startPolling(productId, taskId);
                return taskId;
            }

            String imageUrl = selectImageUrl(product)
                    .orElseThrow(() -> new GenerationStateException(NO_IMAGES_AVAILABLE));
            String fileType = extractFileType(imageUrl);

            SubmittedTask task = generationGateway.submitImageToModel(imageUrl, fileType);
            log.info("Submitted product {} to {} as task {}", productId, generationGateway.getProviderName(), task.taskId());

            try {
                generationLogService.createLog(productId, task.taskId(), task.requestPayload());
            } catch (RuntimeException e) {
                log.warn("Failed to create generation log for task {}: {}", task.taskId(), e.getMessage());
            }
            startPolling(productId, task.taskId());
            return task.taskId();
        } catch (RuntimeException e) {
            log.error("Model generation failed for product {}: {}", productId, e.getMessage());
            productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.FAILED);
            productNotificationService.modelFailed(productId, e.getMessage());
            throw e;
        }
    }

    /**
     * Record on the product why a queued generation was dropped by the gate.
     */
    public void recordGateOutcome(String productId, Outcome outcome) {
        productGenerationStateService.updateGenerationStatus(productId, statusFor(outcome));
    }

    /**
     * Give up on a product whose submission ran out of attempts. A task left queued or processing by
     * the failed submission is marked failed so the product can be requested again.
     */
    public void abandonGeneration(String productId, String reason) {
        generationLogService.getActiveGeneration(productId).ifPresent(entry -> {
            log.warn("Abandoning task {} for product {}: {}", entry.getTaskId(), productId, reason);
            generationLogService.markFailed(entry.getTaskId(), reason);
        });
        productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.FAILED);
    }

    /**
     * Configuration switches that stop generation, in precedence order.
     */
    public Optional<Outcome> checkGate() {
        if (!productionEnabled) {
            return Optional.of(Outcome.DISABLED);
        }
        if (debugSkip) {
            return Optional.of(Outcome.SKIPPED);
        }
        if (!tripoEnabled || !generationGateway.isAvailable()) {
            return Optional.of(Outcome.SERVICE_DISABLED);
        }
        return Optional.empty();
    }

    private void startPolling(String productId, String taskId) {
        productGenerationStateService.recordTaskId(productId, taskId);
        jobScheduler.enqueue(JobType.POLL_STATUS, JobArgs.forTask(productId, taskId));
    }

    static Optional<String> selectImageUrl(ProductEntity product) {
        if (product.getPrimaryImageUrl() != null && !product.getPrimaryImageUrl().isBlank()) {
            return Optional.of(product.getPrimaryImageUrl());
        }
        if (product.getImageUrls() == null) {
            return Optional.empty();
        }
        return product.getImageUrls().stream()
                .filter(url -> url != null && !url.isBlank())
                .findFirst();
    }

    static String extractFileType(String imageUrl) {
        String path;
        try {
            path = URI.create(imageUrl.trim()).getPath();
        } catch (IllegalArgumentException e) {
            path = imageUrl;
        }
        if (path == null) {
            return DEFAULT_FILE_TYPE;
        }
        String filename = path.substring(path.lastIndexOf('/') + 1);
        int dot = filename.lastIndexOf('.');
        String extension = dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        if (extension.isEmpty()) {
            return DEFAULT_FILE_TYPE;
        }
        return "jpeg".equals(extension) ? DEFAULT_FILE_TYPE : extension;
    }

    private static ModelGenerationStatus statusFor(Outcome outcome) {
        switch (outcome) {
            case DISABLED:
                return ModelGenerationStatus.DISABLED;
            case SKIPPED:
                return ModelGenerationStatus.SKIPPED;
            default:
                return ModelGenerationStatus.SERVICE_DISABLED;
        }
    }

    private static String describe(Outcome outcome) {
        switch (outcome) {
            case DISABLED:
                return "3D model generation disabled in production";
            case SKIPPED:
                return "3D model generation skipped in debug mode";
            default:
                return "Generation service not enabled";
        }
    }
}
