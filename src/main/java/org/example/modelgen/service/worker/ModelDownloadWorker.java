package org.example.modelgen.service.worker;

import org.example.modelgen.entity.JobType;
import org.example.modelgen.entity.ModelGenerationStatus;
import org.example.modelgen.service.AssetDownloadException;
import org.example.modelgen.service.AssetStorageService;
import org.example.modelgen.service.GenerationLogService;
import org.example.modelgen.service.ProductGenerationStateService;
import org.example.modelgen.service.ProductNotificationService;
import org.example.modelgen.service.job.GenerationJob;
import org.example.modelgen.service.job.JobArgs;
import org.example.modelgen.service.job.JobResult;
import org.example.modelgen.service.job.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * Fetches the generated model and its preview into local storage, then points the product at them.
 */
@Component
public class ModelDownloadWorker implements JobWorker {

    private static final Logger log = LoggerFactory.getLogger(ModelDownloadWorker.class);

    private static final Duration EXECUTION_TIMEOUT = Duration.ofMinutes(3);

    private final WebClient webClient;
    private final AssetStorageService assetStorageService;
    private final ProductGenerationStateService productGenerationStateService;
    private final GenerationLogService generationLogService;
    private final ProductNotificationService productNotificationService;

    @Value("${generation.download.timeout-seconds:120}")
    private int downloadTimeoutSeconds = 120;

    @Value("${generation.download.max-attempts:3}")
    private int maxAttempts = 3;

    public ModelDownloadWorker(
            @Qualifier("assetDownloadWebClient") WebClient webClient,
            AssetStorageService assetStorageService,
            ProductGenerationStateService productGenerationStateService,
            GenerationLogService generationLogService,
            ProductNotificationService productNotificationService) {
        this.webClient = webClient;
        this.assetStorageService = assetStorageService;
        this.productGenerationStateService = productGenerationStateService;
        this.generationLogService = generationLogService;
        this.productNotificationService = productNotificationService;
    }

    @Override
    public JobType type() {
        return JobType.DOWNLOAD_MODEL;
    }

    @Override
    public int maxAttempts() {
        return Math.max(1, maxAttempts);
    }

    @Override
    public Duration timeout() {
        return EXECUTION_TIMEOUT;
    }

    /**
     * 20s, 40s, 80s ...
     */
    @Override
    public Duration backoff(int attempt) {
        int exponent = Math.max(0, Math.min(attempt, 16));
        return Duration.ofSeconds((1L << exponent) * 10L);
    }

    @Override
    public JobResult perform(GenerationJob job) {
        JobArgs args = job.args();
        String productId = args.productId();
        log.info("Downloading model for product {} (task {}, attempt {}/{})",
                productId, args.taskId(), job.attempt(), job.maxAttempts());
        try {
            assetStorageService.ensureProductDirectory(productId);
            assetStorageService.write(productId, AssetStorageService.MODEL_FILENAME, download(args.modelUrl()));
            assetStorageService.write(productId, AssetStorageService.PREVIEW_FILENAME, download(args.imageUrl()));

            String modelPath = assetStorageService.relativeModelPath(productId);
            productGenerationStateService.completeGeneration(productId, args.taskId(), modelPath);
            productNotificationService.modelReady(productId, modelPath);
            return JobResult.ok();
        } catch (RuntimeException e) {
            log.error("Model download failed for product {} (attempt {}/{}): {}",
                    productId, job.attempt(), job.maxAttempts(), e.getMessage());
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            productGenerationStateService.updateGenerationStatus(productId, ModelGenerationStatus.DOWNLOAD_FAILED);
            if (job.attempt() >= job.maxAttempts()) {
                generationLogService.recordError(args.taskId(), error);
                productNotificationService.modelFailed(productId, error);
            }
            return JobResult.error(error);
        }
    }

    byte[] download(String url) {
        if (url == null || url.isBlank()) {
            throw new AssetDownloadException("No download URL provided");
        }
        try {
            byte[] body = webClient.get()
                    .uri(URI.create(url))
                    .exchangeToMono(response -> {
                        int status = response.statusCode().value();
                        if (status != 200) {
                            return response.releaseBody()
                                    .then(Mono.<byte[]>error(new AssetDownloadException("HTTP " + status)));
                        }
                        return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]);
                    })
                    .block(Duration.ofSeconds(Math.max(1, downloadTimeoutSeconds)));
            return body != null ? body : new byte[0];
        } catch (AssetDownloadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AssetDownloadException("Download failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
