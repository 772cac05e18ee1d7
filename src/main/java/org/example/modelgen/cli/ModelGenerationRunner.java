package org.example.modelgen.cli;

import org.example.modelgen.model.GenerationPipelineStatus;
import org.example.modelgen.model.GenerationRequestResult;
import org.example.modelgen.service.GenerationStatusService;
import org.example.modelgen.service.ModelGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line runner that requests 3D model generation for a list of products.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=generate-model \
 *     -Dspring-boot.run.arguments=--generation.cli.product-ids=id1,id2
 * <p>
 * The process stays up after the requests are queued so the background jobs can finish.
 */
@Component
@Profile("generate-model")
public class ModelGenerationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ModelGenerationRunner.class);

    private final ModelGenerationService modelGenerationService;
    private final GenerationStatusService generationStatusService;

    @Value("${generation.cli.product-ids:}")
    private String productIds;

    public ModelGenerationRunner(
            ModelGenerationService modelGenerationService,
            GenerationStatusService generationStatusService) {
        this.modelGenerationService = modelGenerationService;
        this.generationStatusService = generationStatusService;
    }

    @Override
    public void run(String... args) {
        List<String> ids = parseProductIds(productIds);
        if (ids.isEmpty()) {
            log.warn("No product ids given. Set generation.cli.product-ids=<id>[,<id>...]");
            return;
        }

        log.info("========================================");
        log.info("Model Generation Runner: {} product(s)", ids.size());
        log.info("========================================");

        List<GenerationRequestResult> results = new ArrayList<>();
        for (String productId : ids) {
            try {
                GenerationRequestResult result = modelGenerationService.requestGeneration(productId);
                results.add(result);
                log.info("[{}] {}: {}", productId, result.outcome(), result.message());
            } catch (Exception e) {
                log.error("Failed to request generation for {}: {}", productId, e.getMessage(), e);
            }
        }

        long queued = results.stream().filter(GenerationRequestResult::queued).count();
        GenerationPipelineStatus status = generationStatusService.getPipelineStatus();
        log.info("Queued {}/{} request(s). Pipeline: queued={}, downloading={}, completed={}, unsuccessful={}",
                queued, ids.size(), status.queued(), status.downloading(), status.completed(), status.unsuccessful());
    }

    static List<String> parseProductIds(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .distinct()
                .toList();
    }
}
