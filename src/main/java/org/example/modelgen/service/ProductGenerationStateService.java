package org.example.modelgen.service;

import org.example.modelgen.entity.ModelGenerationStatus;
import org.example.modelgen.entity.ProductEntity;
import org.example.modelgen.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Owns every write to a product's generation fields. Other product fields are never touched here.
 */
@Service
public class ProductGenerationStateService {

    private static final Logger log = LoggerFactory.getLogger(ProductGenerationStateService.class);

    private final ProductRepository productRepository;
    private final GenerationLogService generationLogService;

    public ProductGenerationStateService(
            ProductRepository productRepository,
            GenerationLogService generationLogService) {
        this.productRepository = productRepository;
        this.generationLogService = generationLogService;
    }

    @Transactional
    public boolean updateGenerationStatus(String productId, ModelGenerationStatus status) {
        ProductEntity product = productRepository.findById(productId).orElse(null);
        if (product == null) {
            log.warn("Cannot update generation status: product not found {}", productId);
            return false;
        }
        product.setModelGenerationStatus(status);
        productRepository.save(product);
        log.debug("Updated generation status for product {}: {}", productId, status.value());
        return true;
    }

    @Transactional
    public void recordTaskId(String productId, String taskId) {
        ProductEntity product = productRepository.findById(productId)
                .orElseThrow(() -> new GenerationStateException("Product not found: " + productId));
        product.setTripoTaskId(taskId);
        productRepository.save(product);
    }

    /**
     * Point the product at its downloaded model and mark generation complete.
     * The log's local path and the product fields commit together or not at all.
     */
    @Transactional
    public void completeGeneration(String productId, String taskId, String relativeModelPath) {
        generationLogService.updateLogWithLocalPath(taskId, relativeModelPath)
                .orElseThrow(() -> new GenerationStateException("Generation log not found for task " + taskId));

        ProductEntity product = productRepository.findById(productId)
                .orElseThrow(() -> new GenerationStateException("Product not found: " + productId));
        product.setArModelUrl(relativeModelPath);
        product.setModelGenerationStatus(ModelGenerationStatus.COMPLETED);
        product.setModelGeneratedAt(LocalDateTime.now());
        productRepository.save(product);
        log.info("Product {} now serves model {}", productId, relativeModelPath);
    }
}
