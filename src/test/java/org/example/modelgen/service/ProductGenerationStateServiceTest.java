package org.example.modelgen.service;

import org.example.modelgen.entity.GenerationLogEntity;
import org.example.modelgen.entity.ModelGenerationStatus;
import org.example.modelgen.entity.ProductEntity;
import org.example.modelgen.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductGenerationStateServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private GenerationLogService generationLogService;

    private ProductGenerationStateService service;
    private ProductEntity product;

    @BeforeEach
    void setUp() {
        service = new ProductGenerationStateService(productRepository, generationLogService);
        product = new ProductEntity("Sofa", "https://img.example/sofa.png");
        product.setId("product-1");
    }

    @Test
    void updateGenerationStatus_changesOnlyThePhase() {
        when(productRepository.findById("product-1")).thenReturn(Optional.of(product));

        assertTrue(service.updateGenerationStatus("product-1", ModelGenerationStatus.DOWNLOADING));

        assertEquals(ModelGenerationStatus.DOWNLOADING, product.getModelGenerationStatus());
        assertEquals("Sofa", product.getTitle());
        verify(productRepository).save(product);
    }

    @Test
    void updateGenerationStatus_missingProduct_returnsFalse() {
        when(productRepository.findById("missing")).thenReturn(Optional.empty());

        assertFalse(service.updateGenerationStatus("missing", ModelGenerationStatus.FAILED));
        verify(productRepository, never()).save(any());
    }

    @Test
    void completeGeneration_setsModelPathPhaseAndTimestamp() {
        product.setModelGenerationStatus(ModelGenerationStatus.DOWNLOAD_FAILED);
        when(generationLogService.updateLogWithLocalPath("task-1", "/3d/products/product-1/model.glb"))
                .thenReturn(Optional.of(new GenerationLogEntity(product, "task-1")));
        when(productRepository.findById("product-1")).thenReturn(Optional.of(product));

        service.completeGeneration("product-1", "task-1", "/3d/products/product-1/model.glb");

        assertEquals("/3d/products/product-1/model.glb", product.getArModelUrl());
        assertEquals(ModelGenerationStatus.COMPLETED, product.getModelGenerationStatus());
        assertNotNull(product.getModelGeneratedAt());
    }

    @Test
    void completeGeneration_missingProduct_throws() {
        when(generationLogService.updateLogWithLocalPath("task-1", "/3d/products/gone/model.glb"))
                .thenReturn(Optional.of(new GenerationLogEntity(product, "task-1")));
        when(productRepository.findById("gone")).thenReturn(Optional.empty());

        assertThrows(GenerationStateException.class,
                () -> service.completeGeneration("gone", "task-1", "/3d/products/gone/model.glb"));
        verify(productRepository, never()).save(any());
    }

    @Test
    void completeGeneration_missingLog_throws() {
        when(generationLogService.updateLogWithLocalPath("task-x", "/3d/products/product-1/model.glb"))
                .thenReturn(Optional.empty());

        assertThrows(GenerationStateException.class,
                () -> service.completeGeneration("product-1", "task-x", "/3d/products/product-1/model.glb"));
        assertEquals(ModelGenerationStatus.NONE, product.getModelGenerationStatus());
    }

    @Test
    void recordTaskId_storesTaskOnProduct() {
        when(productRepository.findById("product-1")).thenReturn(Optional.of(product));

        service.recordTaskId("product-1", "task-42");

        assertEquals("task-42", product.getTripoTaskId());
    }
}
