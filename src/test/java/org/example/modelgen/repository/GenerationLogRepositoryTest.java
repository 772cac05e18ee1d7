package org.example.modelgen.repository;

import org.example.modelgen.entity.GenerationLogEntity;
import org.example.modelgen.entity.ProductEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class GenerationLogRepositoryTest {

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private GenerationLogRepository generationLogRepository;

    @Test
    void findFirstActive_returnsNewestQueuedOrProcessingRow() {
        ProductEntity product = productRepository.save(new ProductEntity("Lamp", "https://img.example/lamp.jpg"));

        GenerationLogEntity finished = new GenerationLogEntity(product, "task-old");
        finished.setStatus("success");
        finished.setCreatedAt(LocalDateTime.now().minusHours(2));
        generationLogRepository.save(finished);

        GenerationLogEntity older = new GenerationLogEntity(product, "task-queued");
        older.setCreatedAt(LocalDateTime.now().minusHours(1));
        generationLogRepository.save(older);

        GenerationLogEntity newest = new GenerationLogEntity(product, "task-processing");
        newest.setStatus("processing");
        newest.setCreatedAt(LocalDateTime.now());
        generationLogRepository.save(newest);

        Optional<GenerationLogEntity> active = generationLogRepository
                .findFirstByProductIdAndStatusInOrderByCreatedAtDesc(product.getId(), List.of("queued", "processing"));

        assertTrue(active.isPresent());
        assertEquals("task-processing", active.get().getTaskId());
        assertEquals(3, generationLogRepository.findByProductIdOrderByCreatedAtDesc(product.getId()).size());
        assertEquals("task-processing",
                generationLogRepository.findByProductIdOrderByCreatedAtDesc(product.getId()).get(0).getTaskId());
    }

    @Test
    void findFirstActive_isEmptyWhenAllRowsTerminal() {
        ProductEntity product = productRepository.save(new ProductEntity("Chair", null));
        GenerationLogEntity cancelled = new GenerationLogEntity(product, "task-cancelled");
        cancelled.setStatus("cancelled");
        generationLogRepository.save(cancelled);

        assertTrue(generationLogRepository
                .findFirstByProductIdAndStatusInOrderByCreatedAtDesc(product.getId(), List.of("queued", "processing"))
                .isEmpty());
        assertEquals(1, generationLogRepository.countByStatus("cancelled"));
    }
}
