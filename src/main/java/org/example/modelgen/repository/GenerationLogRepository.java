package org.example.modelgen.repository;

import org.example.modelgen.entity.GenerationLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface GenerationLogRepository extends JpaRepository<GenerationLogEntity, String> {

    Optional<GenerationLogEntity> findByTaskId(String taskId);

    List<GenerationLogEntity> findByProductIdOrderByCreatedAtDesc(String productId);

    Optional<GenerationLogEntity> findFirstByProductIdAndStatusInOrderByCreatedAtDesc(
            String productId,
            Collection<String> statuses);

    long countByStatus(String status);
}
