package org.example.modelgen.repository;

import org.example.modelgen.entity.ModelGenerationStatus;
import org.example.modelgen.entity.ProductEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProductRepository extends JpaRepository<ProductEntity, String> {

    long countByModelGenerationStatus(ModelGenerationStatus status);
}
