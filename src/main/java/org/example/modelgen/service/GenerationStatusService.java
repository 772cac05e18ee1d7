package org.example.modelgen.service;

import org.example.modelgen.entity.JobState;
import org.example.modelgen.entity.ModelGenerationStatus;
import org.example.modelgen.model.GenerationPipelineStatus;
import org.example.modelgen.repository.GenerationJobRepository;
import org.example.modelgen.repository.ProductRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class GenerationStatusService {

    private final ProductRepository productRepository;
    private final GenerationJobRepository generationJobRepository;

    public GenerationStatusService(
            ProductRepository productRepository,
            GenerationJobRepository generationJobRepository) {
        this.productRepository = productRepository;
        this.generationJobRepository = generationJobRepository;
    }

    @Transactional(readOnly = true)
    public GenerationPipelineStatus getPipelineStatus() {
        return GenerationPipelineStatus.of(
                productRepository.countByModelGenerationStatus(ModelGenerationStatus.QUEUED),
                productRepository.countByModelGenerationStatus(ModelGenerationStatus.DOWNLOADING),
                productRepository.countByModelGenerationStatus(ModelGenerationStatus.COMPLETED),
                productRepository.countByModelGenerationStatus(ModelGenerationStatus.FAILED),
                productRepository.countByModelGenerationStatus(ModelGenerationStatus.TIMEOUT),
                productRepository.countByModelGenerationStatus(ModelGenerationStatus.DOWNLOAD_FAILED),
                generationJobRepository.countByState(JobState.SCHEDULED),
                generationJobRepository.countByState(JobState.RUNNING)
        );
    }
}
