package org.example.modelgen.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * One generation attempt against the external service, keyed by its task id.
 * A product accumulates one row per attempt; rows are never deleted here.
 */
@Entity
@Table(name = "generation_logs")
public class GenerationLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true, length = 120)
    private String taskId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", nullable = false)
    private ProductEntity product;

    // Raw status string as reported by the service
    @Column(nullable = false, length = 40)
    private String status;

    @Column(nullable = false)
    private int progress;

    @Column(name = "request_payload", columnDefinition = "TEXT")
    private String requestPayload;

    @Column(name = "response_data", columnDefinition = "TEXT")
    private String responseData;

    @Column(length = 2000)
    private String pbrModelUrl;

    @Column(length = 2000)
    private String renderedImageUrl;

    @Column(length = 2000)
    private String generatedImageUrl;

    private String localModelPath;

    @Column(length = 1000)
    private String errorMessage;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public GenerationLogEntity() {}

    public GenerationLogEntity(ProductEntity product, String taskId) {
        this.product = product;
        this.taskId = taskId;
        this.status = "queued";
        this.progress = 0;
    }

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public ProductEntity getProduct() { return product; }
    public void setProduct(ProductEntity product) { this.product = product; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = progress; }

    public String getRequestPayload() { return requestPayload; }
    public void setRequestPayload(String requestPayload) { this.requestPayload = requestPayload; }

    public String getResponseData() { return responseData; }
    public void setResponseData(String responseData) { this.responseData = responseData; }

    public String getPbrModelUrl() { return pbrModelUrl; }
    public void setPbrModelUrl(String pbrModelUrl) { this.pbrModelUrl = pbrModelUrl; }

    public String getRenderedImageUrl() { return renderedImageUrl; }
    public void setRenderedImageUrl(String renderedImageUrl) { this.renderedImageUrl = renderedImageUrl; }

    public String getGeneratedImageUrl() { return generatedImageUrl; }
    public void setGeneratedImageUrl(String generatedImageUrl) { this.generatedImageUrl = generatedImageUrl; }

    public String getLocalModelPath() { return localModelPath; }
    public void setLocalModelPath(String localModelPath) { this.localModelPath = localModelPath; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
