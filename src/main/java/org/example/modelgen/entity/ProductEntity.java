package org.example.modelgen.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "products")
public class ProductEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(length = 2000)
    private String primaryImageUrl;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "product_image_urls", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "position")
    @Column(name = "url", length = 2000)
    private List<String> imageUrls = new ArrayList<>();

    // Web-relative path of the downloaded model, e.g. /3d/products/{id}/model.glb
    private String arModelUrl;

    @Convert(converter = ModelGenerationStatusConverter.class)
    @Column(nullable = false, length = 40)
    private ModelGenerationStatus modelGenerationStatus = ModelGenerationStatus.NONE;

    private LocalDateTime modelGeneratedAt;

    private String tripoTaskId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public ProductEntity() {}

    public ProductEntity(String title, String primaryImageUrl) {
        this.title = title;
        this.primaryImageUrl = primaryImageUrl;
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

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getPrimaryImageUrl() { return primaryImageUrl; }
    public void setPrimaryImageUrl(String primaryImageUrl) { this.primaryImageUrl = primaryImageUrl; }

    public List<String> getImageUrls() { return imageUrls; }
    public void setImageUrls(List<String> imageUrls) { this.imageUrls = imageUrls; }

    public String getArModelUrl() { return arModelUrl; }
    public void setArModelUrl(String arModelUrl) { this.arModelUrl = arModelUrl; }

    public ModelGenerationStatus getModelGenerationStatus() { return modelGenerationStatus; }
    public void setModelGenerationStatus(ModelGenerationStatus modelGenerationStatus) { this.modelGenerationStatus = modelGenerationStatus; }

    public LocalDateTime getModelGeneratedAt() { return modelGeneratedAt; }
    public void setModelGeneratedAt(LocalDateTime modelGeneratedAt) { this.modelGeneratedAt = modelGeneratedAt; }

    public String getTripoTaskId() { return tripoTaskId; }
    public void setTripoTaskId(String tripoTaskId) { this.tripoTaskId = tripoTaskId; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
