package org.example.modelgen.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "generation_jobs")
public class GenerationJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private JobType jobType;

    @Column(nullable = false)
    private String productId;

    @Column(length = 120)
    private String taskId;

    @Column(name = "args_json", columnDefinition = "TEXT")
    private String argsJson;

    // Failure-attempt counter; deferred retries leave it untouched
    @Column(nullable = false)
    private int attempt;

    @Column(nullable = false)
    private int maxAttempts;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobState state;

    @Column(nullable = false)
    private LocalDateTime scheduledAt;

    @Column(length = 1000)
    private String lastError;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public GenerationJobEntity() {}

    public GenerationJobEntity(JobType jobType, String productId, String taskId, String argsJson, int maxAttempts) {
        this.jobType = jobType;
        this.productId = productId;
        this.taskId = taskId;
        this.argsJson = argsJson;
        this.maxAttempts = maxAttempts;
        this.attempt = 1;
        this.state = JobState.SCHEDULED;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
        this.scheduledAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public JobType getJobType() { return jobType; }
    public void setJobType(JobType jobType) { this.jobType = jobType; }

    public String getProductId() { return productId; }
    public void setProductId(String productId) { this.productId = productId; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getArgsJson() { return argsJson; }
    public void setArgsJson(String argsJson) { this.argsJson = argsJson; }

    public int getAttempt() { return attempt; }
    public void setAttempt(int attempt) { this.attempt = attempt; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public JobState getState() { return state; }
    public void setState(JobState state) { this.state = state; }

    public LocalDateTime getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(LocalDateTime scheduledAt) { this.scheduledAt = scheduledAt; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
