package org.example.modelgen.repository;

import org.example.modelgen.entity.GenerationJobEntity;
import org.example.modelgen.entity.JobState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJobEntity, String> {

    List<GenerationJobEntity> findByStateAndUpdatedAtBefore(JobState state, LocalDateTime cutoff);

    long countByState(JobState state);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE GenerationJobEntity j
            SET j.state = :runningState,
                j.updatedAt = :now
            WHERE j.id = :jobId
              AND j.state = :scheduledState
            """)
    int claimForExecution(
            @Param("jobId") String jobId,
            @Param("now") LocalDateTime now,
            @Param("scheduledState") JobState scheduledState,
            @Param("runningState") JobState runningState);
}
