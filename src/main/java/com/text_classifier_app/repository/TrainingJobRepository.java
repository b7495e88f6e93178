package com.text_classifier_app.repository;

import com.text_classifier_app.entity.TrainingJob;
import com.text_classifier_app.enumeration.status.TrainingJobStatusEnum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface TrainingJobRepository extends JpaRepository<TrainingJob, String> {

    List<TrainingJob> findByProjectIdOrderByCreatedAtDesc(String projectId);

    List<TrainingJob> findByStatusAndStartedAtBefore(TrainingJobStatusEnum status, ZonedDateTime startedBefore);

    boolean existsByProjectIdAndStatusIn(String projectId, Collection<TrainingJobStatusEnum> statuses);

    long deleteByProjectId(String projectId);

    @Query(value = "SELECT cancel_requested FROM training_jobs WHERE id = :jobId", nativeQuery = true)
    Boolean findCancelRequested(@Param("jobId") String jobId);

    // Native on purpose: bypasses @Version and the entity's non-updatable mapping of the flag
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE training_jobs SET cancel_requested = TRUE WHERE id = :jobId AND status IN ('QUEUED', 'TRAINING')", nativeQuery = true)
    int requestCancel(@Param("jobId") String jobId);
}
