package com.text_classifier_app.entity;

import com.text_classifier_app.dto.training.TrainingConfig;
import com.text_classifier_app.dto.training.TrainingResult;
import com.text_classifier_app.entity.converter.TrainingConfigConverter;
import com.text_classifier_app.entity.converter.TrainingResultConverter;
import com.text_classifier_app.enumeration.status.TrainingJobStatusEnum;
import jakarta.persistence.*;
import lombok.*;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "training_jobs", indexes = {
        @Index(name = "idx_training_jobs_project", columnList = "project_id"),
        @Index(name = "idx_training_jobs_status", columnList = "status")
})
public class TrainingJob {

    @Id
    private String id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TrainingJobStatusEnum status;

    @Column(nullable = false)
    private ZonedDateTime createdAt;

    private ZonedDateTime startedAt;

    private ZonedDateTime completedAt;

    private double progress;

    @Convert(converter = TrainingConfigConverter.class)
    @Column(name = "config", nullable = false, updatable = false, columnDefinition = "TEXT")
    private TrainingConfig config;

    @Convert(converter = TrainingResultConverter.class)
    @Column(name = "result", columnDefinition = "TEXT")
    private TrainingResult result;

    @Column(name = "error", length = 2000)
    private String error;

    @Column(name = "artifact_path", length = 1000)
    private String artifactPath;

    // Written only through TrainingJobRepository.requestCancel so a worker save never clears it
    @Column(name = "cancel_requested", nullable = false, updatable = false)
    private boolean cancelRequested;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "training_job_examples", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<TrainingExample> examples = new ArrayList<>();

    @Version
    private Integer version;
}
