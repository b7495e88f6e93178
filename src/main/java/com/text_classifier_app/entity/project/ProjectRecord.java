package com.text_classifier_app.entity.project;

import com.text_classifier_app.enumeration.status.ProjectStatusEnum;
import jakarta.persistence.*;
import lombok.*;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The columns of a project record that the training pipeline reads and writes. The record itself
 * is owned by the project service.
 */
@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "projects")
public class ProjectRecord {

    @Id
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProjectStatusEnum status;

    @Column(name = "current_job_id")
    private String currentJobId;

    @Column(name = "model_path", length = 1000)
    private String modelPath;

    @Column(name = "model_accuracy")
    private Double modelAccuracy;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "project_model_labels", joinColumns = @JoinColumn(name = "project_id"))
    @Column(name = "label")
    @Builder.Default
    private List<String> modelLabels = new ArrayList<>();

    @Column(name = "trained_at")
    private ZonedDateTime trainedAt;

    @Column(name = "updated_at")
    private ZonedDateTime updatedAt;
}
