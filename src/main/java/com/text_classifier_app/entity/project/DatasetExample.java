package com.text_classifier_app.entity.project;

import jakarta.persistence.*;
import lombok.*;

import java.time.ZonedDateTime;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "dataset_examples", indexes = @Index(name = "idx_dataset_examples_project", columnList = "project_id"))
public class DatasetExample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(nullable = false, length = 5000)
    private String text;

    @Column(nullable = false)
    private String label;

    @Column(name = "added_at")
    private ZonedDateTime addedAt;
}
