package com.text_classifier_app.dto.training;

import com.text_classifier_app.enumeration.status.TrainingJobStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrainingJobDTO {

    private String id;
    private String projectId;
    private TrainingJobStatusEnum status;
    private ZonedDateTime createdAt;
    private ZonedDateTime startedAt;
    private ZonedDateTime completedAt;
    private double progress;
    private TrainingConfig config;
    private TrainingResult result;
    private String error;
    private boolean cancelRequested;
}
