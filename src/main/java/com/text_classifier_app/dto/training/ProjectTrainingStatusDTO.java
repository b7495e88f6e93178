package com.text_classifier_app.dto.training;

import com.text_classifier_app.enumeration.status.ProjectStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What a poller needs in one call: the project status, the job that currently drives it and
 * the job history, newest first.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProjectTrainingStatusDTO {

    private String projectId;
    private ProjectStatusEnum projectStatus;
    private TrainingJobDTO currentJob;
    private List<TrainingJobDTO> allJobs;
    private int totalJobs;
}
