package com.text_classifier_app.service;

import com.text_classifier_app.entity.project.ProjectRecord;
import com.text_classifier_app.enumeration.status.ProjectStatusEnum;
import com.text_classifier_app.repository.project.ProjectRecordRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mirrors the training lifecycle onto the project record. Only the project's current job may
 * move its status; updates for superseded jobs are ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectRecordService {

    private final ProjectRecordRepository projectRepository;
    private final Clock clock;

    public ProjectRecord requireProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new EntityNotFoundException("Project not found: " + projectId));
    }

    @Transactional
    public void markQueued(String projectId, String jobId) {
        ProjectRecord project = requireProject(projectId);
        project.setCurrentJobId(jobId);
        project.setStatus(ProjectStatusEnum.QUEUED);
        project.setUpdatedAt(ZonedDateTime.now(clock));
        projectRepository.save(project);
    }

    @Transactional
    public void markTraining(String projectId, String jobId) {
        currentProject(projectId, jobId).ifPresent(project -> {
            project.setStatus(ProjectStatusEnum.TRAINING);
            project.setUpdatedAt(ZonedDateTime.now(clock));
            projectRepository.save(project);
        });
    }

    @Transactional
    public void markTrained(String projectId, String jobId, String modelPath, Double accuracy, List<String> labels) {
        currentProject(projectId, jobId).ifPresent(project -> {
            ZonedDateTime now = ZonedDateTime.now(clock);
            project.setStatus(ProjectStatusEnum.TRAINED);
            project.setModelPath(modelPath);
            project.setModelAccuracy(accuracy);
            project.setModelLabels(new ArrayList<>(labels));
            project.setTrainedAt(now);
            project.setUpdatedAt(now);
            projectRepository.save(project);
        });
    }

    @Transactional
    public void markFailed(String projectId, String jobId) {
        currentProject(projectId, jobId).ifPresent(project -> {
            project.setStatus(ProjectStatusEnum.FAILED);
            project.setUpdatedAt(ZonedDateTime.now(clock));
            projectRepository.save(project);
        });
    }

    /**
     * Forgets the project's model after its training data was deleted.
     */
    @Transactional
    public void resetModel(String projectId) {
        projectRepository.findById(projectId).ifPresent(project -> {
            project.setStatus(ProjectStatusEnum.DRAFT);
            project.setCurrentJobId(null);
            project.setModelPath(null);
            project.setModelAccuracy(null);
            project.getModelLabels().clear();
            project.setTrainedAt(null);
            project.setUpdatedAt(ZonedDateTime.now(clock));
            projectRepository.save(project);
        });
    }

    private Optional<ProjectRecord> currentProject(String projectId, String jobId) {
        Optional<ProjectRecord> project = projectRepository.findById(projectId);
        if (project.isEmpty()) {
            log.warn("Project [{}] no longer exists, ignoring update from job [{}]", projectId, jobId);
            return Optional.empty();
        }
        if (!jobId.equals(project.get().getCurrentJobId())) {
            log.info("Job [{}] is no longer the current job of project [{}], project status left as is", jobId, projectId);
            return Optional.empty();
        }
        return project;
    }
}
