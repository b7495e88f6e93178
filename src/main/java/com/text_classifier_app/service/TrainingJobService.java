package com.text_classifier_app.service;

import com.text_classifier_app.config.TrainingProperties;
import com.text_classifier_app.dto.training.ProjectTrainingStatusDTO;
import com.text_classifier_app.dto.training.TrainingConfig;
import com.text_classifier_app.dto.training.TrainingJobDTO;
import com.text_classifier_app.dto.training.TrainingResult;
import com.text_classifier_app.dto.training.TrainingStartRequest;
import com.text_classifier_app.entity.TrainingExample;
import com.text_classifier_app.entity.TrainingJob;
import com.text_classifier_app.entity.project.DatasetExample;
import com.text_classifier_app.entity.project.ProjectRecord;
import com.text_classifier_app.enumeration.status.TrainingJobStatusEnum;
import com.text_classifier_app.exception.BadRequestException;
import com.text_classifier_app.exception.TrainingInProgressException;
import com.text_classifier_app.queue.JobQueue;
import com.text_classifier_app.repository.TrainingJobRepository;
import com.text_classifier_app.repository.project.DatasetExampleRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns the training job records: creation, status reads, cancellation and the lifecycle
 * transitions driven by the worker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingJobService {

    static final int MAX_ERROR_LENGTH = 2000;

    public static final double PROGRESS_STARTED = 10;
    public static final double PROGRESS_ARTIFACT_STORED = 95;
    public static final double PROGRESS_DONE = 100;

    private static final Set<TrainingJobStatusEnum> ACTIVE_STATUSES =
            EnumSet.of(TrainingJobStatusEnum.QUEUED, TrainingJobStatusEnum.TRAINING);

    private final TrainingJobRepository jobRepository;
    private final DatasetExampleRepository exampleRepository;
    private final ProjectRecordService projectRecordService;
    private final ModelArtifactService artifactService;
    private final PredictionService predictionService;
    private final JobQueue jobQueue;
    private final TrainingProperties properties;
    private final ModelMapper modelMapper;
    private final Clock clock;

    /**
     * Snapshots the project's examples and the effective config into a new queued job and
     * enqueues it. The queue message commits together with the job row.
     */
    @Transactional
    public TrainingJobDTO createTrainingJob(String projectId, TrainingStartRequest request) {
        projectRecordService.requireProject(projectId);

        List<DatasetExample> examples = exampleRepository.findByProjectIdOrderByIdAsc(projectId);
        if (examples.isEmpty()) {
            throw new BadRequestException("No examples found. Add some examples before training.");
        }

        TrainingJob job = TrainingJob.builder()
                .id(UUID.randomUUID().toString())
                .projectId(projectId)
                .status(TrainingJobStatusEnum.QUEUED)
                .createdAt(ZonedDateTime.now(clock))
                .progress(0)
                .config(effectiveConfig(request))
                .examples(examples.stream()
                        .map(example -> new TrainingExample(example.getText(), example.getLabel()))
                        .collect(Collectors.toCollection(ArrayList::new)))
                .build();
        job = jobRepository.save(job);

        String messageId = jobQueue.enqueue(job.getId());
        projectRecordService.markQueued(projectId, job.getId());

        log.info("📨 Queued training job [{}] for project [{}] with {} examples (message {})",
                job.getId(), projectId, examples.size(), messageId);
        return toDto(job);
    }

    /**
     * Overlays the non-null fields of {@code request} on the configured defaults.
     */
    TrainingConfig effectiveConfig(TrainingStartRequest request) {
        TrainingConfig defaults = properties.getDefaults().toConfig();
        if (request == null) {
            return defaults;
        }
        TrainingConfig.TrainingConfigBuilder builder = defaults.toBuilder();
        if (request.getValidationSplit() != null) {
            builder.validationSplit(request.getValidationSplit());
        }
        if (request.getMaxFeatures() != null) {
            builder.maxFeatures(request.getMaxFeatures());
        }
        if (request.getMinTermFrequency() != null) {
            builder.minTermFrequency(request.getMinTermFrequency());
        }
        if (request.getNgramMin() != null) {
            builder.ngramMin(request.getNgramMin());
        }
        if (request.getNgramMax() != null) {
            builder.ngramMax(request.getNgramMax());
        }
        if (request.getRidge() != null) {
            builder.ridge(request.getRidge());
        }
        if (request.getMaxIterations() != null) {
            builder.maxIterations(request.getMaxIterations());
        }
        if (request.getCrossValidationFolds() != null) {
            builder.crossValidationFolds(request.getCrossValidationFolds());
        }
        if (request.getGridSearch() != null) {
            builder.gridSearch(request.getGridSearch());
        }
        if (request.getRidgeGrid() != null) {
            builder.ridgeGrid(List.copyOf(request.getRidgeGrid()));
        }
        if (request.getRandomSeed() != null) {
            builder.randomSeed(request.getRandomSeed());
        }
        if (request.getTopFeatures() != null) {
            builder.topFeatures(request.getTopFeatures());
        }
        TrainingConfig config = builder.build();
        // one side of the range may come from the defaults
        if (config.getNgramMin() > config.getNgramMax()) {
            throw new BadRequestException("ngramMin (" + config.getNgramMin()
                    + ") must not exceed ngramMax (" + config.getNgramMax() + ")");
        }
        return config;
    }

    @Transactional(readOnly = true)
    public TrainingJobDTO getJobStatus(String jobId) {
        return toDto(requireJob(jobId));
    }

    @Transactional(readOnly = true)
    public List<TrainingJobDTO> getProjectJobs(String projectId) {
        return jobRepository.findByProjectIdOrderByCreatedAtDesc(projectId).stream()
                .map(this::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public ProjectTrainingStatusDTO getProjectTrainingStatus(String projectId) {
        ProjectRecord project = projectRecordService.requireProject(projectId);
        List<TrainingJobDTO> jobs = getProjectJobs(projectId);
        String currentJobId = project.getCurrentJobId();
        TrainingJobDTO currentJob = currentJobId == null ? null : jobs.stream()
                .filter(job -> currentJobId.equals(job.getId()))
                .findFirst()
                .orElse(null);
        return ProjectTrainingStatusDTO.builder()
                .projectId(projectId)
                .projectStatus(project.getStatus())
                .currentJob(currentJob)
                .allJobs(jobs)
                .totalJobs(jobs.size())
                .build();
    }

    /**
     * Flags a queued or running job for cancellation. The worker honours the flag at its next
     * checkpoint.
     *
     * @return {@code false} when the job had already finished
     */
    @Transactional
    public boolean cancelJob(String jobId) {
        requireJob(jobId);
        boolean flagged = jobRepository.requestCancel(jobId) > 0;
        if (flagged) {
            log.info("🛑 Cancellation requested for training job [{}]", jobId);
        } else {
            log.info("Training job [{}] already finished, nothing to cancel", jobId);
        }
        return flagged;
    }

    @Transactional(readOnly = true)
    public boolean isCancelRequested(String jobId) {
        return Boolean.TRUE.equals(jobRepository.findCancelRequested(jobId));
    }

    @Transactional(readOnly = true)
    public Optional<TrainingJob> findJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    @Transactional
    public void markTraining(String jobId) {
        TrainingJob job = transition(jobId, TrainingJobStatusEnum.TRAINING);
        job.setStartedAt(ZonedDateTime.now(clock));
        job.setProgress(PROGRESS_STARTED);
        jobRepository.saveAndFlush(job);
        projectRecordService.markTraining(job.getProjectId(), jobId);
        log.info("🚀 Training job [{}] started", jobId);
    }

    /**
     * Progress only moves forward and only while the job is training.
     */
    @Transactional
    public void updateProgress(String jobId, double progress) {
        TrainingJob job = requireJob(jobId);
        if (job.getStatus() != TrainingJobStatusEnum.TRAINING || progress <= job.getProgress()) {
            return;
        }
        job.setProgress(progress);
        jobRepository.saveAndFlush(job);
    }

    @Transactional
    public void markReady(String jobId, TrainingResult result, String artifactPath) {
        TrainingJob job = transition(jobId, TrainingJobStatusEnum.READY);
        job.setCompletedAt(ZonedDateTime.now(clock));
        job.setProgress(PROGRESS_DONE);
        job.setResult(result);
        job.setArtifactPath(artifactPath);
        jobRepository.saveAndFlush(job);
        projectRecordService.markTrained(job.getProjectId(), jobId, artifactPath, result.getAccuracy(), result.getLabels());
        log.info("✅ Training job [{}] ready, accuracy {}%", jobId, result.getAccuracy());
    }

    @Transactional
    public void markFailed(String jobId, String error) {
        TrainingJob job = transition(jobId, TrainingJobStatusEnum.FAILED);
        job.setCompletedAt(ZonedDateTime.now(clock));
        job.setError(truncate(error));
        jobRepository.saveAndFlush(job);
        projectRecordService.markFailed(job.getProjectId(), jobId);
        log.warn("❌ Training job [{}] failed: {}", jobId, job.getError());
    }

    /**
     * Removes every job of the project together with all stored model artifacts. Refused while a
     * job is queued or training. Artifacts are removed only once the job deletion has committed.
     *
     * @return number of jobs deleted
     */
    @Transactional
    public long deleteProjectJobs(String projectId) {
        if (jobRepository.existsByProjectIdAndStatusIn(projectId, ACTIVE_STATUSES)) {
            throw new TrainingInProgressException(projectId);
        }
        long deleted = jobRepository.deleteByProjectId(projectId);
        projectRecordService.resetModel(projectId);
        afterCommit(() -> deleteArtifacts(projectId));
        log.info("🗑️ Deleted {} training job(s) of project [{}]", deleted, projectId);
        return deleted;
    }

    private void deleteArtifacts(String projectId) {
        predictionService.evictProject(projectId);
        try {
            int artifacts = artifactService.deleteProjectArtifacts(projectId);
            log.info("🗑️ Deleted {} artifact(s) of project [{}]", artifacts, projectId);
        } catch (RuntimeException e) {
            log.warn("MinIO delete failed for the artifacts of project [{}]", projectId, e);
        }
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private TrainingJob transition(String jobId, TrainingJobStatusEnum next) {
        TrainingJob job = requireJob(jobId);
        if (!job.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Training job " + jobId + " cannot move from " + job.getStatus() + " to " + next);
        }
        job.setStatus(next);
        return job;
    }

    private TrainingJob requireJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new EntityNotFoundException("Training job not found: " + jobId));
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private TrainingJobDTO toDto(TrainingJob job) {
        return modelMapper.map(job, TrainingJobDTO.class);
    }
}
