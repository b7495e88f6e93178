package com.text_classifier_app.unit_tests.service;

import com.text_classifier_app.config.MapperConfig;
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
import com.text_classifier_app.enumeration.status.ProjectStatusEnum;
import com.text_classifier_app.enumeration.status.TrainingJobStatusEnum;
import com.text_classifier_app.exception.BadRequestException;
import com.text_classifier_app.exception.TrainingInProgressException;
import com.text_classifier_app.exception.TransientInfraException;
import com.text_classifier_app.queue.JobQueue;
import com.text_classifier_app.repository.TrainingJobRepository;
import com.text_classifier_app.repository.project.DatasetExampleRepository;
import com.text_classifier_app.service.ModelArtifactService;
import com.text_classifier_app.service.PredictionService;
import com.text_classifier_app.service.ProjectRecordService;
import com.text_classifier_app.service.TrainingJobService;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrainingJobServiceTest {

    private static final String PROJECT_ID = "project-1";
    private static final String JOB_ID = "job-1";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final ZonedDateTime NOW_UTC = ZonedDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private TrainingJobRepository jobRepository;

    @Mock
    private DatasetExampleRepository exampleRepository;

    @Mock
    private ProjectRecordService projectRecordService;

    @Mock
    private ModelArtifactService artifactService;

    @Mock
    private PredictionService predictionService;

    @Mock
    private JobQueue jobQueue;

    private TrainingJobService trainingJobService;

    @BeforeEach
    void setUp() {
        trainingJobService = new TrainingJobService(jobRepository, exampleRepository, projectRecordService,
                artifactService, predictionService, jobQueue, new TrainingProperties(), new MapperConfig().modelMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static TrainingJob job(TrainingJobStatusEnum status) {
        return TrainingJob.builder()
                .id(JOB_ID)
                .projectId(PROJECT_ID)
                .status(status)
                .createdAt(ZonedDateTime.now())
                .config(new TrainingProperties().getDefaults().toConfig())
                .build();
    }

    private static DatasetExample example(String text, String label) {
        return DatasetExample.builder().projectId(PROJECT_ID).text(text).label(label).build();
    }

    @Nested
    @DisplayName("Creating jobs")
    class CreateJob {

        @Test
        @DisplayName("Should refuse a project without examples")
        void createTrainingJob_NoExamples_ThrowsBadRequest() {
            // Given
            when(projectRecordService.requireProject(PROJECT_ID)).thenReturn(new ProjectRecord());
            when(exampleRepository.findByProjectIdOrderByIdAsc(PROJECT_ID)).thenReturn(List.of());

            // When
            BadRequestException ex = assertThrows(BadRequestException.class,
                    () -> trainingJobService.createTrainingJob(PROJECT_ID, null));

            // Then
            assertEquals("No examples found. Add some examples before training.", ex.getMessage());
            verifyNoInteractions(jobQueue);
            verify(jobRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should snapshot examples and config, enqueue and mark the project queued")
        void createTrainingJob_WithExamples_QueuesJob() {
            // Given
            when(projectRecordService.requireProject(PROJECT_ID)).thenReturn(new ProjectRecord());
            when(exampleRepository.findByProjectIdOrderByIdAsc(PROJECT_ID))
                    .thenReturn(List.of(example("great goal", "sports"), example("bake bread", "cooking")));
            when(jobRepository.save(any(TrainingJob.class))).thenAnswer(inv -> inv.getArgument(0));
            when(jobQueue.enqueue(any())).thenReturn("message-1");
            TrainingStartRequest request = TrainingStartRequest.builder().ridge(0.5).build();

            // When
            TrainingJobDTO dto = trainingJobService.createTrainingJob(PROJECT_ID, request);

            // Then
            ArgumentCaptor<TrainingJob> captor = ArgumentCaptor.forClass(TrainingJob.class);
            verify(jobRepository).save(captor.capture());
            TrainingJob saved = captor.getValue();

            assertEquals(TrainingJobStatusEnum.QUEUED, saved.getStatus());
            assertEquals(0.0, saved.getProgress());
            assertEquals(2, saved.getExamples().size());
            assertEquals("great goal", saved.getExamples().get(0).getText());
            assertEquals("sports", saved.getExamples().get(0).getLabel());
            assertEquals(0.5, saved.getConfig().getRidge());
            assertEquals(1000, saved.getConfig().getMaxFeatures());
            assertFalse(saved.isCancelRequested());
            assertEquals(NOW_UTC, saved.getCreatedAt());

            verify(jobQueue).enqueue(saved.getId());
            verify(projectRecordService).markQueued(PROJECT_ID, saved.getId());
            assertEquals(saved.getId(), dto.getId());
            assertEquals(TrainingJobStatusEnum.QUEUED, dto.getStatus());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("An active job is flagged")
        void cancelJob_ActiveJob_ReturnsTrue() {
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job(TrainingJobStatusEnum.TRAINING)));
            when(jobRepository.requestCancel(JOB_ID)).thenReturn(1);

            assertTrue(trainingJobService.cancelJob(JOB_ID));
        }

        @Test
        @DisplayName("A finished job is left alone")
        void cancelJob_FinishedJob_ReturnsFalse() {
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job(TrainingJobStatusEnum.READY)));
            when(jobRepository.requestCancel(JOB_ID)).thenReturn(0);

            assertFalse(trainingJobService.cancelJob(JOB_ID));
        }

        @Test
        @DisplayName("An unknown job is reported as not found")
        void cancelJob_UnknownJob_ThrowsNotFound() {
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.empty());

            assertThrows(EntityNotFoundException.class, () -> trainingJobService.cancelJob(JOB_ID));
            verify(jobRepository, never()).requestCancel(any());
        }

        @Test
        @DisplayName("A missing flag reads as not cancelled")
        void isCancelRequested_NullFlag_ReturnsFalse() {
            when(jobRepository.findCancelRequested(JOB_ID)).thenReturn(null);

            assertFalse(trainingJobService.isCancelRequested(JOB_ID));
        }
    }

    @Nested
    @DisplayName("Lifecycle transitions")
    class Transitions {

        @Test
        @DisplayName("Starting a queued job marks it training at 10%")
        void markTraining_QueuedJob_StartsTraining() {
            TrainingJob job = job(TrainingJobStatusEnum.QUEUED);
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));

            trainingJobService.markTraining(JOB_ID);

            assertEquals(TrainingJobStatusEnum.TRAINING, job.getStatus());
            assertEquals(NOW_UTC, job.getStartedAt());
            assertEquals(10.0, job.getProgress());
            verify(jobRepository).saveAndFlush(job);
            verify(projectRecordService).markTraining(PROJECT_ID, JOB_ID);
        }

        @Test
        @DisplayName("A finished job never moves again")
        void markTraining_ReadyJob_Throws() {
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job(TrainingJobStatusEnum.READY)));

            assertThrows(IllegalStateException.class, () -> trainingJobService.markTraining(JOB_ID));
            verify(jobRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Progress never goes backwards")
        void updateProgress_LowerValue_Ignored() {
            TrainingJob job = job(TrainingJobStatusEnum.TRAINING);
            job.setProgress(50);
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));

            trainingJobService.updateProgress(JOB_ID, 30);

            assertEquals(50.0, job.getProgress());
            verify(jobRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("A ready job carries its result and artifact and updates the project")
        void markReady_TrainingJob_StoresResult() {
            TrainingJob job = job(TrainingJobStatusEnum.TRAINING);
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));
            TrainingResult result = TrainingResult.builder().accuracy(87.5).labels(List.of("a", "b")).build();

            trainingJobService.markReady(JOB_ID, result, "models/project-1/job-1.model");

            assertEquals(TrainingJobStatusEnum.READY, job.getStatus());
            assertEquals(100.0, job.getProgress());
            assertSame(result, job.getResult());
            assertEquals("models/project-1/job-1.model", job.getArtifactPath());
            assertEquals(NOW_UTC, job.getCompletedAt());
            verify(projectRecordService).markTrained(PROJECT_ID, JOB_ID, "models/project-1/job-1.model", 87.5, List.of("a", "b"));
        }

        @Test
        @DisplayName("A queued job can fail directly and long errors are truncated")
        void markFailed_QueuedJob_TruncatesError() {
            TrainingJob job = job(TrainingJobStatusEnum.QUEUED);
            when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));

            trainingJobService.markFailed(JOB_ID, "x".repeat(5000));

            assertEquals(TrainingJobStatusEnum.FAILED, job.getStatus());
            assertEquals(2000, job.getError().length());
            verify(projectRecordService).markFailed(PROJECT_ID, JOB_ID);
        }
    }

    @Nested
    @DisplayName("Hyperparameter overrides")
    class Overrides {

        @Test
        @DisplayName("Without a request the configured defaults apply")
        void createTrainingJob_NoRequest_UsesDefaults() {
            when(projectRecordService.requireProject(PROJECT_ID)).thenReturn(new ProjectRecord());
            when(exampleRepository.findByProjectIdOrderByIdAsc(PROJECT_ID)).thenReturn(List.of(example("a b", "x")));
            when(jobRepository.save(any(TrainingJob.class))).thenAnswer(inv -> inv.getArgument(0));

            TrainingJobDTO dto = trainingJobService.createTrainingJob(PROJECT_ID, null);

            assertEquals(new TrainingProperties().getDefaults().toConfig(), dto.getConfig());
        }

        @Test
        @DisplayName("Every field of the request overrides its default")
        void createTrainingJob_AllFields_Overridden() {
            // Given
            when(projectRecordService.requireProject(PROJECT_ID)).thenReturn(new ProjectRecord());
            when(exampleRepository.findByProjectIdOrderByIdAsc(PROJECT_ID)).thenReturn(List.of(example("a b", "x")));
            when(jobRepository.save(any(TrainingJob.class))).thenAnswer(inv -> inv.getArgument(0));
            TrainingStartRequest request = TrainingStartRequest.builder()
                    .validationSplit(0.3)
                    .maxFeatures(500)
                    .minTermFrequency(2)
                    .ngramMin(2)
                    .ngramMax(2)
                    .ridge(0.5)
                    .maxIterations(200)
                    .crossValidationFolds(3)
                    .gridSearch(true)
                    .ridgeGrid(List.of(0.5, 5.0))
                    .randomSeed(7L)
                    .topFeatures(15)
                    .build();

            // When
            trainingJobService.createTrainingJob(PROJECT_ID, request);

            // Then
            ArgumentCaptor<TrainingJob> captor = ArgumentCaptor.forClass(TrainingJob.class);
            verify(jobRepository).save(captor.capture());
            TrainingConfig config = captor.getValue().getConfig();
            assertEquals(0.3, config.getValidationSplit());
            assertEquals(500, config.getMaxFeatures());
            assertEquals(2, config.getMinTermFrequency());
            assertEquals(2, config.getNgramMin());
            assertEquals(2, config.getNgramMax());
            assertEquals(0.5, config.getRidge());
            assertEquals(200, config.getMaxIterations());
            assertEquals(3, config.getCrossValidationFolds());
            assertTrue(config.isGridSearch());
            assertEquals(List.of(0.5, 5.0), config.getRidgeGrid());
            assertEquals(7L, config.getRandomSeed());
            assertEquals(15, config.getTopFeatures());
        }

        @Test
        @DisplayName("Fields left out of the request keep their defaults")
        void createTrainingJob_PartialRequest_KeepsOtherDefaults() {
            when(projectRecordService.requireProject(PROJECT_ID)).thenReturn(new ProjectRecord());
            when(exampleRepository.findByProjectIdOrderByIdAsc(PROJECT_ID)).thenReturn(List.of(example("a b", "x")));
            when(jobRepository.save(any(TrainingJob.class))).thenAnswer(inv -> inv.getArgument(0));
            TrainingConfig defaults = new TrainingProperties().getDefaults().toConfig();

            TrainingJobDTO dto = trainingJobService.createTrainingJob(PROJECT_ID,
                    TrainingStartRequest.builder().topFeatures(20).randomSeed(1L).build());

            assertEquals(defaults.toBuilder().topFeatures(20).randomSeed(1L).build(), dto.getConfig());
        }

        @Test
        @DisplayName("An n-gram minimum above the default maximum is refused")
        void createTrainingJob_NgramMinAboveDefaultMax_ThrowsBadRequest() {
            TrainingProperties properties = new TrainingProperties();
            properties.getDefaults().setNgramMax(1);
            TrainingJobService service = new TrainingJobService(jobRepository, exampleRepository, projectRecordService,
                    artifactService, predictionService, jobQueue, properties, new MapperConfig().modelMapper(),
                    Clock.fixed(NOW, ZoneOffset.UTC));
            when(projectRecordService.requireProject(PROJECT_ID)).thenReturn(new ProjectRecord());
            when(exampleRepository.findByProjectIdOrderByIdAsc(PROJECT_ID)).thenReturn(List.of(example("a b", "x")));

            BadRequestException ex = assertThrows(BadRequestException.class,
                    () -> service.createTrainingJob(PROJECT_ID, TrainingStartRequest.builder().ngramMin(2).build()));

            assertEquals("ngramMin (2) must not exceed ngramMax (1)", ex.getMessage());
            verifyNoInteractions(jobQueue);
        }
    }

    @Nested
    @DisplayName("Deleting a project's training data")
    class DeleteProjectJobs {

        @Test
        @DisplayName("Removes jobs, artifacts and cached models and resets the project")
        void deleteProjectJobs_NoActiveJob_RemovesEverything() {
            when(jobRepository.deleteByProjectId(PROJECT_ID)).thenReturn(3L);
            when(artifactService.deleteProjectArtifacts(PROJECT_ID)).thenReturn(2);

            long deleted = trainingJobService.deleteProjectJobs(PROJECT_ID);

            assertEquals(3L, deleted);
            verify(predictionService).evictProject(PROJECT_ID);
            verify(projectRecordService).resetModel(PROJECT_ID);
        }

        @Test
        @DisplayName("Is refused while a job is queued or training")
        void deleteProjectJobs_ActiveJob_ThrowsConflict() {
            when(jobRepository.existsByProjectIdAndStatusIn(PROJECT_ID,
                    EnumSet.of(TrainingJobStatusEnum.QUEUED, TrainingJobStatusEnum.TRAINING))).thenReturn(true);

            assertThrows(TrainingInProgressException.class, () -> trainingJobService.deleteProjectJobs(PROJECT_ID));

            verify(jobRepository, never()).deleteByProjectId(any());
            verifyNoInteractions(artifactService, predictionService);
            verify(projectRecordService, never()).resetModel(any());
        }

        @Test
        @DisplayName("A storage failure after the jobs are gone is logged, not rethrown")
        void deleteProjectJobs_StorageDown_StillDeletesJobs() {
            when(jobRepository.deleteByProjectId(PROJECT_ID)).thenReturn(1L);
            when(artifactService.deleteProjectArtifacts(PROJECT_ID))
                    .thenThrow(new TransientInfraException("minio down"));

            assertEquals(1L, trainingJobService.deleteProjectJobs(PROJECT_ID));
            verify(predictionService).evictProject(PROJECT_ID);
        }
    }

    @Test
    @DisplayName("The project status view carries the current job and the history")
    void getProjectTrainingStatus_ReturnsEnvelope() {
        ProjectRecord project = ProjectRecord.builder()
                .id(PROJECT_ID)
                .status(ProjectStatusEnum.TRAINING)
                .currentJobId(JOB_ID)
                .build();
        TrainingJob older = job(TrainingJobStatusEnum.FAILED);
        older.setId("job-0");
        when(projectRecordService.requireProject(PROJECT_ID)).thenReturn(project);
        when(jobRepository.findByProjectIdOrderByCreatedAtDesc(PROJECT_ID))
                .thenReturn(List.of(job(TrainingJobStatusEnum.TRAINING), older));

        ProjectTrainingStatusDTO status = trainingJobService.getProjectTrainingStatus(PROJECT_ID);

        assertEquals(ProjectStatusEnum.TRAINING, status.getProjectStatus());
        assertEquals(JOB_ID, status.getCurrentJob().getId());
        assertEquals(TrainingJobStatusEnum.TRAINING, status.getCurrentJob().getStatus());
        assertEquals(2, status.getTotalJobs());
        assertEquals("job-0", status.getAllJobs().get(1).getId());
    }

    @Test
    @DisplayName("Status reads map the job onto its DTO")
    void getJobStatus_ExistingJob_ReturnsDto() {
        TrainingJob job = job(TrainingJobStatusEnum.TRAINING);
        job.getExamples().add(new TrainingExample("text", "label"));
        when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));

        TrainingJobDTO dto = trainingJobService.getJobStatus(JOB_ID);

        assertEquals(JOB_ID, dto.getId());
        assertEquals(PROJECT_ID, dto.getProjectId());
        assertEquals(TrainingJobStatusEnum.TRAINING, dto.getStatus());
        assertEquals(job.getConfig(), dto.getConfig());
    }
}
