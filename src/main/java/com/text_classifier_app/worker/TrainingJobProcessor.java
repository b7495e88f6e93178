package com.text_classifier_app.worker;

import com.text_classifier_app.entity.TrainingJob;
import com.text_classifier_app.enumeration.status.TrainingJobStatusEnum;
import com.text_classifier_app.exception.DatasetValidationException;
import com.text_classifier_app.exception.JobCancelledException;
import com.text_classifier_app.service.ModelArtifactService;
import com.text_classifier_app.service.TrainingJobService;
import com.text_classifier_app.trainer.LabeledText;
import com.text_classifier_app.trainer.ModelTrainer;
import com.text_classifier_app.trainer.TrainingOutcome;
import com.text_classifier_app.trainer.TrainingPhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs one training job end to end: {@code queued -> training -> ready | failed}.
 * <p>
 * Failures before the job enters {@code training} propagate, so the queue message stays
 * unacknowledged and is redelivered. Once training has started, every failure is terminal and
 * recorded on the job; there is no automatic retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingJobProcessor {

    static final String CANCELLED_BEFORE_START = "Training job was cancelled before it started";

    public enum ProcessingOutcome {
        COMPLETED,
        FAILED,
        CANCELLED,
        SKIPPED
    }

    private final TrainingJobService jobService;
    private final ModelTrainer trainer;
    private final ModelArtifactService artifactService;

    public ProcessingOutcome process(String jobId) {
        Optional<TrainingJob> found = jobService.findJob(jobId);
        if (found.isEmpty()) {
            log.warn("Training job [{}] no longer exists, dropping its message", jobId);
            return ProcessingOutcome.SKIPPED;
        }
        TrainingJob job = found.get();
        if (job.getStatus() != TrainingJobStatusEnum.QUEUED) {
            // redelivery of a job that already started somewhere
            log.info("Training job [{}] is already {}, skipping", jobId, job.getStatus().getValue());
            return ProcessingOutcome.SKIPPED;
        }
        if (jobService.isCancelRequested(jobId)) {
            jobService.markFailed(jobId, CANCELLED_BEFORE_START);
            return ProcessingOutcome.CANCELLED;
        }

        jobService.markTraining(jobId);
        try {
            List<LabeledText> examples = job.getExamples().stream()
                    .map(example -> new LabeledText(example.getText(), example.getLabel()))
                    .toList();

            TrainingOutcome outcome = trainer.train(examples, job.getConfig(), phase -> checkpoint(jobId, phase));

            String path = artifactService.save(job.getProjectId(), jobId, outcome.model());
            jobService.updateProgress(jobId, TrainingJobService.PROGRESS_ARTIFACT_STORED);
            jobService.markReady(jobId, outcome.result(), path);
            return ProcessingOutcome.COMPLETED;
        } catch (JobCancelledException e) {
            log.info("🛑 Training job [{}] cancelled", jobId);
            return recordFailure(job, e.getMessage(), ProcessingOutcome.CANCELLED);
        } catch (DatasetValidationException e) {
            return recordFailure(job, e.getMessage(), ProcessingOutcome.FAILED);
        } catch (Exception e) {
            log.error("❌ Training job [{}] failed: {}", jobId, e.getMessage(), e);
            return recordFailure(job, "Training failed: " + e.getMessage(), ProcessingOutcome.FAILED);
        }
    }

    /**
     * Marks the job failed, unless its record was deleted while it trained. A deleted job has
     * nothing left to record, only the artifact it may already have written.
     */
    private ProcessingOutcome recordFailure(TrainingJob job, String error, ProcessingOutcome outcome) {
        if (jobService.findJob(job.getId()).isEmpty()) {
            log.warn("Training job [{}] was deleted while training, discarding its output", job.getId());
            artifactService.discard(job.getProjectId(), job.getId());
            return ProcessingOutcome.SKIPPED;
        }
        jobService.markFailed(job.getId(), error);
        return outcome;
    }

    private void checkpoint(String jobId, TrainingPhase phase) {
        if (jobService.isCancelRequested(jobId)) {
            throw new JobCancelledException();
        }
        jobService.updateProgress(jobId, phase.getProgress());
    }
}
