package com.text_classifier_app.worker;

import com.text_classifier_app.config.TrainingProperties;
import com.text_classifier_app.entity.TrainingJob;
import com.text_classifier_app.enumeration.status.TrainingJobStatusEnum;
import com.text_classifier_app.repository.TrainingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Reports jobs that have been training for suspiciously long, typically because their worker
 * died. Only reports; the job state is left for an operator to resolve.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleTrainingWatchdog {

    private final TrainingJobRepository jobRepository;
    private final TrainingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${training.watchdog.check-interval-ms:300000}",
            initialDelayString = "${training.watchdog.check-interval-ms:300000}")
    public void reportStaleJobs() {
        findStaleJobs();
    }

    public List<TrainingJob> findStaleJobs() {
        Duration staleAfter = properties.getWatchdog().getStaleAfter();
        ZonedDateTime cutoff = ZonedDateTime.now(clock).minus(staleAfter);
        List<TrainingJob> stale = jobRepository.findByStatusAndStartedAtBefore(TrainingJobStatusEnum.TRAINING, cutoff);
        for (TrainingJob job : stale) {
            log.warn("⏰ Training job [{}] of project [{}] has been training since {} (more than {}), its worker may be gone",
                    job.getId(), job.getProjectId(), job.getStartedAt(), staleAfter);
        }
        return stale;
    }
}
