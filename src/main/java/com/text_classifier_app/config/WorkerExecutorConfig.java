package com.text_classifier_app.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@Slf4j
public class WorkerExecutorConfig {

    /**
     * Pool that runs accepted training jobs. Sized to the concurrency cap; the small queue only
     * absorbs the moment between a job releasing its slot and its thread returning to the pool.
     */
    @Bean(name = "trainingExecutor")
    public ThreadPoolTaskExecutor trainingExecutor(TrainingProperties properties) {
        int maxConcurrentJobs = properties.getWorker().getMaxConcurrentJobs();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentJobs);
        executor.setMaxPoolSize(maxConcurrentJobs);
        executor.setQueueCapacity(maxConcurrentJobs);
        executor.setThreadNamePrefix("training-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.initialize();
        log.info("Training executor ready with {} slots", maxConcurrentJobs);
        return executor;
    }
}
