package com.text_classifier_app.worker;

import com.text_classifier_app.config.TrainingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Ids of the jobs this process is executing right now. The duplicate check and the capacity
 * check happen under one lock, so the set never grows past its limit.
 */
@Component
public class InFlightJobRegistry {

    public enum Admission {
        ACQUIRED,
        DUPLICATE,
        AT_CAPACITY
    }

    private final int maxConcurrentJobs;
    private final Set<String> jobIds = new HashSet<>();

    @Autowired
    public InFlightJobRegistry(TrainingProperties properties) {
        this(properties.getWorker().getMaxConcurrentJobs());
    }

    public InFlightJobRegistry(int maxConcurrentJobs) {
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be at least 1");
        }
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public synchronized Admission tryAcquire(String jobId) {
        if (jobIds.contains(jobId)) {
            return Admission.DUPLICATE;
        }
        if (jobIds.size() >= maxConcurrentJobs) {
            return Admission.AT_CAPACITY;
        }
        jobIds.add(jobId);
        return Admission.ACQUIRED;
    }

    public synchronized void release(String jobId) {
        jobIds.remove(jobId);
    }

    public synchronized int size() {
        return jobIds.size();
    }

    public synchronized boolean contains(String jobId) {
        return jobIds.contains(jobId);
    }

    public int freeSlots() {
        return Math.max(0, maxConcurrentJobs - size());
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }
}
