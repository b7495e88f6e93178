package com.text_classifier_app.worker;

import com.text_classifier_app.config.TrainingProperties;
import com.text_classifier_app.exception.PoisonMessageException;
import com.text_classifier_app.queue.JobQueue;
import com.text_classifier_app.queue.QueueDelivery;
import com.text_classifier_app.queue.QueueMessageCodec;
import com.text_classifier_app.queue.TrainingQueueMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

/**
 * Pulls training requests off the queue and runs them on the training executor.
 * <p>
 * Each delivery is decoded and admitted through the {@link InFlightJobRegistry}:
 * <ul>
 *     <li>undecodable payloads are acknowledged and dropped,</li>
 *     <li>a job that is already running here is acknowledged without running it again,</li>
 *     <li>at capacity the message is handed back unacknowledged and redelivered later,</li>
 *     <li>otherwise the job runs and the message is acknowledged once it has finished.</li>
 * </ul>
 * Infrastructure failures leave the message unacknowledged for redelivery.
 */
@Component
@Slf4j
public class TrainingWorker implements SmartLifecycle {

    public enum DispatchResult {
        ACCEPTED,
        DUPLICATE,
        DEFERRED,
        POISON
    }

    private final JobQueue queue;
    private final QueueMessageCodec codec;
    private final TrainingJobProcessor processor;
    private final TaskExecutor executor;
    private final InFlightJobRegistry inFlight;
    private final TrainingProperties properties;

    private volatile boolean running;
    private Thread receiver;

    public TrainingWorker(JobQueue queue,
                          QueueMessageCodec codec,
                          TrainingJobProcessor processor,
                          @Qualifier("trainingExecutor") TaskExecutor executor,
                          InFlightJobRegistry inFlight,
                          TrainingProperties properties) {
        this.queue = queue;
        this.codec = codec;
        this.processor = processor;
        this.executor = executor;
        this.inFlight = inFlight;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!properties.getWorker().isEnabled()) {
            log.info("Training worker disabled, not consuming the queue");
            return;
        }
        running = true;
        receiver = new Thread(this::receiveLoop, "training-queue-receiver");
        receiver.setDaemon(true);
        receiver.start();
        log.info("🚀 Training worker started with {} slots", inFlight.getMaxConcurrentJobs());
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (receiver != null) {
            receiver.interrupt();
            try {
                receiver.join(Duration.ofSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            receiver = null;
        }
        log.info("Training worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void receiveLoop() {
        Duration pollInterval = properties.getWorker().getPollInterval();
        while (running) {
            try {
                int free = inFlight.freeSlots();
                List<QueueDelivery> deliveries = free > 0 ? queue.receive(free) : List.of();
                if (deliveries.isEmpty()) {
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }
                deliveries.forEach(this::dispatch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("⚠️ Training queue receive failed, retrying in {}: {}", pollInterval, e.getMessage(), e);
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    public DispatchResult dispatch(QueueDelivery delivery) {
        TrainingQueueMessage message;
        try {
            message = codec.decode(delivery.payload());
        } catch (PoisonMessageException e) {
            log.error("☠️ Dropping poison message [{}]: {}", delivery.messageId(), e.getMessage());
            queue.ack(delivery);
            return DispatchResult.POISON;
        }

        String jobId = message.jobId();
        switch (inFlight.tryAcquire(jobId)) {
            case DUPLICATE -> {
                log.info("Training job [{}] is already running here, acknowledging duplicate delivery [{}]",
                        jobId, delivery.messageId());
                queue.ack(delivery);
                return DispatchResult.DUPLICATE;
            }
            case AT_CAPACITY -> {
                return defer(delivery, jobId);
            }
            default -> {
                // acquired
            }
        }

        try {
            executor.execute(() -> runJob(jobId, delivery));
        } catch (RejectedExecutionException e) {
            inFlight.release(jobId);
            return defer(delivery, jobId);
        }
        return DispatchResult.ACCEPTED;
    }

    private DispatchResult defer(QueueDelivery delivery, String jobId) {
        Duration delay = properties.getWorker().getBackpressureRedeliveryDelay();
        log.info("All {} training slots busy, job [{}] will be redelivered in {}",
                inFlight.getMaxConcurrentJobs(), jobId, delay);
        queue.nack(delivery, delay);
        return DispatchResult.DEFERRED;
    }

    private void runJob(String jobId, QueueDelivery delivery) {
        try {
            TrainingJobProcessor.ProcessingOutcome outcome = processor.process(jobId);
            queue.ack(delivery);
            log.info("Training job [{}] finished as {}", jobId, outcome);
        } catch (RuntimeException e) {
            log.error("⚠️ Training job [{}] interrupted by an infrastructure error, message [{}] left for redelivery: {}",
                    jobId, delivery.messageId(), e.getMessage(), e);
        } finally {
            inFlight.release(jobId);
        }
    }
}
