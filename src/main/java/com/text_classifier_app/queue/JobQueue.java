package com.text_classifier_app.queue;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once queue of training requests. A received message stays leased until it is
 * acknowledged; an unacknowledged message is delivered again once its lease runs out.
 */
public interface JobQueue {

    /**
     * @return the id of the enqueued message
     */
    String enqueue(String jobId);

    List<QueueDelivery> receive(int maxMessages);

    /**
     * Removes the message for good. A no-op when the lease was lost to another consumer.
     */
    void ack(QueueDelivery delivery);

    /**
     * Gives the message back without acknowledging it; it becomes visible again after {@code delay}.
     */
    void nack(QueueDelivery delivery, Duration delay);
}
