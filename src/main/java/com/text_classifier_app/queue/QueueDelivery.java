package com.text_classifier_app.queue;

/**
 * One leased delivery of a queue message. {@code deliveryAttempt} starts at 1.
 */
public record QueueDelivery(String messageId, String leaseToken, String payload, int deliveryAttempt) {
}
