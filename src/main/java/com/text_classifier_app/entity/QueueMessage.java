package com.text_classifier_app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A pending "start training" message. The row is deleted when the consumer acknowledges it;
 * until then it becomes visible again once its lease runs out.
 */
@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "training_queue_messages", indexes = {
        @Index(name = "idx_queue_visible_at", columnList = "visible_at")
})
public class QueueMessage {

    @Id
    private String id;

    @Column(nullable = false, length = 2000)
    private String payload;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    @Column(name = "visible_at", nullable = false)
    private Instant visibleAt;

    @Column(name = "lease_token")
    private String leaseToken;

    @Column(name = "delivery_attempt", nullable = false)
    private int deliveryAttempt;
}
