package com.text_classifier_app.queue;

import com.text_classifier_app.config.TrainingProperties;
import com.text_classifier_app.entity.QueueMessage;
import com.text_classifier_app.exception.TransientInfraException;
import com.text_classifier_app.repository.QueueMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link JobQueue} on a database table. Receivers lease rows with {@code FOR UPDATE SKIP LOCKED},
 * so several worker processes can share the table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaJobQueue implements JobQueue {

    private final QueueMessageRepository messageRepository;
    private final QueueMessageCodec codec;
    private final TrainingProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public String enqueue(String jobId) {
        Instant now = clock.instant();
        QueueMessage message = QueueMessage.builder()
                .id(UUID.randomUUID().toString())
                .payload(codec.encode(TrainingQueueMessage.startTraining(jobId)))
                .enqueuedAt(now)
                .visibleAt(now)
                .deliveryAttempt(0)
                .build();
        try {
            messageRepository.save(message);
        } catch (DataAccessException e) {
            throw new TransientInfraException("Failed to enqueue training job " + jobId, e);
        }
        return message.getId();
    }

    @Override
    @Transactional
    public List<QueueDelivery> receive(int maxMessages) {
        if (maxMessages <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(properties.getQueue().getAckDeadline());
        try {
            List<QueueDelivery> deliveries = new ArrayList<>();
            for (QueueMessage message : messageRepository.findVisibleForUpdate(now, PageRequest.of(0, maxMessages))) {
                message.setLeaseToken(UUID.randomUUID().toString());
                message.setVisibleAt(leaseUntil);
                message.setDeliveryAttempt(message.getDeliveryAttempt() + 1);
                messageRepository.save(message);
                if (message.getDeliveryAttempt() > 1) {
                    log.info("🔁 Redelivering queue message [{}] (attempt {})", message.getId(), message.getDeliveryAttempt());
                }
                deliveries.add(new QueueDelivery(message.getId(), message.getLeaseToken(),
                        message.getPayload(), message.getDeliveryAttempt()));
            }
            return deliveries;
        } catch (DataAccessException e) {
            throw new TransientInfraException("Failed to receive from the training queue", e);
        }
    }

    @Override
    @Transactional
    public void ack(QueueDelivery delivery) {
        try {
            if (messageRepository.deleteLeased(delivery.messageId(), delivery.leaseToken()) == 0) {
                log.warn("Lease on queue message [{}] was lost before ack, it may be delivered again", delivery.messageId());
            }
        } catch (DataAccessException e) {
            throw new TransientInfraException("Failed to ack queue message " + delivery.messageId(), e);
        }
    }

    @Override
    @Transactional
    public void nack(QueueDelivery delivery, Duration delay) {
        try {
            messageRepository.extendLease(delivery.messageId(), delivery.leaseToken(), clock.instant().plus(delay));
        } catch (DataAccessException e) {
            throw new TransientInfraException("Failed to release queue message " + delivery.messageId(), e);
        }
    }
}
