package com.text_classifier_app.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.text_classifier_app.exception.PoisonMessageException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON codec for queue payloads: {@code {"jobId": "...", "action": "start_training"}}.
 */
@Component
@RequiredArgsConstructor
public class QueueMessageCodec {

    private final ObjectMapper objectMapper;

    public String encode(TrainingQueueMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode queue message for job " + message.jobId(), e);
        }
    }

    /**
     * @throws PoisonMessageException when the payload can never be processed
     */
    public TrainingQueueMessage decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new PoisonMessageException("Empty queue message");
        }
        TrainingQueueMessage message;
        try {
            message = objectMapper.readValue(payload, TrainingQueueMessage.class);
        } catch (JsonProcessingException e) {
            throw new PoisonMessageException("Queue message is not valid JSON: " + abbreviate(payload), e);
        }
        if (message == null || message.jobId() == null || message.jobId().isBlank()) {
            throw new PoisonMessageException("Queue message has no jobId: " + abbreviate(payload));
        }
        if (!TrainingQueueMessage.ACTION_START_TRAINING.equals(message.action())) {
            throw new PoisonMessageException("Unsupported queue action '" + message.action() + "' for job " + message.jobId());
        }
        return message;
    }

    private static String abbreviate(String payload) {
        return payload.length() <= 200 ? payload : payload.substring(0, 200) + "...";
    }
}
