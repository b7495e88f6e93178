package com.text_classifier_app.unit_tests.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.text_classifier_app.exception.PoisonMessageException;
import com.text_classifier_app.queue.QueueMessageCodec;
import com.text_classifier_app.queue.TrainingQueueMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueueMessageCodecTest {

    private final QueueMessageCodec codec = new QueueMessageCodec(new ObjectMapper());

    @Test
    @DisplayName("Should decode a start-training payload")
    void decode_ValidPayload_ReturnsMessage() {
        TrainingQueueMessage message = codec.decode("{\"jobId\":\"job-1\",\"action\":\"start_training\"}");

        assertEquals("job-1", message.jobId());
        assertEquals(TrainingQueueMessage.ACTION_START_TRAINING, message.action());
    }

    @Test
    @DisplayName("Encoded messages carry the job id and action")
    void encode_StartTraining_WritesJson() {
        String payload = codec.encode(TrainingQueueMessage.startTraining("job-7"));

        assertTrue(payload.contains("\"jobId\":\"job-7\""));
        assertTrue(payload.contains("\"action\":\"start_training\""));
    }

    @Test
    @DisplayName("Malformed JSON is poison")
    void decode_NotJson_ThrowsPoison() {
        assertThrows(PoisonMessageException.class, () -> codec.decode("{not json"));
    }

    @Test
    @DisplayName("A blank payload is poison")
    void decode_Blank_ThrowsPoison() {
        assertThrows(PoisonMessageException.class, () -> codec.decode("  "));
    }

    @Test
    @DisplayName("A payload without job id is poison")
    void decode_MissingJobId_ThrowsPoison() {
        assertThrows(PoisonMessageException.class, () -> codec.decode("{\"action\":\"start_training\"}"));
    }

    @Test
    @DisplayName("An unknown action is poison")
    void decode_UnknownAction_ThrowsPoison() {
        PoisonMessageException ex = assertThrows(PoisonMessageException.class,
                () -> codec.decode("{\"jobId\":\"job-1\",\"action\":\"delete_everything\"}"));

        assertTrue(ex.getMessage().contains("delete_everything"));
    }
}
