package com.text_classifier_app.service;

import com.text_classifier_app.exception.CorruptArtifactException;
import com.text_classifier_app.exception.ModelTrainingException;
import com.text_classifier_app.trainer.TrainedTextModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import weka.core.SerializationHelper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

/**
 * Persists trained models. Every job writes its own artifact, so a retrained project never
 * overwrites the model that is still serving predictions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelArtifactService {

    static final String CONTENT_TYPE = "application/octet-stream";

    private final ArtifactStorage storage;

    public static String artifactPath(String projectId, String jobId) {
        return projectPrefix(projectId) + jobId + ".model";
    }

    static String projectPrefix(String projectId) {
        return "models/" + projectId + "/";
    }

    /**
     * @return the path the model was stored under
     */
    public String save(String projectId, String jobId, TrainedTextModel model) {
        byte[] bytes;
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            SerializationHelper.write(out, model);
            bytes = out.toByteArray();
        } catch (Exception e) {
            throw new ModelTrainingException("Failed to serialize trained model", e);
        }
        String path = artifactPath(projectId, jobId);
        storage.put(path, bytes, CONTENT_TYPE);
        log.info("💾 Stored model for project [{}] at [{}]", projectId, path);
        return path;
    }

    /**
     * @throws com.text_classifier_app.exception.ArtifactNotFoundException when no artifact exists at the path
     * @throws CorruptArtifactException when the bytes do not deserialize to a model
     */
    public TrainedTextModel load(String path) {
        byte[] bytes = storage.get(path);
        Object restored;
        try {
            restored = SerializationHelper.read(new ByteArrayInputStream(bytes));
        } catch (Exception e) {
            throw new CorruptArtifactException(path, e);
        }
        if (!(restored instanceof TrainedTextModel model)) {
            throw new CorruptArtifactException(path, new ClassCastException(
                    "Expected a trained text model but found " + (restored == null ? "null" : restored.getClass().getName())));
        }
        return model;
    }

    /**
     * Removes the artifact a job wrote, if any.
     *
     * @return whether an artifact was removed
     */
    public boolean discard(String projectId, String jobId) {
        String path = artifactPath(projectId, jobId);
        if (!storage.exists(path)) {
            return false;
        }
        storage.delete(path);
        log.info("🗑️ Discarded model [{}] of job [{}]", path, jobId);
        return true;
    }

    public int deleteProjectArtifacts(String projectId) {
        return storage.deletePrefix(projectPrefix(projectId));
    }
}
