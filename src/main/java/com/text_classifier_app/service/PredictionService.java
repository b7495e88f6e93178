package com.text_classifier_app.service;

import com.text_classifier_app.dto.training.PredictionResult;
import com.text_classifier_app.entity.project.ProjectRecord;
import com.text_classifier_app.enumeration.status.ProjectStatusEnum;
import com.text_classifier_app.exception.NotTrainedException;
import com.text_classifier_app.trainer.TextClassificationPredictor;
import com.text_classifier_app.trainer.TrainedTextModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores texts against a project's current model. Loaded models are cached by artifact path;
 * paths are unique per job, so a cached model is never stale. At most one model per project is
 * kept: caching a retrained model drops the one it replaces.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private final ProjectRecordService projectRecordService;
    private final ModelArtifactService artifactService;
    private final TextClassificationPredictor predictor;

    private final Map<String, TrainedTextModel> modelCache = new ConcurrentHashMap<>();

    public PredictionResult predict(String projectId, String text) {
        ProjectRecord project = projectRecordService.requireProject(projectId);
        if (project.getStatus() != ProjectStatusEnum.TRAINED || project.getModelPath() == null) {
            throw new NotTrainedException(projectId);
        }

        String modelPath = project.getModelPath();
        TrainedTextModel model = modelCache.get(modelPath);
        if (model == null) {
            model = modelCache.computeIfAbsent(modelPath, path -> {
                log.info("📦 Loading model [{}] for project [{}]", path, projectId);
                return artifactService.load(path);
            });
            evictSuperseded(projectId, modelPath);
        }
        return predictor.predict(text, model);
    }

    private void evictSuperseded(String projectId, String currentPath) {
        String prefix = ModelArtifactService.projectPrefix(projectId);
        if (modelCache.keySet().removeIf(path -> path.startsWith(prefix) && !path.equals(currentPath))) {
            log.info("Dropped superseded cached model(s) of project [{}]", projectId);
        }
    }

    public void evictProject(String projectId) {
        String prefix = ModelArtifactService.projectPrefix(projectId);
        modelCache.keySet().removeIf(path -> path.startsWith(prefix));
    }

    public int cachedModels() {
        return modelCache.size();
    }
}
