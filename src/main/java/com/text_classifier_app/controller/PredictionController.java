package com.text_classifier_app.controller;

import com.text_classifier_app.dto.response.GenericResponse;
import com.text_classifier_app.dto.training.PredictionRequest;
import com.text_classifier_app.dto.training.PredictionResult;
import com.text_classifier_app.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
@Tag(name = "Prediction", description = "Classify texts with a project's trained model")
public class PredictionController {

    private final PredictionService predictionService;

    @Operation(summary = "Predict the label of a text")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Prediction returned"),
            @ApiResponse(responseCode = "400", description = "Invalid text"),
            @ApiResponse(responseCode = "404", description = "Project or model not found"),
            @ApiResponse(responseCode = "409", description = "Project not trained yet"),
            @ApiResponse(responseCode = "422", description = "Stored model is corrupt")
    })
    @PostMapping("/{projectId}/predict")
    public ResponseEntity<GenericResponse<PredictionResult>> predict(@PathVariable String projectId,
                                                                     @Valid @RequestBody PredictionRequest request) {
        PredictionResult result = predictionService.predict(projectId, request.getText());
        return ResponseEntity.ok(GenericResponse.success("Prediction completed", result));
    }
}
