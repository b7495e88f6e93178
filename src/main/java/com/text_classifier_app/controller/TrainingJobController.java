package com.text_classifier_app.controller;

import com.text_classifier_app.dto.response.GenericResponse;
import com.text_classifier_app.dto.training.ProjectTrainingStatusDTO;
import com.text_classifier_app.dto.training.TrainingJobDTO;
import com.text_classifier_app.dto.training.TrainingStartRequest;
import com.text_classifier_app.service.TrainingJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Training", description = "Queue, monitor and cancel text classifier training jobs")
public class TrainingJobController {

    private final TrainingJobService trainingJobService;

    @Operation(summary = "Queue a training job for a project")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Training job queued"),
            @ApiResponse(responseCode = "400", description = "No examples or invalid hyperparameters"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @PostMapping("/projects/{projectId}/train")
    public ResponseEntity<GenericResponse<TrainingJobDTO>> startTraining(
            @PathVariable String projectId,
            @Valid @RequestBody(required = false) TrainingStartRequest request) {
        TrainingJobDTO job = trainingJobService.createTrainingJob(projectId, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(GenericResponse.success("Training job queued", job));
    }

    @Operation(summary = "Project training status: project status, current job and all jobs, newest first")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Training status returned"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @GetMapping("/projects/{projectId}/train")
    public ResponseEntity<GenericResponse<ProjectTrainingStatusDTO>> getProjectTrainingStatus(@PathVariable String projectId) {
        ProjectTrainingStatusDTO status = trainingJobService.getProjectTrainingStatus(projectId);
        return ResponseEntity.ok(GenericResponse.success("Training status retrieved successfully", status));
    }

    @Operation(summary = "Tracking training")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job status returned"),
            @ApiResponse(responseCode = "404", description = "Job not found")
    })
    @GetMapping("/training/jobs/{jobId}")
    public ResponseEntity<GenericResponse<TrainingJobDTO>> getJobStatus(@PathVariable String jobId) {
        TrainingJobDTO job = trainingJobService.getJobStatus(jobId);
        return ResponseEntity.ok(GenericResponse.success("Training job retrieved successfully", job));
    }

    @Operation(summary = "Request cancellation of a queued or running job")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Cancellation requested"),
            @ApiResponse(responseCode = "404", description = "Job not found"),
            @ApiResponse(responseCode = "409", description = "Job already finished")
    })
    @DeleteMapping("/training/jobs/{jobId}")
    public ResponseEntity<GenericResponse<Map<String, Boolean>>> cancelJob(@PathVariable String jobId) {
        boolean cancelled = trainingJobService.cancelJob(jobId);
        Map<String, Boolean> body = Map.of("cancelRequested", cancelled);
        if (!cancelled) {
            GenericResponse<Map<String, Boolean>> response = GenericResponse.failure("JOB_FINISHED", "Training job already finished");
            response.setData(body);
            return new ResponseEntity<>(response, HttpStatus.CONFLICT);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(GenericResponse.success("Cancellation requested", body));
    }

    @Operation(summary = "Delete all training jobs and stored models of a project")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Training data deleted"),
            @ApiResponse(responseCode = "409", description = "A job is still queued or training")
    })
    @DeleteMapping("/projects/{projectId}/training")
    public ResponseEntity<GenericResponse<Map<String, Long>>> deleteProjectTraining(@PathVariable String projectId) {
        long deleted = trainingJobService.deleteProjectJobs(projectId);
        log.info("Deleted training data of project [{}]", projectId);
        return ResponseEntity.ok(GenericResponse.success("Training data deleted", Map.of("deletedJobs", deleted)));
    }
}
