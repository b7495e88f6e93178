package com.text_classifier_app.exception;

import com.text_classifier_app.dto.response.GenericResponse;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Objects;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GenericResponse<Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        log.warn("⚠️ Validation failed: {}", ex.getMessage());

        String errorMessage = ex.getBindingResult()
                .getAllErrors()
                .stream()
                .map(DefaultMessageSourceResolvable::getDefaultMessage)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse("Invalid input");

        return ResponseEntity
                .badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(GenericResponse.failure("VALIDATION_ERROR", errorMessage));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<GenericResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errorMessage = ex.getConstraintViolations()
                .stream()
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining(", "));
        return new ResponseEntity<>(GenericResponse.failure("CONSTRAINT_VIOLATION", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GenericResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(GenericResponse.failure("MALFORMED_JSON", "Request body is invalid or malformed"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<GenericResponse<Object>> handleBadRequest(BadRequestException ex) {
        return ResponseEntity.badRequest().body(GenericResponse.failure("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(DatasetValidationException.class)
    public ResponseEntity<GenericResponse<Object>> handleDatasetValidation(DatasetValidationException ex) {
        return ResponseEntity.badRequest().body(GenericResponse.failure("DATASET_INVALID", ex.getMessage()));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<GenericResponse<Object>> handleEntityNotFound(EntityNotFoundException ex) {
        return new ResponseEntity<>(GenericResponse.failure("NOT_FOUND", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<GenericResponse<Object>> handleArtifactNotFound(ArtifactNotFoundException ex) {
        log.warn("Artifact missing: {}", ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("MODEL_NOT_FOUND", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(NotTrainedException.class)
    public ResponseEntity<GenericResponse<Object>> handleNotTrained(NotTrainedException ex) {
        return new ResponseEntity<>(GenericResponse.failure("NOT_TRAINED", ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(TrainingInProgressException.class)
    public ResponseEntity<GenericResponse<Object>> handleTrainingInProgress(TrainingInProgressException ex) {
        return new ResponseEntity<>(GenericResponse.failure("TRAINING_IN_PROGRESS", ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(CorruptArtifactException.class)
    public ResponseEntity<GenericResponse<Object>> handleCorruptArtifact(CorruptArtifactException ex) {
        log.error("Corrupt model artifact: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(GenericResponse.failure("MODEL_CORRUPT", ex.getMessage()), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(TransientInfraException.class)
    public ResponseEntity<GenericResponse<Object>> handleTransientInfra(TransientInfraException ex) {
        log.error("Infrastructure unavailable: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(GenericResponse.failure("SERVICE_UNAVAILABLE", "A backing service is temporarily unavailable. Please try again later."), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GenericResponse<Object>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(GenericResponse.failure("INTERNAL_SERVER_ERROR", "Something went wrong. Please try again later."), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
