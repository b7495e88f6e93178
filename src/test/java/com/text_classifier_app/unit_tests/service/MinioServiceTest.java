package com.text_classifier_app.unit_tests.service;

import com.text_classifier_app.exception.ArtifactNotFoundException;
import com.text_classifier_app.exception.TransientInfraException;
import com.text_classifier_app.service.MinioService;
import io.minio.GetObjectArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.ServerException;
import io.minio.messages.ErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MinioServiceTest {

    private static final String BUCKET = "models";
    private static final String KEY = "models/project-1/job-1.model";

    @Mock
    private MinioClient minioClient;

    private MinioService minioService;

    @BeforeEach
    void setUp() {
        minioService = new MinioService(minioClient, BUCKET);
    }

    private static ErrorResponseException errorWithCode(String code) {
        ErrorResponse errorResponse = mock(ErrorResponse.class);
        when(errorResponse.code()).thenReturn(code);
        ErrorResponseException errorEx = mock(ErrorResponseException.class);
        when(errorEx.errorResponse()).thenReturn(errorResponse);
        return errorEx;
    }

    @Nested
    @DisplayName("Upload")
    class Upload {

        @Test
        @DisplayName("Should upload into the models bucket under the given key")
        void put_Success_UsesBucketAndKey() throws Exception {
            // When
            minioService.put(KEY, new byte[]{1, 2, 3}, "application/octet-stream");

            // Then
            ArgumentCaptor<PutObjectArgs> captor = ArgumentCaptor.forClass(PutObjectArgs.class);
            verify(minioClient).putObject(captor.capture());
            assertEquals(BUCKET, captor.getValue().bucket());
            assertEquals(KEY, captor.getValue().object());
        }

        @Test
        @DisplayName("A server error is transient")
        void put_ServerError_ThrowsTransient() throws Exception {
            when(minioClient.putObject(any(PutObjectArgs.class)))
                    .thenThrow(new ServerException("Internal server error", 500, ""));

            assertThrows(TransientInfraException.class,
                    () -> minioService.put(KEY, new byte[]{1}, "application/octet-stream"));
        }
    }

    @Nested
    @DisplayName("Download")
    class Download {

        @Test
        @DisplayName("A missing key is reported as not found")
        void get_NoSuchKey_ThrowsNotFound() throws Exception {
            ErrorResponseException errorEx = errorWithCode("NoSuchKey");
            when(minioClient.getObject(any(GetObjectArgs.class))).thenThrow(errorEx);

            ArtifactNotFoundException ex = assertThrows(ArtifactNotFoundException.class, () -> minioService.get(KEY));
            assertEquals("Model artifact not found: " + KEY, ex.getMessage());
        }

        @Test
        @DisplayName("Other storage errors are transient")
        void get_AccessDenied_ThrowsTransient() throws Exception {
            ErrorResponseException errorEx = errorWithCode("AccessDenied");
            when(minioClient.getObject(any(GetObjectArgs.class))).thenThrow(errorEx);

            assertThrows(TransientInfraException.class, () -> minioService.get(KEY));
        }
    }

    @Nested
    @DisplayName("Object Exists Tests")
    class ObjectExists {

        @Test
        @DisplayName("Should return true when object exists")
        void exists_ObjectExists_ReturnsTrue() throws Exception {
            when(minioClient.statObject(any(StatObjectArgs.class))).thenReturn(mock(StatObjectResponse.class));

            assertTrue(minioService.exists(KEY));
        }

        @Test
        @DisplayName("Should return false when object does not exist")
        void exists_NoSuchKey_ReturnsFalse() throws Exception {
            ErrorResponseException errorEx = errorWithCode("NoSuchKey");
            when(minioClient.statObject(any(StatObjectArgs.class))).thenThrow(errorEx);

            assertFalse(minioService.exists(KEY));
        }
    }

    @Nested
    @DisplayName("Delete Tests")
    class Delete {

        @Test
        @DisplayName("Should remove the object from the models bucket")
        void delete_Success_RemovesObject() throws Exception {
            minioService.delete(KEY);

            ArgumentCaptor<RemoveObjectArgs> captor = ArgumentCaptor.forClass(RemoveObjectArgs.class);
            verify(minioClient).removeObject(captor.capture());
            assertEquals(BUCKET, captor.getValue().bucket());
            assertEquals(KEY, captor.getValue().object());
        }

        @Test
        @DisplayName("Should wrap a MinIO failure as transient")
        void delete_ServerError_ThrowsTransient() throws Exception {
            doThrow(new RuntimeException("connection reset")).when(minioClient).removeObject(any(RemoveObjectArgs.class));

            assertThrows(TransientInfraException.class, () -> minioService.delete(KEY));
        }
    }
}
