package com.text_classifier_app.service;

import com.text_classifier_app.exception.ArtifactNotFoundException;
import com.text_classifier_app.exception.TransientInfraException;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Set;

/**
 * {@link ArtifactStorage} on a single MinIO bucket.
 */
@Service
@Slf4j
public class MinioService implements ArtifactStorage {

    private static final Set<String> MISSING_CODES = Set.of("NoSuchKey", "NoSuchObject");

    private final MinioClient minioClient;

    private final String bucket;

    public MinioService(MinioClient minioClient, @Value("${minio.bucket.models}") String bucket) {
        this.minioClient = minioClient;
        this.bucket = bucket;
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        try {
            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(bucket)
                            .object(key)
                            .stream(new ByteArrayInputStream(content), content.length, -1)
                            .contentType(contentType)
                            .build()
            );
            log.info("✅ Uploaded object [{}] to bucket [{}] ({} bytes)", key, bucket, content.length);
        } catch (Exception e) {
            log.error("❌ Failed to upload object [{}] to bucket [{}]: {}", key, bucket, e.getMessage(), e);
            throw new TransientInfraException("MinIO upload failed for: " + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        log.info("📥 Downloading [{}]/[{}] from MinIO...", bucket, key);
        try (InputStream in = minioClient.getObject(
                GetObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .build())) {
            return in.readAllBytes();
        } catch (ErrorResponseException e) {
            if (isMissing(e)) {
                throw new ArtifactNotFoundException(key);
            }
            throw new TransientInfraException("❌ Failed to download object from MinIO: " + key, e);
        } catch (Exception e) {
            throw new TransientInfraException("❌ Failed to download object from MinIO: " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            return true;
        } catch (ErrorResponseException e) {
            if (isMissing(e)) {
                return false;
            }
            throw new TransientInfraException("Failed to stat object in MinIO: " + key, e);
        } catch (Exception e) {
            throw new TransientInfraException("Failed to stat object in MinIO: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
            log.info("🗑️ Deleted object [{}] from bucket [{}]", key, bucket);
        } catch (Exception e) {
            throw new TransientInfraException("Failed to delete object from MinIO: " + key, e);
        }
    }

    @Override
    public int deletePrefix(String prefix) {
        int removed = 0;
        try {
            Iterable<Result<Item>> objects = minioClient.listObjects(
                    ListObjectsArgs.builder().bucket(bucket).prefix(prefix).recursive(true).build());
            for (Result<Item> object : objects) {
                String key = object.get().objectName();
                minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
                removed++;
            }
        } catch (Exception e) {
            throw new TransientInfraException("Failed to delete objects under prefix: " + prefix, e);
        }
        log.info("🗑️ Deleted {} object(s) under [{}]/[{}]", removed, bucket, prefix);
        return removed;
    }

    private static boolean isMissing(ErrorResponseException e) {
        return e.errorResponse() != null && MISSING_CODES.contains(e.errorResponse().code());
    }
}
