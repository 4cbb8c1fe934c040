package com.starscape.imageedit.common.storage;

import com.starscape.imageedit.common.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;

/**
 * Uploads results to S3. The destination path becomes the object key, below the
 * configured key prefix.
 */
@Component
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
public class S3ResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(S3ResultStore.class);

    private final S3Client s3Client;
    private final String bucket;
    private final String keyPrefix;

    public S3ResultStore(S3Client s3Client, StorageProperties storageProperties) {
        if (storageProperties.getBucket() == null || storageProperties.getBucket().isBlank()) {
            throw new IllegalStateException("app.storage.bucket is required when app.storage.type=s3");
        }
        this.s3Client = s3Client;
        this.bucket = storageProperties.getBucket();
        this.keyPrefix = storageProperties.getKeyPrefix() == null ? "" : storageProperties.getKeyPrefix();
    }

    @Override
    public String save(String destination, byte[] content) throws IOException {
        String key = toKey(destination);
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType(key))
                .contentLength((long) content.length)
                .build();

        try {
            s3Client.putObject(putRequest, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new IOException("Failed to upload result to s3://" + bucket + "/" + key, e);
        }

        log.debug("Saved result: bucket={}, key={}, bytes={}", bucket, key, content.length);
        return "s3://" + bucket + "/" + key;
    }

    String toKey(String destination) {
        String normalized = destination.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (keyPrefix.isEmpty()) {
            return normalized;
        }
        return keyPrefix.endsWith("/") ? keyPrefix + normalized : keyPrefix + "/" + normalized;
    }

    private static String contentType(String key) {
        String lower = key.toLowerCase();
        if (lower.endsWith(".png")) {
            return "image/png";
        }
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        if (lower.endsWith(".webp")) {
            return "image/webp";
        }
        return "application/octet-stream";
    }
}
