package com.realtyhub.backend.modules.storage.infrastructure;

import java.time.Clock;
import java.util.Objects;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.storage.application.BlobStorage;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * {@link BlobStorage} on Amazon S3. Keys are {@code <folder>/<epochMillis>-<sanitized name>} and
 * URLs are {@code <public-base-url>/<key>}.
 */
@Component
public class S3BlobStorage implements BlobStorage {

    private static final Logger log = LoggerFactory.getLogger(S3BlobStorage.class);
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final S3Client s3;
    private final String bucket;
    private final String publicBaseUrl;
    private final Clock clock;

    public S3BlobStorage(S3Client s3, RealtyhubProperties properties, Clock clock) {
        this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
        this.bucket = properties.storage().bucket();
        this.publicBaseUrl = stripTrailingSlash(properties.storage().publicBaseUrl());
        this.clock = clock;
    }

    @Override
    public String upload(byte[] content, String fileName, String folder, String contentType) {
        String key = buildKey(folder, fileName);
        String resolvedType = (contentType == null || contentType.isBlank()) ? DEFAULT_CONTENT_TYPE : contentType;
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(resolvedType)
                .contentLength((long) content.length)
                .build();
        try {
            s3.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            log.error("s3.upload failed bucket={} key={} msg={}", bucket, key, e.getMessage(), e);
            throw unavailable(e);
        }
        log.info("s3.upload ok bucket={} key={} size={}", bucket, key, content.length);
        return publicBaseUrl + "/" + key;
    }

    @Override
    public void delete(String url) {
        String key = keyOf(url);
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            log.error("s3.delete failed bucket={} key={} msg={}", bucket, key, e.getMessage(), e);
            throw unavailable(e);
        }
        log.info("s3.delete ok bucket={} key={}", bucket, key);
    }

    @Override
    public boolean exists(String url) {
        String key = keyOf(url);
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == HttpStatus.NOT_FOUND.value()) {
                return false;
            }
            log.error("s3.head failed bucket={} key={} status={}", bucket, key, e.statusCode(), e);
            throw unavailable(e);
        } catch (SdkException e) {
            log.error("s3.head failed bucket={} key={} msg={}", bucket, key, e.getMessage(), e);
            throw unavailable(e);
        }
    }

    String buildKey(String folder, String fileName) {
        String prefix = (folder == null || folder.isBlank()) ? "" : stripTrailingSlash(folder) + "/";
        return prefix + clock.millis() + "-" + sanitize(fileName);
    }

    /**
     * Object key for a URL produced by {@link #upload}; URLs from elsewhere are treated as bare keys.
     */
    String keyOf(String url) {
        if (url == null || url.isBlank()) {
            throw ProblemException.badRequest("storage.invalid_url", "파일 URL이 비어 있습니다.");
        }
        if (url.startsWith(publicBaseUrl + "/")) {
            return url.substring(publicBaseUrl.length() + 1);
        }
        return url.startsWith("/") ? url.substring(1) : url;
    }

    static String sanitize(String fileName) {
        String name = FilenameUtils.getName(fileName == null ? "" : fileName);
        String sanitized = name.replaceAll("[^a-zA-Z0-9.-]", "_");
        return sanitized.isEmpty() ? "file" : sanitized;
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static ProblemException unavailable(Exception cause) {
        return new ProblemException(HttpStatus.BAD_GATEWAY, "storage.unavailable",
                "파일 저장소에 연결할 수 없습니다.", cause);
    }
}
