package com.realtyhub.backend.modules.storage.infrastructure;

import java.net.URI;

import com.realtyhub.backend.global.config.RealtyhubProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

@Configuration
public class StorageConfig {

    /**
     * S3 client for the configured region. A non-blank {@code realtyhub.storage.endpoint} points the
     * client at an S3-compatible store (MinIO, LocalStack) using path-style addressing.
     */
    @Bean
    public S3Client s3Client(RealtyhubProperties properties) {
        RealtyhubProperties.Storage storage = properties.storage();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(storage.region()))
                .credentialsProvider(DefaultCredentialsProvider.create());
        if (storage.endpoint() != null && !storage.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.endpoint())).forcePathStyle(true);
        }
        return builder.build();
    }
}
