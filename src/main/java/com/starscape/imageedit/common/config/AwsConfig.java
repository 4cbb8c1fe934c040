package com.starscape.imageedit.common.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * AWS clients, only created when results are stored in S3.
 */
@Configuration
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
public class AwsConfig {

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(StorageProperties storageProperties) {
        // Use profile if specified, otherwise use default credentials chain
        String profile = storageProperties.getProfile();
        if (profile != null && !profile.isBlank()) {
            return ProfileCredentialsProvider.create(profile);
        }
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider, StorageProperties storageProperties) {
        return S3Client.builder()
                .region(Region.of(storageProperties.getRegion()))
                .credentialsProvider(credentialsProvider)
                .build();
    }
}
