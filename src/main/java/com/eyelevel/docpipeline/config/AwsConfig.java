package com.eyelevel.docpipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.crt.S3CrtRetryConfiguration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.transfer.s3.S3TransferManager;

/**
 * AWS clients used by the pipeline: S3 for document content and thumbnails, Textract for OCR and SQS for
 * outbound processing events.
 */
@Slf4j
@Configuration
public class AwsConfig {

    private final Region region;
    private final int sdkRetries;

    public AwsConfig(@Value("${aws.region}") String region, @Value("${aws.s3.retry-count:4}") int sdkRetries) {
        this.region = Region.of(region);
        this.sdkRetries = sdkRetries;
    }

    /**
     * Local runs sign with explicit keys; deployed environments resolve credentials from the instance role.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment,
                                                         @Value("${aws.access-key:}") String accessKey,
                                                         @Value("${aws.secret-key:}") String secretKey) {
        if (!environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Resolving AWS credentials from the default provider chain");
            return DefaultCredentialsProvider.create();
        }
        if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
            throw new IllegalArgumentException("The 'local' profile needs aws.access-key and aws.secret-key");
        }
        log.info("Using static AWS credentials for the 'local' profile");
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }

    /**
     * Adaptive SDK retries. Throttling that outlives them fails the attempt and the job queue takes over.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        return ClientOverrideConfiguration.builder()
                .retryPolicy(RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder().numRetries(sdkRetries).build())
                .build();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentials, ClientOverrideConfiguration overrides) {
        return configure(S3Client.builder(), "S3", credentials).overrideConfiguration(overrides).build();
    }

    @Bean
    public TextractClient textractClient(AwsCredentialsProvider credentials, ClientOverrideConfiguration overrides) {
        return configure(TextractClient.builder(), "Textract", credentials).overrideConfiguration(overrides).build();
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentials) {
        return configure(SqsAsyncClient.builder(), "SQS", credentials).build();
    }

    // The CRT client does not take ClientOverrideConfiguration, so retries are set on its own builder.
    @Bean
    public S3AsyncClient s3AsyncClient(AwsCredentialsProvider credentials) {
        log.info("Creating CRT S3 async client in {}", region);
        return S3AsyncClient.crtBuilder()
                .credentialsProvider(credentials)
                .region(region)
                .retryConfiguration(S3CrtRetryConfiguration.builder().numRetries(sdkRetries).build())
                .build();
    }

    @Bean
    public S3TransferManager s3TransferManager(S3AsyncClient s3AsyncClient) {
        return S3TransferManager.builder().s3Client(s3AsyncClient).build();
    }

    @Bean
    public S3Presigner s3Presigner(AwsCredentialsProvider credentials) {
        return S3Presigner.builder().region(region).credentialsProvider(credentials).build();
    }

    private <B extends AwsClientBuilder<B, ?>> B configure(B builder, String service,
                                                           AwsCredentialsProvider credentials) {
        log.info("Creating {} client in {}", service, region);
        return builder.region(region).credentialsProvider(credentials);
    }
}
