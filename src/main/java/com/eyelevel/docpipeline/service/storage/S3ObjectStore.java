package com.eyelevel.docpipeline.service.storage;

import com.eyelevel.docpipeline.exception.ProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import software.amazon.awssdk.transfer.s3.model.UploadRequest;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * {@link ObjectStore} over a single S3 bucket.
 * <p>
 * Uploads go through {@link S3TransferManager}; reads, copies and deletes use the synchronous {@link S3Client}.
 */
@Slf4j
@Service
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final S3TransferManager transferManager;
    private final String bucketName;
    private final long presignedUrlDurationMinutes;

    public S3ObjectStore(final S3Client s3Client, final S3Presigner s3Presigner,
                         final S3TransferManager transferManager,
                         @Value("${aws.s3.bucket}") final String bucketName,
                         @Value("${aws.s3.presigned-url-duration-minutes:60}") final long presignedUrlDurationMinutes) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.transferManager = transferManager;
        this.bucketName = bucketName;
        this.presignedUrlDurationMinutes = presignedUrlDurationMinutes;
        log.info("S3ObjectStore initialized for bucket '{}' with a pre-signed URL duration of {} minutes.",
                bucketName, presignedUrlDurationMinutes);
    }

    @Override
    public InputStream getObject(final String key) {
        log.debug("Downloading object from S3 key: {}", key);
        final GetObjectRequest getObjectRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();
        return s3Client.getObject(getObjectRequest);
    }

    @Override
    public byte[] getObjectBytes(final String key) {
        try (InputStream inputStream = getObject(key)) {
            return IOUtils.toByteArray(inputStream);
        } catch (IOException e) {
            throw new ProcessingException("Failed to read S3 object: " + key, e);
        }
    }

    @Override
    public void uploadBuffer(final String key, final byte[] content, final String contentType) {
        log.debug("Uploading {} bytes ({}) to S3 key: {}", content.length, contentType, key);
        final UploadRequest uploadRequest = UploadRequest.builder()
                .putObjectRequest(req -> req.bucket(bucketName).key(key).contentType(contentType))
                .requestBody(AsyncRequestBody.fromBytes(content))
                .build();
        try {
            transferManager.upload(uploadRequest).completionFuture().join();
        } catch (CompletionException e) {
            throw new ProcessingException("Failed to upload object to S3 key: " + key,
                    e.getCause() != null ? e.getCause() : e);
        }
        log.info("Successfully uploaded object to S3 key: {}", key);
    }

    @Override
    public void copyObject(final String sourceKey, final String destinationKey) {
        log.info("Copying S3 object from '{}' to '{}'", sourceKey, destinationKey);
        final CopyObjectRequest copyReq = CopyObjectRequest.builder().sourceBucket(bucketName).sourceKey(sourceKey)
                .destinationBucket(bucketName).destinationKey(destinationKey)
                .build();
        s3Client.copyObject(copyReq);
    }

    @Override
    public void deleteObject(final String key) {
        log.info("Deleting S3 object: {}", key);
        s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
    }

    @Override
    public URL getPresignedUploadUrl(final String key, final String contentType) {
        log.debug("Generating pre-signed upload URL for S3 key: {}", key);
        final PutObjectRequest objectRequest = PutObjectRequest.builder().bucket(bucketName).key(key)
                .contentType(contentType).build();

        final PutObjectPresignRequest presignRequest = PutObjectPresignRequest.builder().signatureDuration(
                Duration.ofMinutes(presignedUrlDurationMinutes)).putObjectRequest(objectRequest).build();

        return s3Presigner.presignPutObject(presignRequest).url();
    }

    @Override
    public URL getPresignedDownloadUrl(final String key) {
        log.debug("Generating pre-signed download URL for S3 key: {}", key);
        final GetObjectRequest getObjectRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();

        final GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder().signatureDuration(
                Duration.ofMinutes(presignedUrlDurationMinutes)).getObjectRequest(getObjectRequest).build();

        return s3Presigner.presignGetObject(presignRequest).url();
    }
}
