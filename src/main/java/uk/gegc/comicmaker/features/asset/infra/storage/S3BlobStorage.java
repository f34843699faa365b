package uk.gegc.comicmaker.features.asset.infra.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import uk.gegc.comicmaker.features.asset.application.BlobStorage;
import uk.gegc.comicmaker.features.asset.config.StorageProperties;
import uk.gegc.comicmaker.features.asset.domain.exception.BlobStorageException;
import uk.gegc.comicmaker.features.asset.domain.model.SignedUrl;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "comicmaker.storage", name = "provider", havingValue = "s3")
public class S3BlobStorage implements BlobStorage {

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final StorageProperties properties;
    private final Clock clock;

    @Override
    public void upload(String path, byte[] data, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(properties.getBucket())
                            .key(path)
                            .contentType(contentType)
                            .contentLength((long) data.length)
                            .build(),
                    RequestBody.fromBytes(data));
            log.debug("Uploaded {} bytes to s3://{}/{}", data.length, properties.getBucket(), path);
        } catch (SdkException e) {
            throw new BlobStorageException("Failed to upload " + path, e);
        }
    }

    @Override
    public byte[] download(String path) {
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(properties.getBucket())
                    .key(path)
                    .build()).asByteArray();
        } catch (SdkException e) {
            throw new BlobStorageException("Failed to download " + path, e);
        }
    }

    @Override
    public SignedUrl sign(String path) {
        try {
            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(properties.getSignedUrlTtl())
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(properties.getBucket())
                            .key(path)
                            .build())
                    .build();
            PresignedGetObjectRequest presigned = presigner.presignGetObject(presignRequest);
            LocalDateTime expiresAt = LocalDateTime.now(clock).plus(properties.getSignedUrlTtl());
            return new SignedUrl(presigned.url().toString(), expiresAt);
        } catch (SdkException e) {
            throw new BlobStorageException("Failed to sign " + path, e);
        }
    }
}
