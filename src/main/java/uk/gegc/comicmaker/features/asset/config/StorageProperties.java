package uk.gegc.comicmaker.features.asset.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "comicmaker.storage")
public class StorageProperties {

    /**
     * {@code s3} for any S3-compatible object store, {@code local} for the filesystem
     */
    @NotBlank
    private String provider = "local";

    @NotBlank
    private String bucket = "comicmaker-assets";

    @NotBlank
    private String region = "us-east-1";

    /**
     * Optional endpoint override for S3-compatible stores (MinIO, Spaces, R2)
     */
    private URI endpoint;

    private boolean pathStyleAccess = true;

    private String accessKey;

    private String secretKey;

    /**
     * Root directory for the local provider
     */
    @NotBlank
    private String localRoot = "./data/blobs";

    /**
     * Base URL the local provider signs links against
     */
    @NotBlank
    private String localBaseUrl = "http://localhost:8080/blobs";

    /**
     * Lifetime of signed read URLs
     */
    @NotNull
    private Duration signedUrlTtl = Duration.ofHours(24);

    @NotBlank
    private String pagePrefix = "projects";

    @NotBlank
    private String pdfPrefix = "pdfs";
}
