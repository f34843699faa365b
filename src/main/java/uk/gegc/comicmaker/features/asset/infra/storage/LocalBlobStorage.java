package uk.gegc.comicmaker.features.asset.infra.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.asset.application.BlobStorage;
import uk.gegc.comicmaker.features.asset.config.StorageProperties;
import uk.gegc.comicmaker.features.asset.domain.exception.BlobStorageException;
import uk.gegc.comicmaker.features.asset.domain.model.SignedUrl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Filesystem-backed storage for development and tests. Signed links carry an expiry parameter
 * but are not cryptographically signed.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "comicmaker.storage", name = "provider", havingValue = "local", matchIfMissing = true)
public class LocalBlobStorage implements BlobStorage {

    private final StorageProperties properties;
    private final Clock clock;
    private final Path root;

    public LocalBlobStorage(StorageProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.root = Paths.get(properties.getLocalRoot()).toAbsolutePath().normalize();
    }

    @Override
    public void upload(String path, byte[] data, String contentType) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data);
            log.debug("Stored {} bytes at {}", data.length, target);
        } catch (IOException e) {
            throw new BlobStorageException("Failed to store " + path, e);
        }
    }

    @Override
    public byte[] download(String path) {
        try {
            return Files.readAllBytes(resolve(path));
        } catch (IOException e) {
            throw new BlobStorageException("Failed to read " + path, e);
        }
    }

    @Override
    public SignedUrl sign(String path) {
        LocalDateTime expiresAt = LocalDateTime.now(clock).plus(properties.getSignedUrlTtl());
        String base = properties.getLocalBaseUrl().endsWith("/")
                ? properties.getLocalBaseUrl()
                : properties.getLocalBaseUrl() + "/";
        return new SignedUrl(base + path + "?expires=" + expiresAt.toEpochSecond(ZoneOffset.UTC), expiresAt);
    }

    private Path resolve(String path) {
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Blob path escapes storage root: " + path);
        }
        return target;
    }
}
