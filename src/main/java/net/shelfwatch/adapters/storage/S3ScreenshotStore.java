package net.shelfwatch.adapters.storage;

import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.shelfwatch.domain.scan.ScreenshotStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Loads screenshots recorded on scan runs.
 *
 * <p>References are bucket keys, {@code s3://bucket/key} URIs or plain HTTP(S) URLs.
 * A missing screenshot is never an error; AI review simply runs without it.</p>
 */
@Slf4j
@Component
public class S3ScreenshotStore implements ScreenshotStore {

    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofSeconds(20);

    private final ObjectProvider<S3Client> s3ClientProvider;
    private final WebClient webClient;
    private final String bucket;

    public S3ScreenshotStore(ObjectProvider<S3Client> s3ClientProvider,
                             WebClient.Builder webClientBuilder,
                             @Value("${s3.bucket-name:${S3_BUCKET:}}") String bucket) {
        this.s3ClientProvider = s3ClientProvider;
        this.webClient = webClientBuilder.clone().build();
        this.bucket = bucket;
    }

    @Override
    public Optional<byte[]> load(String reference) {
        if (!StringUtils.hasText(reference)) {
            return Optional.empty();
        }
        String trimmed = reference.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return download(trimmed);
        }

        ObjectLocation location = ObjectLocation.parse(trimmed, bucket);
        if (location == null) {
            log.debug("No bucket known for screenshot reference {}", trimmed);
            return Optional.empty();
        }
        S3Client s3Client = s3ClientProvider.getIfAvailable();
        if (s3Client == null) {
            log.debug("S3 client unavailable; skipping screenshot {}", trimmed);
            return Optional.empty();
        }
        try {
            byte[] bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(location.bucket())
                    .key(location.key())
                    .build())
                .asByteArray();
            return bytes.length == 0 ? Optional.empty() : Optional.of(bytes);
        } catch (NoSuchKeyException missing) {
            log.info("Screenshot {} not found in bucket {}", location.key(), location.bucket());
            return Optional.empty();
        } catch (SdkException sdkException) {
            log.warn("Failed to read screenshot {} from bucket {}: {}",
                location.key(), location.bucket(), sdkException.getMessage());
            return Optional.empty();
        }
    }

    private Optional<byte[]> download(String url) {
        try {
            byte[] bytes = webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(byte[].class)
                .block(DOWNLOAD_TIMEOUT);
            return bytes == null || bytes.length == 0 ? Optional.empty() : Optional.of(bytes);
        } catch (WebClientException | IllegalStateException downloadFailure) {
            log.warn("Failed to download screenshot {}: {}", url, downloadFailure.getMessage());
            return Optional.empty();
        }
    }

    record ObjectLocation(String bucket, String key) {

        static ObjectLocation parse(String reference, String defaultBucket) {
            if (reference.startsWith("s3://")) {
                String path = reference.substring("s3://".length());
                int slash = path.indexOf('/');
                if (slash <= 0 || slash == path.length() - 1) {
                    return null;
                }
                return new ObjectLocation(path.substring(0, slash), path.substring(slash + 1));
            }
            if (!StringUtils.hasText(defaultBucket)) {
                return null;
            }
            String key = reference.startsWith("/") ? reference.substring(1) : reference;
            return key.isEmpty() ? null : new ObjectLocation(defaultBucket, key);
        }
    }
}
