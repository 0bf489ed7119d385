package net.shelfwatch.config;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * S3 client for the bucket the scan engine uploads screenshots into.
 * Supports a custom endpoint for MinIO or other S3 compatible stores.
 */
@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {

    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    @Value("${s3.access-key-id:${S3_ACCESS_KEY_ID:}}")
    private String accessKeyId;

    @Value("${s3.secret-access-key:${S3_SECRET_ACCESS_KEY:}}")
    private String secretAccessKey;

    @Value("${s3.server-url:${S3_SERVER_URL:}}")
    private String serverUrl;

    @Value("${s3.region:${AWS_REGION:us-east-1}}")
    private String region;

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        if (!StringUtils.hasText(accessKeyId) || !StringUtils.hasText(secretAccessKey)) {
            throw new IllegalStateException("S3 credentials are incomplete. Configure s3.access-key-id and s3.secret-access-key.");
        }
        var builder = S3Client.builder()
            .region(Region.of(region))
            .credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create(accessKeyId, secretAccessKey)));
        if (StringUtils.hasText(serverUrl)) {
            builder.endpointOverride(URI.create(serverUrl));
            builder.forcePathStyle(true);
            logger.info("Screenshot S3 client using endpoint {} in region {}", serverUrl, region);
        } else {
            logger.info("Screenshot S3 client using AWS endpoint in region {}", region);
        }
        return builder.build();
    }
}
