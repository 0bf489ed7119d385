package net.shelfwatch.config;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

/**
 * Enables the screenshot bucket client only when credentials and a bucket are configured.
 */
public class S3EnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(S3EnvironmentCondition.class);
    private static final AtomicBoolean statusLogged = new AtomicBoolean(false);

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        boolean hasAccessKey = StringUtils.hasText(firstNonBlank(context, "s3.access-key-id", "S3_ACCESS_KEY_ID"));
        boolean hasSecret = StringUtils.hasText(firstNonBlank(context, "s3.secret-access-key", "S3_SECRET_ACCESS_KEY"));
        String bucket = firstNonBlank(context, "s3.bucket-name", "S3_BUCKET");
        boolean configured = hasAccessKey && hasSecret && StringUtils.hasText(bucket);

        if (statusLogged.compareAndSet(false, true)) {
            if (configured) {
                logger.info("Screenshot bucket configured (bucket: {})", bucket);
            } else {
                logger.warn("Screenshot bucket not configured; AI review will only use screenshot URLs. "
                        + "accessKey={}, secret={}, bucket={}",
                    hasAccessKey ? "SET" : "MISSING",
                    hasSecret ? "SET" : "MISSING",
                    StringUtils.hasText(bucket) ? "SET" : "MISSING");
            }
        }
        return configured;
    }

    static String firstNonBlank(ConditionContext context, String... keys) {
        for (String key : keys) {
            String value = context.getEnvironment().getProperty(key);
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
