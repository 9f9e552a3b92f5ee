package com.libragraph.chunkstore.core.health;

import io.minio.BucketExistsArgs;
import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Chunk bucket reachable. A missing bucket is reported but still up: the store creates
 * it on first use.
 */
@Readiness
@ApplicationScoped
@IfBuildProperty(name = "chunkstore.object-store.type", stringValue = "s3")
public class MinioHealthCheck implements HealthCheck {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "chunkstore.object-store.bucket", defaultValue = "chunks")
    String bucket;

    @Override
    public HealthCheckResponse call() {
        try {
            boolean exists = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            return HealthCheckResponse.named("object-store")
                    .up()
                    .withData("bucket", bucket)
                    .withData("bucketExists", exists)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("object-store")
                    .down()
                    .withData("bucket", bucket)
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
