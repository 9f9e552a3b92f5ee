package com.libragraph.chunkstore.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;

/**
 * Builds the shared MinIO client for the S3 chunk store and its health check.
 */
@ApplicationScoped
@IfBuildProperty(name = "chunkstore.object-store.type", stringValue = "s3")
public class MinioClientProducer {

    @ConfigProperty(name = "chunkstore.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "chunkstore.minio.access-key")
    String accessKey;

    @ConfigProperty(name = "chunkstore.minio.secret-key")
    String secretKey;

    @ConfigProperty(name = "chunkstore.minio.region")
    Optional<String> region;

    @ConfigProperty(name = "chunkstore.minio.timeout", defaultValue = "PT30S")
    Duration timeout;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey);
        region.ifPresent(builder::region);
        MinioClient client = builder.build();
        long millis = timeout.toMillis();
        client.setTimeout(millis, millis, millis);
        return client;
    }
}
