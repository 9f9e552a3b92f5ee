package com.libragraph.chunkstore.core.storage;

import com.libragraph.chunkstore.util.ContentHash;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * S3/MinIO-backed ChunkStore for production use.
 *
 * <p>All chunks live in one bucket under their flat hex hash; MinIO handles
 * sharding internally. S3 lists keys in UTF-8 binary order, which for hex keys
 * is hash order, so {@code startAfter} doubles as the continuation token.
 */
@ApplicationScoped
@IfBuildProperty(name = "chunkstore.object-store.type", stringValue = "s3")
public class S3ChunkStore implements ChunkStore {

    private final MinioClient minioClient;
    private final String bucket;
    private volatile boolean bucketReady;

    @Inject
    public S3ChunkStore(MinioClient minioClient,
                        @ConfigProperty(name = "chunkstore.object-store.bucket", defaultValue = "chunks")
                        String bucket) {
        this.minioClient = minioClient;
        this.bucket = bucket;
    }

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // Concurrent creation: another node already created the bucket
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    @Override
    public Uni<Void> put(ContentHash hash, byte[] content) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ChunkStore.verify(hash, content);
            ensureBucket();
            String key = hash.toHex();
            if (statExists(key)) {
                return;
            }
            try (InputStream is = new ByteArrayInputStream(content)) {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .stream(is, content.length, -1)
                        .contentType("application/octet-stream")
                        .build());
            } catch (Exception e) {
                throw new StorageException("Failed to write chunk: " + hash, e);
            }
        });
    }

    @Override
    public Uni<byte[]> get(ContentHash hash) {
        return Uni.createFrom().item(() -> {
            try (InputStream is = minioClient.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(hash.toHex()).build())) {
                return is.readAllBytes();
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ChunkNotFoundException(hash);
                }
                throw new StorageException("Failed to read chunk: " + hash, e);
            } catch (Exception e) {
                throw new StorageException("Failed to read chunk: " + hash, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(ContentHash hash) {
        // removeObject is silent on missing keys, which is the contract we want
        return Uni.createFrom().voidItem().invoke(() -> {
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucket).object(hash.toHex()).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return;
                }
                throw new StorageException("Failed to delete chunk: " + hash, e);
            } catch (Exception e) {
                throw new StorageException("Failed to delete chunk: " + hash, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(ContentHash hash) {
        return Uni.createFrom().item(() -> statExists(hash.toHex()));
    }

    private boolean statExists(String key) {
        try {
            minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            return true;
        } catch (ErrorResponseException e) {
            if (isMissing(e)) {
                return false;
            }
            throw new StorageException("Failed to check existence: " + key, e);
        } catch (Exception e) {
            throw new StorageException("Failed to check existence: " + key, e);
        }
    }

    @Override
    public Uni<ListingPage> list(String prefix, String continuationToken, int maxKeys) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be positive: " + maxKeys);
        }
        return Uni.createFrom().item(() -> {
            ListObjectsArgs.Builder args = ListObjectsArgs.builder()
                    .bucket(bucket)
                    .recursive(true)
                    .maxKeys(Math.min(maxKeys + 1, 1000));
            if (prefix != null && !prefix.isEmpty()) {
                args.prefix(prefix);
            }
            if (continuationToken != null) {
                args.startAfter(continuationToken);
            }

            List<StoredChunk> entries = new ArrayList<>();
            boolean more = false;
            try {
                for (Result<Item> result : minioClient.listObjects(args.build())) {
                    Item item = result.get();
                    if (item.isDir() || !ContentHash.isHex(item.objectName())) {
                        continue;
                    }
                    if (entries.size() == maxKeys) {
                        more = true;
                        break;
                    }
                    entries.add(new StoredChunk(
                            ContentHash.fromHex(item.objectName()),
                            item.size(),
                            StorageTier.fromStorageClass(item.storageClass())));
                }
            } catch (ErrorResponseException e) {
                if ("NoSuchBucket".equals(e.errorResponse().code())) {
                    return new ListingPage(List.of(), null);
                }
                throw new StorageException("Failed to list chunks in bucket: " + bucket, e);
            } catch (Exception e) {
                throw new StorageException("Failed to list chunks in bucket: " + bucket, e);
            }

            String token = more ? entries.get(entries.size() - 1).hash().toHex() : null;
            return new ListingPage(entries, token);
        });
    }
}
